package org.angle;

/**
 * A degrees, minutes, seconds triple.
 *
 * Components are not range-checked: minutes and seconds may fall outside
 * [0, 60) and any component may be negative. Only
 * {@link DmsConversion#abs(Angle)} brings a triple into range.
 */
public record Dms(int degrees, int minutes, double seconds) {

    public static Dms of(int degrees) {
        return new Dms(degrees, 0, 0.0);
    }

    public static Dms of(int degrees, int minutes) {
        return new Dms(degrees, minutes, 0.0);
    }

    public boolean isZero() {
        return degrees == 0 && minutes == 0 && seconds == 0.0;
    }
}
