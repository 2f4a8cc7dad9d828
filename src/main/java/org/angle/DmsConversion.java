package org.angle;

import java.util.Objects;

/**
 * Degrees, minutes and seconds.
 */
public final class DmsConversion implements AngleConversion {

    private static final int FULL_TURN = 360;

    private final DegreeConversion degrees = new DegreeConversion();

    @Override
    public AngleUnit unit() {
        return AngleUnit.DMS;
    }

    /**
     * Builds an angle from whole degrees. Unlike the scalar units, a zero
     * triple is kept as a DMS angle.
     */
    public Angle init(int degrees) {
        return init(Dms.of(degrees));
    }

    public Angle init(int degrees, int minutes) {
        return init(Dms.of(degrees, minutes));
    }

    public Angle init(int degrees, int minutes, double seconds) {
        return init(new Dms(degrees, minutes, seconds));
    }

    public Angle init(Dms dms) {
        Objects.requireNonNull(dms, "dms must not be null");
        return new Angle(null, null, null, dms);
    }

    @Override
    public Angle ensure(Angle angle) {
        Objects.requireNonNull(angle, "angle must not be null");
        if (angle.has(AngleUnit.DMS)) {
            return angle;
        }
        if (angle.has(AngleUnit.DEGREES)) {
            return angle.withDms(fromDegrees(angle.degrees().getAsDouble()));
        }
        if (angle.isEmpty()) {
            throw new IllegalStateException("Angle has no representation to convert to DMS");
        }
        return ensure(degrees.ensure(angle));
    }

    /**
     * @return the angle carrying DMS, together with the triple.
     */
    public Converted<Dms> toDms(Angle angle) {
        Angle ensured = ensure(angle);
        return new Converted<>(ensured, ensured.dms().get());
    }

    /**
     * Brings the degrees component into [0, 360].
     *
     * A degrees component in [-360, 0) is moved up by a turn and the minutes
     * and seconds are replaced by their complements (60 - m, 60 - s):
     * (-270, 15, 45) becomes (90, 45, 15). Below -360 whole turns are added
     * without complementing, so the complement happens at most once.
     * The result carries only the DMS representation.
     */
    @Override
    public Angle abs(Angle angle) {
        Dms dms = ensure(angle).dms().get();
        int d = dms.degrees();
        int m = dms.minutes();
        double s = dms.seconds();
        while (d > FULL_TURN || d < 0) {
            if (d > FULL_TURN) {
                d -= FULL_TURN;
            } else if (d < -FULL_TURN) {
                d += FULL_TURN;
            } else {
                d += FULL_TURN;
                m = 60 - m;
                s = 60 - s;
            }
        }
        return init(new Dms(d, m, s));
    }

    /**
     * Truncates toward zero at each step, so a negative input gives
     * negative components throughout: -0.5 becomes (0, -30, 0.0).
     *
     * @throws IllegalArgumentException if the whole degrees do not fit in an int
     */
    static Dms fromDegrees(double realDegrees) {
        if (!(realDegrees > Integer.MIN_VALUE - 1.0 && realDegrees < Integer.MAX_VALUE + 1.0)) {
            throw new IllegalArgumentException("Degrees out of range for DMS: " + realDegrees);
        }
        int d = (int) realDegrees;
        double realMinutes = (realDegrees - d) * 60;
        int m = (int) realMinutes;
        double s = (realMinutes - m) * 60;
        return new Dms(d, m, s);
    }
}
