package org.angle.text;

import org.angle.Angle;
import org.angle.Dms;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Renders angles for display: "13.2°", "0.25㎭", "40ᵍ", "90° 30′ 50″".
 *
 * The first populated representation wins, in the order degrees, radians,
 * gradians, DMS. A zero value in any of them renders as a bare "0".
 */
public final class AngleFormatter {

    static final String DEGREES = "°";
    static final String RADIANS = "㎭";
    static final String GRADIANS = "ᵍ";
    static final String PRIME = "′";
    static final String DOUBLE_PRIME = "″";

    private static final String ZERO = "0";

    private AngleFormatter() {
    }

    public static String format(Angle angle) {
        Objects.requireNonNull(angle, "angle must not be null");
        if (isZero(angle.degrees()) || isZero(angle.radians()) || isZero(angle.gradians())
                || angle.dms().map(Dms::isZero).orElse(false)) {
            return ZERO;
        }
        if (angle.degrees().isPresent()) {
            return number(angle.degrees().getAsDouble()) + DEGREES;
        }
        if (angle.radians().isPresent()) {
            return number(angle.radians().getAsDouble()) + RADIANS;
        }
        if (angle.gradians().isPresent()) {
            return number(angle.gradians().getAsDouble()) + GRADIANS;
        }
        Optional<Dms> dms = angle.dms();
        if (dms.isPresent()) {
            return dms(dms.get());
        }
        // Only reachable for an angle that lost its representations.
        return "?";
    }

    /**
     * Same as {@link #format(Angle)}, wrapped as "Angle&lt;...&gt;".
     */
    public static String inspect(Angle angle) {
        return "Angle<" + format(angle) + ">";
    }

    private static String dms(Dms dms) {
        StringBuilder sb = new StringBuilder().append(dms.degrees()).append(DEGREES);
        if (dms.minutes() == 0 && dms.seconds() == 0.0) {
            return sb.toString();
        }
        sb.append(' ').append(dms.minutes()).append(PRIME);
        if (dms.seconds() != 0.0) {
            sb.append(' ').append(number(dms.seconds())).append(DOUBLE_PRIME);
        }
        return sb.toString();
    }

    /**
     * Whole numbers print without a fractional part ("13", not "13.0").
     */
    static String number(double value) {
        if (Double.isFinite(value) && value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static boolean isZero(OptionalDouble value) {
        return value.isPresent() && value.getAsDouble() == 0.0;
    }
}
