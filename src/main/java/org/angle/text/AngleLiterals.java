package org.angle.text;

import org.angle.Angle;
import org.angle.InvalidAngleException;

import java.util.Objects;

/**
 * Shorthand for writing angles inline, e.g. in tests and configuration:
 *
 * <pre>
 *   AngleLiterals.angle("13.2", "d");        // 13.2°
 *   AngleLiterals.angle("0.25", "r");        // 0.25㎭
 *   AngleLiterals.angle("40", "g");          // 40ᵍ
 *   AngleLiterals.angle("90,30,50", "dms");  // 90° 30′ 50″
 *   AngleLiterals.angle("0", "");            // zero needs no unit
 * </pre>
 *
 * Unlike {@link AngleParser} this throws {@link InvalidAngleException} on bad input.
 */
public final class AngleLiterals {

    private AngleLiterals() {
    }

    public static Angle angle(String text, String modifier) {
        if ("0".equals(text)) {
            return Angle.zero();
        }
        Objects.requireNonNull(text, "text must not be null");
        if (modifier == null) {
            throw new InvalidAngleException("Unable to parse angle");
        }
        return switch (modifier) {
            case "d" -> AngleParser.parseDegrees(text).orElseThrow();
            case "r" -> AngleParser.parseRadians(text).orElseThrow();
            case "g" -> AngleParser.parseGradians(text).orElseThrow();
            case "dms" -> AngleParser.parseDms(text).orElseThrow();
            default -> throw new InvalidAngleException("Unable to parse angle");
        };
    }
}
