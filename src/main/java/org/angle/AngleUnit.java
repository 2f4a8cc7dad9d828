package org.angle;

import java.util.Locale;
import java.util.Map;

/**
 * The units an {@link Angle} can be expressed in.
 *
 * Unit names are resolved with {@link #of(String)}:
 * - trim leading/trailing spaces
 * - lowercase
 * - map short aliases ("deg", "rad", "gon", ...) onto the canonical unit
 */
public enum AngleUnit {
    DEGREES("degrees"),
    RADIANS("radians"),
    GRADIANS("gradians"),
    DMS("dms");

    private static final Map<String, AngleUnit> ALIASES = Map.ofEntries(
            Map.entry("degrees", DEGREES),
            Map.entry("degree", DEGREES),
            Map.entry("deg", DEGREES),
            Map.entry("d", DEGREES),
            Map.entry("radians", RADIANS),
            Map.entry("radian", RADIANS),
            Map.entry("rad", RADIANS),
            Map.entry("r", RADIANS),
            Map.entry("gradians", GRADIANS),
            Map.entry("gradian", GRADIANS),
            Map.entry("grad", GRADIANS),
            Map.entry("gon", GRADIANS),
            Map.entry("g", GRADIANS),
            Map.entry("dms", DMS)
    );

    private final String canonicalName;

    AngleUnit(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    /**
     * @return the lowercase name used in text and JSON ("degrees", "dms", ...).
     */
    public String canonicalName() {
        return canonicalName;
    }

    /**
     * Resolves a unit from its canonical name or one of its aliases.
     *
     * @throws IllegalArgumentException if the name is blank or unknown
     */
    public static AngleUnit of(String rawName) {
        if (rawName == null || rawName.isBlank()) {
            throw new IllegalArgumentException("unit name must be non-empty");
        }
        AngleUnit unit = ALIASES.get(rawName.strip().toLowerCase(Locale.ROOT));
        if (unit == null) {
            throw new IllegalArgumentException("Unknown angle unit: " + rawName);
        }
        return unit;
    }

    @Override
    public String toString() {
        return canonicalName;
    }
}
