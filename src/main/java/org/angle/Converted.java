package org.angle;

import java.util.Objects;

/**
 * Result of reading an angle in some unit: the value, and the angle that now
 * caches it. Keep using {@link #angle()} so the conversion is not repeated.
 */
public record Converted<T>(Angle angle, T value) {
    public Converted {
        Objects.requireNonNull(angle, "angle must not be null");
        Objects.requireNonNull(value, "value must not be null");
    }
}
