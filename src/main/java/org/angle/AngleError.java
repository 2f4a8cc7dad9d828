package org.angle;

import java.util.Objects;

/**
 * Why an angle could not be produced.
 */
public record AngleError(Kind kind, String message) {

    public enum Kind {
        /** Input outside the mathematical domain of an inverse function. */
        DOMAIN,
        /** Text that does not describe an angle. */
        PARSE
    }

    public AngleError {
        Objects.requireNonNull(kind, "kind must not be null");
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must be non-empty");
        }
    }

    public static AngleError domain(String message) {
        return new AngleError(Kind.DOMAIN, message);
    }

    public static AngleError parse(String message) {
        return new AngleError(Kind.PARSE, message);
    }

    @Override
    public String toString() {
        return kind + ": " + message;
    }
}
