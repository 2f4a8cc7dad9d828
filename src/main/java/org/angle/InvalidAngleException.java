package org.angle;

/**
 * Thrown where a failed angle result cannot be returned, e.g. by the literal shorthand.
 */
public class InvalidAngleException extends IllegalArgumentException {

    public InvalidAngleException(String message) {
        super(message);
    }
}
