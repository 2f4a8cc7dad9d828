package org.angle;

import java.util.Optional;

/**
 * Either an angle or the reason there is none. Exactly one of the two is present.
 */
public record AngleResult(Angle angle, AngleError error) {

    public AngleResult {
        if ((angle == null) == (error == null)) {
            throw new IllegalArgumentException("exactly one of angle and error must be present");
        }
    }

    public static AngleResult ok(Angle angle) {
        return new AngleResult(angle, null);
    }

    public static AngleResult failure(AngleError error) {
        return new AngleResult(null, error);
    }

    public boolean isOk() {
        return angle != null;
    }

    public Optional<Angle> toOptional() {
        return Optional.ofNullable(angle);
    }

    /**
     * @throws InvalidAngleException carrying the error message if this is a failure
     */
    public Angle orElseThrow() {
        if (angle == null) {
            throw new InvalidAngleException(error.message());
        }
        return angle;
    }

    @Override
    public String toString() {
        return isOk() ? "ok(" + angle + ")" : "error(" + error + ")";
    }
}
