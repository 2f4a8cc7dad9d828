package org.angle;

import java.util.Objects;

/**
 * Gradians (gons): 400 to the full turn.
 */
public final class GradianConversion implements AngleConversion {

    private final DegreeConversion degrees = new DegreeConversion();

    @Override
    public AngleUnit unit() {
        return AngleUnit.GRADIANS;
    }

    /**
     * Builds an angle from a number of gradians. Zero gradians is {@link Angle#zero()}.
     */
    public Angle init(double gradians) {
        if (gradians == 0.0) {
            return Angle.zero();
        }
        return new Angle(null, null, gradians, null);
    }

    @Override
    public Angle ensure(Angle angle) {
        Objects.requireNonNull(angle, "angle must not be null");
        if (angle.has(AngleUnit.GRADIANS)) {
            return angle;
        }
        if (angle.has(AngleUnit.RADIANS)) {
            return angle.withGradians(fromRadians(angle.radians().getAsDouble()));
        }
        if (angle.has(AngleUnit.DEGREES)) {
            return angle.withGradians(fromDegrees(angle.degrees().getAsDouble()));
        }
        if (angle.has(AngleUnit.DMS)) {
            return ensure(degrees.ensure(angle));
        }
        throw new IllegalStateException("Angle has no representation to convert to gradians");
    }

    /**
     * @return the angle carrying gradians, together with the gradians value.
     */
    public Converted<Double> toGradians(Angle angle) {
        Angle ensured = ensure(angle);
        return new Converted<>(ensured, ensured.gradians().getAsDouble());
    }

    /**
     * Gradians have no reduction of their own: the angle is normalized in
     * degrees, and the result is a degree angle in [0, 360].
     */
    @Override
    public Angle abs(Angle angle) {
        Objects.requireNonNull(angle, "angle must not be null");
        return degrees.abs(degrees.ensure(angle));
    }

    static double fromRadians(double radians) {
        return radians * 200.0 / Math.PI;
    }

    static double fromDegrees(double degrees) {
        return degrees / 360.0 * 400.0;
    }
}
