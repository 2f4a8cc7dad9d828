package org.angle;

import java.util.Objects;

/**
 * Radians. Radians are the representation the trigonometric functions work in,
 * and the pivot for the other units.
 */
public final class RadianConversion implements AngleConversion {

    static final double FULL_TURN = 2.0 * Math.PI;

    @Override
    public AngleUnit unit() {
        return AngleUnit.RADIANS;
    }

    /**
     * Builds an angle from a number of radians. Zero radians is {@link Angle#zero()}.
     */
    public Angle init(double radians) {
        if (radians == 0.0) {
            return Angle.zero();
        }
        return new Angle(null, radians, null, null);
    }

    @Override
    public Angle ensure(Angle angle) {
        Objects.requireNonNull(angle, "angle must not be null");
        if (angle.has(AngleUnit.RADIANS)) {
            return angle;
        }
        if (angle.has(AngleUnit.DEGREES)) {
            return angle.withRadians(fromDegrees(angle.degrees().getAsDouble()));
        }
        if (angle.has(AngleUnit.GRADIANS)) {
            return angle.withRadians(fromGradians(angle.gradians().getAsDouble()));
        }
        if (angle.has(AngleUnit.DMS)) {
            // Degrees are only an intermediate here; they are not cached.
            double degrees = DegreeConversion.fromDms(angle.dms().get());
            return angle.withRadians(fromDegrees(degrees));
        }
        throw new IllegalStateException("Angle has no representation to convert to radians");
    }

    /**
     * @return the angle carrying radians, together with the radians value.
     */
    public Converted<Double> toRadians(Angle angle) {
        Angle ensured = ensure(angle);
        return new Converted<>(ensured, ensured.radians().getAsDouble());
    }

    /**
     * Discards complete revolutions: the result lies in [0, 2π].
     */
    @Override
    public Angle abs(Angle angle) {
        double r = ensure(angle).radians().getAsDouble();
        return init(DegreeConversion.reduce(r, FULL_TURN));
    }

    static double fromDegrees(double degrees) {
        return degrees / 180.0 * Math.PI;
    }

    static double fromGradians(double gradians) {
        return gradians * Math.PI / 200.0;
    }
}
