package org.angle;

import java.util.Objects;

/**
 * Decimal degrees.
 */
public final class DegreeConversion implements AngleConversion {

    static final double FULL_TURN = 360.0;

    private static final double MAX_STEPPED_TURNS = 1_000_000.0;

    @Override
    public AngleUnit unit() {
        return AngleUnit.DEGREES;
    }

    /**
     * Builds an angle from a number of degrees. Zero degrees is {@link Angle#zero()}.
     */
    public Angle init(double degrees) {
        if (degrees == 0.0) {
            return Angle.zero();
        }
        return new Angle(degrees, null, null, null);
    }

    @Override
    public Angle ensure(Angle angle) {
        Objects.requireNonNull(angle, "angle must not be null");
        if (angle.has(AngleUnit.DEGREES)) {
            return angle;
        }
        if (angle.has(AngleUnit.RADIANS)) {
            return angle.withDegrees(fromRadians(angle.radians().getAsDouble()));
        }
        if (angle.has(AngleUnit.GRADIANS)) {
            return angle.withDegrees(fromGradians(angle.gradians().getAsDouble()));
        }
        if (angle.has(AngleUnit.DMS)) {
            return angle.withDegrees(fromDms(angle.dms().get()));
        }
        throw new IllegalStateException("Angle has no representation to convert to degrees");
    }

    /**
     * @return the angle carrying degrees, together with the degrees value.
     */
    public Converted<Double> toDegrees(Angle angle) {
        Angle ensured = ensure(angle);
        return new Converted<>(ensured, ensured.degrees().getAsDouble());
    }

    /**
     * Discards complete revolutions: the result lies in [0, 360].
     * -270 and 1170 both become 90.
     */
    @Override
    public Angle abs(Angle angle) {
        double d = ensure(angle).degrees().getAsDouble();
        return init(reduce(d, FULL_TURN));
    }

    static double fromRadians(double radians) {
        return radians * 180.0 / Math.PI;
    }

    static double fromGradians(double gradians) {
        return gradians / 400.0 * 360.0;
    }

    static double fromDms(Dms dms) {
        return dms.degrees() + (dms.minutes() / 60.0) + (dms.seconds() / 3600.0);
    }

    /**
     * One turn at a time, until the value lies in [0, turn].
     */
    static double reduce(double value, double turn) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("Cannot normalize a non-finite angle: " + value);
        }
        double v = value;
        // Far enough out, subtracting a turn no longer changes the value.
        if (Math.abs(v) > turn * MAX_STEPPED_TURNS) {
            v = v % turn;
        }
        while (v > turn) {
            v -= turn;
        }
        while (v < 0) {
            v += turn;
        }
        return v;
    }
}
