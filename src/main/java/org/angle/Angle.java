package org.angle;

import org.angle.text.AngleFormatter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * An immutable angle that may carry up to four representations of the same value:
 * decimal degrees, radians, gradians and degrees/minutes/seconds.
 *
 * An angle starts out with the single representation it was built from
 * (the zero angle excepted, see {@link #zero()}). Other representations are
 * computed on demand by the unit conversions and carried by the angle they
 * return, so each one is computed at most once per value:
 *
 * <pre>
 *   Converted&lt;Double&gt; r = Angle.ofDegrees(90).toRadians();
 *   Converted&lt;Double&gt; g = r.angle().toGradians();   // reuses the cached radians
 * </pre>
 */
public final class Angle {

    private static final Logger log = LoggerFactory.getLogger(Angle.class);

    private static final Angle ZERO = new Angle(0.0, 0.0, 0.0, null);

    private static final DegreeConversion DEGREES = new DegreeConversion();
    private static final RadianConversion RADIANS = new RadianConversion();
    private static final GradianConversion GRADIANS = new GradianConversion();
    private static final DmsConversion DMS = new DmsConversion();

    // Order in which absoluteValue picks the representation to normalize.
    private static final List<AngleConversion> ABS_PRIORITY = List.of(RADIANS, DEGREES, GRADIANS, DMS);

    private final Double degrees;
    private final Double radians;
    private final Double gradians;
    private final Dms dms;

    Angle(Double degrees, Double radians, Double gradians, Dms dms) {
        this.degrees = degrees;
        this.radians = radians;
        this.gradians = gradians;
        this.dms = dms;
    }

    /**
     * The zero angle. Zero is the same in every unit, so degrees, radians and
     * gradians are all populated.
     */
    public static Angle zero() {
        return ZERO;
    }

    public static Angle ofDegrees(double degrees) {
        return DEGREES.init(degrees);
    }

    public static Angle ofRadians(double radians) {
        return RADIANS.init(radians);
    }

    public static Angle ofGradians(double gradians) {
        return GRADIANS.init(gradians);
    }

    public static Angle ofDms(int degrees) {
        return DMS.init(degrees);
    }

    public static Angle ofDms(int degrees, int minutes) {
        return DMS.init(degrees, minutes);
    }

    public static Angle ofDms(int degrees, int minutes, double seconds) {
        return DMS.init(degrees, minutes, seconds);
    }

    /**
     * Folds the angle into the principal range of one of its units.
     * The unit is the first populated one in the order radians, degrees,
     * gradians, DMS.
     *
     * @throws IllegalStateException if the angle carries no representation at all
     */
    public static Angle absoluteValue(Angle angle) {
        Objects.requireNonNull(angle, "angle must not be null");
        for (AngleConversion conversion : ABS_PRIORITY) {
            if (angle.has(conversion.unit())) {
                return conversion.abs(angle);
            }
        }
        log.error("absoluteValue called on an angle without any representation");
        throw new IllegalStateException("Angle has no representation to normalize");
    }

    public Angle absoluteValue() {
        return absoluteValue(this);
    }

    public Converted<Double> toDegrees() {
        return DEGREES.toDegrees(this);
    }

    public Converted<Double> toRadians() {
        return RADIANS.toRadians(this);
    }

    public Converted<Double> toGradians() {
        return GRADIANS.toGradians(this);
    }

    public Converted<Dms> toDms() {
        return DMS.toDms(this);
    }

    /**
     * @return true if the given representation is already present on this angle.
     */
    public boolean has(AngleUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        return switch (unit) {
            case DEGREES -> degrees != null;
            case RADIANS -> radians != null;
            case GRADIANS -> gradians != null;
            case DMS -> dms != null;
        };
    }

    public boolean isEmpty() {
        return degrees == null && radians == null && gradians == null && dms == null;
    }

    public OptionalDouble degrees() {
        return degrees == null ? OptionalDouble.empty() : OptionalDouble.of(degrees);
    }

    public OptionalDouble radians() {
        return radians == null ? OptionalDouble.empty() : OptionalDouble.of(radians);
    }

    public OptionalDouble gradians() {
        return gradians == null ? OptionalDouble.empty() : OptionalDouble.of(gradians);
    }

    public Optional<Dms> dms() {
        return Optional.ofNullable(dms);
    }

    // Functional updates used by the conversions; the receiver is never changed.

    Angle withDegrees(double value) {
        return new Angle(value, radians, gradians, dms);
    }

    Angle withRadians(double value) {
        return new Angle(degrees, value, gradians, dms);
    }

    Angle withGradians(double value) {
        return new Angle(degrees, radians, value, dms);
    }

    Angle withDms(Dms value) {
        return new Angle(degrees, radians, gradians, value);
    }

    @Override
    public String toString() {
        return AngleFormatter.inspect(this);
    }

    @Override
    public int hashCode() {
        return Objects.hash(degrees, radians, gradians, dms);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null) return false;
        if (obj.getClass() != this.getClass()) return false;

        Angle other = (Angle) obj;
        return Objects.equals(degrees, other.degrees)
                && Objects.equals(radians, other.radians)
                && Objects.equals(gradians, other.gradians)
                && Objects.equals(dms, other.dms);
    }
}
