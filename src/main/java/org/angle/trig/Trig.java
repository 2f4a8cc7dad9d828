package org.angle.trig;

import org.angle.Angle;
import org.angle.AngleError;
import org.angle.AngleResult;
import org.angle.Converted;
import org.angle.RadianConversion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.DoubleUnaryOperator;

/**
 * Trigonometric functions over {@link Angle}.
 *
 * The direct functions convert their argument to radians (once) and return
 * the angle that now carries them alongside the result. The inverse functions
 * check the domain of their input and return the resulting angle in radians,
 * or a {@link AngleError.Kind#DOMAIN} failure. A zero result (acos(1), asin(0),
 * acosh(1), ...) is {@link Angle#zero()}, which carries degrees and gradians as well.
 *
 * Results come from {@link Math}, whose approximations may differ in the
 * last bits across platforms; compare with a tolerance.
 */
public final class Trig {

    private static final Logger log = LoggerFactory.getLogger(Trig.class);

    static final String INVALID_DOMAIN = "Invalid function domain";

    private static final RadianConversion RADIANS = new RadianConversion();

    // Above this, sqrt(x * x ± 1) equals x in double precision.
    private static final double LARGE = 1e8;
    private static final double LN_2 = Math.log(2.0);

    private Trig() {
    }

    /** Cosine, in [-1, 1]. */
    public static Converted<Double> cos(Angle angle) {
        return apply(angle, Math::cos);
    }

    /** Hyperbolic cosine, in [1, +∞). */
    public static Converted<Double> cosh(Angle angle) {
        return apply(angle, Math::cosh);
    }

    /** Sine, in [-1, 1]. */
    public static Converted<Double> sin(Angle angle) {
        return apply(angle, Math::sin);
    }

    public static Converted<Double> sinh(Angle angle) {
        return apply(angle, Math::sinh);
    }

    public static Converted<Double> tan(Angle angle) {
        return apply(angle, Math::tan);
    }

    /** Hyperbolic tangent, in [-1, 1]. */
    public static Converted<Double> tanh(Angle angle) {
        return apply(angle, Math::tanh);
    }

    /**
     * Arccosine of x in [-1, 1]; the angle lies in [0, π].
     */
    public static AngleResult acos(double x) {
        if (!(x >= -1 && x <= 1)) {
            return outsideDomain("acos", x);
        }
        return inRadians(Math.acos(x));
    }

    /**
     * Inverse hyperbolic cosine of x in [1, +∞).
     */
    public static AngleResult acosh(double x) {
        if (!(x >= 1)) {
            return outsideDomain("acosh", x);
        }
        if (x > LARGE) {
            return inRadians(Math.log(x) + LN_2);
        }
        double t = x - 1.0;
        return inRadians(Math.log1p(t + Math.sqrt(2.0 * t + t * t)));
    }

    /**
     * Arcsine of x in [-1, 1]; the angle lies in [-π/2, π/2].
     */
    public static AngleResult asin(double x) {
        if (!(x >= -1 && x <= 1)) {
            return outsideDomain("asin", x);
        }
        return inRadians(Math.asin(x));
    }

    /**
     * Inverse hyperbolic sine of any real x.
     */
    public static AngleResult asinh(double x) {
        if (Double.isNaN(x)) {
            return outsideDomain("asinh", x);
        }
        // Odd function: evaluate on |x| to avoid cancellation for negative x.
        double a = Math.abs(x);
        double r = a > LARGE
                ? Math.log(a) + LN_2
                : Math.log1p(a + a * a / (1.0 + Math.sqrt(1.0 + a * a)));
        return inRadians(Math.copySign(r, x));
    }

    /**
     * Arctangent of any real x; the angle lies in [-π/2, π/2].
     */
    public static AngleResult atan(double x) {
        if (Double.isNaN(x)) {
            return outsideDomain("atan", x);
        }
        return inRadians(Math.atan(x));
    }

    /**
     * Angle between the positive x axis and the point (x, y); lies in [-π, π].
     */
    public static AngleResult atan2(double y, double x) {
        if (Double.isNaN(y) || Double.isNaN(x)) {
            log.debug("atan2 rejected ({}, {}): {}", y, x, INVALID_DOMAIN);
            return AngleResult.failure(AngleError.domain(INVALID_DOMAIN));
        }
        return inRadians(Math.atan2(y, x));
    }

    private static Converted<Double> apply(Angle angle, DoubleUnaryOperator fn) {
        Objects.requireNonNull(angle, "angle must not be null");
        Converted<Double> radians = RADIANS.toRadians(angle);
        return new Converted<>(radians.angle(), fn.applyAsDouble(radians.value()));
    }

    private static AngleResult inRadians(double radians) {
        return AngleResult.ok(RADIANS.init(radians));
    }

    private static AngleResult outsideDomain(String function, double x) {
        log.debug("{} rejected {}: {}", function, x, INVALID_DOMAIN);
        return AngleResult.failure(AngleError.domain(INVALID_DOMAIN));
    }
}
