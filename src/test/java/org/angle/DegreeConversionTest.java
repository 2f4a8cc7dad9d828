package org.angle;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DegreeConversionTest {

    private final DegreeConversion degrees = new DegreeConversion();

    @Nested
    class Ensure {

        @Test
        void fromRadians() {
            assertEquals(28.64788975654116, degrees.ensure(Angle.ofRadians(0.5)).degrees().getAsDouble());
        }

        @Test
        void fromGradians() {
            assertEquals(68.75496000000001, degrees.ensure(Angle.ofGradians(76.3944)).degrees().getAsDouble());
        }

        @Test
        void fromDms() {
            assertEquals(77.84888888888888, degrees.ensure(Angle.ofDms(77, 50, 56)).degrees().getAsDouble());
        }

        @Test
        void alreadyPresent_returnsSameInstance() {
            Angle angle = Angle.ofDegrees(13);
            assertSame(angle, degrees.ensure(angle));
        }

        @Test
        void isIdempotent() {
            Angle once = degrees.ensure(Angle.ofRadians(1.25));
            Angle twice = degrees.ensure(once);

            assertSame(once, twice);
            assertEquals(once, degrees.ensure(Angle.ofRadians(1.25)));
        }

        @Test
        void prefersRadians_overOtherSources() {
            Angle radiansAndDms = Angle.ofDms(10).toRadians().angle();

            Angle ensured = degrees.ensure(radiansAndDms);

            assertEquals(radiansAndDms.radians().getAsDouble() * 180.0 / Math.PI,
                    ensured.degrees().getAsDouble());
        }

        @Test
        void emptyAngle_throws() {
            assertThrows(IllegalStateException.class, () -> degrees.ensure(new Angle(null, null, null, null)));
        }
    }

    @Test
    void toDegrees_returnsAngleCarryingTheValue() {
        Converted<Double> c = degrees.toDegrees(Angle.ofRadians(0.5));

        assertEquals(28.64788975654116, c.value());
        assertEquals(c.value(), c.angle().degrees().getAsDouble());
        assertTrue(c.angle().has(AngleUnit.RADIANS));
    }

    @Nested
    class Abs {

        @Test
        void negative_addsTurns() {
            assertEquals(90.0, degrees.abs(Angle.ofDegrees(-270)).degrees().getAsDouble());
        }

        @Test
        void overOneTurn_subtractsTurns() {
            assertEquals(90.0, degrees.abs(Angle.ofDegrees(1170)).degrees().getAsDouble());
        }

        @Test
        void inRange_isUnchanged_including360() {
            assertEquals(45.5, degrees.abs(Angle.ofDegrees(45.5)).degrees().getAsDouble());
            assertEquals(360.0, degrees.abs(Angle.ofDegrees(360)).degrees().getAsDouble());
        }

        @Test
        void fullNegativeTurn_becomesZero() {
            assertSame(Angle.zero(), degrees.abs(Angle.ofDegrees(-360)));
        }

        @Test
        void result_carriesOnlyDegrees() {
            Angle abs = degrees.abs(Angle.ofDegrees(-270).toRadians().angle());

            assertTrue(abs.has(AngleUnit.DEGREES));
            assertFalse(abs.has(AngleUnit.RADIANS));
        }

        @Test
        void angleInAnotherUnit_isConvertedFirst() {
            assertEquals(90.0, degrees.abs(Angle.ofDms(-270)).degrees().getAsDouble());
        }

        @Test
        void hugeValues_stillLandInRange() {
            double abs = degrees.abs(Angle.ofDegrees(1e300)).degrees().getAsDouble();
            assertTrue(abs >= 0.0 && abs <= 360.0);
        }

        @Test
        void nonFinite_throws() {
            assertThrows(IllegalArgumentException.class,
                    () -> degrees.abs(Angle.ofDegrees(Double.POSITIVE_INFINITY)));
        }
    }

    @Test
    void roundTrip_throughRadians() {
        for (double x = -1000.0; x <= 1000.0; x += 13.7) {
            Angle viaRadians = Angle.ofRadians(Angle.ofDegrees(x).toRadians().value());
            double back = viaRadians.toDegrees().value();
            assertEquals(x, back, Math.max(1e-9, Math.abs(x) * 1e-9), "round trip for " + x);
        }
    }

    @Test
    void unit_isDegrees() {
        assertEquals(AngleUnit.DEGREES, degrees.unit());
    }
}
