package org.angle;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DmsConversionTest {

    private static final double EPS = 1e-9;

    private final DmsConversion dms = new DmsConversion();

    @Nested
    class Ensure {

        @Test
        void fromDegrees() {
            assertEquals(new Dms(90, 30, 0.0), dms.ensure(Angle.ofDegrees(90.5)).dms().get());
        }

        @Test
        void fromDegrees_truncatesEachStep() {
            Dms out = dms.ensure(Angle.ofDegrees(166.76624)).dms().get();

            assertEquals(166, out.degrees());
            assertEquals(45, out.minutes());
            assertEquals(58.464, out.seconds(), 1e-6);
        }

        @Test
        void fromNegativeDegrees_truncatesTowardZero() {
            Dms out = dms.ensure(Angle.ofDegrees(-10.5)).dms().get();

            assertEquals(-10, out.degrees());
            assertEquals(-30, out.minutes());
            assertEquals(0.0, out.seconds(), EPS);
        }

        @Test
        void fromRadians_pivotsThroughDegrees() {
            Angle ensured = dms.ensure(Angle.ofRadians(1.579522973054868));

            assertTrue(ensured.has(AngleUnit.DEGREES));
            Dms out = ensured.dms().get();
            assertEquals(90, out.degrees());
            assertEquals(30, out.minutes());
            assertEquals(0.0, out.seconds(), 1e-6);
        }

        @Test
        void fromGradians_pivotsThroughDegrees() {
            Dms out = dms.ensure(Angle.ofGradians(100.55555555555556)).dms().get();

            assertEquals(90, out.degrees());
            assertEquals(30, out.minutes());
            assertEquals(0.0, out.seconds(), 1e-6);
        }

        @Test
        void degreesBeyondIntRange_throw() {
            assertThrows(IllegalArgumentException.class, () -> dms.ensure(Angle.ofDegrees(3e9)));
            assertThrows(IllegalArgumentException.class, () -> dms.ensure(Angle.ofDegrees(-3e9)));
            assertThrows(IllegalArgumentException.class, () -> dms.ensure(Angle.ofDegrees(Double.NaN)));
        }

        @Test
        void degreesAtIntLimit_areKept() {
            assertEquals(Integer.MAX_VALUE, dms.ensure(Angle.ofDegrees(Integer.MAX_VALUE + 0.5)).dms().get().degrees());
        }

        @Test
        void alreadyPresent_returnsSameInstance() {
            Angle angle = Angle.ofDms(1, 2, 3);
            assertSame(angle, dms.ensure(angle));
        }

        @Test
        void emptyAngle_throws() {
            assertThrows(IllegalStateException.class, () -> dms.ensure(new Angle(null, null, null, null)));
        }
    }

    @Test
    void toDms_fromRadians() {
        Converted<Dms> c = dms.toDms(Angle.ofRadians(0.5));

        assertEquals(28, c.value().degrees());
        assertEquals(38, c.value().minutes());
        assertEquals(52.403123548181156, c.value().seconds(), 1e-6);
        assertEquals(28.64788975654116, c.angle().degrees().getAsDouble());
    }

    @Nested
    @DisplayName("abs")
    class Abs {

        @Test
        void negativeWithinOneTurn_complementsMinutesAndSeconds() {
            assertEquals(new Dms(90, 45, 15.0), dms.abs(Angle.ofDms(-270, 15, 45)).dms().get());
        }

        @Test
        void overOneTurn_keepsMinutesAndSeconds() {
            assertEquals(new Dms(90, 0, 0.0), dms.abs(Angle.ofDms(1170, 0, 0)).dms().get());
        }

        @Test
        void complementIsAppliedOnlyOnce() {
            // -630 -> -270 (no complement) -> 90 (complement)
            assertEquals(new Dms(90, 45, 15.0), dms.abs(Angle.ofDms(-630, 15, 45)).dms().get());
        }

        @Test
        void inRange_isUnchanged() {
            assertEquals(new Dms(10, 20, 30.0), dms.abs(Angle.ofDms(10, 20, 30)).dms().get());
        }

        @Test
        void result_carriesOnlyDms() {
            Angle abs = dms.abs(Angle.ofDms(-270, 15, 45).toDegrees().angle());

            assertTrue(abs.has(AngleUnit.DMS));
            assertFalse(abs.has(AngleUnit.DEGREES));
        }

        @Test
        void angleInAnotherUnit_isConvertedFirst() {
            assertEquals(new Dms(90, 30, 0.0), dms.abs(Angle.ofDegrees(450.5)).dms().get());
        }
    }

    @Test
    void roundTrip_throughDegrees_withWholeSeconds() {
        for (int d = 0; d < 360; d += 37) {
            for (int m = 0; m < 60; m += 11) {
                for (int s = 0; s < 60; s += 13) {
                    double degrees = Angle.ofDms(d, m, s).toDegrees().value();
                    Dms back = Angle.ofDegrees(degrees).toDms().value();

                    double expected = d + m / 60.0 + s / 3600.0;
                    double actual = back.degrees() + back.minutes() / 60.0 + back.seconds() / 3600.0;
                    assertEquals(expected, actual, 1e-9, "round trip for " + d + " " + m + " " + s);
                }
            }
        }
    }
}
