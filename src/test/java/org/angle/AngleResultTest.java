package org.angle;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class AngleResultTest {

    @Test
    void ok_exposesAngle() {
        AngleResult result = AngleResult.ok(Angle.ofDegrees(13));

        assertTrue(result.isOk());
        assertEquals(Angle.ofDegrees(13), result.toOptional().get());
        assertEquals(Angle.ofDegrees(13), result.orElseThrow());
        assertNull(result.error());
    }

    @Test
    void failure_throwsInvalidAngleWithMessage() {
        AngleResult result = AngleResult.failure(AngleError.parse("Unable to parse value as degrees"));

        assertFalse(result.isOk());
        assertTrue(result.toOptional().isEmpty());
        assertEquals(AngleError.Kind.PARSE, result.error().kind());
        InvalidAngleException ex = assertThrows(InvalidAngleException.class, result::orElseThrow);
        assertEquals("Unable to parse value as degrees", ex.getMessage());
    }

    @Test
    void bothOrNeither_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AngleResult(null, null));
        assertThrows(IllegalArgumentException.class,
                () -> new AngleResult(Angle.zero(), AngleError.domain("Invalid function domain")));
    }

    @Test
    void error_requiresKindAndMessage() {
        assertThrows(NullPointerException.class, () -> new AngleError(null, "x"));
        assertThrows(IllegalArgumentException.class, () -> new AngleError(AngleError.Kind.DOMAIN, " "));
    }
}
