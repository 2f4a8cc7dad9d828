package org.angle.text;

import org.angle.Angle;
import org.angle.AngleError;
import org.angle.AngleResult;
import org.angle.AngleUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.angle.util.Numbers.parseInteger;
import static org.angle.util.Numbers.parseNumber;

/**
 * Reads angles from text.
 *
 * Scalar units take the leading number and ignore whatever follows it, so
 * "13.2°", "0.25㎭" and "40ᵍ" all parse. Only degrees accept a leading minus.
 * DMS text is three numbers separated by commas, spaces or the degree, prime and
 * double-prime symbols: "166 45 58.46", "166,45,58.46", "-166° 45′ 58.46″".
 *
 * Malformed text yields a {@link AngleError.Kind#PARSE} failure, never an exception.
 */
public final class AngleParser {

    private static final Logger log = LoggerFactory.getLogger(AngleParser.class);

    private static final Pattern SIGNED_NUMBER = Pattern.compile("^-?[0-9]+(?:\\.[0-9]+)?");
    private static final Pattern UNSIGNED_NUMBER = Pattern.compile("^[0-9]+(?:\\.[0-9]+)?");
    private static final Pattern DMS = Pattern.compile(
            "(-?[0-9]+)"
                    + "(?:[°, ]? *)"
                    + "([0-9]+)"
                    + "(?:[′', ]? *)"
                    + "([0-9]+(?:\\.[0-9]+)?)"
                    + "[″\"]?");

    private AngleParser() {
    }

    public static AngleResult parse(String text, AngleUnit unit) {
        Objects.requireNonNull(unit, "unit must not be null");
        return switch (unit) {
            case DEGREES -> parseDegrees(text);
            case RADIANS -> parseRadians(text);
            case GRADIANS -> parseGradians(text);
            case DMS -> parseDms(text);
        };
    }

    public static AngleResult parseDegrees(String text) {
        OptionalDouble n = leadingNumber(SIGNED_NUMBER, text);
        return n.isPresent()
                ? AngleResult.ok(Angle.ofDegrees(n.getAsDouble()))
                : failure(text, "Unable to parse value as degrees");
    }

    public static AngleResult parseRadians(String text) {
        OptionalDouble n = leadingNumber(UNSIGNED_NUMBER, text);
        return n.isPresent()
                ? AngleResult.ok(Angle.ofRadians(n.getAsDouble()))
                : failure(text, "Unable to parse value as radians");
    }

    public static AngleResult parseGradians(String text) {
        OptionalDouble n = leadingNumber(UNSIGNED_NUMBER, text);
        return n.isPresent()
                ? AngleResult.ok(Angle.ofGradians(n.getAsDouble()))
                : failure(text, "Unable to parse value as gradians");
    }

    public static AngleResult parseDms(String text) {
        if (text != null) {
            Matcher m = DMS.matcher(text);
            if (m.find()) {
                OptionalInt d = parseInteger(m.group(1));
                OptionalInt min = parseInteger(m.group(2));
                OptionalDouble s = parseNumber(m.group(3));
                if (d.isPresent() && min.isPresent() && s.isPresent()) {
                    return AngleResult.ok(Angle.ofDms(d.getAsInt(), min.getAsInt(), s.getAsDouble()));
                }
            }
        }
        return failure(text, "Unable to parse value as DMS");
    }

    private static OptionalDouble leadingNumber(Pattern pattern, String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        Matcher m = pattern.matcher(text);
        return m.find() ? parseNumber(m.group()) : OptionalDouble.empty();
    }

    private static AngleResult failure(String text, String message) {
        log.debug("Rejected angle text '{}': {}", text, message);
        return AngleResult.failure(AngleError.parse(message));
    }
}
