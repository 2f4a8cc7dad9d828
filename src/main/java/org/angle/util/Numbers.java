package org.angle.util;

import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.regex.Pattern;

/**
 * Best-effort conversion of strings to numbers.
 * Every method returns an empty optional instead of throwing on bad input.
 */
public final class Numbers {

    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");
    private static final Pattern DECIMAL = Pattern.compile("-?[0-9]+\\.[0-9]+");

    private Numbers() {
    }

    /**
     * Parses an optionally signed run of digits ("13", "-4").
     * Values that do not fit in an int are rejected.
     */
    public static OptionalInt parseInteger(String value) {
        if (value == null || !INTEGER.matcher(value).matches()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            return OptionalInt.empty();
        }
    }

    /**
     * Parses a decimal with a mandatory fractional part ("13.2"); "13" is rejected.
     */
    public static OptionalDouble parseDecimal(String value) {
        if (value == null || !DECIMAL.matcher(value).matches()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(value));
    }

    /**
     * Parses either form: a decimal first, then an integer of any length.
     */
    public static OptionalDouble parseNumber(String value) {
        OptionalDouble decimal = parseDecimal(value);
        if (decimal.isPresent()) {
            return decimal;
        }
        if (value == null || !INTEGER.matcher(value).matches()) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(Double.parseDouble(value));
    }
}
