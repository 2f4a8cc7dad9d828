package org.angle.io.json;

/**
 * Describes how the unit and the value are stored in the JSON objects.
 * Example objects:
 * { "unit": "degrees", "value": 13.2 }
 * { "unit": "dms", "value": [90, 30, 50.0] }
 */
public record AngleJsonFormat(String unitField, String valueField) {

    public AngleJsonFormat {
        if (unitField == null || unitField.isBlank()) {
            throw new IllegalArgumentException("unitField must be non-empty");
        }
        if (valueField == null || valueField.isBlank()) {
            throw new IllegalArgumentException("valueField must be non-empty");
        }
        if (unitField.equals(valueField)) {
            throw new IllegalArgumentException("unitField and valueField must differ");
        }
    }

    public static AngleJsonFormat defaults() {
        return new AngleJsonFormat("unit", "value");
    }
}
