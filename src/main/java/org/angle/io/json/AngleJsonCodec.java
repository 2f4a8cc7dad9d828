package org.angle.io.json;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.angle.Angle;
import org.angle.AngleUnit;
import org.angle.Dms;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Reads and writes lists of angles as JSON.
 *
 * Expected JSON shape: array of objects
 * [
 *   { "unit": "degrees", "value": 13.2 },
 *   { "unit": "rad",     "value": 0.25 },
 *   { "unit": "dms",     "value": [90, 30, 50] }
 * ]
 *
 * Unit names go through {@link AngleUnit#of(String)}, so aliases are accepted on read.
 * Each angle is written in the first unit it carries, in the order degrees,
 * radians, gradians, DMS.
 */
public final class AngleJsonCodec {

    private static final Logger log = LoggerFactory.getLogger(AngleJsonCodec.class);

    private final AngleJsonFormat format;
    private final JsonFactory factory;

    public AngleJsonCodec() {
        this(AngleJsonFormat.defaults());
    }

    public AngleJsonCodec(AngleJsonFormat format) {
        this.format = Objects.requireNonNull(format, "format must not be null");
        this.factory = new ObjectMapper().getFactory();
    }

    public List<Angle> read(InputStreamSupplier streamSupplier) {
        Objects.requireNonNull(streamSupplier, "streamSupplier must not be null");

        List<Angle> result = new ArrayList<>();

        try (InputStream in = streamSupplier.open();
             JsonParser p = factory.createParser(in)) {

            if (p.nextToken() != JsonToken.START_ARRAY) {
                throw new IllegalArgumentException("JSON must start with an array of objects");
            }

            while (p.nextToken() != JsonToken.END_ARRAY) {
                if (p.currentToken() != JsonToken.START_OBJECT) {
                    throw new IllegalArgumentException("Expected an object inside the array");
                }
                result.add(readAngle(p, result.size()));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read angles from JSON", e);
        }

        log.debug("Read {} angles from JSON", result.size());
        return Collections.unmodifiableList(result);
    }

    public void write(List<Angle> angles, OutputStream out) {
        Objects.requireNonNull(angles, "angles must not be null");
        Objects.requireNonNull(out, "out must not be null");

        try (JsonGenerator g = factory.createGenerator(out)) {
            g.writeStartArray();
            for (Angle angle : angles) {
                writeAngle(g, Objects.requireNonNull(angle, "angles must not contain null"));
            }
            g.writeEndArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write angles as JSON", e);
        }

        log.debug("Wrote {} angles as JSON", angles.size());
    }

    private Angle readAngle(JsonParser p, int index) throws IOException {
        AngleUnit unit = null;
        Double scalar = null;
        double[] triple = null;

        while (p.nextToken() != JsonToken.END_OBJECT) {
            String field = p.currentName();
            p.nextToken(); // move to value

            if (format.unitField().equals(field)) {
                String rawUnit = p.getValueAsString(null);
                if (rawUnit == null) {
                    throw new IllegalArgumentException("Unit field '" + format.unitField() + "' must be a string at index " + index);
                }
                unit = AngleUnit.of(rawUnit);
            } else if (format.valueField().equals(field)) {
                if (p.currentToken() == JsonToken.START_ARRAY) {
                    triple = readTriple(p, index);
                } else if (p.currentToken().isNumeric()) {
                    scalar = p.getDoubleValue();
                } else {
                    throw new IllegalArgumentException("Value must be a number or an array at index " + index);
                }
            } else {
                // Skip unknown fields cleanly
                p.skipChildren();
            }
        }

        if (unit == null) {
            throw new IllegalArgumentException("Missing unit field '" + format.unitField() + "' at index " + index);
        }
        if (scalar == null && triple == null) {
            throw new IllegalArgumentException("Missing value field '" + format.valueField() + "' at index " + index);
        }

        if (unit == AngleUnit.DMS) {
            if (triple == null) {
                throw new IllegalArgumentException("DMS value must be an array at index " + index);
            }
            return Angle.ofDms(toInt(triple[0], index), toInt(triple[1], index), triple[2]);
        }
        if (scalar == null) {
            throw new IllegalArgumentException("Value for unit '" + unit + "' must be a number at index " + index);
        }
        return switch (unit) {
            case DEGREES -> Angle.ofDegrees(scalar);
            case RADIANS -> Angle.ofRadians(scalar);
            case GRADIANS -> Angle.ofGradians(scalar);
            case DMS -> throw new IllegalStateException("unreachable");
        };
    }

    /**
     * [d] , [d, m] and [d, m, s] are all accepted; missing components are zero.
     */
    private static double[] readTriple(JsonParser p, int index) throws IOException {
        double[] out = new double[3];
        int size = 0;
        while (p.nextToken() != JsonToken.END_ARRAY) {
            if (!p.currentToken().isNumeric()) {
                throw new IllegalArgumentException("DMS array must contain numbers only at index " + index);
            }
            if (size == out.length) {
                throw new IllegalArgumentException("DMS array has more than 3 components at index " + index);
            }
            out[size++] = p.getDoubleValue();
        }
        if (size == 0) {
            throw new IllegalArgumentException("DMS array must not be empty at index " + index);
        }
        return out;
    }

    private static int toInt(double value, int index) {
        if (value != Math.rint(value) || Math.abs(value) > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("DMS degrees and minutes must be integers at index " + index);
        }
        return (int) value;
    }

    private void writeAngle(JsonGenerator g, Angle angle) throws IOException {
        g.writeStartObject();
        if (angle.degrees().isPresent()) {
            writeScalar(g, AngleUnit.DEGREES, angle.degrees().getAsDouble());
        } else if (angle.radians().isPresent()) {
            writeScalar(g, AngleUnit.RADIANS, angle.radians().getAsDouble());
        } else if (angle.gradians().isPresent()) {
            writeScalar(g, AngleUnit.GRADIANS, angle.gradians().getAsDouble());
        } else if (angle.dms().isPresent()) {
            Dms dms = angle.dms().get();
            g.writeStringField(format.unitField(), AngleUnit.DMS.canonicalName());
            g.writeArrayFieldStart(format.valueField());
            g.writeNumber(dms.degrees());
            g.writeNumber(dms.minutes());
            g.writeNumber(dms.seconds());
            g.writeEndArray();
        } else {
            throw new IllegalStateException("Angle has no representation to write");
        }
        g.writeEndObject();
    }

    private void writeScalar(JsonGenerator g, AngleUnit unit, double value) throws IOException {
        g.writeStringField(format.unitField(), unit.canonicalName());
        g.writeNumberField(format.valueField(), value);
    }

    /**
     * Simple functional interface so callers can provide:
     * - a file stream
     * - a classpath resource stream
     * - an in-memory stream in tests
     */
    @FunctionalInterface
    public interface InputStreamSupplier {
        InputStream open() throws IOException;
    }
}
