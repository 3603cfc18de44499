package io.fullerstack.eseries.collector.sink;

import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.Point;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * InfluxDB line protocol encoding at second precision.
 * <p>
 * {@code measurement,tag=v,tag=v field=1.5,count=3i,name="x" 1700000000}
 * <p>
 * Absent fields are left out of the line. A point without any present field cannot be
 * represented and encodes to {@link Optional#empty()}.
 */
@UtilityClass
public class LineProtocol {

    public Optional<String> encode(Point point) {
        StringBuilder fields = new StringBuilder();
        for (Map.Entry<String, FieldValue> entry : point.fields().entrySet()) {
            FieldValue value = entry.getValue();
            if (!value.isPresent()) {
                continue;
            }
            String encoded = encodeValue(value);
            if (encoded == null) {
                continue;
            }
            if (fields.length() > 0) {
                fields.append(',');
            }
            fields.append(escapeKey(entry.getKey())).append('=').append(encoded);
        }
        if (fields.length() == 0) {
            return Optional.empty();
        }

        StringBuilder line = new StringBuilder(escapeMeasurement(point.measurement()));
        point.tags().forEach((key, value) ->
            line.append(',').append(escapeKey(key)).append('=').append(escapeKey(value)));
        line.append(' ').append(fields).append(' ').append(point.timestamp().getEpochSecond());
        return Optional.of(line.toString());
    }

    /**
     * Encode a batch, one line per representable point, newline separated.
     */
    public String encodeAll(List<Point> points) {
        StringBuilder body = new StringBuilder();
        for (Point point : points) {
            encode(point).ifPresent(line -> body.append(line).append('\n'));
        }
        return body.toString();
    }

    private String encodeValue(FieldValue value) {
        if (value instanceof FieldValue.FloatValue f) {
            // NaN and infinities are rejected by the backend
            return Double.isFinite(f.value()) ? Double.toString(f.value()) : null;
        }
        if (value instanceof FieldValue.IntegerValue i) {
            return i.value() + "i";
        }
        if (value instanceof FieldValue.BoolValue b) {
            return Boolean.toString(b.value());
        }
        if (value instanceof FieldValue.TextValue t) {
            return '"' + flatten(t.value()).replace("\\", "\\\\").replace("\"", "\\\"") + '"';
        }
        return null;
    }

    // The protocol has no escape for line breaks; one inside a value splits the line
    String flatten(String text) {
        return text.replace("\r\n", " ").replace('\r', ' ').replace('\n', ' ');
    }

    String escapeMeasurement(String measurement) {
        return flatten(measurement).replace(",", "\\,").replace(" ", "\\ ");
    }

    String escapeKey(String key) {
        return flatten(key).replace(",", "\\,").replace("=", "\\=").replace(" ", "\\ ");
    }
}
