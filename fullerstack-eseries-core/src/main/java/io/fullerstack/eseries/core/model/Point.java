package io.fullerstack.eseries.core.model;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A normalized time-series point ready to be handed to a metrics sink.
 * <p>
 * Tags and fields keep their insertion order, so two points built from the same input
 * serialize identically. Timestamps are kept at second precision.
 *
 * @param measurement Measurement name (e.g., "volumes")
 * @param tags        Ordered tag set, unique keys, non-blank values
 * @param fields      Ordered field set; declared fields are never omitted
 * @param timestamp   Point time, truncated to whole seconds
 */
public record Point(
        String measurement,
        Map<String, String> tags,
        Map<String, FieldValue> fields,
        Instant timestamp
) {
    /**
     * Compact constructor with validation and defensive copies.
     */
    public Point {
        Objects.requireNonNull(measurement, "measurement cannot be null");
        Objects.requireNonNull(tags, "tags cannot be null");
        Objects.requireNonNull(fields, "fields cannot be null");
        Objects.requireNonNull(timestamp, "timestamp cannot be null");

        if (measurement.isBlank()) {
            throw new IllegalArgumentException("measurement cannot be blank");
        }
        tags.forEach((key, value) -> {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException("tag '" + key + "' has a blank value");
            }
        });
        fields.forEach((key, value) -> Objects.requireNonNull(value, "field '" + key + "' cannot be null"));

        tags = Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        timestamp = timestamp.truncatedTo(ChronoUnit.SECONDS);
    }

    /**
     * Field value by name, {@link FieldValue#absent()} if the key is unknown.
     */
    public FieldValue field(String name) {
        return fields.getOrDefault(name, FieldValue.absent());
    }

    /**
     * @return true if at least one field carries a value
     */
    public boolean hasPresentField() {
        return fields.values().stream().anyMatch(FieldValue::isPresent);
    }

    /**
     * Copy of this point with some fields replaced. Keys not already present are appended.
     */
    public Point withFields(Map<String, FieldValue> replacements) {
        Map<String, FieldValue> merged = new LinkedHashMap<>(fields);
        merged.putAll(replacements);
        return new Point(measurement, tags, merged, timestamp);
    }

    /**
     * Copy of this point with a different timestamp.
     */
    public Point withTimestamp(Instant newTimestamp) {
        return new Point(measurement, tags, fields, newTimestamp);
    }
}
