package io.fullerstack.eseries.core.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A failure that changed state during a reconciliation cycle.
 *
 * @param record New state of the failure (active flag and transition time)
 * @param kind   Direction of the change
 */
public record FailureTransition(
        FailureRecord record,
        Kind kind
) {
    public enum Kind {
        ACTIVATED,
        RESOLVED
    }

    public FailureTransition {
        Objects.requireNonNull(record, "record cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
    }

    /**
     * Render the transition as a {@code failures} point.
     *
     * @param sysName Human label of the system, written as the {@code sys_name} tag
     */
    public Point toPoint(String sysName) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("sys_id", record.sysId());
        putIfNotBlank(tags, "sys_name", sysName);
        tags.put("failure_type", record.failureType());
        putIfNotBlank(tags, "object_ref", record.objectRef());
        putIfNotBlank(tags, "object_type", record.objectType());
        tags.put("active", Boolean.toString(record.active()));

        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("name_of", FieldValue.of(sysName));
        fields.put("type_of", FieldValue.of(record.failureType()));

        return new Point(MetricClass.FAILURE.measurement(), tags, fields, record.lastTransition());
    }

    private static void putIfNotBlank(Map<String, String> tags, String key, String value) {
        if (value != null && !value.isBlank()) {
            tags.put(key, value);
        }
    }
}
