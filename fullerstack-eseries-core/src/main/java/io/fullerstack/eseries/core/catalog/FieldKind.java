package io.fullerstack.eseries.core.catalog;

/**
 * Semantics of a catalog field.
 */
public enum FieldKind {
    /**
     * Monotonically increasing total. Converted to a per-second rate when the
     * upstream exposes raw totals.
     */
    COUNTER,

    /**
     * Instantaneous reading (response time, percentage, temperature). Passed through.
     */
    GAUGE,

    /**
     * Descriptive value (event id, description). Never aggregated.
     */
    ATTRIBUTE
}
