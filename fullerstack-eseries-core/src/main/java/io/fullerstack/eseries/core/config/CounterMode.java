package io.fullerstack.eseries.core.config;

/**
 * How the array exposes performance statistics.
 */
public enum CounterMode {
    /**
     * {@code analysed-*-statistics} endpoints: values are already rates and are written as-is.
     */
    ANALYSED,

    /**
     * Raw {@code *-statistics} endpoints: counter fields are cumulative totals and are
     * converted to per-second rates by the delta engine.
     */
    CUMULATIVE
}
