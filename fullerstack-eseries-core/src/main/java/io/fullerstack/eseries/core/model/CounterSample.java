package io.fullerstack.eseries.core.model;

import io.fullerstack.eseries.core.catalog.FieldSpec;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Raw cumulative counter values observed for one key at one instant.
 * <p>
 * Samples are immutable; the delta engine replaces the cached sample for a key on every
 * observation instead of mutating it.
 *
 * @param key        Counter series identity
 * @param values     Counter field name to raw cumulative value
 * @param observedAt Wall-clock time the sample was taken
 */
public record CounterSample(
        CounterKey key,
        Map<String, Double> values,
        Instant observedAt
) {
    public CounterSample {
        Objects.requireNonNull(key, "key cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        Objects.requireNonNull(observedAt, "observedAt cannot be null");
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /**
     * Build a sample from the counter fields of a mapped point. Absent or non-numeric
     * counter fields are left out of the sample.
     *
     * @param key        Counter series identity
     * @param observed   Point produced by the mapper from the raw record
     * @param observedAt Wall-clock time of the observation
     */
    public static CounterSample fromPoint(CounterKey key, Point observed, Instant observedAt) {
        Map<String, Double> counters = new LinkedHashMap<>();
        for (FieldSpec spec : key.metricClass().catalog().counterFields()) {
            OptionalDouble value = observed.field(spec.name()).numeric();
            if (value.isPresent()) {
                counters.put(spec.name(), value.getAsDouble());
            }
        }
        return new CounterSample(key, counters, observedAt);
    }
}
