package io.fullerstack.eseries.core.model;

import java.util.Objects;

/**
 * Identity of a cumulative counter series: one entity of one class on one system.
 *
 * @param sysId       Storage system WWN
 * @param entityId    Entity identifier within the class (volume name, interface id, ...)
 * @param metricClass Class the counters belong to
 */
public record CounterKey(
        String sysId,
        String entityId,
        MetricClass metricClass
) {
    public CounterKey {
        Objects.requireNonNull(sysId, "sysId cannot be null");
        Objects.requireNonNull(entityId, "entityId cannot be null");
        Objects.requireNonNull(metricClass, "metricClass cannot be null");
    }
}
