package io.fullerstack.eseries.core.failures;

import io.fullerstack.eseries.core.model.FailureRecord;

import java.util.List;

/**
 * Durable record of failure states, queried when the reconciler has no cached state for a
 * system (first cycle after a restart, or after {@link FailureReconciler#invalidate}).
 */
@FunctionalInterface
public interface FailureStateStore {

    /**
     * Last written state of every failure tuple known for the system.
     *
     * @param sysId Storage system WWN
     * @return Last known records, possibly empty
     */
    List<FailureRecord> lastKnownFailures(String sysId);

    /**
     * Store for deployments without a queryable backend: every cold start begins empty.
     */
    static FailureStateStore empty() {
        return sysId -> List.of();
    }
}
