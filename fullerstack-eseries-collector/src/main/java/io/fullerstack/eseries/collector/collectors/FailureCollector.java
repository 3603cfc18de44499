package io.fullerstack.eseries.collector.collectors;

import com.fasterxml.jackson.databind.JsonNode;
import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.client.ApiPaths;
import io.fullerstack.eseries.collector.scheduler.BatchOutcome;
import io.fullerstack.eseries.collector.scheduler.CollectionTask;
import io.fullerstack.eseries.core.failures.FailureReconciler;
import io.fullerstack.eseries.core.failures.ReconcileResult;
import io.fullerstack.eseries.core.model.FailureTransition;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Emits {@code failures} points for failures that became active or were resolved.
 * <p>
 * When a batch carrying transitions is not written, the reconciler state of the system is
 * invalidated so the next cycle re-derives it from the backend instead of losing the
 * transitions.
 */
public class FailureCollector implements CollectionTask {
    private static final Logger logger = LoggerFactory.getLogger(FailureCollector.class);

    private final StorageSystem system;
    private final ApiClient apiClient;
    private final FailureReconciler reconciler;
    private final Duration timeout;

    private volatile boolean pendingTransitions;

    public FailureCollector(StorageSystem system, ApiClient apiClient, FailureReconciler reconciler, Duration timeout) {
        this.system = Objects.requireNonNull(system, "system cannot be null");
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient cannot be null");
        this.reconciler = Objects.requireNonNull(reconciler, "reconciler cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
    }

    @Override
    public StorageSystem system() {
        return system;
    }

    @Override
    public MetricClass metricClass() {
        return MetricClass.FAILURE;
    }

    @Override
    public List<Point> collect() {
        pendingTransitions = false;
        JsonNode payload = apiClient.get(ApiPaths.failures(system.sysId()), timeout);
        ReconcileResult result = reconciler.reconcile(system.sysId(), payload);
        if (result.skipped()) {
            logger.debug("Failure payload of {} unchanged", system.sysName());
            return List.of();
        }

        List<Point> points = new ArrayList<>();
        for (FailureTransition transition : result.transitions()) {
            points.add(transition.toPoint(system.sysName()));
        }
        pendingTransitions = !points.isEmpty();
        return points;
    }

    @Override
    public void onBatchOutcome(BatchOutcome outcome) {
        // A cancelled task may have reconciled without us seeing its transitions
        boolean lost = outcome == BatchOutcome.DISCARDED
            || (outcome != BatchOutcome.WRITTEN && pendingTransitions);
        if (lost) {
            logger.warn("Failure transitions of {} not written ({}); state will be reloaded from the backend",
                system.sysName(), outcome);
            reconciler.invalidate(system.sysId());
        }
        pendingTransitions = false;
    }
}
