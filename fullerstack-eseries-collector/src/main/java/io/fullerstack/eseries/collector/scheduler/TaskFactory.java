package io.fullerstack.eseries.collector.scheduler;

import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.StorageSystem;

/**
 * Creates the collection task for one (system, class) pair. Called once per pair; the
 * scheduler reuses the task on every tick.
 */
@FunctionalInterface
public interface TaskFactory {

    CollectionTask create(StorageSystem system, MetricClass metricClass);
}
