package io.fullerstack.eseries.collector.scheduler;

import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;

import java.util.List;

/**
 * One unit of collection work: one metric class of one storage system.
 * <p>
 * The scheduler calls {@link #collect()} on a worker thread, writes the returned batch
 * from the coordinating thread and then reports the result through
 * {@link #onBatchOutcome(BatchOutcome)}. Tasks that keep state across cycles (MEL cursor,
 * failure cache) commit or roll back that state there.
 */
public interface CollectionTask {

    StorageSystem system();

    MetricClass metricClass();

    /**
     * Fetch and transform this cycle's data.
     *
     * @return Points to write, possibly empty
     */
    List<Point> collect();

    /**
     * Called once per tick after the batch was handled.
     *
     * @param outcome Result of the write
     */
    default void onBatchOutcome(BatchOutcome outcome) {
    }

    default String describe() {
        return metricClass() + "@" + system().sysName();
    }
}
