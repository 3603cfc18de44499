package io.fullerstack.eseries.collector.scheduler;

/**
 * What happened to the points a collection task produced in one tick.
 */
public enum BatchOutcome {
    /**
     * The batch reached the sink (or was empty).
     */
    WRITTEN,

    /**
     * The sink rejected the batch; the points are lost for this cycle.
     */
    WRITE_FAILED,

    /**
     * The task missed the tick deadline and its results were not written.
     */
    DISCARDED,

    /**
     * The task threw; there was nothing to write.
     */
    FAILED
}
