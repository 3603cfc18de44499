package io.fullerstack.eseries.collector.sink;

import io.fullerstack.eseries.core.model.Point;

import java.util.List;

/**
 * Destination of collected points.
 * <p>
 * Implementations must accept out-of-order timestamps and duplicate points; a repeated
 * point with the same tag set and timestamp overwrites the earlier one.
 */
public interface MetricsSink {

    /**
     * Write one batch.
     *
     * @param batch Points to write
     * @throws SinkException if the batch was not (fully) written
     */
    void write(List<Point> batch);

    /**
     * Short name used in log lines.
     */
    String name();
}
