package io.fullerstack.eseries.collector.sink;

import io.fullerstack.eseries.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Logs batches instead of posting them. Lines are logged at DEBUG in line protocol.
 */
public class LoggingSink implements MetricsSink {
    private static final Logger logger = LoggerFactory.getLogger(LoggingSink.class);

    @Override
    public void write(List<Point> batch) {
        if (batch.isEmpty()) {
            return;
        }
        logger.info("Batch of {} points for measurement {}", batch.size(), batch.get(0).measurement());
        if (logger.isDebugEnabled()) {
            for (Point point : batch) {
                LineProtocol.encode(point).ifPresent(line -> logger.debug("  {}", line));
            }
        }
    }

    @Override
    public String name() {
        return "log";
    }
}
