package io.fullerstack.eseries.collector.sink;

import io.fullerstack.eseries.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes every batch to all delegates.
 * <p>
 * A failing delegate does not stop the others. If any delegate failed the batch counts as
 * not written, and a {@link SinkException} carrying each delegate failure as suppressed
 * exception is thrown after all delegates were tried.
 */
public class FanOutSink implements MetricsSink {
    private static final Logger logger = LoggerFactory.getLogger(FanOutSink.class);

    private final List<MetricsSink> delegates;

    public FanOutSink(List<MetricsSink> delegates) {
        Objects.requireNonNull(delegates, "delegates cannot be null");
        if (delegates.isEmpty()) {
            throw new IllegalArgumentException("at least one delegate sink is required");
        }
        this.delegates = List.copyOf(delegates);
    }

    @Override
    public void write(List<Point> batch) {
        List<SinkException> failures = new ArrayList<>();
        for (MetricsSink delegate : delegates) {
            try {
                delegate.write(batch);
            } catch (SinkException e) {
                logger.warn("Sink {} failed: {}", delegate.name(), e.getMessage());
                failures.add(e);
            } catch (RuntimeException e) {
                logger.error("Sink {} failed unexpectedly", delegate.name(), e);
                failures.add(new SinkException(delegate.name() + ": " + e.getMessage(), e));
            }
        }

        if (!failures.isEmpty()) {
            SinkException failure = new SinkException(failures.size() + " of " + delegates.size()
                + " sinks failed: " + failures.stream().map(Throwable::getMessage).collect(Collectors.joining("; ")));
            failures.forEach(failure::addSuppressed);
            throw failure;
        }
    }

    @Override
    public String name() {
        return delegates.stream().map(MetricsSink::name).collect(Collectors.joining("+", "fanout(", ")"));
    }

    public List<MetricsSink> delegates() {
        return delegates;
    }
}
