package io.fullerstack.eseries.collector.scheduler;

import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Summary of one scheduler tick.
 *
 * @param startedAt     Tick start
 * @param dueClasses    Classes dispatched in this tick
 * @param tasksWritten  Tasks whose batch was written
 * @param tasksFailed   Tasks that threw
 * @param tasksTimedOut Tasks cancelled at the deadline
 * @param writeFailures Batches the sink rejected
 * @param pointsWritten Points accepted by the sink
 * @param elapsed       Wall-clock duration of the tick
 */
public record TickReport(
        Instant startedAt,
        Set<MetricClass> dueClasses,
        int tasksWritten,
        int tasksFailed,
        int tasksTimedOut,
        int writeFailures,
        int pointsWritten,
        Duration elapsed
) {
    public static final String HEALTH_MEASUREMENT = "collector_health";

    public TickReport {
        dueClasses = Set.copyOf(dueClasses);
    }

    public int tasksDispatched() {
        return tasksWritten + tasksFailed + tasksTimedOut + writeFailures;
    }

    /**
     * Synthetic health point describing this tick.
     */
    public Point toHealthPoint() {
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("tasks_ok", FieldValue.of((long) tasksWritten));
        fields.put("tasks_failed", FieldValue.of((long) tasksFailed));
        fields.put("tasks_timed_out", FieldValue.of((long) tasksTimedOut));
        fields.put("write_failures", FieldValue.of((long) writeFailures));
        fields.put("points_written", FieldValue.of((long) pointsWritten));
        fields.put("elapsed_ms", FieldValue.of(elapsed.toMillis()));
        return new Point(HEALTH_MEASUREMENT, Map.of("collector", "eseries"), fields, startedAt);
    }
}
