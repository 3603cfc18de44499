package io.fullerstack.eseries.collector.scheduler;

import io.fullerstack.eseries.collector.sink.MetricsSink;
import io.fullerstack.eseries.collector.sink.SinkException;
import io.fullerstack.eseries.core.config.CollectorConfig;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Drives the polling cadence of every metric class.
 * <p>
 * A single coordinating loop ticks at the shortest configured interval. On each tick:
 * <ol>
 *   <li>classes whose interval elapsed since their last run (or that never ran) are due</li>
 *   <li>one {@link CollectionTask} per (system, due class) runs on the bounded worker pool</li>
 *   <li>the loop joins the tasks; tasks still running at the deadline are cancelled and
 *       their results discarded</li>
 *   <li>each completed batch is written to the sink and the outcome reported to its task</li>
 *   <li>the loop sleeps for the rest of the tick, or logs an overrun and continues at once</li>
 * </ol>
 * A task failure never affects the other tasks of the tick. Because the loop joins before
 * sleeping, two ticks of the same class never overlap.
 * <p>
 * Usage:
 * <pre>
 * TieredScheduler scheduler = TieredScheduler.fromConfig(config, taskFactory, sink);
 * scheduler.start();
 *
 * // ... later ...
 * scheduler.shutdown();
 * </pre>
 */
public class TieredScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TieredScheduler.class);

    private final Map<MetricClass, Duration> intervals;
    private final List<StorageSystem> systems;
    private final TaskFactory taskFactory;
    private final MetricsSink sink;
    private final ExecutorService workers;
    private final Duration tickInterval;
    private final Duration taskTimeout;
    private final boolean healthPoints;
    private final Clock clock;

    // Touched by the coordinating thread only
    private final Map<MetricClass, Instant> lastRun = new EnumMap<>(MetricClass.class);
    private final Map<String, CollectionTask> tasks = new HashMap<>();

    private final List<Consumer<TickReport>> tickListeners = new CopyOnWriteArrayList<>();
    private volatile boolean running;
    private Thread loopThread;

    /**
     * Create a scheduler.
     *
     * @param intervals    Interval per collected class; classes without an entry are not collected
     * @param systems      Monitored storage systems
     * @param taskFactory  Creates the task of each (system, class) pair
     * @param sink         Destination of all batches
     * @param poolSize     Worker threads
     * @param taskTimeout  Deadline of a tick's tasks
     * @param healthPoints Write a {@code collector_health} point per tick
     * @param clock        Time source
     */
    public TieredScheduler(
        Map<MetricClass, Duration> intervals,
        List<StorageSystem> systems,
        TaskFactory taskFactory,
        MetricsSink sink,
        int poolSize,
        Duration taskTimeout,
        boolean healthPoints,
        Clock clock
    ) {
        Objects.requireNonNull(intervals, "intervals cannot be null");
        this.systems = List.copyOf(Objects.requireNonNull(systems, "systems cannot be null"));
        this.taskFactory = Objects.requireNonNull(taskFactory, "taskFactory cannot be null");
        this.sink = Objects.requireNonNull(sink, "sink cannot be null");
        this.taskTimeout = Objects.requireNonNull(taskTimeout, "taskTimeout cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.healthPoints = healthPoints;

        if (intervals.isEmpty()) {
            throw new IllegalArgumentException("at least one metric class must be scheduled");
        }
        intervals.forEach((metricClass, interval) -> {
            if (interval.isZero() || interval.isNegative()) {
                throw new IllegalArgumentException("interval of " + metricClass + " must be positive");
            }
        });
        if (poolSize <= 0) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        this.intervals = new EnumMap<>(intervals);
        this.tickInterval = intervals.values().stream().min(Duration::compareTo).orElseThrow();

        AtomicInteger threadCount = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(poolSize, r -> {
            Thread t = new Thread(r, "eseries-collector-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Scheduler collecting every metric class at the intervals of the configuration.
     */
    public static TieredScheduler fromConfig(CollectorConfig config, TaskFactory taskFactory, MetricsSink sink) {
        Map<MetricClass, Duration> intervals = new EnumMap<>(MetricClass.class);
        for (MetricClass metricClass : MetricClass.values()) {
            intervals.put(metricClass, config.intervalFor(metricClass));
        }
        return new TieredScheduler(intervals, config.systems(), taskFactory, sink, config.poolSize(),
            config.taskTimeout(), config.healthPoints(), Clock.systemUTC());
    }

    /**
     * Register a callback invoked on the coordinating thread after every tick.
     */
    public void addTickListener(Consumer<TickReport> listener) {
        tickListeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    /**
     * Start the coordinating loop on its own thread. The first tick runs immediately and
     * dispatches every class.
     */
    public synchronized void start() {
        if (running) {
            throw new IllegalStateException("scheduler already started");
        }
        running = true;
        logger.info("Starting tiered scheduler: tick {}s, {} systems, intervals {}",
            tickInterval.toSeconds(), systems.size(), intervals);

        loopThread = new Thread(this::runLoop, "eseries-scheduler");
        loopThread.start();
    }

    private void runLoop() {
        // Ticks are anchored on a fixed-rate schedule; lastRun stamps use the scheduled
        // instant so a class whose interval equals the tick is due on every tick.
        Instant scheduled = clock.instant();
        while (running) {
            try {
                runTick(scheduled);
            } catch (RuntimeException e) {
                logger.error("Scheduler tick failed", e);
            }

            Instant now = clock.instant();
            Instant next = scheduled.plus(tickInterval);
            if (now.isAfter(next)) {
                logger.warn("Tick overrun: took {} ms, interval is {} ms; starting next tick immediately",
                    Duration.between(scheduled, now).toMillis(), tickInterval.toMillis());
                next = now;
            }

            try {
                sleepUntil(next);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            scheduled = next;
        }
        logger.info("Scheduler loop stopped");
    }

    private void sleepUntil(Instant deadline) throws InterruptedException {
        long millis = sleepMillis(clock.instant(), deadline);
        while (millis > 0 && running) {
            Thread.sleep(millis);
            millis = sleepMillis(clock.instant(), deadline);
        }
    }

    /**
     * Milliseconds until the deadline, rounded up so the sleeper never wakes early;
     * zero once the deadline has passed.
     */
    static long sleepMillis(Instant now, Instant deadline) {
        Duration remaining = Duration.between(now, deadline);
        if (remaining.isNegative() || remaining.isZero()) {
            return 0;
        }
        long millis = remaining.toMillis();
        return remaining.minusMillis(millis).isZero() ? millis : millis + 1;
    }

    /**
     * Run one tick now: dispatch due classes, join, write, report.
     *
     * @return Summary of the tick
     */
    public TickReport runTick() {
        return runTick(clock.instant());
    }

    /**
     * Run the tick scheduled at {@code start}. Due checks and last-run stamps use that
     * instant, not the time the tick actually began.
     */
    TickReport runTick(Instant start) {
        Set<MetricClass> due = dueClasses(start);
        due.forEach(metricClass -> lastRun.put(metricClass, start));

        List<CollectionTask> batch = new ArrayList<>();
        for (StorageSystem system : systems) {
            for (MetricClass metricClass : due) {
                batch.add(task(system, metricClass));
            }
        }

        List<Callable<List<Point>>> calls = new ArrayList<>();
        for (CollectionTask task : batch) {
            calls.add(task::collect);
        }

        List<Future<List<Point>>> futures;
        try {
            futures = workers.invokeAll(calls, taskTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for {} collection tasks; discarding their results", batch.size());
            batch.forEach(task -> notifyOutcome(task, BatchOutcome.DISCARDED));
            return report(start, due, 0, 0, batch.size(), 0, 0);
        }

        int written = 0;
        int failed = 0;
        int timedOut = 0;
        int writeFailures = 0;
        int points = 0;
        for (int i = 0; i < batch.size(); i++) {
            CollectionTask task = batch.get(i);
            Future<List<Point>> future = futures.get(i);

            BatchOutcome outcome;
            List<Point> result = null;
            if (future.isCancelled()) {
                logger.warn("{} did not finish within {} ms; results discarded", task.describe(), taskTimeout.toMillis());
                outcome = BatchOutcome.DISCARDED;
            } else {
                try {
                    result = future.get();
                    outcome = write(task, result);
                } catch (ExecutionException e) {
                    logger.error("Collection of {} failed", task.describe(), e.getCause());
                    outcome = BatchOutcome.FAILED;
                } catch (CancellationException e) {
                    outcome = BatchOutcome.DISCARDED;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    outcome = BatchOutcome.DISCARDED;
                }
            }

            switch (outcome) {
                case WRITTEN -> {
                    written++;
                    points += result == null ? 0 : result.size();
                }
                case WRITE_FAILED -> writeFailures++;
                case DISCARDED -> timedOut++;
                case FAILED -> failed++;
            }
            notifyOutcome(task, outcome);
        }

        return report(start, due, written, failed, timedOut, writeFailures, points);
    }

    private BatchOutcome write(CollectionTask task, List<Point> result) {
        if (result == null || result.isEmpty()) {
            return BatchOutcome.WRITTEN;
        }
        try {
            sink.write(result);
            logger.debug("{}: wrote {} points", task.describe(), result.size());
            return BatchOutcome.WRITTEN;
        } catch (SinkException e) {
            logger.warn("Dropping {} points of {}: {}", result.size(), task.describe(), e.getMessage());
            return BatchOutcome.WRITE_FAILED;
        }
    }

    private void notifyOutcome(CollectionTask task, BatchOutcome outcome) {
        try {
            task.onBatchOutcome(outcome);
        } catch (RuntimeException e) {
            logger.error("{} failed to handle batch outcome {}", task.describe(), outcome, e);
        }
    }

    private TickReport report(Instant start, Set<MetricClass> due, int written, int failed, int timedOut,
                              int writeFailures, int points) {
        TickReport report = new TickReport(start, due, written, failed, timedOut, writeFailures, points,
            Duration.between(start, clock.instant()));

        if (!due.isEmpty()) {
            logger.info("Tick {}: {} tasks ({} written, {} failed, {} timed out, {} write failures), {} points in {} ms",
                due, report.tasksDispatched(), written, failed, timedOut, writeFailures, points,
                report.elapsed().toMillis());
        }

        if (healthPoints) {
            try {
                sink.write(List.of(report.toHealthPoint()));
            } catch (SinkException e) {
                logger.warn("Could not write health point: {}", e.getMessage());
            }
        }

        for (Consumer<TickReport> listener : tickListeners) {
            try {
                listener.accept(report);
            } catch (RuntimeException e) {
                logger.error("Tick listener failed", e);
            }
        }
        return report;
    }

    /**
     * Classes due at {@code now}: never run, or interval elapsed since the last run.
     */
    Set<MetricClass> dueClasses(Instant now) {
        Set<MetricClass> due = EnumSet.noneOf(MetricClass.class);
        intervals.forEach((metricClass, interval) -> {
            Instant previous = lastRun.get(metricClass);
            if (previous == null || Duration.between(previous, now).compareTo(interval) >= 0) {
                due.add(metricClass);
            }
        });
        return due;
    }

    private CollectionTask task(StorageSystem system, MetricClass metricClass) {
        return tasks.computeIfAbsent(system.sysId() + "/" + metricClass,
            key -> taskFactory.create(system, metricClass));
    }

    public Duration tickInterval() {
        return tickInterval;
    }

    public Collection<MetricClass> scheduledClasses() {
        return intervals.keySet();
    }

    /**
     * Gracefully shutdown the scheduler.
     * <p>
     * Stops the loop, then waits up to 5 seconds for running tasks before forcing shutdown.
     */
    public void shutdown() {
        logger.info("Shutting down tiered scheduler");
        running = false;

        Thread loop;
        synchronized (this) {
            loop = loopThread;
        }
        if (loop != null) {
            loop.interrupt();
        }

        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
            if (loop != null) {
                loop.join(TimeUnit.SECONDS.toMillis(5));
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }

        logger.info("Tiered scheduler shutdown complete");
    }
}
