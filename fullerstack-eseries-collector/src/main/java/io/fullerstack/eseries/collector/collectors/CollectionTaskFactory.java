package io.fullerstack.eseries.collector.collectors;

import io.fullerstack.eseries.collector.client.ApiClient;
import io.fullerstack.eseries.collector.location.DiskLocationResolver;
import io.fullerstack.eseries.collector.scheduler.CollectionTask;
import io.fullerstack.eseries.collector.scheduler.TaskFactory;
import io.fullerstack.eseries.core.config.CounterMode;
import io.fullerstack.eseries.core.delta.DeltaRateEngine;
import io.fullerstack.eseries.core.failures.FailureReconciler;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mel.MelCursorTracker;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.StorageSystem;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Creates the collection task of each metric class, sharing the process-wide state
 * (counter cache, failure reconciler, MEL cursors) between systems.
 */
public class CollectionTaskFactory implements TaskFactory {

    private final ApiClient apiClient;
    private final PointMapper mapper;
    private final DeltaRateEngine deltaEngine;
    private final FailureReconciler failureReconciler;
    private final MelCursorTracker melCursorTracker;
    private final DiskLocationResolver locationResolver;
    private final CounterMode counterMode;
    private final Duration requestTimeout;
    private final Clock clock;

    public CollectionTaskFactory(
        ApiClient apiClient,
        PointMapper mapper,
        DeltaRateEngine deltaEngine,
        FailureReconciler failureReconciler,
        MelCursorTracker melCursorTracker,
        DiskLocationResolver locationResolver,
        CounterMode counterMode,
        Duration requestTimeout,
        Clock clock
    ) {
        this.apiClient = Objects.requireNonNull(apiClient, "apiClient cannot be null");
        this.mapper = Objects.requireNonNull(mapper, "mapper cannot be null");
        this.deltaEngine = Objects.requireNonNull(deltaEngine, "deltaEngine cannot be null");
        this.failureReconciler = Objects.requireNonNull(failureReconciler, "failureReconciler cannot be null");
        this.melCursorTracker = Objects.requireNonNull(melCursorTracker, "melCursorTracker cannot be null");
        this.locationResolver = Objects.requireNonNull(locationResolver, "locationResolver cannot be null");
        this.counterMode = Objects.requireNonNull(counterMode, "counterMode cannot be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    @Override
    public CollectionTask create(StorageSystem system, MetricClass metricClass) {
        switch (metricClass) {
            case DRIVE:
                return new DriveStatisticsCollector(system, apiClient, mapper, deltaEngine, locationResolver,
                    counterMode, requestTimeout, clock);
            case INTERFACE:
            case SYSTEM:
            case VOLUME:
            case CONTROLLER:
                return new StatisticsCollector(system, metricClass, apiClient, mapper, deltaEngine,
                    counterMode, requestTimeout, clock);
            case MEL:
                return new MelCollector(system, apiClient, melCursorTracker, mapper, requestTimeout, clock);
            case FAILURE:
                return new FailureCollector(system, apiClient, failureReconciler, requestTimeout);
            case POWER:
                return new PowerCollector(system, apiClient, mapper, requestTimeout);
            case TEMPERATURE:
                return new TemperatureCollector(system, apiClient, mapper, requestTimeout);
            case STORAGE_POOL:
            case VOLUME_CONFIG:
            case HOST:
            case HOST_GROUP:
            case VOLUME_MAPPING:
            case TRAY:
            case INTERFACE_CONFIG:
                return new InventoryCollector(system, metricClass, apiClient, mapper, requestTimeout, clock);
            default:
                throw new IllegalArgumentException("Unsupported metric class: " + metricClass);
        }
    }
}
