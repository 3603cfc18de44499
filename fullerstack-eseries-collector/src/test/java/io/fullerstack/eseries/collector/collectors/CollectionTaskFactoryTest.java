package io.fullerstack.eseries.collector.collectors;

import io.fullerstack.eseries.collector.location.DiskLocationResolver;
import io.fullerstack.eseries.collector.scheduler.CollectionTask;
import io.fullerstack.eseries.core.config.CounterMode;
import io.fullerstack.eseries.core.delta.DeltaRateEngine;
import io.fullerstack.eseries.core.failures.ChecksumGuard;
import io.fullerstack.eseries.core.failures.FailureReconciler;
import io.fullerstack.eseries.core.failures.FailureStateStore;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mel.MelCursorTracker;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

class CollectionTaskFactoryTest {

    private final CollectionTaskFactory factory = new CollectionTaskFactory(
        new FakeApiClient(),
        new PointMapper(),
        new DeltaRateEngine(),
        new FailureReconciler(FailureStateStore.empty(), new ChecksumGuard()),
        new MelCursorTracker(MelCursorTracker.DEFAULT_PAGE_SIZE),
        mock(DiskLocationResolver.class),
        CounterMode.ANALYSED,
        Duration.ofSeconds(120),
        Clock.systemUTC());

    @ParameterizedTest
    @EnumSource(MetricClass.class)
    void create_shouldBuildTaskForEveryClass(MetricClass metricClass) {
        StorageSystem system = new StorageSystem("wwn1", "array1");

        CollectionTask task = factory.create(system, metricClass);

        assertThat(task.metricClass()).isEqualTo(metricClass);
        assertThat(task.system()).isEqualTo(system);
        assertThat(task.describe()).isEqualTo(metricClass + "@array1");
    }

    @ParameterizedTest
    @EnumSource(value = MetricClass.class, names = {"INTERFACE", "SYSTEM", "VOLUME", "CONTROLLER"})
    void create_shouldUseStatisticsCollector(MetricClass metricClass) {
        assertThat(factory.create(new StorageSystem("wwn1", "array1"), metricClass))
            .isExactlyInstanceOf(StatisticsCollector.class);
    }

    @ParameterizedTest
    @EnumSource(value = MetricClass.class, names = {"STORAGE_POOL", "VOLUME_CONFIG", "HOST", "HOST_GROUP",
        "VOLUME_MAPPING", "TRAY", "INTERFACE_CONFIG"})
    void create_shouldUseInventoryCollectorForConfigurationClasses(MetricClass metricClass) {
        assertThat(metricClass.configuration()).isTrue();
        assertThat(factory.create(new StorageSystem("wwn1", "array1"), metricClass))
            .isExactlyInstanceOf(InventoryCollector.class);
    }
}
