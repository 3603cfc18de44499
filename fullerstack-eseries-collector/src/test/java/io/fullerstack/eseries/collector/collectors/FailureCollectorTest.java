package io.fullerstack.eseries.collector.collectors;

import io.fullerstack.eseries.collector.scheduler.BatchOutcome;
import io.fullerstack.eseries.core.failures.ChecksumGuard;
import io.fullerstack.eseries.core.failures.FailureReconciler;
import io.fullerstack.eseries.core.failures.FailureStateStore;
import io.fullerstack.eseries.core.model.FailureRecord;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for FailureCollector, including invalidation after lost batches.
 */
class FailureCollectorTest {

    private static final StorageSystem SYSTEM = new StorageSystem("wwn1", "array1");
    private static final String PATH = "/devmgr/v2/storage-systems/wwn1/failures";
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private static final String ONE_FAILURE = """
        [{"failureType": "driveFailed", "objectRef": "0100000050000396DC8A2F41", "objectType": "drive"}]
        """;

    private FakeApiClient api;
    private FailureStateStore store;
    private FailureReconciler reconciler;
    private FailureCollector collector;

    @BeforeEach
    void setUp() {
        api = new FakeApiClient();
        store = mock(FailureStateStore.class);
        when(store.lastKnownFailures("wwn1")).thenReturn(List.of());
        reconciler = new FailureReconciler(store, new ChecksumGuard(), Clock.fixed(NOW, ZoneOffset.UTC));
        collector = new FailureCollector(SYSTEM, api, reconciler, Duration.ofSeconds(120));
    }

    @Test
    void collect_shouldEmitActivationPoint() {
        api.respond(PATH, ONE_FAILURE);

        List<Point> points = collector.collect();

        assertThat(points).singleElement().satisfies(point -> {
            assertThat(point.measurement()).isEqualTo("failures");
            assertThat(point.tags())
                .containsEntry("sys_name", "array1")
                .containsEntry("failure_type", "driveFailed")
                .containsEntry("object_type", "drive")
                .containsEntry("active", "true");
            assertThat(point.timestamp()).isEqualTo(NOW);
        });
    }

    @Test
    void collect_shouldEmitNothing_whenPayloadUnchanged() {
        api.respond(PATH, ONE_FAILURE);
        collector.collect();
        collector.onBatchOutcome(BatchOutcome.WRITTEN);

        assertThat(collector.collect()).isEmpty();
        verify(store, times(1)).lastKnownFailures("wwn1");
    }

    @Test
    void collect_shouldEmitResolution_whenFailureClears() {
        api.respond(PATH, ONE_FAILURE);
        collector.collect();
        collector.onBatchOutcome(BatchOutcome.WRITTEN);

        api.respond(PATH, "[]");
        List<Point> points = collector.collect();

        assertThat(points).singleElement()
            .satisfies(point -> assertThat(point.tags()).containsEntry("active", "false"));
    }

    @Test
    void onBatchOutcome_shouldInvalidate_whenWriteFailed() {
        api.respond(PATH, ONE_FAILURE);
        collector.collect();

        collector.onBatchOutcome(BatchOutcome.WRITE_FAILED);

        // State is reloaded from the store, which never saw the activation
        assertThat(reconciler.knownFailures("wwn1")).isEmpty();
        List<Point> retried = collector.collect();
        assertThat(retried).hasSize(1);
        verify(store, times(2)).lastKnownFailures("wwn1");
    }

    @Test
    void onBatchOutcome_shouldKeepState_whenWritten() {
        api.respond(PATH, ONE_FAILURE);
        collector.collect();

        collector.onBatchOutcome(BatchOutcome.WRITTEN);

        assertThat(reconciler.knownFailures("wwn1"))
            .extracting(FailureRecord::failureType)
            .containsExactly("driveFailed");
    }

    @Test
    void onBatchOutcome_shouldInvalidate_whenDiscarded() {
        api.respond(PATH, ONE_FAILURE);
        collector.collect();
        collector.onBatchOutcome(BatchOutcome.WRITTEN);

        collector.onBatchOutcome(BatchOutcome.DISCARDED);

        assertThat(reconciler.knownFailures("wwn1")).isEmpty();
    }
}
