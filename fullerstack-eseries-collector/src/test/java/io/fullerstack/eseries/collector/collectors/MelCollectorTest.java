package io.fullerstack.eseries.collector.collectors;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import io.fullerstack.eseries.collector.scheduler.BatchOutcome;
import io.fullerstack.eseries.core.mapper.PointMapper;
import io.fullerstack.eseries.core.mel.MelCursorStore;
import io.fullerstack.eseries.core.mel.MelCursorTracker;
import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.Point;
import io.fullerstack.eseries.core.model.StorageSystem;
import org.junit.jupiter.api.BeforeEach;
import org.slf4j.LoggerFactory;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for MelCollector paging and cursor commits.
 */
class MelCollectorTest {

    private static final StorageSystem SYSTEM = new StorageSystem("wwn1", "array1");
    private static final String PATH = "/devmgr/v2/storage-systems/wwn1/mel-events";
    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private static final String PAGE = """
        [
          {"sequenceNumber": "101", "timeStamp": "1709286000", "eventType": "0x280D", "category": "failure",
           "priority": "critical", "critical": true, "asc": "0x00", "ascq": "0x00",
           "id": "e1", "description": "Drive failed", "location": "Tray 0, Slot 4"},
          {"sequenceNumber": "102", "timeStamp": 1709286060, "eventType": "0x100A", "category": "notification",
           "priority": "info", "critical": false, "asc": "0x00", "ascq": "0x00",
           "id": "e2", "description": "Volume created", "location": ""}
        ]
        """;

    private FakeApiClient api;
    private MelCursorStore store;
    private MelCursorTracker tracker;
    private MelCollector collector;

    @BeforeEach
    void setUp() {
        api = new FakeApiClient();
        store = mock(MelCursorStore.class);
        when(store.lastSequence("wwn1")).thenReturn(OptionalLong.empty());
        tracker = new MelCursorTracker(store, 8192);
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        collector = new MelCollector(SYSTEM, api, tracker, new PointMapper(clock), Duration.ofSeconds(120), clock);
    }

    @Test
    void collect_shouldStartFromBeginning_whenNoCursor() {
        api.respond(PATH, PAGE);

        List<Point> points = collector.collect();

        assertThat(points).hasSize(2);
        assertThat(api.lastCall(PATH).params())
            .containsEntry("count", "8192")
            .containsEntry("startSequenceNumber", "-1");
    }

    @Test
    void collect_shouldUseEventTimeAndTags() {
        api.respond(PATH, PAGE);

        Point first = collector.collect().get(0);

        assertThat(first.measurement()).isEqualTo("major_event_log");
        assertThat(first.timestamp()).isEqualTo(Instant.ofEpochSecond(1709286000L));
        assertThat(first.tags())
            .containsEntry("event_type", "0x280D")
            .containsEntry("time_stamp", "1709286000")
            .containsEntry("critical", "true");
        assertThat(first.field("sequenceNumber")).isEqualTo(FieldValue.of(101L));
        assertThat(first.field("description")).isEqualTo(FieldValue.of("Drive failed"));
    }

    @Test
    void onBatchOutcome_shouldAdvanceCursor_whenWritten() {
        api.respond(PATH, PAGE);
        collector.collect();

        collector.onBatchOutcome(BatchOutcome.WRITTEN);

        assertThat(tracker.cursor("wwn1")).hasValue(102L);
        api.respond(PATH, "[]");
        collector.collect();
        assertThat(api.lastCall(PATH).params()).containsEntry("startSequenceNumber", "103");
    }

    @Test
    void onBatchOutcome_shouldKeepCursor_whenWriteFailed() {
        api.respond(PATH, PAGE);
        collector.collect();

        collector.onBatchOutcome(BatchOutcome.WRITE_FAILED);

        assertThat(tracker.cursor("wwn1")).isEmpty();
        collector.collect();
        assertThat(api.lastCall(PATH).params()).containsEntry("startSequenceNumber", "-1");
    }

    @Test
    void collect_shouldResumeAfterStoredSequence() {
        when(store.lastSequence("wwn1")).thenReturn(OptionalLong.of(5000L));
        api.respond(PATH, "[]");

        collector.collect();

        assertThat(api.lastCall(PATH).params()).containsEntry("startSequenceNumber", "5001");
    }

    @Test
    void onBatchOutcome_shouldIgnoreEmptyPages() {
        api.respond(PATH, "[]");
        collector.collect();

        collector.onBatchOutcome(BatchOutcome.WRITTEN);

        assertThat(tracker.cursor("wwn1")).isEmpty();
    }

    @Test
    void collect_shouldWarn_whenNoEventHasSequenceNumber() {
        api.respond(PATH, """
            [{"sequenceNumber": "n/a", "timeStamp": "1709286000", "eventType": "0x280D", "category": "failure",
              "priority": "critical", "critical": true, "asc": "0x00", "ascq": "0x00", "id": "e1"}]
            """);
        Logger logger = (Logger) LoggerFactory.getLogger(MelCollector.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertThat(collector.collect()).hasSize(1);
            collector.onBatchOutcome(BatchOutcome.WRITTEN);
        } finally {
            logger.detachAppender(appender);
        }

        assertThat(tracker.cursor("wwn1")).isEmpty();
        assertThat(appender.list)
            .anySatisfy(event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage()).contains("readable sequenceNumber");
            });
    }
}
