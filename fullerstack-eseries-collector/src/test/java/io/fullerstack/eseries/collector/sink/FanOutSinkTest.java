package io.fullerstack.eseries.collector.sink;

import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.Point;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests for FanOutSink.
 */
class FanOutSinkTest {

    private static final List<Point> BATCH = List.of(new Point("volumes", Map.of("sys_id", "wwn1"),
        Map.of("readOps", FieldValue.of(1.0)), Instant.ofEpochSecond(1_700_000_000L)));

    private static MetricsSink sink(String name) {
        MetricsSink sink = mock(MetricsSink.class);
        when(sink.name()).thenReturn(name);
        return sink;
    }

    @Test
    void write_shouldReachEveryDelegate() {
        MetricsSink influx = sink("influx");
        MetricsSink json = sink("json");

        new FanOutSink(List.of(influx, json)).write(BATCH);

        verify(influx).write(BATCH);
        verify(json).write(BATCH);
    }

    @Test
    void write_shouldContinueAfterFailingDelegate() {
        MetricsSink influx = sink("influx");
        MetricsSink json = sink("json");
        doThrow(new SinkException("HTTP 500")).when(influx).write(BATCH);

        FanOutSink fanOut = new FanOutSink(List.of(influx, json));

        assertThatThrownBy(() -> fanOut.write(BATCH))
            .isInstanceOf(SinkException.class)
            .hasMessageContaining("1 of 2 sinks failed")
            .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));
        verify(json).write(BATCH);
    }

    @Test
    void write_shouldWrapUnexpectedExceptions() {
        MetricsSink json = sink("json");
        doThrow(new IllegalStateException("disk gone")).when(json).write(BATCH);

        assertThatThrownBy(() -> new FanOutSink(List.of(json)).write(BATCH))
            .isInstanceOf(SinkException.class)
            .hasMessageContaining("json: disk gone");
    }

    @Test
    void name_shouldListDelegates() {
        assertThat(new FanOutSink(List.of(sink("influx"), sink("json"))).name()).isEqualTo("fanout(influx+json)");
    }

    @Test
    void constructor_shouldRejectEmptyDelegates() {
        assertThatThrownBy(() -> new FanOutSink(List.of())).isInstanceOf(IllegalArgumentException.class);
    }
}
