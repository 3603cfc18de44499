package io.fullerstack.eseries.collector.sink;

import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.Point;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for PrometheusSink.
 */
class PrometheusSinkTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    private final PrometheusSink sink = new PrometheusSink(0);

    @AfterEach
    void tearDown() {
        sink.close();
    }

    private static Point volume(String sysId, String volName, double readIOps) {
        Map<String, String> tags = new LinkedHashMap<>();
        tags.put("sys_id", sysId);
        tags.put("sys_name", "array-" + sysId);
        tags.put("vol_name", volName);
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        fields.put("readIOps", FieldValue.of(readIOps));
        fields.put("combinedResponseTime", FieldValue.absent());
        return new Point("volumes", tags, fields, NOW);
    }

    // =========================================================================
    // Exposition
    // =========================================================================

    @Test
    void write_shouldExposeNumericFieldsAsGauges() {
        sink.write(List.of(volume("wwn1", "vol1", 812.5)));

        assertThat(sink.exposition()).isEqualTo("""
            # TYPE eseries_volumes_read_iops gauge
            eseries_volumes_read_iops{sys_id="wwn1",sys_name="array-wwn1",vol_name="vol1"} 812.5
            """);
    }

    @Test
    void write_shouldSkipTextBooleanAndInventoryValues() {
        Point failure = new Point("failures", Map.of("sys_id", "wwn1"),
            Map.of("name_of", FieldValue.of("Drive 4")), NOW);
        Point pool = new Point("config_storage_pools", Map.of("sys_id", "wwn1"),
            Map.of("freeSpace", FieldValue.of(1024L)), NOW);
        Point power = new Point("power", Map.of("sys_id", "wwn1"),
            Map.of("totalPower", FieldValue.of(612.0), "online", FieldValue.of(true)), NOW);

        sink.write(List.of(failure, pool, power));

        assertThat(sink.exposition())
            .contains("eseries_power_total_power{sys_id=\"wwn1\"} 612\n")
            .doesNotContain("failures", "config_storage_pools", "online");
    }

    @Test
    void write_shouldReplaceSeriesOfSameSystemOnly() {
        sink.write(List.of(volume("wwn1", "vol1", 1), volume("wwn1", "vol2", 2)));
        sink.write(List.of(volume("wwn2", "vol9", 9)));

        sink.write(List.of(volume("wwn1", "vol1", 3)));

        assertThat(sink.exposition())
            .contains("vol_name=\"vol1\"} 3\n")
            .contains("vol_name=\"vol9\"} 9\n")
            .doesNotContain("vol2");
    }

    @Test
    void exposition_shouldEscapeLabelValues() {
        Point point = new Point("temp", Map.of("sys_id", "wwn1", "sensor", "Tray \"0\"\nfront\\left"),
            Map.of("temp", FieldValue.of(24.0)), NOW);

        sink.write(List.of(point));

        assertThat(sink.exposition()).contains("sensor=\"Tray \\\"0\\\"\\nfront\\\\left\"");
    }

    @Test
    void metricName_shouldUseSnakeCaseAndKeepAcronymsJoined() {
        assertThat(PrometheusSink.metricName("volumes", "readIOps")).isEqualTo("eseries_volumes_read_iops");
        assertThat(PrometheusSink.metricName("controllers", "observedTimeInMS"))
            .isEqualTo("eseries_controllers_observed_time_in_ms");
        assertThat(PrometheusSink.metricName("controllers", "raid0BytesPercent"))
            .isEqualTo("eseries_controllers_raid0_bytes_percent");
        assertThat(PrometheusSink.metricName("collector-health", "tasks"))
            .isEqualTo("eseries_collector_health_tasks");
    }

    // =========================================================================
    // Endpoint
    // =========================================================================

    @Test
    void start_shouldServeMetricsOverHttp() throws Exception {
        sink.start();
        sink.write(List.of(volume("wwn1", "vol1", 5)));
        HttpClient client = HttpClient.newHttpClient();
        URI uri = URI.create("http://127.0.0.1:" + sink.boundPort() + "/metrics");

        HttpResponse<String> get = client.send(HttpRequest.newBuilder(uri).GET().build(),
            HttpResponse.BodyHandlers.ofString());
        HttpResponse<String> post = client.send(
            HttpRequest.newBuilder(uri).POST(HttpRequest.BodyPublishers.ofString("x")).build(),
            HttpResponse.BodyHandlers.ofString());

        assertThat(get.statusCode()).isEqualTo(200);
        assertThat(get.headers().firstValue("Content-Type")).contains(PrometheusSink.CONTENT_TYPE);
        assertThat(get.body()).contains("eseries_volumes_read_iops{sys_id=\"wwn1\"");
        assertThat(post.statusCode()).isEqualTo(405);
    }

    @Test
    void stop_shouldBeIdempotent() {
        sink.start();
        sink.stop();

        assertThatCode(sink::stop).doesNotThrowAnyException();
    }
}
