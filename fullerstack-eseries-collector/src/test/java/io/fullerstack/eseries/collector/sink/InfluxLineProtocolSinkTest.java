package io.fullerstack.eseries.collector.sink;

import com.sun.net.httpserver.HttpServer;
import io.fullerstack.eseries.core.config.InfluxConfig;
import io.fullerstack.eseries.core.model.FieldValue;
import io.fullerstack.eseries.core.model.Point;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for InfluxLineProtocolSink against an in-process HTTP server.
 */
class InfluxLineProtocolSinkTest {

    private HttpServer server;
    private InfluxConfig config;
    private final List<String> uris = new CopyOnWriteArrayList<>();
    private final List<String> bodies = new CopyOnWriteArrayList<>();
    private volatile int status = 204;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            uris.add(exchange.getRequestURI().toString());
            try (InputStream in = exchange.getRequestBody()) {
                bodies.add(new String(in.readAllBytes(), StandardCharsets.UTF_8));
            }
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();
        config = new InfluxConfig("http://127.0.0.1:" + server.getAddress().getPort(), "eseries",
            InfluxConfig.DEFAULT_SHORT_RETENTION, InfluxConfig.DEFAULT_LONG_RETENTION,
            InfluxConfig.DEFAULT_BUCKET_MINUTES);
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    private static Point point(FieldValue value) {
        return new Point("volumes", Map.of("sys_id", "wwn1"), Map.of("readOps", value),
            Instant.ofEpochSecond(1_700_000_000L));
    }

    @Test
    void write_shouldPostLineProtocolAtSecondPrecision() {
        new InfluxLineProtocolSink(config, Duration.ofSeconds(5)).write(List.of(point(FieldValue.of(2.0))));

        assertThat(uris).containsExactly("/write?db=eseries&precision=s");
        assertThat(bodies).containsExactly("volumes,sys_id=wwn1 readOps=2.0 1700000000\n");
    }

    @Test
    void write_shouldSkipRequest_whenNothingEncodable() {
        new InfluxLineProtocolSink(config, Duration.ofSeconds(5)).write(List.of(point(FieldValue.absent())));

        assertThat(uris).isEmpty();
    }

    @Test
    void write_shouldThrowSinkException_onErrorStatus() {
        status = 500;
        InfluxLineProtocolSink sink = new InfluxLineProtocolSink(config, Duration.ofSeconds(5));

        assertThatThrownBy(() -> sink.write(List.of(point(FieldValue.of(2.0)))))
            .isInstanceOf(SinkException.class)
            .hasMessageContaining("HTTP 500");
    }
}
