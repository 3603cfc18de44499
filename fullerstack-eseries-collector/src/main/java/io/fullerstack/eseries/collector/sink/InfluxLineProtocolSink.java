package io.fullerstack.eseries.collector.sink;

import io.fullerstack.eseries.core.config.CollectorConfig;
import io.fullerstack.eseries.core.config.InfluxConfig;
import io.fullerstack.eseries.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Writes batches to InfluxDB 1.x through {@code POST /write?db=..&precision=s}.
 */
public class InfluxLineProtocolSink implements MetricsSink {
    private static final Logger logger = LoggerFactory.getLogger(InfluxLineProtocolSink.class);

    private final HttpClient httpClient;
    private final URI writeUri;
    private final Duration timeout;

    public InfluxLineProtocolSink(InfluxConfig config, Duration timeout) {
        this(config, timeout, HttpClient.newBuilder()
            .connectTimeout(CollectorConfig.CONNECT_TIMEOUT)
            .build());
    }

    InfluxLineProtocolSink(InfluxConfig config, Duration timeout, HttpClient httpClient) {
        Objects.requireNonNull(config, "config cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.writeUri = URI.create(config.url() + "/write?db="
            + URLEncoder.encode(config.database(), StandardCharsets.UTF_8) + "&precision=s");
    }

    @Override
    public void write(List<Point> batch) {
        String body = LineProtocol.encodeAll(batch);
        if (body.isEmpty()) {
            logger.debug("Nothing to write: {} points without present fields", batch.size());
            return;
        }

        HttpRequest request = HttpRequest.newBuilder(writeUri)
            .timeout(timeout)
            .header("Content-Type", "text/plain; charset=utf-8")
            .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SinkException("InfluxDB write failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkException("Interrupted while writing to InfluxDB", e);
        }

        int status = response.statusCode();
        if (status / 100 != 2) {
            throw new SinkException("InfluxDB write returned HTTP " + status + ": " + response.body());
        }
        logger.debug("Wrote {} points to {}", batch.size(), writeUri);
    }

    @Override
    public String name() {
        return "influx";
    }
}
