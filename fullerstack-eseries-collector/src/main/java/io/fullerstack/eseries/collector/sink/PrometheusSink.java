package io.fullerstack.eseries.collector.sink;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.fullerstack.eseries.core.model.MetricClass;
import io.fullerstack.eseries.core.model.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keeps the latest value of every numeric series and serves it in the Prometheus text
 * exposition format on {@code GET /metrics}.
 * <p>
 * Each field becomes a gauge named {@code eseries_<measurement>_<field>} in snake case,
 * with the point's tags as labels. A batch replaces every series previously written for
 * the same measurement and system, so deleted volumes or drives drop out on the next
 * cycle. Inventory, MEL and failure points are not exported; text and boolean fields
 * are skipped.
 * <pre>
 * # TYPE eseries_volumes_read_iops gauge
 * eseries_volumes_read_iops{sys_id="600A0980",sys_name="dc1r226-elk",vol_name="vol1"} 812.5
 * </pre>
 */
public class PrometheusSink implements MetricsSink, AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PrometheusSink.class);

    static final String PREFIX = "eseries_";
    static final String CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private static final Set<String> NOT_EXPORTED = Arrays.stream(MetricClass.values())
        .filter(c -> c.configuration() || c == MetricClass.MEL || c == MetricClass.FAILURE)
        .map(MetricClass::measurement)
        .collect(Collectors.toUnmodifiableSet());

    record Sample(String name, Map<String, String> labels, double value) {
    }

    private final int port;
    private final Map<String, List<Sample>> seriesByGroup = new ConcurrentHashMap<>();
    private HttpServer server;

    /**
     * @param port Listen port; 0 binds an ephemeral port
     */
    public PrometheusSink(int port) {
        this.port = port;
    }

    /**
     * Start the scrape endpoint.
     *
     * @throws UncheckedIOException if the port cannot be bound
     */
    public synchronized void start() {
        if (server != null) {
            return;
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot bind Prometheus endpoint on port " + port, e);
        }
        server.createContext("/metrics", exchange -> {
            if ("GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 200, exposition());
            } else {
                sendResponse(exchange, 405, "Method not allowed\n");
            }
        });
        server.setExecutor(null);
        server.start();
        logger.info("Prometheus metrics served on port {}", boundPort());
    }

    /**
     * Port the endpoint listens on, or the configured port before {@link #start()}.
     */
    public synchronized int boundPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    public synchronized void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            logger.info("Prometheus endpoint stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }

    @Override
    public void write(List<Point> batch) {
        Map<String, List<Sample>> groups = new LinkedHashMap<>();
        for (Point point : batch) {
            if (NOT_EXPORTED.contains(point.measurement())) {
                continue;
            }
            List<Sample> samples = groups.computeIfAbsent(groupKey(point), k -> new ArrayList<>());
            Map<String, String> labels = labels(point.tags());
            point.fields().forEach((field, value) -> {
                OptionalDouble numeric = value.numeric();
                if (numeric.isPresent()) {
                    samples.add(new Sample(metricName(point.measurement(), field), labels, numeric.getAsDouble()));
                }
            });
        }
        groups.forEach(seriesByGroup::put);
        logger.debug("Updated {} Prometheus series groups", groups.size());
    }

    @Override
    public String name() {
        return "prometheus";
    }

    private static String groupKey(Point point) {
        return point.measurement() + "|" + point.tags().getOrDefault("sys_id", "");
    }

    /**
     * Current exposition text, metrics and series in sorted order.
     */
    String exposition() {
        Map<String, List<String>> linesByName = new TreeMap<>();
        for (List<Sample> samples : seriesByGroup.values()) {
            for (Sample sample : samples) {
                linesByName.computeIfAbsent(sample.name(), k -> new ArrayList<>()).add(line(sample));
            }
        }

        StringBuilder text = new StringBuilder();
        linesByName.forEach((name, lines) -> {
            text.append("# TYPE ").append(name).append(" gauge\n");
            lines.stream().sorted().forEach(line -> text.append(line).append('\n'));
        });
        return text.toString();
    }

    private static String line(Sample sample) {
        StringBuilder line = new StringBuilder(sample.name());
        if (!sample.labels().isEmpty()) {
            line.append('{');
            boolean first = true;
            for (Map.Entry<String, String> label : sample.labels().entrySet()) {
                if (!first) {
                    line.append(',');
                }
                line.append(label.getKey()).append("=\"").append(escapeLabelValue(label.getValue())).append('"');
                first = false;
            }
            line.append('}');
        }
        return line.append(' ').append(formatValue(sample.value())).toString();
    }

    private static Map<String, String> labels(Map<String, String> tags) {
        Map<String, String> labels = new LinkedHashMap<>();
        tags.forEach((key, value) -> labels.put(sanitize(key), value));
        return labels;
    }

    /**
     * {@code eseries_<measurement>_<field>}, e.g. {@code readIOps} of {@code volumes} gives
     * {@code eseries_volumes_read_iops}.
     */
    static String metricName(String measurement, String field) {
        return PREFIX + sanitize(measurement) + "_" + snakeCase(field);
    }

    static String snakeCase(String name) {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isUpperCase(c)) {
                // Acronyms stay joined: readIOps is read_iops
                if (i > 0 && !Character.isUpperCase(name.charAt(i - 1))) {
                    out.append('_');
                }
                out.append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return sanitize(out.toString().toLowerCase(Locale.ROOT));
    }

    /**
     * Replace characters not allowed in metric and label names.
     */
    static String sanitize(String name) {
        StringBuilder out = new StringBuilder(name.length());
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            boolean valid = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_'
                || (c >= '0' && c <= '9' && i > 0);
            out.append(valid ? c : '_');
        }
        return out.toString();
    }

    static String escapeLabelValue(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static void sendResponse(HttpExchange exchange, int statusCode, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", CONTENT_TYPE);
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
