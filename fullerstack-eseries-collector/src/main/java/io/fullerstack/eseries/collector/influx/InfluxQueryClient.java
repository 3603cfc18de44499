package io.fullerstack.eseries.collector.influx;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.eseries.collector.retention.AlreadyExistsException;
import io.fullerstack.eseries.core.config.CollectorConfig;
import io.fullerstack.eseries.core.config.InfluxConfig;
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
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * InfluxQL over the InfluxDB 1.x HTTP API.
 * <p>
 * Read statements ({@code SELECT}, {@code SHOW}) go through {@code GET /query}, everything
 * else through {@code POST /query}. Timestamps are requested as epoch seconds.
 * Errors map to:
 * <ul>
 *   <li>{@link BackendUnavailableException}: connection failures and 5xx responses</li>
 *   <li>{@link AlreadyExistsException}: statement errors reporting an existing object</li>
 *   <li>{@link InfluxQueryException}: any other statement error</li>
 * </ul>
 */
public class InfluxQueryClient {
    private static final Logger logger = LoggerFactory.getLogger(InfluxQueryClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String database;
    private final Duration timeout;

    public InfluxQueryClient(InfluxConfig config, ObjectMapper objectMapper, Duration timeout) {
        this(config, objectMapper, timeout, HttpClient.newBuilder()
            .connectTimeout(CollectorConfig.CONNECT_TIMEOUT)
            .build());
    }

    InfluxQueryClient(InfluxConfig config, ObjectMapper objectMapper, Duration timeout, HttpClient httpClient) {
        Objects.requireNonNull(config, "config cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.baseUrl = config.url();
        this.database = config.database();
    }

    public String database() {
        return database;
    }

    /**
     * Check that the backend answers.
     *
     * @throws BackendUnavailableException if it does not
     */
    public void ping() {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/ping"))
            .timeout(timeout)
            .GET()
            .build();
        HttpResponse<String> response = send(request, "ping");
        if (response.statusCode() / 100 != 2) {
            throw new BackendUnavailableException("InfluxDB ping returned HTTP " + response.statusCode());
        }
    }

    /**
     * Run a read statement.
     *
     * @return The statement's result object ({@code results[0]})
     */
    public JsonNode query(String statement) {
        URI uri = URI.create(baseUrl + "/query?" + form(statement) + "&epoch=s");
        HttpRequest request = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .GET()
            .build();
        return result(send(request, statement), statement);
    }

    /**
     * Run a statement that changes the database (create, alter, drop).
     *
     * @return The statement's result object ({@code results[0]})
     */
    public JsonNode execute(String statement) {
        HttpRequest request = HttpRequest.newBuilder(URI.create(baseUrl + "/query"))
            .timeout(timeout)
            .header("Content-Type", "application/x-www-form-urlencoded")
            .POST(HttpRequest.BodyPublishers.ofString(form(statement), StandardCharsets.UTF_8))
            .build();
        logger.debug("Executing: {}", statement);
        return result(send(request, statement), statement);
    }

    private String form(String statement) {
        return "db=" + URLEncoder.encode(database, StandardCharsets.UTF_8)
            + "&q=" + URLEncoder.encode(statement, StandardCharsets.UTF_8);
    }

    private HttpResponse<String> send(HttpRequest request, String what) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new BackendUnavailableException("InfluxDB unreachable at " + baseUrl + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted during InfluxDB request: " + what, e);
        }
        if (response.statusCode() >= 500) {
            throw new BackendUnavailableException("InfluxDB returned HTTP " + response.statusCode() + " for: " + what);
        }
        return response;
    }

    private JsonNode result(HttpResponse<String> response, String statement) {
        JsonNode body;
        try {
            body = objectMapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new InfluxQueryException("Unparseable InfluxDB response (HTTP " + response.statusCode()
                + ") for: " + statement);
        }
        if (body == null || body.isMissingNode()) {
            throw new InfluxQueryException("Empty InfluxDB response (HTTP " + response.statusCode()
                + ") for: " + statement);
        }

        if (body.hasNonNull("error")) {
            throw failure(body.get("error").asText(), statement);
        }
        JsonNode result = body.path("results").path(0);
        if (result.hasNonNull("error")) {
            throw failure(result.get("error").asText(), statement);
        }
        if (response.statusCode() / 100 != 2) {
            throw new InfluxQueryException("InfluxDB returned HTTP " + response.statusCode() + " for: " + statement);
        }
        return result;
    }

    private static RuntimeException failure(String error, String statement) {
        if (error.contains("already exists")) {
            return new AlreadyExistsException(error);
        }
        return new InfluxQueryException(error + " (statement: " + statement + ")");
    }

    /**
     * Series of a result object, empty if the statement matched nothing.
     */
    public static List<JsonNode> series(JsonNode result) {
        List<JsonNode> series = new ArrayList<>();
        result.path("series").forEach(series::add);
        return series;
    }

    public static String identifier(String name) {
        return '"' + name.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }

    public static String literal(String value) {
        return '\'' + value.replace("\\", "\\\\").replace("'", "\\'") + '\'';
    }
}
