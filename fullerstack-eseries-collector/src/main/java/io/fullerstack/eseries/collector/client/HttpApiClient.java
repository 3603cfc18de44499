package io.fullerstack.eseries.collector.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fullerstack.eseries.core.config.ApiConfig;
import io.fullerstack.eseries.core.config.CollectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link ApiClient} over the JDK HTTP client.
 * <p>
 * Responsibilities:
 * - Basic authentication on every request
 * - Round-robin across the configured controller endpoints
 * - Connect timeout of {@link CollectorConfig#CONNECT_TIMEOUT}, per-request read timeout
 * - Mapping of transport failures, non-2xx statuses and bad bodies to {@link ApiException}
 * <p>
 * Controllers usually present self-signed certificates; with {@code insecureTls} the client
 * accepts any certificate and host name.
 * <p>
 * Thread-safe; one instance is shared by all collection tasks.
 */
public class HttpApiClient implements ApiClient {
    private static final Logger logger = LoggerFactory.getLogger(HttpApiClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final List<String> endpoints;
    private final String authorization;
    private final AtomicInteger nextEndpoint = new AtomicInteger();

    public HttpApiClient(ApiConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, buildHttpClient(config));
    }

    HttpApiClient(ApiConfig config, ObjectMapper objectMapper, HttpClient httpClient) {
        Objects.requireNonNull(config, "config cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient cannot be null");
        this.endpoints = config.endpoints();
        String credentials = config.username() + ":" + config.password();
        this.authorization = "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }

    private static HttpClient buildHttpClient(ApiConfig config) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(CollectorConfig.CONNECT_TIMEOUT)
                .followRedirects(HttpClient.Redirect.NORMAL);

        if (config.insecureTls()) {
            logger.warn("TLS certificate verification DISABLED for management API endpoints {}", config.endpoints());
            // The JDK client reads this once, when its first instance is created
            System.setProperty("jdk.internal.httpclient.disableHostnameVerification", "true");
            builder.sslContext(trustAllContext());
        }
        return builder.build();
    }

    private static SSLContext trustAllContext() {
        TrustManager trustAll = new X509TrustManager() {
            @Override
            public void checkClientTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public void checkServerTrusted(X509Certificate[] chain, String authType) {
            }

            @Override
            public X509Certificate[] getAcceptedIssuers() {
                return new X509Certificate[0];
            }
        };
        try {
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, new TrustManager[]{trustAll}, new SecureRandom());
            return context;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot initialize TLS context", e);
        }
    }

    @Override
    public JsonNode get(String path, Map<String, String> params, Duration timeout) {
        Objects.requireNonNull(path, "path cannot be null");
        Objects.requireNonNull(params, "params cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");

        String endpoint = endpoints.get(Math.floorMod(nextEndpoint.getAndIncrement(), endpoints.size()));
        URI uri = URI.create(endpoint + path + queryString(params));

        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Authorization", authorization)
                .header("Accept", "application/json")
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ApiException(ApiException.Kind.TRANSIENT_NETWORK,
                    "Request to " + endpoint + path + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ApiException(ApiException.Kind.TRANSIENT_NETWORK, "Interrupted during request to " + path, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw ApiException.status(response.statusCode(), path);
        }

        try {
            JsonNode body = objectMapper.readTree(response.body());
            if (body == null || body.isMissingNode()) {
                throw ApiException.payload("Empty response from " + path);
            }
            logger.debug("GET {} -> {} ({} bytes)", uri, response.statusCode(), response.body().length());
            return body;
        } catch (JsonProcessingException e) {
            throw new ApiException(ApiException.Kind.PAYLOAD, "Invalid JSON from " + path, e);
        }
    }

    static String queryString(Map<String, String> params) {
        if (params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        params.forEach((key, value) -> joiner.add(
                URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8)));
        return joiner.toString();
    }
}
