package io.fullerstack.eseries.core.config;

import java.util.List;
import java.util.Objects;

/**
 * Connection settings for the SANtricity management API.
 *
 * @param endpoints   Base URLs of the controllers or Web Services Proxy
 *                    (e.g., "https://10.0.0.10:8443"); requests are spread round-robin
 * @param username    API user
 * @param password    API password
 * @param insecureTls Accept self-signed controller certificates
 */
public record ApiConfig(
        List<String> endpoints,
        String username,
        String password,
        boolean insecureTls
) {
    public ApiConfig {
        Objects.requireNonNull(endpoints, "endpoints cannot be null");
        Objects.requireNonNull(username, "username cannot be null");
        Objects.requireNonNull(password, "password cannot be null");

        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("at least one API endpoint is required");
        }
        if (username.isBlank()) {
            throw new IllegalArgumentException("username cannot be blank");
        }
        endpoints = endpoints.stream()
                .map(e -> e.endsWith("/") ? e.substring(0, e.length() - 1) : e)
                .toList();
    }

    @Override
    public String toString() {
        return "ApiConfig[endpoints=" + endpoints + ", username=" + username
                + ", insecureTls=" + insecureTls + "]";
    }
}
