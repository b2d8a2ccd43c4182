package com.p14n.fanout.data;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Settings of one outbound real-time connection.
 *
 * @param url                  the socket endpoint
 * @param token                optional access token, sent as the {@code token}
 *                             query parameter
 * @param baseDelay            delay before the first reconnect attempt
 * @param maxReconnectAttempts attempts made before the connection gives up
 */
public record ConnectionConfig(String url, String token, Duration baseDelay, int maxReconnectAttempts) {

    public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
    public static final int DEFAULT_MAX_RECONNECT_ATTEMPTS = 5;

    public ConnectionConfig {
        if (url == null || url.trim().isEmpty()) {
            throw new IllegalArgumentException("url cannot be null or empty");
        }
        if (baseDelay == null) {
            baseDelay = DEFAULT_BASE_DELAY;
        }
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("Base delay must be positive");
        }
        if (maxReconnectAttempts < 0) {
            throw new IllegalArgumentException("Max reconnect attempts cannot be negative");
        }
    }

    public ConnectionConfig(String url, String token) {
        this(url, token, DEFAULT_BASE_DELAY, DEFAULT_MAX_RECONNECT_ATTEMPTS);
    }

    public ConnectionConfig(String url) {
        this(url, null);
    }

    /**
     * Returns the endpoint with the token appended as a query parameter.
     *
     * @return the URI to open
     */
    public URI endpoint() {
        if (token == null || token.isEmpty()) {
            return URI.create(url);
        }
        String separator = url.contains("?") ? "&" : "?";
        return URI.create(url + separator + "token=" + URLEncoder.encode(token, StandardCharsets.UTF_8));
    }
}
