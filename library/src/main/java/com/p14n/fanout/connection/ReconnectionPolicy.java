package com.p14n.fanout.connection;

import java.time.Duration;

import com.p14n.fanout.data.ConnectionConfig;

/**
 * Exponential backoff for reconnect attempts: attempt {@code n} waits
 * {@code baseDelay * 2^(n-1)}. Once {@code maxAttempts} attempts have been made
 * without a successful open, {@link #shouldRetry()} is false until
 * {@link #recordSuccess()} or {@link #reset()}.
 *
 * <pre>
 * ReconnectionPolicy policy = ReconnectionPolicy.builder()
 *     .baseDelay(Duration.ofSeconds(1))
 *     .maxAttempts(5)
 *     .build();
 *
 * if (policy.shouldRetry()) {
 *     Duration delay = policy.recordAttempt();
 *     schedule(this::reconnect, delay);
 * }
 * </pre>
 */
public class ReconnectionPolicy {

    private final Duration baseDelay;
    private final int maxAttempts;

    private int attemptCount = 0;

    private ReconnectionPolicy(Duration baseDelay, int maxAttempts) {
        this.baseDelay = baseDelay;
        this.maxAttempts = maxAttempts;
    }

    public synchronized boolean shouldRetry() {
        return attemptCount < maxAttempts;
    }

    /**
     * Counts a new attempt.
     *
     * @return the delay to wait before making it
     * @throws IllegalStateException if no attempts are left
     */
    public synchronized Duration recordAttempt() {
        if (!shouldRetry()) {
            throw new IllegalStateException("No reconnect attempts left");
        }
        attemptCount++;
        return delayFor(attemptCount);
    }

    /**
     * Returns the delay before the given attempt.
     *
     * @param attempt attempt number, starting at 1
     * @return the delay
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt must be at least 1");
        }
        return baseDelay.multipliedBy(1L << Math.min(attempt - 1, 30));
    }

    public synchronized void recordSuccess() {
        attemptCount = 0;
    }

    public synchronized void reset() {
        recordSuccess();
    }

    public synchronized int getAttemptCount() {
        return attemptCount;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static ReconnectionPolicy from(ConnectionConfig config) {
        return builder()
                .baseDelay(config.baseDelay())
                .maxAttempts(config.maxReconnectAttempts())
                .build();
    }

    public static class Builder {
        private Duration baseDelay = ConnectionConfig.DEFAULT_BASE_DELAY;
        private int maxAttempts = ConnectionConfig.DEFAULT_MAX_RECONNECT_ATTEMPTS;

        public Builder baseDelay(Duration baseDelay) {
            if (baseDelay.isNegative() || baseDelay.isZero()) {
                throw new IllegalArgumentException("Base delay must be positive");
            }
            this.baseDelay = baseDelay;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            if (maxAttempts < 0) {
                throw new IllegalArgumentException("Max attempts cannot be negative");
            }
            this.maxAttempts = maxAttempts;
            return this;
        }

        public ReconnectionPolicy build() {
            return new ReconnectionPolicy(baseDelay, maxAttempts);
        }
    }
}
