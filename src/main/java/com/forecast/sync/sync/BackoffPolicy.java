package com.forecast.sync.sync;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff: {@code baseDelay * 2^(attempt - 1)}, capped at {@code maxDelay}.
 */
public record BackoffPolicy(Duration baseDelay, Duration maxDelay) {

    public BackoffPolicy {
        Objects.requireNonNull(baseDelay, "baseDelay is required");
        Objects.requireNonNull(maxDelay, "maxDelay is required");
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be > 0");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be >= baseDelay");
        }
    }

    /**
     * Delay before the retry that follows failed attempt number {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1");
        }
        int shift = Math.min(attempt - 1, 30);
        long millis = baseDelay.toMillis();
        if (millis > maxDelay.toMillis() >> shift) {
            return maxDelay;
        }
        return Duration.ofMillis(millis << shift);
    }
}
