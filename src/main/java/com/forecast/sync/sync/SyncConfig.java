package com.forecast.sync.sync;

import java.time.Duration;

/**
 * Configuration of the write-back worker.
 *
 * @param batchSize         maximum modifications claimed per cycle
 * @param maxAttempts       attempts before a transiently failing modification becomes {@code sync_error}
 * @param backoff           delay between attempts
 * @param requestsPerSecond outbound call ceiling shared by the whole cycle
 * @param callTimeout       limit for a single call to the external system
 * @param cycleTimeout      limit for a whole cycle; unprocessed claims are released
 */
public record SyncConfig(
        int batchSize,
        int maxAttempts,
        BackoffPolicy backoff,
        double requestsPerSecond,
        Duration callTimeout,
        Duration cycleTimeout
) {
    public SyncConfig {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be > 0");
        }
        if (backoff == null) {
            throw new IllegalArgumentException("backoff is required");
        }
        if (requestsPerSecond <= 0) {
            throw new IllegalArgumentException("requestsPerSecond must be > 0");
        }
        if (callTimeout == null || callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be > 0");
        }
        if (cycleTimeout == null || cycleTimeout.compareTo(callTimeout) < 0) {
            throw new IllegalArgumentException("cycleTimeout must be >= callTimeout");
        }
    }

    /**
     * 100 per batch, 3 attempts, 5s doubling backoff capped at 5 minutes, 10 requests/second,
     * 30s per call, 5 minutes per cycle.
     */
    public static SyncConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int batchSize = 100;
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(5);
        private Duration backoffMax = Duration.ofMinutes(5);
        private double requestsPerSecond = 10;
        private Duration callTimeout = Duration.ofSeconds(30);
        private Duration cycleTimeout = Duration.ofMinutes(5);

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder backoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
            return this;
        }

        public Builder backoffMax(Duration backoffMax) {
            this.backoffMax = backoffMax;
            return this;
        }

        public Builder requestsPerSecond(double requestsPerSecond) {
            this.requestsPerSecond = requestsPerSecond;
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder cycleTimeout(Duration cycleTimeout) {
            this.cycleTimeout = cycleTimeout;
            return this;
        }

        public SyncConfig build() {
            return new SyncConfig(batchSize, maxAttempts, new BackoffPolicy(backoffBase, backoffMax),
                    requestsPerSecond, callTimeout, cycleTimeout);
        }
    }
}
