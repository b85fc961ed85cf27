package com.forecast.sync.schedule;

import java.time.Duration;
import java.util.Objects;

/**
 * Intervals of the two periodic jobs. Each interval is measured from the end of one run to the
 * start of the next, so a slow run never overlaps its successor.
 *
 * @param shutdownTimeout how long {@link JobScheduler#stop} waits for a running job
 */
public record SchedulerConfig(
        boolean syncEnabled,
        Duration syncInterval,
        Duration syncInitialDelay,
        boolean retentionEnabled,
        Duration retentionInterval,
        Duration retentionInitialDelay,
        Duration shutdownTimeout
) {
    public SchedulerConfig {
        requirePositive(syncInterval, "syncInterval");
        requirePositive(retentionInterval, "retentionInterval");
        requireNonNegative(syncInitialDelay, "syncInitialDelay");
        requireNonNegative(retentionInitialDelay, "retentionInitialDelay");
        requireNonNegative(shutdownTimeout, "shutdownTimeout");
    }

    /**
     * Sync every minute, retention once a day, both enabled.
     */
    public static SchedulerConfig defaults() {
        return builder().build();
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static void requireNonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " is required");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean syncEnabled = true;
        private Duration syncInterval = Duration.ofMinutes(1);
        private Duration syncInitialDelay = Duration.ZERO;
        private boolean retentionEnabled = true;
        private Duration retentionInterval = Duration.ofDays(1);
        private Duration retentionInitialDelay = Duration.ofMinutes(5);
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public Builder syncEnabled(boolean syncEnabled) {
            this.syncEnabled = syncEnabled;
            return this;
        }

        public Builder syncInterval(Duration syncInterval) {
            this.syncInterval = syncInterval;
            return this;
        }

        public Builder syncInitialDelay(Duration syncInitialDelay) {
            this.syncInitialDelay = syncInitialDelay;
            return this;
        }

        public Builder retentionEnabled(boolean retentionEnabled) {
            this.retentionEnabled = retentionEnabled;
            return this;
        }

        public Builder retentionInterval(Duration retentionInterval) {
            this.retentionInterval = retentionInterval;
            return this;
        }

        public Builder retentionInitialDelay(Duration retentionInitialDelay) {
            this.retentionInitialDelay = retentionInitialDelay;
            return this;
        }

        public Builder shutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
            return this;
        }

        public SchedulerConfig build() {
            return new SchedulerConfig(syncEnabled, syncInterval, syncInitialDelay,
                    retentionEnabled, retentionInterval, retentionInitialDelay, shutdownTimeout);
        }
    }
}
