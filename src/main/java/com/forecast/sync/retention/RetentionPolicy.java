package com.forecast.sync.retention;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the raw intake retention job.
 *
 * @param retentionDays   maximum age of raw intake rows
 * @param batchSize       rows archived and deleted per batch
 * @param archivalEnabled archive each batch before deleting it
 * @param dryRun          count eligible rows without archiving or deleting
 * @param timeBudget      wall-clock limit of one run; remaining batches wait for the next run
 */
public record RetentionPolicy(
        int retentionDays,
        int batchSize,
        boolean archivalEnabled,
        boolean dryRun,
        Duration timeBudget
) {
    public RetentionPolicy {
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be at least 1");
        }
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1");
        }
        Objects.requireNonNull(timeBudget, "timeBudget is required");
        if (timeBudget.isNegative() || timeBudget.isZero()) {
            throw new IllegalArgumentException("timeBudget must be positive");
        }
    }

    /**
     * 90 days, batches of 1000, archival off, one hour per run.
     */
    public static RetentionPolicy defaults() {
        return builder().build();
    }

    public Duration retentionWindow() {
        return Duration.ofDays(retentionDays);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int retentionDays = 90;
        private int batchSize = 1000;
        private boolean archivalEnabled = false;
        private boolean dryRun = false;
        private Duration timeBudget = Duration.ofHours(1);

        public Builder retentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
            return this;
        }

        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        public Builder archivalEnabled(boolean archivalEnabled) {
            this.archivalEnabled = archivalEnabled;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder timeBudget(Duration timeBudget) {
            this.timeBudget = timeBudget;
            return this;
        }

        public RetentionPolicy build() {
            return new RetentionPolicy(retentionDays, batchSize, archivalEnabled, dryRun, timeBudget);
        }
    }
}
