package com.forecast.sync.sync;

import com.forecast.sync.metrics.SyncOutcome;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of one write-back cycle.
 *
 * @param skipped true when another cycle was still running and this invocation did nothing
 */
public record SyncCycleResult(
        String batchId,
        Instant startedAt,
        Instant completedAt,
        int claimed,
        int succeeded,
        int conflicts,
        int retried,
        int failed,
        int released,
        boolean skipped
) {
    public Duration duration() {
        return Duration.between(startedAt, completedAt);
    }

    static SyncCycleResult skipped(Instant at) {
        return new SyncCycleResult(null, at, at, 0, 0, 0, 0, 0, 0, true);
    }

    static final class Tally {
        private final String batchId;
        private final Instant startedAt;
        private int claimed;
        private int succeeded;
        private int conflicts;
        private int retried;
        private int failed;
        private int released;

        Tally(String batchId, Instant startedAt) {
            this.batchId = batchId;
            this.startedAt = startedAt;
        }

        void claimed(int count) {
            this.claimed = count;
        }

        void record(SyncOutcome outcome) {
            switch (outcome) {
                case SUCCEEDED -> succeeded++;
                case CONFLICT -> conflicts++;
                case RETRY_SCHEDULED -> retried++;
                case FAILED -> failed++;
                case RELEASED -> released++;
            }
        }

        SyncCycleResult complete(Instant completedAt) {
            return new SyncCycleResult(batchId, startedAt, completedAt, claimed, succeeded, conflicts,
                    retried, failed, released, false);
        }
    }
}
