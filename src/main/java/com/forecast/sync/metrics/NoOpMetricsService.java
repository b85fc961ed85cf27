package com.forecast.sync.metrics;

import java.time.Duration;

/**
 * Metrics service that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    public static final NoOpMetricsService INSTANCE = new NoOpMetricsService();

    @Override
    public void recordSyncCycle(Duration duration, int claimed) {
    }

    @Override
    public void incrementSyncOutcome(SyncOutcome outcome) {
    }

    @Override
    public void recordThrottleWait(Duration waited) {
    }

    @Override
    public void incrementDraftsSaved() {
    }

    @Override
    public void incrementDraftsCommitted(int count) {
    }

    @Override
    public void incrementDraftsDiscarded(int count) {
    }

    @Override
    public void recordRetentionRun(Duration duration, long archived, long deleted, long errored) {
    }
}
