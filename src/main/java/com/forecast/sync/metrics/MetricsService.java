package com.forecast.sync.metrics;

import java.time.Duration;

/**
 * Records sync engine metrics. The default {@link NoOpMetricsService} does nothing, so the
 * engine runs without a metrics backend.
 */
public interface MetricsService {

    void recordSyncCycle(Duration duration, int claimed);

    void incrementSyncOutcome(SyncOutcome outcome);

    void recordThrottleWait(Duration waited);

    void incrementDraftsSaved();

    void incrementDraftsCommitted(int count);

    void incrementDraftsDiscarded(int count);

    void recordRetentionRun(Duration duration, long archived, long deleted, long errored);
}
