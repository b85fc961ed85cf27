package com.forecast.sync.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Micrometer implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code mirror.sync.cycle.duration}: Timer</li>
 *   <li>{@code mirror.sync.cycle.claimed}: DistributionSummary</li>
 *   <li>{@code mirror.sync.outcome}: Counter (tag: outcome)</li>
 *   <li>{@code mirror.sync.throttle.wait}: Timer</li>
 *   <li>{@code mirror.drafts.saved}, {@code mirror.drafts.committed}, {@code mirror.drafts.discarded}: Counters</li>
 *   <li>{@code mirror.retention.duration}: Timer</li>
 *   <li>{@code mirror.retention.records}: Counter (tag: result)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final Timer cycleTimer;
    private final DistributionSummary claimedSummary;
    private final Map<SyncOutcome, Counter> outcomeCounters = new EnumMap<>(SyncOutcome.class);
    private final Timer throttleTimer;
    private final Counter draftsSaved;
    private final Counter draftsCommitted;
    private final Counter draftsDiscarded;
    private final Timer retentionTimer;
    private final Counter retentionArchived;
    private final Counter retentionDeleted;
    private final Counter retentionErrored;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.cycleTimer = Timer.builder("mirror.sync.cycle.duration")
                .description("Duration of write-back sync cycles")
                .register(registry);
        this.claimedSummary = DistributionSummary.builder("mirror.sync.cycle.claimed")
                .description("Modifications claimed per sync cycle")
                .register(registry);
        for (SyncOutcome outcome : SyncOutcome.values()) {
            outcomeCounters.put(outcome, Counter.builder("mirror.sync.outcome")
                    .description("Write-back outcomes per modification")
                    .tag("outcome", outcome.name().toLowerCase())
                    .register(registry));
        }
        this.throttleTimer = Timer.builder("mirror.sync.throttle.wait")
                .description("Time spent waiting on the outbound rate limiter")
                .register(registry);
        this.draftsSaved = Counter.builder("mirror.drafts.saved").register(registry);
        this.draftsCommitted = Counter.builder("mirror.drafts.committed").register(registry);
        this.draftsDiscarded = Counter.builder("mirror.drafts.discarded").register(registry);
        this.retentionTimer = Timer.builder("mirror.retention.duration")
                .description("Duration of raw intake retention runs")
                .register(registry);
        this.retentionArchived = retentionCounter(registry, "archived");
        this.retentionDeleted = retentionCounter(registry, "deleted");
        this.retentionErrored = retentionCounter(registry, "errored");
    }

    private static Counter retentionCounter(MeterRegistry registry, String result) {
        return Counter.builder("mirror.retention.records")
                .description("Raw intake records handled by retention")
                .tag("result", result)
                .register(registry);
    }

    @Override
    public void recordSyncCycle(Duration duration, int claimed) {
        cycleTimer.record(duration);
        claimedSummary.record(claimed);
    }

    @Override
    public void incrementSyncOutcome(SyncOutcome outcome) {
        outcomeCounters.get(outcome).increment();
    }

    @Override
    public void recordThrottleWait(Duration waited) {
        throttleTimer.record(waited);
    }

    @Override
    public void incrementDraftsSaved() {
        draftsSaved.increment();
    }

    @Override
    public void incrementDraftsCommitted(int count) {
        draftsCommitted.increment(count);
    }

    @Override
    public void incrementDraftsDiscarded(int count) {
        draftsDiscarded.increment(count);
    }

    @Override
    public void recordRetentionRun(Duration duration, long archived, long deleted, long errored) {
        retentionTimer.record(duration);
        retentionArchived.increment(archived);
        retentionDeleted.increment(deleted);
        retentionErrored.increment(errored);
    }
}
