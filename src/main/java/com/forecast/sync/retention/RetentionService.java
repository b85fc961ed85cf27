package com.forecast.sync.retention;

import com.forecast.sync.archival.ArchivalBackend;
import com.forecast.sync.archival.ArchivalException;
import com.forecast.sync.archival.ArchivalMetadata;
import com.forecast.sync.audit.AuditAction;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.core.model.RawIntakeRecord;
import com.forecast.sync.logging.LogContext;
import com.forecast.sync.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Enforces the rolling retention window over raw intake.
 *
 * <p>Eligible rows are processed oldest first in fixed-size batches. With archival enabled a
 * batch is deleted only after the backend confirms an archive holding exactly that batch; a
 * failed archive leaves the batch in place, counts its rows as errors and the run moves on.
 * Batches are read by keyset, so kept rows are not read again within the same run. Store
 * failures abort the run; batches already deleted stay deleted.</p>
 */
public class RetentionService {
    private static final Logger log = LoggerFactory.getLogger(RetentionService.class);

    private static final String ACTOR = "RETENTION_JOB";

    private final RawIntakeStore store;
    private final ArchivalBackend archivalBackend;
    private final RetentionPolicy policy;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;

    public RetentionService(RawIntakeStore store, ArchivalBackend archivalBackend, RetentionPolicy policy,
                            AuditService auditService, MetricsService metricsService, Clock clock) {
        this.store = Objects.requireNonNull(store, "store is required");
        this.policy = Objects.requireNonNull(policy, "policy is required");
        if (policy.archivalEnabled() && archivalBackend == null) {
            throw new IllegalArgumentException("Archival is enabled but no archival backend is configured");
        }
        this.archivalBackend = archivalBackend;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Runs one retention pass.
     */
    public RetentionResult prune() {
        String runId = LogContext.newId();
        try (LogContext ignored = LogContext.forRetention(runId)) {
            Instant startedAt = clock.instant();
            Instant cutoff = startedAt.minus(policy.retentionWindow());
            Instant deadline = startedAt.plus(policy.timeBudget());
            log.info("retention.starting cutoff={} batchSize={} archival={} dryRun={}",
                    cutoff, policy.batchSize(), policy.archivalEnabled(), policy.dryRun());

            long eligible = store.countIngestedBefore(cutoff);
            if (eligible == 0) {
                RetentionResult result = RetentionResult.nothingToDo(runId, cutoff, policy.dryRun(),
                        Duration.between(startedAt, clock.instant()));
                log.info("retention.nothingToPrune cutoff={}", cutoff);
                return finish(result);
            }
            log.info("retention.eligible count={}", eligible);

            long archived = 0;
            long deleted = 0;
            long errored = 0;
            long dryRunMatched = 0;
            int batches = 0;
            int failedBatches = 0;
            boolean timedOut = false;
            RawIntakeStore.Cursor cursor = null;

            while (true) {
                if (clock.instant().isAfter(deadline)) {
                    timedOut = true;
                    log.warn("retention.timeBudgetExceeded budget={} batches={}", policy.timeBudget(), batches);
                    break;
                }
                List<RawIntakeRecord> batch = store.findBatch(cutoff, cursor, policy.batchSize());
                if (batch.isEmpty()) {
                    break;
                }
                batches++;
                cursor = RawIntakeStore.Cursor.of(batch.get(batch.size() - 1));

                if (policy.dryRun()) {
                    dryRunMatched += batch.size();
                } else if (!policy.archivalEnabled() || archive(batch, batches)) {
                    if (policy.archivalEnabled()) {
                        archived += batch.size();
                    }
                    int removed = store.deleteByIds(batch.stream().map(RawIntakeRecord::id).toList());
                    deleted += removed;
                    log.debug("retention.batchDeleted batch={} records={} total={}", batches, removed, deleted);
                } else {
                    errored += batch.size();
                    failedBatches++;
                }

                if (batch.size() < policy.batchSize()) {
                    break;
                }
            }

            RetentionResult result = new RetentionResult(runId, cutoff, eligible, archived, deleted, errored,
                    batches, failedBatches, dryRunMatched, policy.dryRun(), timedOut,
                    Duration.between(startedAt, clock.instant()));
            log.info("retention.completed result={}", result);
            return finish(result);
        } catch (RuntimeException e) {
            log.error("retention.failed runId={}", runId, e);
            throw e;
        }
    }

    /**
     * Counts describing the raw intake store against the current cutoff.
     */
    public RetentionStats getPruningStats() {
        Instant cutoff = clock.instant().minus(policy.retentionWindow());
        return new RetentionStats(
                store.count(),
                store.countIngestedBefore(cutoff),
                store.oldestIngestedAt().orElse(null),
                store.newestIngestedAt().orElse(null),
                cutoff,
                policy.retentionDays(),
                policy.archivalEnabled());
    }

    private boolean archive(List<RawIntakeRecord> batch, int batchNumber) {
        try {
            ArchivalMetadata metadata = archivalBackend.archiveBatch(batch);
            if (metadata == null || metadata.recordCount() != batch.size()) {
                log.error("retention.archiveUnconfirmed batch={} expected={} archived={}",
                        batchNumber, batch.size(), metadata == null ? null : metadata.recordCount());
                return false;
            }
            log.info("retention.batchArchived batch={} records={} archiveId={} compressedBytes={}",
                    batchNumber, metadata.recordCount(), metadata.archiveId(), metadata.compressedSize());
            return true;
        } catch (ArchivalException e) {
            log.error("retention.archiveFailed batch={} records={}", batchNumber, batch.size(), e);
            return false;
        }
    }

    private RetentionResult finish(RetentionResult result) {
        metricsService.recordRetentionRun(result.duration(), result.archived(), result.deleted(), result.errored());
        auditService.record(AuditAction.RETENTION_COMPLETED, null, result.runId(), ACTOR, Map.of(
                "cutoff", result.cutoff().toString(),
                "archived", result.archived(),
                "deleted", result.deleted(),
                "errored", result.errored(),
                "batches", result.batches(),
                "dryRun", result.dryRun(),
                "timedOut", result.timedOut(),
                "durationMs", result.duration().toMillis()));
        return result;
    }
}
