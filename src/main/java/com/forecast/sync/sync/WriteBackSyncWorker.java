package com.forecast.sync.sync;

import com.forecast.sync.audit.AuditAction;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.conflict.ConflictRepository;
import com.forecast.sync.core.NotFoundException;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.FieldValue;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncConflict;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.delta.ModificationRepository;
import com.forecast.sync.logging.LogContext;
import com.forecast.sync.metrics.MetricsService;
import com.forecast.sync.metrics.SyncOutcome;
import com.forecast.sync.mirror.MirrorStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains committed modifications to the external system.
 *
 * <p>Each cycle claims a batch (committed to syncing in one atomic step), then per item reads the
 * remote state, pushes the delta when the remote version still equals the delta's base version,
 * and folds the confirmed result into the mirror. A remote version that moved records one
 * conflict per delta field. Transient failures are retried with exponential backoff until the
 * attempt limit, after which the item stays in {@code sync_error}.</p>
 *
 * <p>Every outbound call goes through one shared rate limiter and runs with a timeout; the cycle
 * as a whole is time-boxed and hands unprocessed claims back to the queue.</p>
 */
public class WriteBackSyncWorker implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WriteBackSyncWorker.class);

    private static final String WORKER_ACTOR = "write-back-worker";

    private final ModificationRepository modifications;
    private final MirrorStore mirrorStore;
    private final ConflictRepository conflicts;
    private final ExternalSystemClient client;
    private final SyncConfig config;
    private final OutboundRateLimiter rateLimiter;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;
    private final ExecutorService callExecutor;
    private final List<SyncEventListener> listeners = new CopyOnWriteArrayList<>();

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile String currentBatchId;

    public WriteBackSyncWorker(ModificationRepository modifications, MirrorStore mirrorStore,
                               ConflictRepository conflicts, ExternalSystemClient client, SyncConfig config,
                               AuditService auditService, MetricsService metricsService, Clock clock) {
        this.modifications = modifications;
        this.mirrorStore = mirrorStore;
        this.conflicts = conflicts;
        this.client = client;
        this.config = config;
        this.rateLimiter = new OutboundRateLimiter(config.requestsPerSecond());
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;
        AtomicInteger threads = new AtomicInteger();
        this.callExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mirror-sync-call-" + threads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void addListener(SyncEventListener listener) {
        listeners.add(listener);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Id of the batch being processed, or null when idle.
     */
    public String currentBatchId() {
        return currentBatchId;
    }

    /**
     * Runs one cycle. Returns immediately with a skipped result if a cycle is already running.
     * Failures of the external system are confined to the item in flight; a failing store aborts
     * the cycle after handing unprocessed claims back.
     */
    public SyncCycleResult runSyncCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("sync.cycleSkipped reason=already-running batchId={}", currentBatchId);
            return SyncCycleResult.skipped(clock.instant());
        }
        String batchId = LogContext.newId();
        currentBatchId = batchId;
        Instant startedAt = clock.instant();
        long startNanos = System.nanoTime();
        long deadline = startNanos + config.cycleTimeout().toNanos();
        SyncCycleResult.Tally tally = new SyncCycleResult.Tally(batchId, startedAt);
        List<Modification> claimed = List.of();
        int next = 0;
        try (LogContext ctx = LogContext.forSyncCycle(batchId)) {
            try {
                claimed = modifications.claimDue(config.batchSize(), startedAt);
                tally.claimed(claimed.size());
                if (claimed.isEmpty()) {
                    log.debug("sync.cycleIdle");
                    return tally.complete(clock.instant());
                }
                log.info("sync.cycleStarted claimed={}", claimed.size());
                for (; next < claimed.size(); next++) {
                    if (System.nanoTime() >= deadline || Thread.currentThread().isInterrupted()) {
                        log.warn("sync.cycleTimeBoxed processed={} remaining={}", next, claimed.size() - next);
                        break;
                    }
                    SyncOutcome outcome = process(claimed.get(next), batchId);
                    tally.record(outcome);
                    metricsService.incrementSyncOutcome(outcome);
                }
            } finally {
                for (int i = next; i < claimed.size(); i++) {
                    if (release(claimed.get(i))) {
                        tally.record(SyncOutcome.RELEASED);
                        metricsService.incrementSyncOutcome(SyncOutcome.RELEASED);
                    }
                }
                currentBatchId = null;
                running.set(false);
            }
            SyncCycleResult result = tally.complete(clock.instant());
            metricsService.recordSyncCycle(Duration.ofNanos(System.nanoTime() - startNanos), result.claimed());
            log.info("sync.cycleCompleted claimed={} succeeded={} conflicts={} retried={} failed={} released={}",
                    result.claimed(), result.succeeded(), result.conflicts(), result.retried(),
                    result.failed(), result.released());
            return result;
        }
    }

    private SyncOutcome process(Modification modification, String batchId) {
        try (LogContext ctx = LogContext.forModification(modification.getId(), modification.getEntityId())) {
            publish(SyncEvent.Type.PROCESSING, modification, batchId, null);
            Optional<MirrorRecord> mirror = mirrorStore.findById(modification.getMirrorId());
            if (mirror.isEmpty()) {
                return fail(modification, batchId, "MIRROR_NOT_FOUND", "Mirror row no longer exists");
            }
            String org = modification.getOrganizationId();
            String entityId = modification.getEntityId();
            try {
                RemoteState remote = call(() -> client.fetchCurrentState(org, entityId));
                if (remote.version() != modification.getBaseVersion()) {
                    return conflict(modification, remote, batchId);
                }
                PushResult push = call(() -> client.pushDelta(org, entityId, modification.getDelta(),
                        modification.getBaseVersion()));
                return switch (push.outcome()) {
                    case SUCCESS -> succeed(modification, mirror.get(), push, batchId);
                    case CONFLICT -> conflict(modification, call(() -> client.fetchCurrentState(org, entityId)), batchId);
                    case TRANSIENT_ERROR -> retryOrFail(modification, batchId, push.errorCode(), push.message());
                    case REJECTED -> fail(modification, batchId, push.errorCode(), push.message());
                };
            } catch (TransientSyncException e) {
                return retryOrFail(modification, batchId, e.getErrorCode(), e.getMessage());
            } catch (NotFoundException e) {
                return fail(modification, batchId, "NOT_FOUND", e.getMessage());
            }
        }
    }

    private SyncOutcome succeed(Modification modification, MirrorRecord mirror, PushResult push, String batchId) {
        Document confirmed = push.confirmedDocument() != null
                ? push.confirmedDocument()
                : mirror.document().overlay(modification.getDelta());
        // an accepted push moved the remote exactly one step past the expected base version
        long remoteVersion = push.confirmedVersion() > 0
                ? push.confirmedVersion()
                : modification.getBaseVersion() + 1;
        MirrorRecord updated = mirrorStore.applyWriteBack(mirror.id(), confirmed, remoteVersion);
        transition(modification, modification.toBuilder()
                .syncState(SyncState.RETIRED)
                .attemptCount(modification.getAttemptCount() + 1)
                .nextAttemptAt(null)
                .lastError(null)
                .updatedAt(clock.instant())
                .build());
        log.info("sync.succeeded entityId={} mirrorVersion={} remoteVersion={}",
                modification.getEntityId(), updated.version(), remoteVersion);
        auditService.record(AuditAction.WRITE_BACK_SUCCEEDED, modification.getOrganizationId(),
                modification.getEntityId(), WORKER_ACTOR, Map.of(
                        "modificationId", modification.getId(),
                        "author", modification.getUserId(),
                        "mirrorVersion", updated.version()));
        publish(SyncEvent.Type.SUCCEEDED, modification, batchId, null);
        return SyncOutcome.SUCCEEDED;
    }

    private SyncOutcome conflict(Modification modification, RemoteState remote, String batchId) {
        Instant now = clock.instant();
        List<SyncConflict> detected = new ArrayList<>();
        for (Map.Entry<String, FieldValue> field : modification.getDelta().asMap().entrySet()) {
            FieldValue remoteValue = remote.document().get(field.getKey()).orElse(FieldValue.nullValue());
            detected.add(SyncConflict.detected(modification, field.getKey(), field.getValue(), remoteValue,
                    remote.version(), remote.lastModifiedBy(), now));
        }
        conflicts.saveAll(detected);
        String message = "Remote version " + remote.version() + " differs from base version "
                + modification.getBaseVersion();
        transition(modification, modification.toBuilder()
                .syncState(SyncState.CONFLICT)
                .attemptCount(modification.getAttemptCount() + 1)
                .nextAttemptAt(null)
                .lastError(message)
                .updatedAt(now)
                .build());
        log.warn("sync.conflict entityId={} baseVersion={} remoteVersion={} fields={}",
                modification.getEntityId(), modification.getBaseVersion(), remote.version(),
                modification.getDelta().keys());
        auditService.record(AuditAction.WRITE_BACK_CONFLICT, modification.getOrganizationId(),
                modification.getEntityId(), WORKER_ACTOR, Map.of(
                        "modificationId", modification.getId(),
                        "baseVersion", modification.getBaseVersion(),
                        "remoteVersion", remote.version(),
                        "fields", List.copyOf(modification.getDelta().keys())));
        publish(SyncEvent.Type.CONFLICT, modification, batchId, message);
        return SyncOutcome.CONFLICT;
    }

    private SyncOutcome retryOrFail(Modification modification, String batchId, String code, String message) {
        int attempts = modification.getAttemptCount() + 1;
        if (attempts >= config.maxAttempts()) {
            return fail(modification, batchId, code, message);
        }
        Duration delay = config.backoff().delayFor(attempts);
        Instant now = clock.instant();
        transition(modification, modification.toBuilder()
                .syncState(SyncState.COMMITTED)
                .attemptCount(attempts)
                .nextAttemptAt(now.plus(delay))
                .lastError(describe(code, message))
                .updatedAt(now)
                .build());
        log.warn("sync.retryScheduled entityId={} attempt={} delayMs={} error={}",
                modification.getEntityId(), attempts, delay.toMillis(), describe(code, message));
        publish(SyncEvent.Type.RETRY_SCHEDULED, modification, batchId, describe(code, message));
        return SyncOutcome.RETRY_SCHEDULED;
    }

    private SyncOutcome fail(Modification modification, String batchId, String code, String message) {
        int attempts = modification.getAttemptCount() + 1;
        transition(modification, modification.toBuilder()
                .syncState(SyncState.SYNC_ERROR)
                .attemptCount(attempts)
                .nextAttemptAt(null)
                .lastError(describe(code, message))
                .updatedAt(clock.instant())
                .build());
        log.error("sync.failed entityId={} attempts={} error={}",
                modification.getEntityId(), attempts, describe(code, message));
        auditService.record(AuditAction.WRITE_BACK_FAILED, modification.getOrganizationId(),
                modification.getEntityId(), WORKER_ACTOR, Map.of(
                        "modificationId", modification.getId(),
                        "attempts", attempts,
                        "error", describe(code, message)));
        publish(SyncEvent.Type.FAILED, modification, batchId, describe(code, message));
        return SyncOutcome.FAILED;
    }

    private boolean release(Modification claimed) {
        try {
            transition(claimed, claimed.toBuilder()
                    .syncState(SyncState.COMMITTED)
                    .updatedAt(clock.instant())
                    .build());
            return true;
        } catch (RuntimeException e) {
            log.error("sync.releaseFailed modificationId={} state=syncing", claimed.getId(), e);
            return false;
        }
    }

    private void transition(Modification claimed, Modification updated) {
        if (!modifications.compareAndSet(claimed, updated)) {
            throw new IllegalStateException("Claimed modification " + claimed.getId()
                    + " changed while syncing");
        }
    }

    /**
     * Runs one outbound call under the shared rate limit and the per-call timeout.
     */
    private <T> T call(Callable<T> outbound) {
        Future<T> future = null;
        try {
            Duration waited = rateLimiter.acquire();
            metricsService.recordThrottleWait(waited);
            future = callExecutor.submit(outbound);
            return future.get(config.callTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientSyncException("TIMEOUT",
                    "External call exceeded " + config.callTimeout().toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            throw new TransientSyncException("INTERRUPTED", "Interrupted during external call", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof TransientSyncException || cause instanceof NotFoundException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new TransientSyncException("CLIENT_ERROR", String.valueOf(cause.getMessage()), cause);
        }
    }

    private void publish(SyncEvent.Type type, Modification modification, String batchId, String detail) {
        if (listeners.isEmpty()) {
            return;
        }
        SyncEvent event = new SyncEvent(type, modification.getOrganizationId(), modification.getEntityId(),
                modification.getId(), batchId, clock.instant(), detail);
        for (SyncEventListener listener : listeners) {
            try {
                listener.onSyncEvent(event);
            } catch (RuntimeException e) {
                log.warn("sync.listenerFailed type={} listener={}", type, listener.getClass().getName(), e);
            }
        }
    }

    private static String describe(String code, String message) {
        return code == null ? message : code + ": " + message;
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }
}
