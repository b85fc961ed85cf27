package com.forecast.sync.sync;

import com.forecast.sync.audit.AuditAction;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.core.NotFoundException;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.delta.ModificationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;

/**
 * Operator view of the write-back pipeline: state lookups, failure listings and requeueing of
 * modifications that exhausted their attempts.
 */
public class SyncStatusService {
    private static final Logger log = LoggerFactory.getLogger(SyncStatusService.class);

    private final ModificationRepository modifications;
    private final AuditService auditService;
    private final Clock clock;

    public SyncStatusService(ModificationRepository modifications, AuditService auditService, Clock clock) {
        this.modifications = modifications;
        this.auditService = auditService;
        this.clock = clock;
    }

    public Modification getModification(String modificationId) {
        return modifications.findById(modificationId)
                .orElseThrow(() -> new NotFoundException("Modification", modificationId));
    }

    public List<Modification> listByState(String organizationId, SyncState state) {
        return modifications.findByState(organizationId, state);
    }

    /**
     * Modifications parked in {@code sync_error}, newest first.
     */
    public List<Modification> listSyncErrors(String organizationId) {
        return listByState(organizationId, SyncState.SYNC_ERROR);
    }

    public SyncStatusSummary getSummary(String organizationId) {
        return SyncStatusSummary.of(organizationId, modifications.countByState(organizationId));
    }

    /**
     * Puts a {@code sync_error} modification back in the queue with a fresh attempt budget.
     *
     * @throws NotFoundException     if the modification does not exist
     * @throws IllegalStateException if it is not in {@code sync_error}, or its author already has
     *                               another active modification of the entity
     */
    public Modification requeue(String modificationId, String operatorId) {
        Modification failed = getModification(modificationId);
        if (failed.getSyncState() != SyncState.SYNC_ERROR) {
            throw new IllegalStateException("Modification " + modificationId + " is "
                    + failed.getSyncState().code() + ", not sync_error");
        }
        if (modifications.findActive(failed.getMirrorId(), failed.getUserId()).isPresent()) {
            throw new IllegalStateException("User " + failed.getUserId()
                    + " already has an active modification for entity " + failed.getEntityId());
        }
        Modification requeued = failed.toBuilder()
                .syncState(SyncState.COMMITTED)
                .attemptCount(0)
                .nextAttemptAt(null)
                .committedAt(clock.instant())
                .updatedAt(clock.instant())
                .build();
        if (!modifications.compareAndSet(failed, requeued)) {
            throw new IllegalStateException("Modification " + modificationId + " changed concurrently");
        }
        log.info("sync.requeued modificationId={} operator={} previousError={}",
                modificationId, operatorId, failed.getLastError());
        auditService.record(AuditAction.SYNC_REQUEUED, failed.getOrganizationId(), failed.getEntityId(),
                operatorId, Map.of("modificationId", modificationId));
        return requeued;
    }
}
