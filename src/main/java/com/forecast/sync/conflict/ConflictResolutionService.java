package com.forecast.sync.conflict;

import com.forecast.sync.audit.AuditAction;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.core.NotFoundException;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncConflict;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.delta.ModificationRepository;
import com.forecast.sync.lock.DistributedLock;
import com.forecast.sync.lock.LockAcquisitionException;
import com.forecast.sync.mirror.MirrorStore;
import com.forecast.sync.validation.ValidationException;
import com.forecast.sync.validation.ValidationGate;
import com.forecast.sync.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Settles conflicts detected by the write-back worker. Conflicts are never resolved
 * automatically; a caller decides per field and the result re-enters the pipeline as a fresh
 * draft rebased on the newest known version.
 */
public class ConflictResolutionService {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolutionService.class);

    private final ConflictRepository conflicts;
    private final ModificationRepository modifications;
    private final MirrorStore mirrorStore;
    private final ValidationGate validationGate;
    private final DistributedLock lock;
    private final AuditService auditService;
    private final Clock clock;

    public ConflictResolutionService(ConflictRepository conflicts, ModificationRepository modifications,
                                     MirrorStore mirrorStore, ValidationGate validationGate,
                                     DistributedLock lock, AuditService auditService, Clock clock) {
        this.conflicts = conflicts;
        this.modifications = modifications;
        this.mirrorStore = mirrorStore;
        this.validationGate = validationGate;
        this.lock = lock;
        this.auditService = auditService;
        this.clock = clock;
    }

    public List<SyncConflict> listUnresolved(String organizationId) {
        return conflicts.findByOrganization(organizationId);
    }

    public List<SyncConflict> listForModification(String modificationId) {
        return conflicts.findByModification(modificationId);
    }

    /**
     * Applies one decision per conflicting field. The conflicts and the conflicted modification
     * are removed; the resolved values become a new draft of the same user whose base version is
     * the newer of the mirror version and the remote version seen at detection.
     *
     * @param commit commit the new draft right away instead of leaving it as a draft
     * @return the new modification, empty when every field kept the remote value
     * @throws NotFoundException        if the modification does not exist (e.g. already resolved)
     * @throws IllegalStateException    if the modification is not in conflict, or the user already
     *                                  has another active modification of the entity
     * @throws IllegalArgumentException if decisions are missing or name fields without conflicts
     * @throws ValidationException      if the resolved values fail validation
     */
    public Optional<Modification> resolve(String modificationId, Map<String, FieldDecision> decisions,
                                          String resolvedBy, boolean commit) {
        Modification conflicted = modifications.findById(modificationId)
                .orElseThrow(() -> new NotFoundException("Modification", modificationId));
        if (conflicted.getSyncState() != SyncState.CONFLICT) {
            throw new IllegalStateException("Modification " + modificationId + " is "
                    + conflicted.getSyncState().code() + ", not conflict");
        }
        List<SyncConflict> fieldConflicts = conflicts.findByModification(modificationId);
        checkDecisions(modificationId, fieldConflicts, decisions);

        Document resolved = resolvedValues(fieldConflicts, decisions);
        if (!resolved.isEmpty()) {
            ValidationResult validation = validationGate.validate(resolved);
            if (!validation.isValid()) {
                throw new ValidationException(conflicted.getEntityId(), validation.errors());
            }
        }
        MirrorRecord mirror = mirrorStore.findById(conflicted.getMirrorId())
                .orElseThrow(() -> new NotFoundException("Mirror", conflicted.getMirrorId()));
        long remoteVersion = fieldConflicts.stream().mapToLong(SyncConflict::remoteVersion).max().orElse(0);
        long baseVersion = Math.max(mirror.version(), remoteVersion);

        String lockKey = "draft:" + conflicted.getMirrorId() + ":" + conflicted.getUserId();
        if (!lock.tryLock(lockKey)) {
            throw new LockAcquisitionException("Lock not acquired: " + lockKey);
        }
        Modification rebased = null;
        try {
            if (modifications.findActive(conflicted.getMirrorId(), conflicted.getUserId()).isPresent()) {
                throw new IllegalStateException("User " + conflicted.getUserId()
                        + " already has an active modification for entity " + conflicted.getEntityId());
            }
            if (!resolved.isEmpty()) {
                Instant now = clock.instant();
                rebased = modifications.insert(Modification.builder()
                        .mirrorId(conflicted.getMirrorId())
                        .organizationId(conflicted.getOrganizationId())
                        .entityId(conflicted.getEntityId())
                        .userId(conflicted.getUserId())
                        .delta(resolved)
                        .modifiedFields(resolved.keys())
                        .sessionId(conflicted.getSessionId())
                        .changeReason(conflicted.getChangeReason())
                        .baseVersion(baseVersion)
                        .editCount(1)
                        .syncState(commit ? SyncState.COMMITTED : SyncState.DRAFT)
                        .committedAt(commit ? now : null)
                        .createdAt(now)
                        .updatedAt(now)
                        .build());
            }
            conflicts.deleteByModification(modificationId);
            modifications.delete(modificationId);
        } finally {
            lock.unlock(lockKey);
        }

        log.info("conflict.resolved modificationId={} entityId={} fields={} rebasedVersion={} newModification={}",
                modificationId, conflicted.getEntityId(), decisions.keySet(), baseVersion,
                rebased != null ? rebased.getId() : "none");
        Map<String, Object> details = new HashMap<>();
        details.put("modificationId", modificationId);
        details.put("decisions", decisions.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, e -> e.getValue().choice().name())));
        details.put("baseVersion", baseVersion);
        if (rebased != null) {
            details.put("newModificationId", rebased.getId());
        }
        auditService.record(AuditAction.CONFLICT_RESOLVED, conflicted.getOrganizationId(),
                conflicted.getEntityId(), resolvedBy, details);
        return Optional.ofNullable(rebased);
    }

    private static void checkDecisions(String modificationId, List<SyncConflict> fieldConflicts,
                                       Map<String, FieldDecision> decisions) {
        Set<String> conflictFields = fieldConflicts.stream().map(SyncConflict::fieldName).collect(Collectors.toSet());
        Set<String> missing = new HashSet<>(conflictFields);
        missing.removeAll(decisions.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("No decision for conflicting fields " + missing
                    + " of modification " + modificationId);
        }
        Set<String> unknown = new HashSet<>(decisions.keySet());
        unknown.removeAll(conflictFields);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Fields " + unknown + " have no conflict on modification "
                    + modificationId);
        }
    }

    private static Document resolvedValues(List<SyncConflict> fieldConflicts, Map<String, FieldDecision> decisions) {
        Document.Builder resolved = Document.builder();
        for (SyncConflict conflict : fieldConflicts) {
            FieldDecision decision = decisions.get(conflict.fieldName());
            switch (decision.choice()) {
                case KEEP_LOCAL -> resolved.put(conflict.fieldName(), conflict.localValue());
                case MANUAL -> resolved.put(conflict.fieldName(), decision.manualValue());
                case KEEP_REMOTE -> {
                    // remote value already authoritative
                }
            }
        }
        return resolved.build();
    }
}
