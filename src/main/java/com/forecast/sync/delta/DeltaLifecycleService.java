package com.forecast.sync.delta;

import com.forecast.sync.audit.AuditAction;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.core.NotFoundException;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.core.model.UserIdentity;
import com.forecast.sync.lock.DistributedLock;
import com.forecast.sync.lock.LockAcquisitionException;
import com.forecast.sync.logging.LogContext;
import com.forecast.sync.metrics.MetricsService;
import com.forecast.sync.mirror.MirrorStore;
import com.forecast.sync.validation.FieldError;
import com.forecast.sync.validation.ValidationException;
import com.forecast.sync.validation.ValidationGate;
import com.forecast.sync.validation.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Creates, updates, commits and discards per-user overlay deltas. None of these calls touches
 * the external system; committing only makes a draft eligible for the write-back worker.
 */
public class DeltaLifecycleService {
    private static final Logger log = LoggerFactory.getLogger(DeltaLifecycleService.class);

    private final MirrorStore mirrorStore;
    private final ModificationRepository repository;
    private final ValidationGate validationGate;
    private final DistributedLock lock;
    private final UserDirectory userDirectory;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final Clock clock;

    public DeltaLifecycleService(MirrorStore mirrorStore, ModificationRepository repository,
                                 ValidationGate validationGate, DistributedLock lock,
                                 UserDirectory userDirectory, AuditService auditService,
                                 MetricsService metricsService, Clock clock) {
        this.mirrorStore = mirrorStore;
        this.repository = repository;
        this.validationGate = validationGate;
        this.lock = lock;
        this.userDirectory = userDirectory;
        this.auditService = auditService;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Saves the user's draft for the entity. An existing active delta of the same user is updated
     * in place: fields are overwritten, the modified-field set grows and the edit counter
     * increments. A committed delta that has not been claimed yet is pulled back to draft.
     *
     * @throws ValidationException   if the delta fails validation; nothing is stored
     * @throws NotFoundException     if the organization has no mirror row for the entity
     * @throws IllegalStateException if the user's delta is currently being written back
     */
    public Modification saveDraft(String organizationId, String userId, String entityId,
                                  Document deltaFields, String sessionId, String changeReason) {
        if (deltaFields == null || deltaFields.isEmpty()) {
            throw new IllegalArgumentException("deltaFields must contain at least one field");
        }
        ValidationResult validation = validationGate.validate(deltaFields);
        if (!validation.isValid()) {
            throw new ValidationException(entityId, validation.errors());
        }
        MirrorRecord mirror = mirrorStore.findByEntity(organizationId, entityId)
                .orElseThrow(() -> new NotFoundException("Mirror", organizationId + "/" + entityId));

        String lockKey = "draft:" + mirror.id() + ":" + userId;
        Modification saved;
        try (LogContext ctx = LogContext.forDrafts(organizationId, userId, "saveDraft")) {
            if (!lock.tryLock(lockKey)) {
                throw new LockAcquisitionException("Lock not acquired: " + lockKey);
            }
            try {
                Instant now = clock.instant();
                saved = repository.findActive(mirror.id(), userId)
                        .map(existing -> updateExisting(existing, deltaFields, sessionId, changeReason, now))
                        .orElseGet(() -> repository.insert(Modification.builder()
                                .mirrorId(mirror.id())
                                .organizationId(organizationId)
                                .entityId(entityId)
                                .userId(userId)
                                .delta(deltaFields)
                                .modifiedFields(deltaFields.keys())
                                .sessionId(sessionId)
                                .changeReason(changeReason)
                                .baseVersion(mirror.version())
                                .editCount(1)
                                .syncState(SyncState.DRAFT)
                                .createdAt(now)
                                .updatedAt(now)
                                .build()));
            } finally {
                lock.unlock(lockKey);
            }
            log.info("draft.saved entityId={} modificationId={} editCount={} fields={}",
                    entityId, saved.getId(), saved.getEditCount(), deltaFields.keys());
        }
        metricsService.incrementDraftsSaved();
        auditService.record(AuditAction.DRAFT_SAVED, organizationId, entityId, userId, Map.of(
                "modificationId", saved.getId(),
                "fields", List.copyOf(deltaFields.keys()),
                "editCount", saved.getEditCount()));
        return saved;
    }

    private Modification updateExisting(Modification existing, Document deltaFields, String sessionId,
                                        String changeReason, Instant now) {
        if (existing.getSyncState() == SyncState.SYNCING) {
            throw new IllegalStateException("Modification " + existing.getId() + " is being written back");
        }
        Set<String> fields = new LinkedHashSet<>(existing.getModifiedFields());
        fields.addAll(deltaFields.keys());
        Modification updated = existing.toBuilder()
                .delta(existing.getDelta().overlay(deltaFields))
                .modifiedFields(fields)
                .editCount(existing.getEditCount() + 1)
                .sessionId(sessionId != null ? sessionId : existing.getSessionId())
                .changeReason(changeReason != null ? changeReason : existing.getChangeReason())
                .syncState(SyncState.DRAFT)
                .committedAt(null)
                // new content starts a fresh write-back history
                .attemptCount(0)
                .nextAttemptAt(null)
                .lastError(null)
                .updatedAt(now)
                .build();
        if (!repository.compareAndSet(existing, updated)) {
            throw new IllegalStateException("Modification " + existing.getId()
                    + " was claimed for write-back while saving");
        }
        if (existing.getSyncState() == SyncState.COMMITTED) {
            log.info("draft.reopened modificationId={}", existing.getId());
        }
        return updated;
    }

    /**
     * Marks the user's matching drafts as committed. Repeating the call commits nothing further.
     *
     * @param sessionId restrict to one session, or null
     * @param entityIds restrict to these entities, or null for every draft of the user
     * @return number of drafts committed
     * @throws ValidationException if any selected draft fails validation; nothing is committed
     */
    public int commitDrafts(String organizationId, String userId, String sessionId, Collection<String> entityIds) {
        DraftSelector selector = selector(organizationId, userId, sessionId, entityIds);
        if (selector == null) {
            return 0;
        }
        try (LogContext ctx = LogContext.forDrafts(organizationId, userId, "commitDrafts")) {
            List<Modification> drafts = repository.findDrafts(selector);
            if (drafts.isEmpty()) {
                log.debug("drafts.commit nothing to commit");
                return 0;
            }
            List<FieldError> errors = new ArrayList<>();
            Set<String> rejected = new LinkedHashSet<>();
            for (Modification draft : drafts) {
                ValidationResult result = validationGate.validate(draft.getDelta());
                if (!result.isValid()) {
                    errors.addAll(result.errors());
                    rejected.add(draft.getEntityId());
                }
            }
            if (!errors.isEmpty()) {
                throw new ValidationException(String.join(", ", rejected), errors);
            }

            int committed = repository.commitDrafts(selector, clock.instant());
            log.info("drafts.committed count={} session={}", committed, sessionId);
            metricsService.incrementDraftsCommitted(committed);
            auditService.record(AuditAction.DRAFTS_COMMITTED, organizationId, null, userId,
                    details(committed, sessionId, drafts));
            return committed;
        }
    }

    /**
     * Deletes the user's matching drafts. Irreversible; repeating the call deletes nothing further.
     *
     * @return number of drafts deleted
     */
    public int discardDrafts(String organizationId, String userId, String sessionId, Collection<String> entityIds) {
        DraftSelector selector = selector(organizationId, userId, sessionId, entityIds);
        if (selector == null) {
            return 0;
        }
        try (LogContext ctx = LogContext.forDrafts(organizationId, userId, "discardDrafts")) {
            List<Modification> drafts = repository.findDrafts(selector);
            int discarded = repository.deleteDrafts(selector);
            log.info("drafts.discarded count={} session={}", discarded, sessionId);
            if (discarded > 0) {
                metricsService.incrementDraftsDiscarded(discarded);
                auditService.record(AuditAction.DRAFTS_DISCARDED, organizationId, null, userId,
                        details(discarded, sessionId, drafts));
            }
            return discarded;
        }
    }

    public long getDraftCount(String organizationId, String userId) {
        return repository.countDrafts(organizationId, userId);
    }

    /**
     * All modifications of the entity, newest first, with their authors.
     */
    public List<ModificationHistoryEntry> getModificationHistory(String organizationId, String entityId) {
        Map<String, UserIdentity> authors = new HashMap<>();
        return repository.findByEntity(organizationId, entityId).stream()
                .map(m -> ModificationHistoryEntry.of(m, authors.computeIfAbsent(m.getUserId(),
                        id -> userDirectory.findUser(id).orElseGet(() -> UserIdentity.unknown(id)))))
                .toList();
    }

    /**
     * Returns null when an entity subset was given but none of it exists, meaning nothing can match.
     */
    private DraftSelector selector(String organizationId, String userId, String sessionId,
                                   Collection<String> entityIds) {
        if (entityIds == null) {
            return new DraftSelector(organizationId, userId, sessionId, null);
        }
        Set<String> mirrorIds = mirrorStore.findByEntityIds(organizationId, entityIds).stream()
                .map(MirrorRecord::id)
                .collect(Collectors.toSet());
        return mirrorIds.isEmpty() ? null : new DraftSelector(organizationId, userId, sessionId, mirrorIds);
    }

    private static Map<String, Object> details(int count, String sessionId, List<Modification> drafts) {
        Map<String, Object> details = new HashMap<>();
        details.put("count", count);
        details.put("entityIds", drafts.stream().map(Modification::getEntityId).distinct().toList());
        if (sessionId != null) {
            details.put("sessionId", sessionId);
        }
        return details;
    }
}
