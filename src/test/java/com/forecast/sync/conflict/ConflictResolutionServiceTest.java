package com.forecast.sync.conflict;

import com.forecast.sync.audit.AuditAction;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.core.NotFoundException;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.FieldValue;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncConflict;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.delta.InMemoryModificationRepository;
import com.forecast.sync.lock.DistributedLock;
import com.forecast.sync.lock.LocalDistributedLock;
import com.forecast.sync.lock.LockAcquisitionException;
import com.forecast.sync.mirror.InMemoryMirrorStore;
import com.forecast.sync.testing.MutableClock;
import com.forecast.sync.validation.FieldError;
import com.forecast.sync.validation.ValidationException;
import com.forecast.sync.validation.ValidationGate;
import com.forecast.sync.validation.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ConflictResolutionServiceTest {

    private static final String ORG = "org-1";

    private MutableClock clock;
    private InMemoryMirrorStore mirrors;
    private InMemoryModificationRepository modifications;
    private InMemoryConflictRepository conflicts;
    private AuditService auditService;
    private ConflictResolutionService service;
    private MirrorRecord mirror;
    private Modification conflicted;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-01T08:00:00Z");
        mirrors = new InMemoryMirrorStore(clock);
        modifications = new InMemoryModificationRepository();
        conflicts = new InMemoryConflictRepository();
        auditService = new AuditService();
        service = newService(ValidationGate.acceptAll(), new LocalDistributedLock());

        for (int v = 0; v < 3; v++) {
            mirror = mirrors.promote(ORG, "FC-1", Document.of(Map.of("amount", 100, "unit", "USD")));
        }
        conflicted = modifications.insert(Modification.builder()
                .mirrorId(mirror.id())
                .organizationId(ORG)
                .entityId("FC-1")
                .userId("alice")
                .delta(Document.of(Map.of("amount", 150, "unit", "EUR")))
                .modifiedFields(Set.of("amount", "unit"))
                .sessionId("s-1")
                .baseVersion(3)
                .syncState(SyncState.CONFLICT)
                .createdAt(clock.instant())
                .build());
        conflicts.saveAll(List.of(
                SyncConflict.detected(conflicted, "amount", FieldValue.of(150), FieldValue.of(200), 5, "bob",
                        clock.instant()),
                SyncConflict.detected(conflicted, "unit", FieldValue.of("EUR"), FieldValue.of("USD"), 5, "bob",
                        clock.instant())));
    }

    private ConflictResolutionService newService(ValidationGate gate, DistributedLock lock) {
        return new ConflictResolutionService(conflicts, modifications, mirrors, gate, lock, auditService, clock);
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("keeps local and manual values in a new draft rebased on the newer version")
        void rebasesDraft() {
            Optional<Modification> rebased = service.resolve(conflicted.getId(), Map.of(
                    "amount", FieldDecision.manual(180),
                    "unit", FieldDecision.keepLocal()), "alice", false);

            Modification draft = rebased.orElseThrow();
            assertEquals(SyncState.DRAFT, draft.getSyncState());
            assertEquals(5, draft.getBaseVersion(), "remote version 5 is newer than mirror version 3");
            assertEquals(FieldValue.of(180), draft.getDelta().get("amount").orElseThrow());
            assertEquals(FieldValue.of("EUR"), draft.getDelta().get("unit").orElseThrow());
            assertEquals("s-1", draft.getSessionId());
            assertTrue(modifications.findById(conflicted.getId()).isEmpty());
            assertTrue(conflicts.findByModification(conflicted.getId()).isEmpty());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.CONFLICT_RESOLVED).size());
        }

        @Test
        @DisplayName("keep-remote fields drop out of the rebased delta")
        void keepRemoteDropsField() {
            Modification draft = service.resolve(conflicted.getId(), Map.of(
                    "amount", FieldDecision.keepLocal(),
                    "unit", FieldDecision.keepRemote()), "alice", true).orElseThrow();

            assertEquals(SyncState.COMMITTED, draft.getSyncState());
            assertEquals(clock.instant(), draft.getCommittedAt());
            assertEquals(Set.of("amount"), draft.getDelta().keys());
        }

        @Test
        @DisplayName("accepting every remote value leaves nothing to write")
        void allRemote() {
            assertEquals(2, service.listForModification(conflicted.getId()).size());

            Optional<Modification> rebased = service.resolve(conflicted.getId(), Map.of(
                    "amount", FieldDecision.keepRemote(),
                    "unit", FieldDecision.keepRemote()), "alice", true);

            assertTrue(rebased.isEmpty());
            assertTrue(modifications.findActive(mirror.id(), "alice").isEmpty());
            assertTrue(service.listUnresolved(ORG).isEmpty());
            assertTrue(service.listForModification(conflicted.getId()).isEmpty());
        }

        @Test
        @DisplayName("the mirror version wins when it is newer than the remote one seen")
        void mirrorVersionNewer() {
            for (int v = 0; v < 4; v++) {
                mirrors.promote(ORG, "FC-1", Document.of(Map.of("amount", 210)));
            }

            Modification draft = service.resolve(conflicted.getId(), Map.of(
                    "amount", FieldDecision.keepLocal(),
                    "unit", FieldDecision.keepLocal()), "alice", false).orElseThrow();

            assertEquals(7, draft.getBaseVersion());
        }

        @Test
        @DisplayName("resolving twice reports the modification as gone")
        void resolveTwice() {
            Map<String, FieldDecision> decisions = Map.of(
                    "amount", FieldDecision.keepRemote(), "unit", FieldDecision.keepRemote());
            service.resolve(conflicted.getId(), decisions, "alice", false);

            assertThrows(NotFoundException.class,
                    () -> service.resolve(conflicted.getId(), decisions, "alice", false));
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("every conflicting field needs a decision")
        void missingDecision() {
            assertThrows(IllegalArgumentException.class, () -> service.resolve(conflicted.getId(),
                    Map.of("amount", FieldDecision.keepLocal()), "alice", false));
            assertEquals(SyncState.CONFLICT,
                    modifications.findById(conflicted.getId()).orElseThrow().getSyncState());
        }

        @Test
        @DisplayName("decisions for fields without a conflict are refused")
        void unknownField() {
            assertThrows(IllegalArgumentException.class, () -> service.resolve(conflicted.getId(), Map.of(
                    "amount", FieldDecision.keepLocal(),
                    "unit", FieldDecision.keepLocal(),
                    "notes", FieldDecision.manual("x")), "alice", false));
        }

        @Test
        @DisplayName("a modification that is not in conflict cannot be resolved")
        void notInConflict() {
            Modification draft = modifications.insert(conflicted.toBuilder().id("other")
                    .userId("bob").syncState(SyncState.DRAFT).build());

            assertThrows(IllegalStateException.class, () -> service.resolve(draft.getId(),
                    Map.of(), "bob", false));
        }

        @Test
        @DisplayName("the author's newer active edit blocks the rebase")
        void activeEditBlocks() {
            modifications.insert(conflicted.toBuilder().id("newer").syncState(SyncState.DRAFT).build());

            assertThrows(IllegalStateException.class, () -> service.resolve(conflicted.getId(), Map.of(
                    "amount", FieldDecision.keepLocal(), "unit", FieldDecision.keepLocal()), "alice", false));
            assertEquals(2, conflicts.findByModification(conflicted.getId()).size());
        }

        @Test
        @DisplayName("resolved values go through the validation gate")
        void validated() {
            ValidationGate rejectsManual = delta -> delta.get("amount")
                    .filter(v -> v.asNumber().intValue() < 0)
                    .map(v -> ValidationResult.invalid(List.of(new FieldError("amount", "must be >= 0", "RANGE"))))
                    .orElse(ValidationResult.valid());
            ConflictResolutionService validating = newService(rejectsManual, new LocalDistributedLock());

            ValidationException e = assertThrows(ValidationException.class, () -> validating.resolve(
                    conflicted.getId(), Map.of(
                            "amount", FieldDecision.manual(-5),
                            "unit", FieldDecision.keepLocal()), "alice", false));
            assertEquals("amount", e.getErrors().get(0).field());
        }
    }

    @Nested
    @ExtendWith(MockitoExtension.class)
    @DisplayName("locking")
    class Locking {

        @Mock
        DistributedLock lock;

        @Test
        @DisplayName("a busy lock fails the resolution without touching rows")
        void busyLock() {
            when(lock.tryLock(anyString())).thenReturn(false);
            ConflictResolutionService locked = newService(ValidationGate.acceptAll(), lock);

            assertThrows(LockAcquisitionException.class, () -> locked.resolve(conflicted.getId(), Map.of(
                    "amount", FieldDecision.keepLocal(), "unit", FieldDecision.keepLocal()), "alice", false));
            verify(lock, never()).unlock(anyString());
            assertTrue(modifications.findById(conflicted.getId()).isPresent());
        }
    }
}
