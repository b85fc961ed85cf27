package com.forecast.sync.sync;

import com.forecast.sync.audit.AuditAction;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.conflict.InMemoryConflictRepository;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.FieldValue;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncConflict;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.delta.DeltaLifecycleService;
import com.forecast.sync.delta.InMemoryModificationRepository;
import com.forecast.sync.delta.UserDirectory;
import com.forecast.sync.lock.LocalDistributedLock;
import com.forecast.sync.metrics.NoOpMetricsService;
import com.forecast.sync.mirror.InMemoryMirrorStore;
import com.forecast.sync.testing.FakeExternalSystemClient;
import com.forecast.sync.testing.MutableClock;
import com.forecast.sync.validation.ValidationGate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WriteBackSyncWorkerTest {

    private static final String ORG = "org-1";
    private static final String ALICE = "alice";

    private MutableClock clock;
    private InMemoryMirrorStore mirrors;
    private InMemoryModificationRepository modifications;
    private InMemoryConflictRepository conflicts;
    private AuditService auditService;
    private FakeExternalSystemClient remote;
    private DeltaLifecycleService drafts;
    private WriteBackSyncWorker worker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-01T08:00:00Z");
        mirrors = new InMemoryMirrorStore(clock);
        modifications = new InMemoryModificationRepository();
        conflicts = new InMemoryConflictRepository();
        auditService = new AuditService();
        remote = new FakeExternalSystemClient();
        drafts = new DeltaLifecycleService(mirrors, modifications, ValidationGate.acceptAll(),
                new LocalDistributedLock(), UserDirectory.anonymous(), auditService,
                NoOpMetricsService.INSTANCE, clock);
        worker = newWorker(remote, SyncConfig.builder()
                .requestsPerSecond(1000)
                .backoffBase(Duration.ofSeconds(1))
                .backoffMax(Duration.ofSeconds(30))
                .build());
    }

    @AfterEach
    void tearDown() {
        worker.close();
    }

    private WriteBackSyncWorker newWorker(ExternalSystemClient client, SyncConfig config) {
        return new WriteBackSyncWorker(modifications, mirrors, conflicts, client, config, auditService,
                NoOpMetricsService.INSTANCE, clock);
    }

    /** Mirror and remote both at {@code version} holding {@code amount}. */
    private MirrorRecord entity(String entityId, int amount, int version) {
        MirrorRecord mirror = null;
        for (int v = 1; v <= version; v++) {
            mirror = mirrors.promote(ORG, entityId, Document.of(Map.of("amount", amount, "unit", "USD")));
        }
        remote.put(ORG, entityId, mirror.document(), version, "erp-import");
        return mirror;
    }

    private Modification commitEdit(String entityId, int amount) {
        drafts.saveDraft(ORG, ALICE, entityId, Document.of(Map.of("amount", amount)), "s-1", null);
        drafts.commitDrafts(ORG, ALICE, null, List.of(entityId));
        return modifications.findActive(mirrors.findByEntity(ORG, entityId).orElseThrow().id(), ALICE)
                .orElseThrow();
    }

    @Nested
    @DisplayName("successful write-back")
    class Success {

        @Test
        @DisplayName("retires the modification and advances the mirror version")
        void retiresAndAdvancesMirror() {
            MirrorRecord before = entity("FC-1", 100, 3);
            Modification committed = commitEdit("FC-1", 150);

            SyncCycleResult result = worker.runSyncCycle();

            assertEquals(1, result.claimed());
            assertEquals(1, result.succeeded());
            assertFalse(result.skipped());
            MirrorRecord after = mirrors.findById(before.id()).orElseThrow();
            assertEquals(before.version() + 1, after.version());
            assertEquals(FieldValue.of(150), after.document().get("amount").orElseThrow());
            assertEquals(FieldValue.of("USD"), after.document().get("unit").orElseThrow());
            Modification retired = modifications.findById(committed.getId()).orElseThrow();
            assertEquals(SyncState.RETIRED, retired.getSyncState());
            assertEquals(1, retired.getAttemptCount());
            assertEquals(4, remote.get(ORG, "FC-1").version());
            assertTrue(conflicts.findByModification(committed.getId()).isEmpty());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.WRITE_BACK_SUCCEEDED).size());
        }

        @Test
        @DisplayName("an idle cycle claims nothing")
        void idleCycle() {
            SyncCycleResult result = worker.runSyncCycle();

            assertEquals(0, result.claimed());
            assertEquals(0, remote.fetchCount);
        }

        @Test
        @DisplayName("drafts are never pushed")
        void draftsStayLocal() {
            entity("FC-1", 100, 1);
            drafts.saveDraft(ORG, ALICE, "FC-1", Document.of(Map.of("amount", 150)), "s-1", null);

            assertEquals(0, worker.runSyncCycle().claimed());
            assertTrue(remote.pushedEntities.isEmpty());
        }

        @Test
        @DisplayName("listeners see processing then success")
        void listenersNotified() {
            entity("FC-1", 100, 1);
            commitEdit("FC-1", 150);
            List<SyncEvent.Type> seen = new ArrayList<>();
            worker.addListener(event -> seen.add(event.type()));
            worker.addListener(event -> {
                throw new IllegalStateException("listener failure is contained");
            });

            worker.runSyncCycle();

            assertEquals(List.of(SyncEvent.Type.PROCESSING, SyncEvent.Type.SUCCEEDED), seen);
        }
    }

    @Nested
    @DisplayName("conflicts")
    class Conflicts {

        @Test
        @DisplayName("a remote version that moved records one conflict per field and leaves the mirror alone")
        void remoteMovedRecordsConflict() {
            MirrorRecord v3 = entity("FC-1", 100, 3);
            Modification committed = commitEdit("FC-1", 150);
            mirrors.promote(ORG, "FC-1", Document.of(Map.of("amount", 200, "unit", "USD")));
            remote.put(ORG, "FC-1", Document.of(Map.of("amount", 200, "unit", "USD")), 4, "bob");

            SyncCycleResult result = worker.runSyncCycle();

            assertEquals(1, result.conflicts());
            assertTrue(remote.pushedEntities.isEmpty());
            List<SyncConflict> recorded = conflicts.findByModification(committed.getId());
            assertEquals(1, recorded.size());
            SyncConflict conflict = recorded.get(0);
            assertEquals("amount", conflict.fieldName());
            assertEquals(FieldValue.of(150), conflict.localValue());
            assertEquals(FieldValue.of(200), conflict.remoteValue());
            assertEquals(3, conflict.localVersion());
            assertEquals(4, conflict.remoteVersion());
            assertEquals("bob", conflict.remoteModifiedBy());
            MirrorRecord mirror = mirrors.findById(v3.id()).orElseThrow();
            assertEquals(4, mirror.version());
            assertEquals(FieldValue.of(200), mirror.document().get("amount").orElseThrow());
            assertEquals(SyncState.CONFLICT, modifications.findById(committed.getId()).orElseThrow().getSyncState());
        }

        @Test
        @DisplayName("a conflict reported by the push itself is recorded against the refetched state")
        void pushConflict() {
            entity("FC-1", 100, 2);
            Modification committed = commitEdit("FC-1", 150);
            remote.scriptPush(() -> {
                remote.put(ORG, "FC-1", Document.of(Map.of("amount", 175)), 3, "carol");
                return PushResult.conflict("moved");
            });

            assertEquals(1, worker.runSyncCycle().conflicts());

            SyncConflict conflict = conflicts.findByModification(committed.getId()).get(0);
            assertEquals(3, conflict.remoteVersion());
            assertEquals(FieldValue.of(175), conflict.remoteValue());
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("transient failures back off exponentially then park in sync_error")
        void retriesThenSyncError() {
            entity("FC-1", 100, 1);
            Modification committed = commitEdit("FC-1", 150);
            remote.alwaysPush(() -> PushResult.transientError("RATE_LIMIT", "429 Too Many Requests"), 3);

            assertEquals(1, worker.runSyncCycle().retried());
            Modification afterFirst = modifications.findById(committed.getId()).orElseThrow();
            assertEquals(SyncState.COMMITTED, afterFirst.getSyncState());
            assertEquals(1, afterFirst.getAttemptCount());
            assertEquals(clock.instant().plusSeconds(1), afterFirst.getNextAttemptAt());

            assertEquals(0, worker.runSyncCycle().claimed(), "still backing off");

            clock.advance(Duration.ofSeconds(1));
            assertEquals(1, worker.runSyncCycle().retried());
            assertEquals(clock.instant().plusSeconds(2),
                    modifications.findById(committed.getId()).orElseThrow().getNextAttemptAt());

            clock.advance(Duration.ofSeconds(2));
            assertEquals(1, worker.runSyncCycle().failed());

            SyncStatusService status = new SyncStatusService(modifications, auditService, clock);
            List<Modification> errors = status.listSyncErrors(ORG);
            assertEquals(1, errors.size());
            assertEquals(3, errors.get(0).getAttemptCount());
            assertEquals("RATE_LIMIT: 429 Too Many Requests", errors.get(0).getLastError());
            assertEquals(1, status.getSummary(ORG).count(SyncState.SYNC_ERROR));
        }

        @Test
        @DisplayName("a thrown transient exception is retried like a transient result")
        void thrownTransient() {
            entity("FC-1", 100, 1);
            commitEdit("FC-1", 150);
            remote.scriptPush(() -> {
                throw new TransientSyncException("NETWORK", "connection reset");
            });

            assertEquals(1, worker.runSyncCycle().retried());
        }

        @Test
        @DisplayName("a rejected push fails immediately")
        void rejected() {
            entity("FC-1", 100, 1);
            Modification committed = commitEdit("FC-1", 150);
            remote.scriptPush(() -> PushResult.rejected("VALIDATION", "amount out of range"));

            assertEquals(1, worker.runSyncCycle().failed());
            Modification failed = modifications.findById(committed.getId()).orElseThrow();
            assertEquals(SyncState.SYNC_ERROR, failed.getSyncState());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.WRITE_BACK_FAILED).size());
        }

        @Test
        @DisplayName("an entity missing remotely fails without a push")
        void missingRemote() {
            mirrors.promote(ORG, "FC-9", Document.of(Map.of("amount", 1)));
            commitEdit("FC-9", 2);

            assertEquals(1, worker.runSyncCycle().failed());
            assertTrue(remote.pushedEntities.isEmpty());
        }

        @Test
        @DisplayName("one failing item does not stop the rest of the batch")
        void failureIsolated() {
            entity("FC-1", 100, 1);
            entity("FC-2", 100, 1);
            commitEdit("FC-1", 150);
            clock.advance(Duration.ofSeconds(1));
            commitEdit("FC-2", 250);
            remote.scriptPush(() -> PushResult.rejected("VALIDATION", "bad"));

            SyncCycleResult result = worker.runSyncCycle();

            assertEquals(1, result.failed());
            assertEquals(1, result.succeeded());
        }
    }

    @Nested
    @DisplayName("cycle control")
    class CycleControl {

        @Test
        @DisplayName("an overlapping invocation is skipped")
        void overlapSkipped() throws Exception {
            entity("FC-1", 100, 1);
            commitEdit("FC-1", 150);
            CountDownLatch pushing = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            remote.scriptPush(() -> {
                pushing.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return PushResult.transientError("SLOW", "slow");
            });

            CompletableFuture<SyncCycleResult> first = CompletableFuture.supplyAsync(worker::runSyncCycle);
            assertTrue(pushing.await(5, TimeUnit.SECONDS));
            assertTrue(worker.isRunning());
            assertNotNull(worker.currentBatchId());

            SyncCycleResult second = worker.runSyncCycle();
            release.countDown();

            assertTrue(second.skipped());
            assertEquals(1, first.get(5, TimeUnit.SECONDS).claimed());
            assertFalse(worker.isRunning());
            assertNull(worker.currentBatchId());
        }

        @Test
        @DisplayName("claims left over when the cycle time box expires go back to the queue")
        void timeBoxReleasesClaims() {
            for (int i = 0; i < 10; i++) {
                entity("FC-" + i, 100, 1);
                commitEdit("FC-" + i, 150 + i);
                clock.advance(Duration.ofSeconds(1));
            }
            FakeExternalSystemClient slow = new FakeExternalSystemClient() {
                @Override
                public RemoteState fetchCurrentState(String organizationId, String entityId) {
                    try {
                        Thread.sleep(60);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                    return remote.fetchCurrentState(organizationId, entityId);
                }

                @Override
                public PushResult pushDelta(String organizationId, String entityId, Document delta, long base) {
                    return remote.pushDelta(organizationId, entityId, delta, base);
                }
            };
            try (WriteBackSyncWorker boxed = newWorker(slow, SyncConfig.builder()
                    .requestsPerSecond(1000)
                    .callTimeout(Duration.ofMillis(150))
                    .cycleTimeout(Duration.ofMillis(150))
                    .build())) {

                SyncCycleResult result = boxed.runSyncCycle();

                assertEquals(10, result.claimed());
                assertTrue(result.released() > 0);
                assertEquals(10, result.succeeded() + result.released());
                assertEquals(result.released(), modifications.countByState(ORG).get(SyncState.COMMITTED));
                assertEquals(0L, modifications.countByState(ORG).get(SyncState.SYNCING));
            }
        }

        @Test
        @DisplayName("concurrent workers never push the same modification twice")
        void concurrentWorkersExclusive() throws Exception {
            for (int i = 0; i < 30; i++) {
                entity("FC-" + i, 100, 1);
                commitEdit("FC-" + i, 150);
            }
            try (WriteBackSyncWorker other = newWorker(remote, SyncConfig.builder()
                    .requestsPerSecond(1000).batchSize(10).build());
                 WriteBackSyncWorker third = newWorker(remote, SyncConfig.builder()
                         .requestsPerSecond(1000).batchSize(10).build())) {
                CompletableFuture<SyncCycleResult> a = CompletableFuture.supplyAsync(other::runSyncCycle);
                CompletableFuture<SyncCycleResult> b = CompletableFuture.supplyAsync(third::runSyncCycle);
                SyncCycleResult first = a.get(10, TimeUnit.SECONDS);
                SyncCycleResult second = b.get(10, TimeUnit.SECONDS);

                assertEquals(20, first.succeeded() + second.succeeded());
                assertEquals(0, first.conflicts() + second.conflicts());
                assertEquals(20, remote.pushedEntities.size());
                assertEquals(remote.pushedEntities.size(), remote.pushedEntities.stream().distinct().count());
            }
        }
    }
}
