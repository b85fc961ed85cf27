package com.forecast.sync.view;

import com.forecast.sync.api.Page;
import com.forecast.sync.api.PageRequest;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.FieldValue;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.delta.DeltaLifecycleService;
import com.forecast.sync.delta.InMemoryModificationRepository;
import com.forecast.sync.delta.UserDirectory;
import com.forecast.sync.lock.LocalDistributedLock;
import com.forecast.sync.metrics.NoOpMetricsService;
import com.forecast.sync.mirror.InMemoryMirrorStore;
import com.forecast.sync.mirror.MirrorFilter;
import com.forecast.sync.testing.MutableClock;
import com.forecast.sync.validation.ValidationGate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class MergedViewServiceTest {

    private static final String ORG = "org-1";

    private MutableClock clock;
    private InMemoryMirrorStore mirrors;
    private InMemoryModificationRepository modifications;
    private MergedViewService service;
    private MirrorRecord crane;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-06-01T08:00:00Z");
        mirrors = new InMemoryMirrorStore(clock);
        modifications = new InMemoryModificationRepository();
        service = new MergedViewService(mirrors, modifications);
        crane = mirrors.promote(ORG, "PFA-1", Document.of(Map.of("category", "Cranes", "monthlyRate", 1000)));
        mirrors.promote(ORG, "PFA-2", Document.of(Map.of("category", "Trucks", "monthlyRate", 400)));
        mirrors.promote("org-2", "PFA-9", Document.of(Map.of("category", "Cranes")));
    }

    private Modification delta(String user, SyncState state, Map<String, ?> fields) {
        clock.advance(Duration.ofMinutes(1));
        Modification m = Modification.builder()
                .mirrorId(crane.id())
                .organizationId(ORG)
                .entityId("PFA-1")
                .userId(user)
                .delta(Document.of(fields))
                .modifiedFields(fields.keySet())
                .baseVersion(crane.version())
                .syncState(state)
                .createdAt(clock.instant())
                .build();
        return modifications.insert(m);
    }

    @Test
    @DisplayName("rows without a delta are pristine")
    void pristineRows() {
        List<MergedView> views = service.getMergedViews(ORG, MirrorFilter.none(), "alice");

        assertEquals(2, views.size());
        assertTrue(views.stream().noneMatch(MergedView::hasModifications));
        assertTrue(views.stream().allMatch(v -> MergedView.PRISTINE.equals(v.syncState())));
    }

    @Test
    @DisplayName("the requesting user's delta overlays the mirror document")
    void overlaysOwnDelta() {
        Modification draft = delta("alice", SyncState.DRAFT, Map.of("monthlyRate", 1500));

        MergedView view = service.getMergedViews(ORG, MirrorFilter.none(), "alice").get(0);

        assertTrue(view.hasModifications());
        assertEquals(FieldValue.of(1500), view.document().get("monthlyRate").orElseThrow());
        assertEquals(FieldValue.of("Cranes"), view.document().get("category").orElseThrow());
        assertEquals("draft", view.syncState());
        assertEquals("alice", view.modifiedBy());
        assertEquals(draft.getId(), view.modificationId());
        assertEquals(crane.version(), view.mirrorVersion());
    }

    @Test
    @DisplayName("another user's delta is hidden from a specific requester")
    void otherUsersDeltaHidden() {
        delta("bob", SyncState.COMMITTED, Map.of("monthlyRate", 900));

        MergedView view = service.getMergedViews(ORG, MirrorFilter.none(), "alice").get(0);

        assertFalse(view.hasModifications());
        assertEquals(FieldValue.of(1000), view.document().get("monthlyRate").orElseThrow());
    }

    @Test
    @DisplayName("without a requester the most recently updated active delta wins")
    void latestDeltaWithoutRequester() {
        delta("bob", SyncState.COMMITTED, Map.of("monthlyRate", 900));
        delta("alice", SyncState.DRAFT, Map.of("monthlyRate", 1500));

        MergedView view = service.getMergedViews(ORG, MirrorFilter.none(), null).get(0);

        assertEquals("alice", view.modifiedBy());
        assertEquals(FieldValue.of(1500), view.document().get("monthlyRate").orElseThrow());
    }

    @Test
    @DisplayName("settled deltas no longer overlay the mirror")
    void settledDeltasIgnored() {
        delta("alice", SyncState.RETIRED, Map.of("monthlyRate", 1500));

        assertFalse(service.getMergedViews(ORG, MirrorFilter.none(), "alice").get(0).hasModifications());
    }

    @Test
    @DisplayName("filters and pages the mirror before overlaying")
    void filterAndPage() {
        MirrorFilter cranes = MirrorFilter.builder().category("Cranes").build();

        assertEquals(1, service.getCount(ORG, cranes));
        assertEquals(List.of("PFA-1"), service.getMergedViews(ORG, cranes, null).stream()
                .map(MergedView::entityId).toList());

        Page<MergedView> page = service.getPage(ORG, MirrorFilter.none(), null, new PageRequest(1, 1));
        assertEquals(2, page.totalElements());
        assertEquals("PFA-2", page.content().get(0).entityId());
        assertFalse(page.hasNext());
    }

    @Test
    @DisplayName("an empty organization yields an empty page")
    void emptyOrganization() {
        Page<MergedView> page = service.getPage("org-empty", MirrorFilter.none(), null, PageRequest.defaults());

        assertTrue(page.content().isEmpty());
        assertEquals(0, page.totalElements());
    }

    @Test
    @DisplayName("reads running alongside draft saves never see a half-applied delta")
    void concurrentSavesAndReads() throws Exception {
        mirrors.promote(ORG, "PFA-3", Document.of(Map.of("monthlyRate", 0, "purchasePrice", 0)));
        DeltaLifecycleService drafts = new DeltaLifecycleService(mirrors, modifications,
                ValidationGate.acceptAll(), new LocalDistributedLock(), UserDirectory.anonymous(),
                new AuditService(), NoOpMetricsService.INSTANCE, clock);
        MirrorFilter filter = MirrorFilter.builder().search("PFA-3").build();
        AtomicBoolean saving = new AtomicBoolean(true);
        List<String> torn = new CopyOnWriteArrayList<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(3);
        try {
            Future<?> writer = executor.submit(() -> {
                start.await();
                try {
                    for (int i = 1; i <= 500; i++) {
                        drafts.saveDraft(ORG, "alice", "PFA-3",
                                Document.of(Map.of("monthlyRate", i, "purchasePrice", i)), "s-1", null);
                    }
                } finally {
                    saving.set(false);
                }
                return null;
            });
            List<Future<?>> readers = new ArrayList<>();
            for (String requester : new String[]{"alice", null}) {
                readers.add(executor.submit(() -> {
                    start.await();
                    while (saving.get()) {
                        for (MergedView view : service.getMergedViews(ORG, filter, requester)) {
                            FieldValue rate = view.document().get("monthlyRate").orElseThrow();
                            FieldValue price = view.document().get("purchasePrice").orElseThrow();
                            if (!rate.equals(price)) {
                                torn.add(rate + " != " + price);
                            }
                        }
                    }
                    return null;
                }));
            }
            start.countDown();
            writer.get(30, TimeUnit.SECONDS);
            for (Future<?> reader : readers) {
                reader.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertTrue(torn.isEmpty(), () -> "torn reads: " + torn);
        MergedView last = service.getMergedViews(ORG, filter, "alice").get(0);
        assertEquals(FieldValue.of(500), last.document().get("monthlyRate").orElseThrow());
        assertEquals(FieldValue.of(500), last.document().get("purchasePrice").orElseThrow());
    }
}
