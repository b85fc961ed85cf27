package com.forecast.sync.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private InMemoryAuditRepository repository;
    private AuditService service;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAuditRepository();
        service = new AuditService(repository);
    }

    @Test
    @DisplayName("records entries with generated id and timestamp")
    void recordsEntries() {
        AuditEntry entry = service.record(AuditAction.DRAFTS_COMMITTED, "org-1", "FC-1", "alice",
                Map.of("count", 3));

        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
        assertEquals(3, entry.details().get("count"));
        assertEquals(1, service.size());
        assertEquals(List.of(entry), service.getEntriesForSubject("FC-1"));
    }

    @Test
    @DisplayName("filters by action")
    void filtersByAction() {
        service.record(AuditAction.DRAFT_SAVED, "org-1", "FC-1", "alice", Map.of());
        service.record(AuditAction.DRAFT_SAVED, "org-1", "FC-2", "alice", Map.of());
        service.record(AuditAction.WRITE_BACK_CONFLICT, "org-1", "FC-1", "write-back-worker", Map.of());

        assertEquals(2, service.getEntriesByAction(AuditAction.DRAFT_SAVED).size());
        assertEquals(1, service.getEntriesByAction(AuditAction.WRITE_BACK_CONFLICT).size());
        assertEquals(3, service.getAllEntries().size());
    }

    @Test
    @DisplayName("details are copied on record")
    void detailsCopied() {
        Map<String, Object> details = new HashMap<>();
        details.put("fields", "amount");
        AuditEntry entry = service.record(AuditAction.CONFLICT_RESOLVED, "org-1", "FC-1", "alice", details);

        details.put("fields", "unit");

        assertEquals("amount", entry.details().get("fields"));
        assertThrows(UnsupportedOperationException.class, () -> entry.details().put("x", 1));
    }

    @Test
    void findBetween() {
        Instant t0 = Instant.parse("2024-06-01T00:00:00Z");
        repository.save(AuditEntry.builder().action(AuditAction.RETENTION_COMPLETED).subjectId("run-1")
                .actorId("RETENTION_JOB").timestamp(t0).build());
        repository.save(AuditEntry.builder().action(AuditAction.RETENTION_COMPLETED).subjectId("run-2")
                .actorId("RETENTION_JOB").timestamp(t0.plusSeconds(86_400)).build());

        assertEquals(1, repository.findBetween(t0.minusSeconds(1), t0.plusSeconds(1)).size());
    }

    @Test
    void actionIsRequired() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().subjectId("x").build());
    }
}
