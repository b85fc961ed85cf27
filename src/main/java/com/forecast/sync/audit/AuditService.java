package com.forecast.sync.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Records and queries the audit trail of draft, sync, conflict and retention operations.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final AuditRepository repository;

    public AuditService() {
        this(new InMemoryAuditRepository());
    }

    public AuditService(AuditRepository repository) {
        this.repository = repository;
    }

    public AuditEntry record(AuditEntry entry) {
        repository.save(entry);
        log.debug("audit.recorded action={} subject={} actor={}", entry.action(), entry.subjectId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String organizationId, String subjectId, String actorId,
                             Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .organizationId(organizationId)
                .subjectId(subjectId)
                .actorId(actorId)
                .details(details)
                .build());
    }

    public List<AuditEntry> getAllEntries() {
        return repository.findAll();
    }

    public List<AuditEntry> getEntriesForSubject(String subjectId) {
        return repository.findBySubjectId(subjectId);
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return repository.findByAction(action);
    }

    public int size() {
        return repository.count();
    }
}
