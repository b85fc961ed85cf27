package com.forecast.sync.audit;

import java.time.Instant;
import java.util.List;

/**
 * Append-only storage for audit entries.
 */
public interface AuditRepository {

    AuditEntry save(AuditEntry entry);

    List<AuditEntry> findAll();

    List<AuditEntry> findBySubjectId(String subjectId);

    List<AuditEntry> findByAction(AuditAction action);

    List<AuditEntry> findBetween(Instant start, Instant end);

    int count();
}
