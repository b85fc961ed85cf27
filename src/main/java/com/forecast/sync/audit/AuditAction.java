package com.forecast.sync.audit;

/**
 * Auditable operations of the sync engine.
 */
public enum AuditAction {
    DRAFT_SAVED,
    DRAFTS_COMMITTED,
    DRAFTS_DISCARDED,
    WRITE_BACK_SUCCEEDED,
    WRITE_BACK_CONFLICT,
    WRITE_BACK_FAILED,
    CONFLICT_RESOLVED,
    SYNC_REQUEUED,
    RETENTION_COMPLETED
}
