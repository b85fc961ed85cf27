package com.forecast.sync.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical snapshot of one externally owned entity within one organization. Replaced wholesale
 * with a version bump, never patched by user edits.
 */
public record MirrorRecord(
        String id,
        String organizationId,
        String entityId,
        Document document,
        long version,
        Instant updatedAt
) {
    public MirrorRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(document, "document is required");
        Objects.requireNonNull(updatedAt, "updatedAt is required");
        if (version < 1) {
            throw new IllegalArgumentException("version must be >= 1");
        }
    }

    /**
     * Returns the successor snapshot holding {@code replacement} at {@code version + 1}.
     */
    public MirrorRecord replacedBy(Document replacement, Instant at) {
        return new MirrorRecord(id, organizationId, entityId, replacement, version + 1, at);
    }

    /**
     * Returns the successor snapshot after a confirmed write-back. The version moves at least one
     * step and never stays behind {@code remoteVersion}, the remote version the document belongs to.
     */
    public MirrorRecord writtenBack(Document confirmed, long remoteVersion, Instant at) {
        return new MirrorRecord(id, organizationId, entityId, confirmed, Math.max(version + 1, remoteVersion), at);
    }
}
