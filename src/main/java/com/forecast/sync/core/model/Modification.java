package com.forecast.sync.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * A user's overlay delta against one mirror row. Instances are immutable; every state change
 * produces a new instance through {@link #toBuilder()} so concurrent readers never see a
 * partially written delta.
 *
 * <p>{@code baseVersion} is the mirror version observed when the delta was created and drives
 * conflict detection. {@code editCount} only counts local saves.</p>
 */
public final class Modification {

    private final String id;
    private final String mirrorId;
    private final String organizationId;
    private final String entityId;
    private final String userId;
    private final Document delta;
    private final Set<String> modifiedFields;
    private final String sessionId;
    private final String changeReason;
    private final long baseVersion;
    private final int editCount;
    private final SyncState syncState;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant committedAt;
    private final int attemptCount;
    private final Instant nextAttemptAt;
    private final String lastError;

    private Modification(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.mirrorId = Objects.requireNonNull(builder.mirrorId, "mirrorId is required");
        this.organizationId = Objects.requireNonNull(builder.organizationId, "organizationId is required");
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId is required");
        this.userId = Objects.requireNonNull(builder.userId, "userId is required");
        this.delta = builder.delta != null ? builder.delta : Document.empty();
        this.modifiedFields = Collections.unmodifiableSet(new LinkedHashSet<>(builder.modifiedFields));
        this.sessionId = builder.sessionId;
        this.changeReason = builder.changeReason;
        this.baseVersion = builder.baseVersion;
        this.editCount = builder.editCount;
        this.syncState = builder.syncState != null ? builder.syncState : SyncState.DRAFT;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : this.createdAt;
        this.committedAt = builder.committedAt;
        this.attemptCount = builder.attemptCount;
        this.nextAttemptAt = builder.nextAttemptAt;
        this.lastError = builder.lastError;
    }

    public String getId() { return id; }
    public String getMirrorId() { return mirrorId; }
    public String getOrganizationId() { return organizationId; }
    public String getEntityId() { return entityId; }
    public String getUserId() { return userId; }
    public Document getDelta() { return delta; }
    public Set<String> getModifiedFields() { return modifiedFields; }
    public String getSessionId() { return sessionId; }
    public String getChangeReason() { return changeReason; }
    public long getBaseVersion() { return baseVersion; }
    public int getEditCount() { return editCount; }
    public SyncState getSyncState() { return syncState; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getUpdatedAt() { return updatedAt; }
    public Instant getCommittedAt() { return committedAt; }
    public int getAttemptCount() { return attemptCount; }
    public Instant getNextAttemptAt() { return nextAttemptAt; }
    public String getLastError() { return lastError; }

    public boolean isActive() {
        return syncState.isActive();
    }

    /**
     * A committed delta is eligible for a sync cycle once its backoff delay has elapsed.
     */
    public boolean isDueAt(Instant now) {
        return syncState == SyncState.COMMITTED && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .mirrorId(mirrorId)
                .organizationId(organizationId)
                .entityId(entityId)
                .userId(userId)
                .delta(delta)
                .modifiedFields(modifiedFields)
                .sessionId(sessionId)
                .changeReason(changeReason)
                .baseVersion(baseVersion)
                .editCount(editCount)
                .syncState(syncState)
                .createdAt(createdAt)
                .updatedAt(updatedAt)
                .committedAt(committedAt)
                .attemptCount(attemptCount)
                .nextAttemptAt(nextAttemptAt)
                .lastError(lastError);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Modification that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Modification{id='" + id + "', entityId='" + entityId + "', userId='" + userId
                + "', state=" + syncState + ", baseVersion=" + baseVersion
                + ", fields=" + modifiedFields + "}";
    }

    public static class Builder {
        private String id;
        private String mirrorId;
        private String organizationId;
        private String entityId;
        private String userId;
        private Document delta;
        private Set<String> modifiedFields = Set.of();
        private String sessionId;
        private String changeReason;
        private long baseVersion;
        private int editCount = 1;
        private SyncState syncState;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant committedAt;
        private int attemptCount;
        private Instant nextAttemptAt;
        private String lastError;

        public Builder id(String id) { this.id = id; return this; }
        public Builder mirrorId(String mirrorId) { this.mirrorId = mirrorId; return this; }
        public Builder organizationId(String organizationId) { this.organizationId = organizationId; return this; }
        public Builder entityId(String entityId) { this.entityId = entityId; return this; }
        public Builder userId(String userId) { this.userId = userId; return this; }
        public Builder delta(Document delta) { this.delta = delta; return this; }
        public Builder modifiedFields(Set<String> modifiedFields) {
            this.modifiedFields = modifiedFields != null ? modifiedFields : Set.of();
            return this;
        }
        public Builder sessionId(String sessionId) { this.sessionId = sessionId; return this; }
        public Builder changeReason(String changeReason) { this.changeReason = changeReason; return this; }
        public Builder baseVersion(long baseVersion) { this.baseVersion = baseVersion; return this; }
        public Builder editCount(int editCount) { this.editCount = editCount; return this; }
        public Builder syncState(SyncState syncState) { this.syncState = syncState; return this; }
        public Builder createdAt(Instant createdAt) { this.createdAt = createdAt; return this; }
        public Builder updatedAt(Instant updatedAt) { this.updatedAt = updatedAt; return this; }
        public Builder committedAt(Instant committedAt) { this.committedAt = committedAt; return this; }
        public Builder attemptCount(int attemptCount) { this.attemptCount = attemptCount; return this; }
        public Builder nextAttemptAt(Instant nextAttemptAt) { this.nextAttemptAt = nextAttemptAt; return this; }
        public Builder lastError(String lastError) { this.lastError = lastError; return this; }

        public Modification build() {
            return new Modification(this);
        }
    }
}
