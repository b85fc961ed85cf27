package com.forecast.sync.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * One field whose local intended value diverged from the external system's current value.
 */
public record SyncConflict(
        String id,
        String modificationId,
        String organizationId,
        String entityId,
        String fieldName,
        FieldValue localValue,
        FieldValue remoteValue,
        long localVersion,
        long remoteVersion,
        String remoteModifiedBy,
        Instant detectedAt
) {
    public SyncConflict {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(modificationId, "modificationId is required");
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(entityId, "entityId is required");
        Objects.requireNonNull(fieldName, "fieldName is required");
        localValue = localValue != null ? localValue : FieldValue.nullValue();
        remoteValue = remoteValue != null ? remoteValue : FieldValue.nullValue();
        Objects.requireNonNull(detectedAt, "detectedAt is required");
    }

    public static SyncConflict detected(Modification modification, String fieldName,
                                        FieldValue localValue, FieldValue remoteValue,
                                        long remoteVersion, String remoteModifiedBy, Instant at) {
        return new SyncConflict(UUID.randomUUID().toString(), modification.getId(),
                modification.getOrganizationId(), modification.getEntityId(), fieldName,
                localValue, remoteValue, modification.getBaseVersion(), remoteVersion,
                remoteModifiedBy, at);
    }
}
