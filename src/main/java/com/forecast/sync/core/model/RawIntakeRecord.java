package com.forecast.sync.core.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable fact ingested from the source pipeline. The payload is kept opaque.
 */
public record RawIntakeRecord(
        String id,
        String organizationId,
        Instant ingestedAt,
        String payload
) {
    public RawIntakeRecord {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(organizationId, "organizationId is required");
        Objects.requireNonNull(ingestedAt, "ingestedAt is required");
        payload = payload == null ? "" : payload;
    }

    public static RawIntakeRecord of(String organizationId, Instant ingestedAt, String payload) {
        return new RawIntakeRecord(UUID.randomUUID().toString(), organizationId, ingestedAt, payload);
    }
}
