package com.forecast.sync.sync;

import com.forecast.sync.core.model.Document;

import java.time.Instant;
import java.util.Objects;

/**
 * The external system's current view of one entity.
 *
 * @param lastModifiedBy whoever last changed the entity remotely, may be null
 */
public record RemoteState(Document document, long version, String lastModifiedBy, Instant lastModifiedAt) {

    public RemoteState {
        Objects.requireNonNull(document, "document is required");
    }
}
