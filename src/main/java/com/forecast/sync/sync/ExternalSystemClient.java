package com.forecast.sync.sync;

import com.forecast.sync.core.model.Document;

/**
 * What the write-back worker needs from the external system of record.
 */
public interface ExternalSystemClient {

    /**
     * Reads the entity's current remote document and version.
     *
     * @throws TransientSyncException                   on retryable transport failures
     * @throws com.forecast.sync.core.NotFoundException if the entity does not exist remotely
     */
    RemoteState fetchCurrentState(String organizationId, String entityId);

    /**
     * Applies the changed fields if the remote version still equals {@code expectedBaseVersion}.
     *
     * @throws TransientSyncException on retryable transport failures
     */
    PushResult pushDelta(String organizationId, String entityId, Document deltaFields, long expectedBaseVersion);
}
