package com.forecast.sync.sync;

import java.time.Instant;

/**
 * Progress notification for one modification handled by the write-back worker.
 *
 * @param detail error or conflict description, may be null
 */
public record SyncEvent(
        Type type,
        String organizationId,
        String entityId,
        String modificationId,
        String batchId,
        Instant timestamp,
        String detail
) {
    public enum Type {
        PROCESSING,
        SUCCEEDED,
        CONFLICT,
        RETRY_SCHEDULED,
        FAILED
    }
}
