package com.forecast.sync.delta;

import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.core.model.UserIdentity;

import java.time.Instant;
import java.util.Set;

/**
 * One modification of an entity together with its author.
 */
public record ModificationHistoryEntry(
        String modificationId,
        String entityId,
        UserIdentity author,
        SyncState syncState,
        Document delta,
        Set<String> modifiedFields,
        String changeReason,
        long baseVersion,
        int editCount,
        Instant updatedAt,
        Instant committedAt,
        String lastError
) {
    static ModificationHistoryEntry of(Modification m, UserIdentity author) {
        return new ModificationHistoryEntry(m.getId(), m.getEntityId(), author, m.getSyncState(),
                m.getDelta(), m.getModifiedFields(), m.getChangeReason(), m.getBaseVersion(),
                m.getEditCount(), m.getUpdatedAt(), m.getCommittedAt(), m.getLastError());
    }
}
