package com.forecast.sync.mirror;

import com.forecast.sync.api.PageRequest;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.MirrorRecord;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Storage for canonical mirror rows. Documents are only ever replaced wholesale together with a
 * version increment.
 */
public interface MirrorStore {

    Optional<MirrorRecord> findById(String mirrorId);

    Optional<MirrorRecord> findByEntity(String organizationId, String entityId);

    List<MirrorRecord> findByEntityIds(String organizationId, Collection<String> entityIds);

    /**
     * Creates the mirror row at version 1, or replaces an existing row's document and increments
     * its version. Used when newer intake is promoted.
     */
    MirrorRecord promote(String organizationId, String entityId, Document document);

    /**
     * Atomically replaces the document with the externally confirmed result. The version becomes
     * {@code max(version + 1, remoteVersion)} so the mirror lines up with the remote version the
     * document was confirmed at.
     *
     * @param remoteVersion remote version after the push
     * @throws com.forecast.sync.core.NotFoundException if the mirror row no longer exists
     */
    MirrorRecord applyWriteBack(String mirrorId, Document confirmed, long remoteVersion);

    /**
     * Rows of the organization matching the filter, ordered by entity id ascending.
     */
    List<MirrorRecord> query(String organizationId, MirrorFilter filter, PageRequest page);

    long count(String organizationId, MirrorFilter filter);
}
