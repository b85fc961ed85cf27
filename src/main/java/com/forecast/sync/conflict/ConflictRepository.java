package com.forecast.sync.conflict;

import com.forecast.sync.core.model.SyncConflict;

import java.util.List;

/**
 * Storage for unresolved {@link SyncConflict}s. Rows exist until a resolution removes them.
 */
public interface ConflictRepository {

    void saveAll(List<SyncConflict> conflicts);

    List<SyncConflict> findByModification(String modificationId);

    /**
     * Unresolved conflicts of the organization, most recently detected first.
     */
    List<SyncConflict> findByOrganization(String organizationId);

    /**
     * @return number of conflicts deleted
     */
    int deleteByModification(String modificationId);
}
