package com.forecast.sync.archival;

import com.forecast.sync.core.model.RawIntakeRecord;
import com.forecast.sync.health.HealthStatus;

import java.time.Instant;
import java.util.List;

/**
 * Cold storage for raw intake batches.
 */
public interface ArchivalBackend {

    /**
     * Stores the batch as one archive. Returns only once the archive contents have been forced to storage.
     *
     * @throws ArchivalException if the archive could not be written
     */
    ArchivalMetadata archiveBatch(List<RawIntakeRecord> records);

    /**
     * @throws ArchivalException if the archive is missing or unreadable
     */
    List<RawIntakeRecord> retrieveArchive(String archiveId);

    /**
     * Archives written within the range, oldest first. Null bounds are open.
     */
    List<ArchivalMetadata> listArchives(Instant from, Instant to);

    void deleteArchive(String archiveId);

    HealthStatus healthCheck();
}
