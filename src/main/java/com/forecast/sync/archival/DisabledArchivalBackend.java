package com.forecast.sync.archival;

import com.forecast.sync.core.model.RawIntakeRecord;
import com.forecast.sync.health.HealthStatus;

import java.time.Instant;
import java.util.List;

/**
 * Backend used when archival is switched off. Refuses to archive, so nothing can be deleted on
 * the strength of an archive that does not exist.
 */
public class DisabledArchivalBackend implements ArchivalBackend {

    @Override
    public ArchivalMetadata archiveBatch(List<RawIntakeRecord> records) {
        throw new ArchivalException("Archival is disabled");
    }

    @Override
    public List<RawIntakeRecord> retrieveArchive(String archiveId) {
        throw new ArchivalException("Archival is disabled");
    }

    @Override
    public List<ArchivalMetadata> listArchives(Instant from, Instant to) {
        return List.of();
    }

    @Override
    public void deleteArchive(String archiveId) {
        throw new ArchivalException("Archival is disabled");
    }

    @Override
    public HealthStatus healthCheck() {
        return HealthStatus.up("Archival disabled");
    }
}
