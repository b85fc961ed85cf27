package com.forecast.sync.archival;

import java.time.Instant;

/**
 * Description of one stored archive.
 */
public record ArchivalMetadata(
        String archiveId,
        int recordCount,
        long compressedSize,
        long uncompressedSize,
        Instant archiveDate
) {
}
