package com.forecast.sync.retention;

import java.time.Instant;

/**
 * Point-in-time view of raw intake against the retention window. Timestamps are null when the
 * store is empty.
 */
public record RetentionStats(
        long totalRecords,
        long eligibleForPruning,
        Instant oldestIngestedAt,
        Instant newestIngestedAt,
        Instant cutoff,
        int retentionDays,
        boolean archivalEnabled
) {
}
