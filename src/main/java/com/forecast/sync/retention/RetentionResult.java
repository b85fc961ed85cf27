package com.forecast.sync.retention;

import java.time.Duration;
import java.time.Instant;

/**
 * Summary of one retention run.
 *
 * @param archived      rows written to cold storage
 * @param deleted       rows removed from raw intake; always zero on a dry run
 * @param errored       rows whose batch failed to archive and was therefore kept
 * @param batches       non-empty batches read
 * @param failedBatches batches whose archive could not be confirmed
 * @param dryRunMatched rows a dry run would have processed
 * @param timedOut      the run stopped at its time budget with eligible rows left
 */
public record RetentionResult(
        String runId,
        Instant cutoff,
        long eligible,
        long archived,
        long deleted,
        long errored,
        int batches,
        int failedBatches,
        long dryRunMatched,
        boolean dryRun,
        boolean timedOut,
        Duration duration
) {

    static RetentionResult nothingToDo(String runId, Instant cutoff, boolean dryRun, Duration duration) {
        return new RetentionResult(runId, cutoff, 0, 0, 0, 0, 0, 0, 0, dryRun, false, duration);
    }

    public boolean hasErrors() {
        return errored > 0;
    }

    @Override
    public String toString() {
        return "RetentionResult{archived=" + archived +
                ", deleted=" + deleted +
                ", errored=" + errored +
                ", batches=" + batches +
                ", dryRunMatched=" + dryRunMatched +
                ", timedOut=" + timedOut +
                ", duration=" + duration.toMillis() + "ms}";
    }
}
