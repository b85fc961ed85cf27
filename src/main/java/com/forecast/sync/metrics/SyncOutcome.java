package com.forecast.sync.metrics;

/**
 * How the sync worker finished with one claimed modification.
 */
public enum SyncOutcome {
    SUCCEEDED,
    CONFLICT,
    RETRY_SCHEDULED,
    FAILED,
    RELEASED
}
