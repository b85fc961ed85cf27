package com.forecast.sync.sync;

import com.forecast.sync.core.model.SyncState;

import java.util.Map;

/**
 * Write-back pipeline counts for one organization.
 *
 * @param successRate retired share of finished modifications, in percent; 100 when none finished
 */
public record SyncStatusSummary(
        String organizationId,
        Map<SyncState, Long> countsByState,
        double successRate,
        Health health
) {
    public enum Health {
        HEALTHY,
        DEGRADED,
        UNHEALTHY
    }

    public SyncStatusSummary {
        countsByState = Map.copyOf(countsByState);
    }

    public long count(SyncState state) {
        return countsByState.getOrDefault(state, 0L);
    }

    /**
     * Committed rows waiting for a cycle.
     */
    public long queued() {
        return count(SyncState.COMMITTED);
    }

    static SyncStatusSummary of(String organizationId, Map<SyncState, Long> counts) {
        long retired = counts.getOrDefault(SyncState.RETIRED, 0L);
        long finished = retired + counts.getOrDefault(SyncState.SYNC_ERROR, 0L)
                + counts.getOrDefault(SyncState.CONFLICT, 0L);
        double successRate = finished == 0 ? 100.0 : retired * 100.0 / finished;
        Health health = successRate >= 95 ? Health.HEALTHY
                : successRate >= 80 ? Health.DEGRADED
                : Health.UNHEALTHY;
        return new SyncStatusSummary(organizationId, counts, successRate, health);
    }
}
