package com.forecast.sync.health;

import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.sync.SyncStatusService;
import com.forecast.sync.sync.SyncStatusSummary;

/**
 * Reports the write-back success rate of one organization: healthy maps to UP, degraded to
 * DEGRADED and unhealthy to DOWN.
 */
public class SyncBacklogHealthCheck implements HealthCheck {

    private final SyncStatusService statusService;
    private final String organizationId;

    public SyncBacklogHealthCheck(SyncStatusService statusService, String organizationId) {
        this.statusService = statusService;
        this.organizationId = organizationId;
    }

    @Override
    public String getName() {
        return "sync-backlog:" + organizationId;
    }

    @Override
    public HealthStatus check() {
        SyncStatusSummary summary = statusService.getSummary(organizationId);
        String message = String.format("success rate %.1f%%", summary.successRate());
        HealthStatus status = switch (summary.health()) {
            case HEALTHY -> HealthStatus.up(message);
            case DEGRADED -> HealthStatus.degraded(message);
            case UNHEALTHY -> HealthStatus.down(message);
        };
        return status
                .withDetail("queued", summary.queued())
                .withDetail("syncing", summary.count(SyncState.SYNCING))
                .withDetail("syncErrors", summary.count(SyncState.SYNC_ERROR))
                .withDetail("conflicts", summary.count(SyncState.CONFLICT));
    }
}
