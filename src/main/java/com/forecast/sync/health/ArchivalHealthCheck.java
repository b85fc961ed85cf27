package com.forecast.sync.health;

import com.forecast.sync.archival.ArchivalBackend;

/**
 * Delegates to the archival backend's own probe.
 */
public class ArchivalHealthCheck implements HealthCheck {

    private final ArchivalBackend backend;

    public ArchivalHealthCheck(ArchivalBackend backend) {
        this.backend = backend;
    }

    @Override
    public String getName() {
        return "archival";
    }

    @Override
    public HealthStatus check() {
        return backend.healthCheck();
    }
}
