package com.forecast.sync.health;

/**
 * A check of one component of the sync engine.
 */
public interface HealthCheck {

    String getName();

    HealthStatus check();
}
