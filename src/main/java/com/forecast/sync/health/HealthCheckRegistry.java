package com.forecast.sync.health;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered checks and reports the worst status among them. A check that throws counts as
 * DOWN.
 */
public class HealthCheckRegistry {

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }
        Map<String, Object> results = new LinkedHashMap<>();
        HealthStatus.Status worst = HealthStatus.Status.UP;
        String worstMessage = "OK";
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", result.message(),
                    "details", result.details()));
            if (result.status().ordinal() > worst.ordinal()) {
                worst = result.status();
                worstMessage = check.getName() + ": " + result.message();
            }
        }
        return new HealthStatus(worst, worstMessage, results);
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            return check.check();
        } catch (RuntimeException e) {
            return HealthStatus.down(check.getName() + " check failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }

    public int size() {
        return checks.size();
    }
}
