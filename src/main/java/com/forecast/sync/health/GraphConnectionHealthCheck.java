package com.forecast.sync.health;

import com.forecast.sync.graph.GraphConnection;

/**
 * Round-trips a trivial query to the graph database and reports its latency.
 */
public class GraphConnectionHealthCheck implements HealthCheck {

    private final GraphConnection connection;

    public GraphConnectionHealthCheck(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public String getName() {
        return "graph";
    }

    @Override
    public HealthStatus check() {
        try {
            long startMs = System.currentTimeMillis();
            connection.query("RETURN 1");
            return HealthStatus.up()
                    .withDetail("latencyMs", System.currentTimeMillis() - startMs)
                    .withDetail("graphName", connection.getGraphName());
        } catch (RuntimeException e) {
            return HealthStatus.down("Graph connection failed: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName());
        }
    }
}
