package com.forecast.sync.graph;

import java.util.List;
import java.util.Map;

/**
 * Connection to the graph database holding mirror rows, modifications, conflicts and raw intake.
 * Every dynamic value travels as a {@code $param}; implementations never splice values into
 * query text.
 */
public interface GraphConnection extends AutoCloseable {

    /**
     * Executes a Cypher statement that modifies the graph.
     *
     * @param query  the Cypher statement
     * @param params statement parameters
     */
    void execute(String query, Map<String, Object> params);

    default void execute(String query) {
        execute(query, Map.of());
    }

    /**
     * Executes a Cypher query and returns its rows keyed by column name.
     *
     * @param query  the Cypher query
     * @param params query parameters
     * @return result rows
     */
    List<Map<String, Object>> query(String query, Map<String, Object> params);

    default List<Map<String, Object>> query(String query) {
        return query(query, Map.of());
    }

    boolean isConnected();

    String getGraphName();

    /**
     * Creates the indexes used by the sync engine's lookups if they don't exist.
     */
    void createIndexes();

    @Override
    void close();
}
