package com.forecast.sync.graph;

import com.falkordb.Driver;
import com.falkordb.FalkorDB;
import com.falkordb.Graph;
import com.falkordb.Record;
import com.falkordb.ResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * FalkorDB implementation using the JFalkorDB client. Parameters are sent to the server
 * alongside the query.
 */
public class FalkorDBConnection implements GraphConnection {
    private static final Logger log = LoggerFactory.getLogger(FalkorDBConnection.class);

    private final Driver driver;
    private final Graph graph;
    private final String graphName;

    public FalkorDBConnection(String host, int port, String graphName) {
        this.driver = FalkorDB.driver(host, port);
        this.graphName = graphName;
        this.graph = driver.graph(graphName);
        log.info("falkordb.connected host={} port={} graph={}", host, port, graphName);
    }

    @Override
    public void execute(String query, Map<String, Object> params) {
        log.debug("falkordb.execute query={} paramKeys={}", query, params.keySet());
        graph.query(query, params);
    }

    @Override
    public List<Map<String, Object>> query(String query, Map<String, Object> params) {
        log.debug("falkordb.query query={} paramKeys={}", query, params.keySet());
        ResultSet resultSet = graph.query(query, params);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (Record record : resultSet) {
            Map<String, Object> row = new HashMap<>();
            for (String key : record.keys()) {
                row.put(key, record.getValue(key));
            }
            rows.add(row);
        }
        log.debug("falkordb.query rows={}", rows.size());
        return rows;
    }

    @Override
    public boolean isConnected() {
        try {
            graph.query("RETURN 1");
            return true;
        } catch (Exception e) {
            log.warn("falkordb.ping failed graph={}", graphName, e);
            return false;
        }
    }

    @Override
    public String getGraphName() {
        return graphName;
    }

    @Override
    public void createIndexes() {
        log.info("falkordb.createIndexes graph={}", graphName);
        createIndex("CREATE INDEX FOR (m:Mirror) ON (m.id)");
        createIndex("CREATE INDEX FOR (m:Mirror) ON (m.organizationId, m.entityId)");
        createIndex("CREATE INDEX FOR (d:Modification) ON (d.id)");
        createIndex("CREATE INDEX FOR (d:Modification) ON (d.mirrorId, d.userId)");
        createIndex("CREATE INDEX FOR (d:Modification) ON (d.syncState)");
        createIndex("CREATE INDEX FOR (c:SyncConflict) ON (c.modificationId)");
        createIndex("CREATE INDEX FOR (r:RawIntake) ON (r.ingestedAt)");
    }

    private void createIndex(String statement) {
        try {
            graph.query(statement);
        } catch (Exception e) {
            // FalkorDB rejects an index that already exists
            log.debug("falkordb.createIndex skipped statement={} reason={}", statement, e.getMessage());
        }
    }

    @Override
    public void close() {
        try {
            driver.close();
        } catch (Exception e) {
            log.warn("falkordb.close failed graph={}", graphName, e);
        }
        log.info("falkordb.closed graph={}", graphName);
    }
}
