package com.forecast.sync.conflict;

import com.forecast.sync.core.model.SyncConflict;
import com.forecast.sync.graph.DocumentCodec;
import com.forecast.sync.graph.GraphConnection;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Conflict repository backed by {@code :SyncConflict} nodes. Local and remote values are stored
 * as JSON so their kind survives.
 */
public class GraphConflictRepository implements ConflictRepository {

    private static final String RETURN_CONFLICT = """
            RETURN c.id AS id, c.modificationId AS modificationId, c.organizationId AS organizationId,
                   c.entityId AS entityId, c.fieldName AS fieldName, c.localValue AS localValue,
                   c.remoteValue AS remoteValue, c.localVersion AS localVersion,
                   c.remoteVersion AS remoteVersion, c.remoteModifiedBy AS remoteModifiedBy,
                   c.detectedAt AS detectedAt
            """;

    private final GraphConnection connection;

    public GraphConflictRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public void saveAll(List<SyncConflict> conflicts) {
        for (SyncConflict conflict : conflicts) {
            Map<String, Object> params = new HashMap<>();
            params.put("id", conflict.id());
            params.put("modificationId", conflict.modificationId());
            params.put("organizationId", conflict.organizationId());
            params.put("entityId", conflict.entityId());
            params.put("fieldName", conflict.fieldName());
            params.put("localValue", DocumentCodec.encodeValue(conflict.localValue()));
            params.put("remoteValue", DocumentCodec.encodeValue(conflict.remoteValue()));
            params.put("localVersion", conflict.localVersion());
            params.put("remoteVersion", conflict.remoteVersion());
            params.put("remoteModifiedBy", conflict.remoteModifiedBy());
            params.put("detectedAt", conflict.detectedAt().toEpochMilli());
            connection.execute("""
                    CREATE (:SyncConflict {id: $id, modificationId: $modificationId,
                        organizationId: $organizationId, entityId: $entityId, fieldName: $fieldName,
                        localValue: $localValue, remoteValue: $remoteValue, localVersion: $localVersion,
                        remoteVersion: $remoteVersion, remoteModifiedBy: $remoteModifiedBy,
                        detectedAt: $detectedAt})
                    """, params);
        }
    }

    @Override
    public List<SyncConflict> findByModification(String modificationId) {
        return connection.query("MATCH (c:SyncConflict {modificationId: $modificationId}) "
                        + RETURN_CONFLICT + " ORDER BY fieldName", Map.of("modificationId", modificationId))
                .stream().map(GraphConflictRepository::toConflict).toList();
    }

    @Override
    public List<SyncConflict> findByOrganization(String organizationId) {
        return connection.query("MATCH (c:SyncConflict {organizationId: $organizationId}) "
                        + RETURN_CONFLICT + " ORDER BY detectedAt DESC, fieldName",
                        Map.of("organizationId", organizationId))
                .stream().map(GraphConflictRepository::toConflict).toList();
    }

    @Override
    public int deleteByModification(String modificationId) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (c:SyncConflict {modificationId: $modificationId}) DELETE c RETURN count(*) AS total",
                Map.of("modificationId", modificationId));
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("total")).intValue();
    }

    private static SyncConflict toConflict(Map<String, Object> row) {
        return new SyncConflict(
                (String) row.get("id"),
                (String) row.get("modificationId"),
                (String) row.get("organizationId"),
                (String) row.get("entityId"),
                (String) row.get("fieldName"),
                DocumentCodec.decodeValue((String) row.get("localValue")),
                DocumentCodec.decodeValue((String) row.get("remoteValue")),
                ((Number) row.get("localVersion")).longValue(),
                ((Number) row.get("remoteVersion")).longValue(),
                (String) row.get("remoteModifiedBy"),
                Instant.ofEpochMilli(((Number) row.get("detectedAt")).longValue()));
    }
}
