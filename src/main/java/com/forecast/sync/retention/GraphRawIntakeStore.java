package com.forecast.sync.retention;

import com.forecast.sync.core.model.RawIntakeRecord;
import com.forecast.sync.graph.GraphConnection;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw intake stored as {@code :RawIntake} nodes. Timestamps are epoch millis so range predicates
 * compare numerically.
 */
public class GraphRawIntakeStore implements RawIntakeStore {

    private final GraphConnection connection;

    public GraphRawIntakeStore(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public void append(RawIntakeRecord record) {
        connection.execute("""
                CREATE (:RawIntake {id: $id, organizationId: $organizationId,
                    ingestedAt: $ingestedAt, payload: $payload})
                """, Map.of(
                "id", record.id(),
                "organizationId", record.organizationId(),
                "ingestedAt", record.ingestedAt().toEpochMilli(),
                "payload", record.payload()));
    }

    @Override
    public long count() {
        return total(connection.query("MATCH (r:RawIntake) RETURN count(r) AS total", Map.of()));
    }

    @Override
    public long countIngestedBefore(Instant cutoff) {
        return total(connection.query(
                "MATCH (r:RawIntake) WHERE r.ingestedAt < $cutoff RETURN count(r) AS total",
                Map.of("cutoff", cutoff.toEpochMilli())));
    }

    @Override
    public List<RawIntakeRecord> findBatch(Instant cutoff, Cursor after, int limit) {
        Map<String, Object> params = new HashMap<>();
        params.put("cutoff", cutoff.toEpochMilli());
        params.put("limit", limit);
        StringBuilder query = new StringBuilder("MATCH (r:RawIntake) WHERE r.ingestedAt < $cutoff");
        if (after != null) {
            query.append(" AND (r.ingestedAt > $afterAt OR (r.ingestedAt = $afterAt AND r.id > $afterId))");
            params.put("afterAt", after.ingestedAt().toEpochMilli());
            params.put("afterId", after.id());
        }
        query.append("""
                 RETURN r.id AS id, r.organizationId AS organizationId, r.ingestedAt AS ingestedAt,
                        r.payload AS payload
                 ORDER BY ingestedAt ASC, id ASC LIMIT $limit
                """);
        List<RawIntakeRecord> batch = new ArrayList<>();
        for (Map<String, Object> row : connection.query(query.toString(), params)) {
            batch.add(new RawIntakeRecord(
                    (String) row.get("id"),
                    (String) row.get("organizationId"),
                    Instant.ofEpochMilli(((Number) row.get("ingestedAt")).longValue()),
                    (String) row.get("payload")));
        }
        return batch;
    }

    @Override
    public int deleteByIds(Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        return (int) total(connection.query(
                "MATCH (r:RawIntake) WHERE r.id IN $ids DELETE r RETURN count(*) AS total",
                Map.of("ids", List.copyOf(ids))));
    }

    @Override
    public Optional<Instant> oldestIngestedAt() {
        return boundary("min");
    }

    @Override
    public Optional<Instant> newestIngestedAt() {
        return boundary("max");
    }

    private Optional<Instant> boundary(String aggregate) {
        List<Map<String, Object>> rows = connection.query(
                "MATCH (r:RawIntake) RETURN " + aggregate + "(r.ingestedAt) AS value", Map.of());
        if (rows.isEmpty() || rows.get(0).get("value") == null) {
            return Optional.empty();
        }
        return Optional.of(Instant.ofEpochMilli(((Number) rows.get(0).get("value")).longValue()));
    }

    private static long total(List<Map<String, Object>> rows) {
        if (rows.isEmpty() || rows.get(0).get("total") == null) {
            return 0;
        }
        return ((Number) rows.get(0).get("total")).longValue();
    }
}
