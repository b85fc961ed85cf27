package com.forecast.sync.delta;

import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.graph.DocumentCodec;
import com.forecast.sync.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Modification repository backed by {@code :Modification} nodes. Each state transition is a
 * single statement, so the database serializes competing claims and saves.
 */
public class GraphModificationRepository implements ModificationRepository {
    private static final Logger log = LoggerFactory.getLogger(GraphModificationRepository.class);

    private static final List<String> ACTIVE_STATES = List.of(
            SyncState.DRAFT.code(), SyncState.COMMITTED.code(), SyncState.SYNCING.code());

    /** Properties written on insert and replace, in column order. */
    private static final List<String> PROPERTIES = List.of(
            "id", "mirrorId", "organizationId", "entityId", "userId", "delta", "modifiedFields",
            "sessionId", "changeReason", "baseVersion", "editCount", "syncState", "createdAt",
            "updatedAt", "committedAt", "attemptCount", "nextAttemptAt", "lastError");

    private static final String RETURN_ROW = "RETURN " + PROPERTIES.stream()
            .map(p -> "d." + p + " AS " + p)
            .collect(Collectors.joining(", "));

    private final GraphConnection connection;

    public GraphModificationRepository(GraphConnection connection) {
        this.connection = connection;
    }

    @Override
    public Optional<Modification> findById(String id) {
        return single(connection.query("MATCH (d:Modification {id: $id}) " + RETURN_ROW, Map.of("id", id)));
    }

    @Override
    public Optional<Modification> findActive(String mirrorId, String userId) {
        return single(connection.query("""
                        MATCH (d:Modification {mirrorId: $mirrorId, userId: $userId})
                        WHERE d.syncState IN $activeStates
                        """ + RETURN_ROW,
                Map.of("mirrorId", mirrorId, "userId", userId, "activeStates", ACTIVE_STATES)));
    }

    @Override
    public Map<String, Modification> findActiveByMirrors(Collection<String> mirrorIds, String userId) {
        if (mirrorIds.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> params = new HashMap<>();
        params.put("mirrorIds", List.copyOf(mirrorIds));
        params.put("activeStates", ACTIVE_STATES);
        String userClause = "";
        if (userId != null) {
            params.put("userId", userId);
            userClause = " AND d.userId = $userId";
        }
        List<Map<String, Object>> rows = connection.query(
                "MATCH (d:Modification) WHERE d.mirrorId IN $mirrorIds AND d.syncState IN $activeStates"
                        + userClause + " " + RETURN_ROW + " ORDER BY updatedAt DESC", params);
        Map<String, Modification> active = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            Modification m = toModification(row);
            active.putIfAbsent(m.getMirrorId(), m);
        }
        return active;
    }

    @Override
    public Modification insert(Modification modification) {
        Map<String, Object> params = toParams(modification);
        params.put("activeStates", ACTIVE_STATES);
        params.put("checkActive", modification.isActive());
        List<Map<String, Object>> rows = connection.query("""
                OPTIONAL MATCH (existing:Modification {mirrorId: $mirrorId, userId: $userId})
                WHERE existing.syncState IN $activeStates
                WITH count(existing) AS active
                WHERE active = 0 OR NOT $checkActive
                CREATE (d:Modification {""" + propertyMap() + "}) RETURN d.id AS id", params);
        if (rows.isEmpty()) {
            throw new IllegalStateException("An active modification already exists for mirror "
                    + modification.getMirrorId() + " and user " + modification.getUserId());
        }
        return modification;
    }

    @Override
    public boolean compareAndSet(Modification expected, Modification updated) {
        Map<String, Object> params = toParams(updated);
        params.put("expectedState", expected.getSyncState().code());
        params.put("expectedEditCount", expected.getEditCount());
        params.put("expectedAttemptCount", expected.getAttemptCount());
        List<Map<String, Object>> rows = connection.query("""
                MATCH (d:Modification {id: $id})
                WHERE d.syncState = $expectedState AND d.editCount = $expectedEditCount
                  AND d.attemptCount = $expectedAttemptCount
                SET\s""" + assignments() + " RETURN d.id AS id", params);
        return !rows.isEmpty();
    }

    @Override
    public List<Modification> findDrafts(DraftSelector selector) {
        Map<String, Object> params = new HashMap<>();
        String where = draftClause(selector, params);
        return connection.query("MATCH (d:Modification) WHERE " + where + " " + RETURN_ROW
                        + " ORDER BY updatedAt DESC", params)
                .stream().map(GraphModificationRepository::toModification).toList();
    }

    @Override
    public int commitDrafts(DraftSelector selector, Instant committedAt) {
        Map<String, Object> params = new HashMap<>();
        String where = draftClause(selector, params);
        params.put("committedState", SyncState.COMMITTED.code());
        params.put("now", committedAt.toEpochMilli());
        List<Map<String, Object>> rows = connection.query("MATCH (d:Modification) WHERE " + where
                + " SET d.syncState = $committedState, d.committedAt = $now, d.updatedAt = $now"
                + " RETURN count(d) AS total", params);
        return total(rows);
    }

    @Override
    public int deleteDrafts(DraftSelector selector) {
        Map<String, Object> params = new HashMap<>();
        String where = draftClause(selector, params);
        List<Map<String, Object>> rows = connection.query("MATCH (d:Modification) WHERE " + where
                + " DELETE d RETURN count(*) AS total", params);
        return total(rows);
    }

    @Override
    public long countDrafts(String organizationId, String userId) {
        Map<String, Object> params = new HashMap<>();
        String where = draftClause(DraftSelector.allDrafts(organizationId, userId), params);
        return total(connection.query("MATCH (d:Modification) WHERE " + where + " RETURN count(d) AS total", params));
    }

    @Override
    public List<Modification> findByEntity(String organizationId, String entityId) {
        return connection.query("MATCH (d:Modification {organizationId: $organizationId, entityId: $entityId}) "
                                + RETURN_ROW + " ORDER BY updatedAt DESC",
                        Map.of("organizationId", organizationId, "entityId", entityId))
                .stream().map(GraphModificationRepository::toModification).toList();
    }

    @Override
    public List<Modification> claimDue(int limit, Instant now) {
        List<Map<String, Object>> rows = connection.query("""
                        MATCH (d:Modification)
                        WHERE d.syncState = $committedState
                          AND (d.nextAttemptAt IS NULL OR d.nextAttemptAt <= $now)
                        WITH d ORDER BY d.committedAt ASC, d.id ASC LIMIT $limit
                        SET d.syncState = $syncingState, d.updatedAt = $now
                        """ + RETURN_ROW,
                Map.of("committedState", SyncState.COMMITTED.code(),
                        "syncingState", SyncState.SYNCING.code(),
                        "now", now.toEpochMilli(),
                        "limit", limit));
        log.debug("modification.claimed count={}", rows.size());
        return rows.stream().map(GraphModificationRepository::toModification).toList();
    }

    @Override
    public List<Modification> findByState(String organizationId, SyncState state) {
        return connection.query("MATCH (d:Modification {organizationId: $organizationId, syncState: $state}) "
                                + RETURN_ROW + " ORDER BY updatedAt DESC",
                        Map.of("organizationId", organizationId, "state", state.code()))
                .stream().map(GraphModificationRepository::toModification).toList();
    }

    @Override
    public Map<SyncState, Long> countByState(String organizationId) {
        Map<SyncState, Long> counts = new EnumMap<>(SyncState.class);
        for (SyncState state : SyncState.values()) {
            counts.put(state, 0L);
        }
        connection.query("MATCH (d:Modification {organizationId: $organizationId}) "
                                + "RETURN d.syncState AS state, count(d) AS total",
                        Map.of("organizationId", organizationId))
                .forEach(row -> counts.put(SyncState.fromCode((String) row.get("state")),
                        ((Number) row.get("total")).longValue()));
        return counts;
    }

    @Override
    public boolean delete(String id) {
        return total(connection.query("MATCH (d:Modification {id: $id}) DELETE d RETURN count(*) AS total",
                Map.of("id", id))) > 0;
    }

    private static String draftClause(DraftSelector selector, Map<String, Object> params) {
        StringBuilder clause = new StringBuilder(
                "d.syncState = $draftState AND d.organizationId = $organizationId AND d.userId = $userId");
        params.put("draftState", SyncState.DRAFT.code());
        params.put("organizationId", selector.organizationId());
        params.put("userId", selector.userId());
        if (selector.sessionId() != null) {
            clause.append(" AND d.sessionId = $sessionId");
            params.put("sessionId", selector.sessionId());
        }
        if (selector.mirrorIds() != null) {
            clause.append(" AND d.mirrorId IN $mirrorIds");
            params.put("mirrorIds", List.copyOf(selector.mirrorIds()));
        }
        return clause.toString();
    }

    private static String propertyMap() {
        return PROPERTIES.stream().map(p -> p + ": $" + p).collect(Collectors.joining(", "));
    }

    private static String assignments() {
        return PROPERTIES.stream().filter(p -> !p.equals("id"))
                .map(p -> "d." + p + " = $" + p)
                .collect(Collectors.joining(", "));
    }

    private static int total(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? 0 : ((Number) rows.get(0).get("total")).intValue();
    }

    static Map<String, Object> toParams(Modification m) {
        Map<String, Object> params = new HashMap<>();
        params.put("id", m.getId());
        params.put("mirrorId", m.getMirrorId());
        params.put("organizationId", m.getOrganizationId());
        params.put("entityId", m.getEntityId());
        params.put("userId", m.getUserId());
        params.put("delta", DocumentCodec.encode(m.getDelta()));
        params.put("modifiedFields", List.copyOf(m.getModifiedFields()));
        params.put("sessionId", m.getSessionId());
        params.put("changeReason", m.getChangeReason());
        params.put("baseVersion", m.getBaseVersion());
        params.put("editCount", m.getEditCount());
        params.put("syncState", m.getSyncState().code());
        params.put("createdAt", millis(m.getCreatedAt()));
        params.put("updatedAt", millis(m.getUpdatedAt()));
        params.put("committedAt", millis(m.getCommittedAt()));
        params.put("attemptCount", m.getAttemptCount());
        params.put("nextAttemptAt", millis(m.getNextAttemptAt()));
        params.put("lastError", m.getLastError());
        return params;
    }

    static Modification toModification(Map<String, Object> row) {
        Set<String> fields = new LinkedHashSet<>();
        if (row.get("modifiedFields") instanceof Collection<?> names) {
            names.forEach(name -> fields.add(String.valueOf(name)));
        }
        return Modification.builder()
                .id((String) row.get("id"))
                .mirrorId((String) row.get("mirrorId"))
                .organizationId((String) row.get("organizationId"))
                .entityId((String) row.get("entityId"))
                .userId((String) row.get("userId"))
                .delta(DocumentCodec.decode((String) row.get("delta")))
                .modifiedFields(fields)
                .sessionId((String) row.get("sessionId"))
                .changeReason((String) row.get("changeReason"))
                .baseVersion(((Number) row.get("baseVersion")).longValue())
                .editCount(((Number) row.get("editCount")).intValue())
                .syncState(SyncState.fromCode((String) row.get("syncState")))
                .createdAt(instant(row.get("createdAt")))
                .updatedAt(instant(row.get("updatedAt")))
                .committedAt(instant(row.get("committedAt")))
                .attemptCount(row.get("attemptCount") == null ? 0 : ((Number) row.get("attemptCount")).intValue())
                .nextAttemptAt(instant(row.get("nextAttemptAt")))
                .lastError((String) row.get("lastError"))
                .build();
    }

    private static Optional<Modification> single(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(toModification(rows.get(0)));
    }

    private static Long millis(Instant instant) {
        return instant == null ? null : instant.toEpochMilli();
    }

    private static Instant instant(Object value) {
        return value == null ? null : Instant.ofEpochMilli(((Number) value).longValue());
    }
}
