package com.forecast.sync.mirror;

import com.forecast.sync.api.PageRequest;
import com.forecast.sync.core.NotFoundException;
import com.forecast.sync.core.model.Document;
import com.forecast.sync.core.model.MirrorRecord;
import com.forecast.sync.graph.DocumentCodec;
import com.forecast.sync.graph.GraphConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Mirror store backed by {@code :Mirror} nodes. Documents are stored as JSON; each
 * {@link IndexedField} is copied to its own property so filters can be evaluated by the database.
 */
public class GraphMirrorStore implements MirrorStore {
    private static final Logger log = LoggerFactory.getLogger(GraphMirrorStore.class);

    private static final String RETURN_MIRROR = """
            RETURN m.id AS id, m.organizationId AS organizationId, m.entityId AS entityId,
                   m.document AS document, m.version AS version, m.updatedAt AS updatedAt
            """;

    private final GraphConnection connection;
    private final Clock clock;

    public GraphMirrorStore(GraphConnection connection) {
        this(connection, Clock.systemUTC());
    }

    public GraphMirrorStore(GraphConnection connection, Clock clock) {
        this.connection = connection;
        this.clock = clock;
    }

    @Override
    public Optional<MirrorRecord> findById(String mirrorId) {
        return single(connection.query("MATCH (m:Mirror {id: $id}) " + RETURN_MIRROR, Map.of("id", mirrorId)));
    }

    @Override
    public Optional<MirrorRecord> findByEntity(String organizationId, String entityId) {
        return single(connection.query(
                "MATCH (m:Mirror {organizationId: $organizationId, entityId: $entityId}) " + RETURN_MIRROR,
                Map.of("organizationId", organizationId, "entityId", entityId)));
    }

    @Override
    public List<MirrorRecord> findByEntityIds(String organizationId, Collection<String> entityIds) {
        if (entityIds.isEmpty()) {
            return List.of();
        }
        return connection.query("""
                        MATCH (m:Mirror {organizationId: $organizationId})
                        WHERE m.entityId IN $entityIds
                        """ + RETURN_MIRROR + " ORDER BY entityId",
                Map.of("organizationId", organizationId, "entityIds", List.copyOf(entityIds)))
                .stream().map(GraphMirrorStore::toMirror).toList();
    }

    @Override
    public MirrorRecord promote(String organizationId, String entityId, Document document) {
        Map<String, Object> params = documentParams(document);
        params.put("organizationId", organizationId);
        params.put("entityId", entityId);
        params.put("id", UUID.randomUUID().toString());
        List<Map<String, Object>> rows = connection.query("""
                MERGE (m:Mirror {organizationId: $organizationId, entityId: $entityId})
                ON CREATE SET m.id = $id, m.version = 1
                ON MATCH SET m.version = m.version + 1
                SET m.document = $document, m.updatedAt = $updatedAt,
                """ + indexedAssignments() + " " + RETURN_MIRROR, params);
        MirrorRecord promoted = single(rows).orElseThrow(() ->
                new IllegalStateException("Promotion returned no row for entity " + entityId));
        log.debug("mirror.promoted entityId={} version={}", entityId, promoted.version());
        return promoted;
    }

    @Override
    public MirrorRecord applyWriteBack(String mirrorId, Document confirmed, long remoteVersion) {
        Map<String, Object> params = documentParams(confirmed);
        params.put("id", mirrorId);
        params.put("remoteVersion", remoteVersion);
        List<Map<String, Object>> rows = connection.query("""
                MATCH (m:Mirror {id: $id})
                SET m.version = CASE WHEN m.version + 1 > $remoteVersion THEN m.version + 1 ELSE $remoteVersion END,
                    m.document = $document, m.updatedAt = $updatedAt,
                """ + indexedAssignments() + " " + RETURN_MIRROR, params);
        return single(rows).orElseThrow(() -> new NotFoundException("Mirror", mirrorId));
    }

    @Override
    public List<MirrorRecord> query(String organizationId, MirrorFilter filter, PageRequest page) {
        Predicate predicate = Predicate.of(organizationId, filter);
        Map<String, Object> params = new HashMap<>(predicate.params());
        params.put("offset", page.offset());
        params.put("limit", page.limit());
        return connection.query("MATCH (m:Mirror) WHERE " + predicate.clause() + " "
                        + RETURN_MIRROR + " ORDER BY entityId SKIP $offset LIMIT $limit", params)
                .stream().map(GraphMirrorStore::toMirror).toList();
    }

    @Override
    public long count(String organizationId, MirrorFilter filter) {
        Predicate predicate = Predicate.of(organizationId, filter);
        List<Map<String, Object>> rows = connection.query(
                "MATCH (m:Mirror) WHERE " + predicate.clause() + " RETURN count(m) AS total",
                predicate.params());
        if (rows.isEmpty()) {
            return 0;
        }
        return ((Number) rows.get(0).get("total")).longValue();
    }

    private Map<String, Object> documentParams(Document document) {
        Map<String, Object> params = new HashMap<>();
        params.put("document", DocumentCodec.encode(document));
        params.put("updatedAt", clock.millis());
        for (IndexedField field : IndexedField.values()) {
            params.put(field.property(), field.textOf(document));
        }
        return params;
    }

    private static String indexedAssignments() {
        List<String> assignments = new ArrayList<>();
        for (IndexedField field : IndexedField.values()) {
            assignments.add("m." + field.property() + " = $" + field.property());
        }
        return String.join(", ", assignments);
    }

    private static Optional<MirrorRecord> single(List<Map<String, Object>> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(toMirror(rows.get(0)));
    }

    static MirrorRecord toMirror(Map<String, Object> row) {
        return new MirrorRecord(
                (String) row.get("id"),
                (String) row.get("organizationId"),
                (String) row.get("entityId"),
                DocumentCodec.decode((String) row.get("document")),
                ((Number) row.get("version")).longValue(),
                Instant.ofEpochMilli(((Number) row.get("updatedAt")).longValue()));
    }

    /**
     * WHERE clause over alias {@code m} with every value bound as a parameter. Property names
     * come from {@link IndexedField} only.
     */
    record Predicate(String clause, Map<String, Object> params) {

        static Predicate of(String organizationId, MirrorFilter filter) {
            StringBuilder clause = new StringBuilder("m.organizationId = $organizationId");
            Map<String, Object> params = new HashMap<>();
            params.put("organizationId", organizationId);
            filter.exactMatches().forEach((field, value) -> {
                clause.append(" AND m.").append(field.property()).append(" = $").append(field.property());
                params.put(field.property(), value);
            });
            if (filter.search() != null) {
                clause.append(" AND (toLower(m.entityId) CONTAINS $search");
                for (IndexedField field : IndexedField.values()) {
                    if (field.searchable()) {
                        clause.append(" OR toLower(m.").append(field.property()).append(") CONTAINS $search");
                    }
                }
                clause.append(")");
                params.put("search", filter.search());
            }
            return new Predicate(clause.toString(), params);
        }
    }
}
