package com.forecast.sync.retention;

import com.forecast.sync.core.model.RawIntakeRecord;
import com.forecast.sync.testing.StubGraphConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GraphRawIntakeStore using a stub GraphConnection.
 */
class GraphRawIntakeStoreTest {

    private static final Instant CUTOFF = Instant.parse("2024-03-03T00:00:00Z");

    private StubGraphConnection connection;
    private GraphRawIntakeStore store;

    @BeforeEach
    void setUp() {
        connection = new StubGraphConnection();
        store = new GraphRawIntakeStore(connection);
    }

    @Test
    void findBatch_firstBatchHasNoKeysetClause() {
        connection.thenReturn(List.of(Map.of("id", "r-1", "organizationId", "org-1",
                "ingestedAt", 1_700_000_000_000L, "payload", "{}")));

        List<RawIntakeRecord> batch = store.findBatch(CUTOFF, null, 1000);

        assertFalse(connection.lastQuery().contains("$afterAt"));
        assertTrue(connection.lastQuery().contains("ORDER BY ingestedAt ASC, id ASC LIMIT $limit"));
        assertEquals(CUTOFF.toEpochMilli(), connection.lastParams().get("cutoff"));
        assertEquals(1000, connection.lastParams().get("limit"));
        assertEquals(Instant.ofEpochMilli(1_700_000_000_000L), batch.get(0).ingestedAt());
    }

    @Test
    void findBatch_continuesAfterTheCursor() {
        Instant last = Instant.parse("2024-01-01T00:00:00Z");

        store.findBatch(CUTOFF, new RawIntakeStore.Cursor(last, "r-9"), 500);

        assertTrue(connection.lastQuery().contains(
                "(r.ingestedAt > $afterAt OR (r.ingestedAt = $afterAt AND r.id > $afterId))"));
        assertEquals(last.toEpochMilli(), connection.lastParams().get("afterAt"));
        assertEquals("r-9", connection.lastParams().get("afterId"));
    }

    @Test
    void deleteByIds_skipsTheRoundTripForNoIds() {
        assertEquals(0, store.deleteByIds(List.of()));
        assertTrue(connection.executedQueries.isEmpty());

        connection.thenReturn(List.of(Map.of("total", 2L)));
        assertEquals(2, store.deleteByIds(List.of("r-1", "r-2")));
        assertEquals(List.of("r-1", "r-2"), connection.lastParams().get("ids"));
    }

    @Test
    void append_storesEpochMillis() {
        Instant at = Instant.parse("2024-05-01T10:00:00Z");

        store.append(new RawIntakeRecord("r-1", "org-1", at, "{\"a\":1}"));

        assertTrue(connection.lastQuery().contains("CREATE (:RawIntake"));
        assertEquals(at.toEpochMilli(), connection.lastParams().get("ingestedAt"));
    }

    @Test
    void boundaries_areEmptyForAnEmptyStore() {
        connection.queryResults = List.of(Collections.singletonMap("value", null));

        assertTrue(store.oldestIngestedAt().isEmpty());
        assertTrue(store.newestIngestedAt().isEmpty());
        assertTrue(connection.lastQuery().contains("max(r.ingestedAt)"));
    }
}
