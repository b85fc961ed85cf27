package com.forecast.sync.health;

import com.forecast.sync.archival.ArchivalBackend;
import com.forecast.sync.archival.DisabledArchivalBackend;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.core.model.Modification;
import com.forecast.sync.core.model.SyncState;
import com.forecast.sync.delta.InMemoryModificationRepository;
import com.forecast.sync.graph.GraphConnection;
import com.forecast.sync.sync.SyncStatusService;
import com.forecast.sync.testing.MutableClock;
import com.forecast.sync.testing.StubGraphConnection;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("Health Check Tests")
class HealthCheckTest {

    @Nested
    @DisplayName("HealthStatus")
    class HealthStatusTests {

        @Test
        @DisplayName("withDetail() keeps earlier details and the status")
        void withDetail() {
            HealthStatus status = HealthStatus.degraded("slow")
                    .withDetail("latencyMs", 42L)
                    .withDetail("graphName", "mirror");

            assertEquals(HealthStatus.Status.DEGRADED, status.status());
            assertEquals(42L, status.details().get("latencyMs"));
            assertEquals(2, status.details().size());
            assertThrows(UnsupportedOperationException.class, () -> status.details().put("x", 1));
        }
    }

    @Nested
    @DisplayName("HealthCheckRegistry")
    class RegistryTests {

        @Test
        @DisplayName("an empty registry is up")
        void emptyIsUp() {
            assertTrue(new HealthCheckRegistry().checkAll().isUp());
        }

        @Test
        @DisplayName("reports the worst status and each check by name")
        void worstWins() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(named("a", HealthStatus.up()));
            registry.register(named("b", HealthStatus.degraded("backlog growing")));
            registry.register(named("c", HealthStatus.up()));
            registry.register(null);

            HealthStatus overall = registry.checkAll();

            assertEquals(3, registry.size());
            assertEquals(HealthStatus.Status.DEGRADED, overall.status());
            assertEquals("b: backlog growing", overall.message());
            assertTrue(overall.details().containsKey("a"));
        }

        @Test
        @DisplayName("a throwing check counts as down")
        void throwingCheckIsDown() {
            HealthCheckRegistry registry = new HealthCheckRegistry();
            registry.register(new HealthCheck() {
                @Override
                public String getName() {
                    return "broken";
                }

                @Override
                public HealthStatus check() {
                    throw new IllegalStateException("boom");
                }
            });

            assertEquals(HealthStatus.Status.DOWN, registry.checkAll().status());
        }

        private HealthCheck named(String name, HealthStatus status) {
            return new HealthCheck() {
                @Override
                public String getName() {
                    return name;
                }

                @Override
                public HealthStatus check() {
                    return status;
                }
            };
        }
    }

    @Nested
    @DisplayName("GraphConnectionHealthCheck")
    class GraphTests {

        @Test
        void upWithLatency() {
            HealthStatus status = new GraphConnectionHealthCheck(new StubGraphConnection()).check();

            assertTrue(status.isUp());
            assertEquals("test-graph", status.details().get("graphName"));
            assertTrue(status.details().containsKey("latencyMs"));
        }

        @Test
        void downWhenQueryFails() {
            GraphConnection connection = mock(GraphConnection.class);
            when(connection.query(anyString())).thenThrow(new IllegalStateException("connection refused"));

            HealthStatus status = new GraphConnectionHealthCheck(connection).check();

            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertTrue(status.message().contains("connection refused"));
        }
    }

    @Nested
    @DisplayName("SyncBacklogHealthCheck")
    class BacklogTests {

        @Test
        @DisplayName("maps an unhealthy success rate to DOWN")
        void unhealthyIsDown() {
            InMemoryModificationRepository modifications = new InMemoryModificationRepository();
            insert(modifications, "1", SyncState.RETIRED);
            insert(modifications, "2", SyncState.SYNC_ERROR);
            insert(modifications, "3", SyncState.COMMITTED);
            SyncBacklogHealthCheck check = new SyncBacklogHealthCheck(
                    new SyncStatusService(modifications, new AuditService(), MutableClock.at("2024-06-01T00:00:00Z")),
                    "org-1");

            HealthStatus status = check.check();

            assertEquals("sync-backlog:org-1", check.getName());
            assertEquals(HealthStatus.Status.DOWN, status.status());
            assertEquals(1L, status.details().get("queued"));
            assertEquals(1L, status.details().get("syncErrors"));
        }

        private void insert(InMemoryModificationRepository repository, String id, SyncState state) {
            repository.insert(Modification.builder().id(id).mirrorId("m-" + id).organizationId("org-1")
                    .entityId("FC-" + id).userId("alice").syncState(state)
                    .createdAt(Instant.parse("2024-05-01T00:00:00Z")).build());
        }
    }

    @Nested
    @DisplayName("ArchivalHealthCheck")
    class ArchivalTests {

        @Test
        void delegatesToBackend() {
            ArchivalBackend backend = mock(ArchivalBackend.class);
            when(backend.healthCheck()).thenReturn(HealthStatus.down("bucket unreachable"));

            ArchivalHealthCheck check = new ArchivalHealthCheck(backend);

            assertEquals("archival", check.getName());
            assertEquals(HealthStatus.Status.DOWN, check.check().status());
            assertTrue(new ArchivalHealthCheck(new DisabledArchivalBackend()).check().isUp());
        }
    }
}
