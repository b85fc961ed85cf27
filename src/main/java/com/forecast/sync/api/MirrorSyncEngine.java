package com.forecast.sync.api;

import com.forecast.sync.archival.ArchivalBackend;
import com.forecast.sync.archival.ArchivalBackendFactory;
import com.forecast.sync.archival.ArchivalConfig;
import com.forecast.sync.audit.AuditRepository;
import com.forecast.sync.audit.AuditService;
import com.forecast.sync.conflict.ConflictRepository;
import com.forecast.sync.conflict.ConflictResolutionService;
import com.forecast.sync.conflict.GraphConflictRepository;
import com.forecast.sync.conflict.InMemoryConflictRepository;
import com.forecast.sync.delta.DeltaLifecycleService;
import com.forecast.sync.delta.GraphModificationRepository;
import com.forecast.sync.delta.InMemoryModificationRepository;
import com.forecast.sync.delta.ModificationRepository;
import com.forecast.sync.delta.UserDirectory;
import com.forecast.sync.graph.FalkorDBConnection;
import com.forecast.sync.graph.GraphConnection;
import com.forecast.sync.health.ArchivalHealthCheck;
import com.forecast.sync.health.GraphConnectionHealthCheck;
import com.forecast.sync.health.HealthCheckRegistry;
import com.forecast.sync.health.HealthStatus;
import com.forecast.sync.health.SyncBacklogHealthCheck;
import com.forecast.sync.lock.DistributedLock;
import com.forecast.sync.lock.LocalDistributedLock;
import com.forecast.sync.metrics.MetricsService;
import com.forecast.sync.metrics.NoOpMetricsService;
import com.forecast.sync.mirror.CountCacheConfig;
import com.forecast.sync.mirror.CountCachingMirrorStore;
import com.forecast.sync.mirror.GraphMirrorStore;
import com.forecast.sync.mirror.InMemoryMirrorStore;
import com.forecast.sync.mirror.MirrorStore;
import com.forecast.sync.retention.GraphRawIntakeStore;
import com.forecast.sync.retention.InMemoryRawIntakeStore;
import com.forecast.sync.retention.RawIntakeStore;
import com.forecast.sync.retention.RetentionPolicy;
import com.forecast.sync.retention.RetentionResult;
import com.forecast.sync.retention.RetentionService;
import com.forecast.sync.schedule.JobScheduler;
import com.forecast.sync.schedule.ScheduledJobs;
import com.forecast.sync.schedule.SchedulerConfig;
import com.forecast.sync.sync.ExternalSystemClient;
import com.forecast.sync.sync.SyncConfig;
import com.forecast.sync.sync.SyncCycleResult;
import com.forecast.sync.sync.SyncStatusService;
import com.forecast.sync.sync.WriteBackSyncWorker;
import com.forecast.sync.validation.ValidationGate;
import com.forecast.sync.view.MergedViewService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Entry point of the mirror-delta sync engine. Wires the stores, the lifecycle services, the
 * write-back worker and the retention job from one builder.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * MirrorSyncEngine engine = MirrorSyncEngine.builder()
 *     .falkorDB("localhost", 6379, "forecast")
 *     .externalSystemClient(HttpExternalSystemClient.builder().baseUrl(url).build())
 *     .validationGate(new ForecastValidationGate())
 *     .build();
 *
 * engine.drafts().saveDraft(org, user, "PFA-1", Document.of(Map.of("monthlyRate", 150)), null, null);
 * engine.drafts().commitDrafts(org, user, null, null);
 *
 * ScheduledJobs jobs = engine.start(scheduler, SchedulerConfig.defaults());
 * ...
 * scheduler.stop(jobs);
 * engine.close();
 * </pre>
 *
 * <p>Without a graph connection every store is in memory.</p>
 */
public class MirrorSyncEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MirrorSyncEngine.class);

    private final GraphConnection connection;
    private final boolean ownsConnection;
    private final MirrorStore mirrorStore;
    private final ModificationRepository modificationRepository;
    private final ConflictRepository conflictRepository;
    private final RawIntakeStore rawIntakeStore;
    private final AuditService auditService;
    private final MergedViewService mergedViewService;
    private final DeltaLifecycleService deltaLifecycleService;
    private final WriteBackSyncWorker syncWorker;
    private final ConflictResolutionService conflictResolutionService;
    private final SyncStatusService syncStatusService;
    private final RetentionService retentionService;
    private final HealthCheckRegistry healthCheckRegistry = new HealthCheckRegistry();

    private MirrorSyncEngine(Builder builder) {
        this.connection = builder.connection;
        this.ownsConnection = builder.ownsConnection;
        Clock clock = builder.clock;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : NoOpMetricsService.INSTANCE;
        DistributedLock lock = builder.distributedLock != null
                ? builder.distributedLock : new LocalDistributedLock();
        ValidationGate validationGate = builder.validationGate != null
                ? builder.validationGate : ValidationGate.acceptAll();
        UserDirectory userDirectory = builder.userDirectory != null
                ? builder.userDirectory : UserDirectory.anonymous();

        if (builder.auditService != null) {
            this.auditService = builder.auditService;
        } else if (builder.auditRepository != null) {
            this.auditService = new AuditService(builder.auditRepository);
        } else {
            this.auditService = new AuditService();
        }

        if (connection != null && builder.createIndexes) {
            connection.createIndexes();
        }

        MirrorStore baseMirrorStore = builder.mirrorStore != null ? builder.mirrorStore
                : connection != null ? new GraphMirrorStore(connection, clock) : new InMemoryMirrorStore(clock);
        this.mirrorStore = builder.countCacheConfig.enabled()
                ? new CountCachingMirrorStore(baseMirrorStore, builder.countCacheConfig) : baseMirrorStore;
        this.modificationRepository = builder.modificationRepository != null ? builder.modificationRepository
                : connection != null ? new GraphModificationRepository(connection) : new InMemoryModificationRepository();
        this.conflictRepository = builder.conflictRepository != null ? builder.conflictRepository
                : connection != null ? new GraphConflictRepository(connection) : new InMemoryConflictRepository();
        this.rawIntakeStore = builder.rawIntakeStore != null ? builder.rawIntakeStore
                : connection != null ? new GraphRawIntakeStore(connection) : new InMemoryRawIntakeStore();

        ArchivalBackend archivalBackend = builder.archivalBackend;
        if (archivalBackend == null && builder.archivalConfig != null) {
            archivalBackend = ArchivalBackendFactory.create(builder.archivalConfig);
        }

        this.mergedViewService = new MergedViewService(mirrorStore, modificationRepository);
        this.deltaLifecycleService = new DeltaLifecycleService(mirrorStore, modificationRepository,
                validationGate, lock, userDirectory, auditService, metricsService, clock);
        this.syncWorker = new WriteBackSyncWorker(modificationRepository, mirrorStore, conflictRepository,
                builder.externalSystemClient, builder.syncConfig, auditService, metricsService, clock);
        this.conflictResolutionService = new ConflictResolutionService(conflictRepository,
                modificationRepository, mirrorStore, validationGate, lock, auditService, clock);
        this.syncStatusService = new SyncStatusService(modificationRepository, auditService, clock);
        this.retentionService = new RetentionService(rawIntakeStore, archivalBackend, builder.retentionPolicy,
                auditService, metricsService, clock);

        if (connection != null) {
            healthCheckRegistry.register(new GraphConnectionHealthCheck(connection));
        }
        if (archivalBackend != null) {
            healthCheckRegistry.register(new ArchivalHealthCheck(archivalBackend));
        }
        for (String organizationId : builder.monitoredOrganizations) {
            healthCheckRegistry.register(new SyncBacklogHealthCheck(syncStatusService, organizationId));
        }

        log.info("engine.created storage={} archival={} syncBatchSize={} retentionDays={}",
                connection != null ? "graph:" + connection.getGraphName() : "memory",
                archivalBackend != null ? archivalBackend.getClass().getSimpleName() : "none",
                builder.syncConfig.batchSize(), builder.retentionPolicy.retentionDays());
    }

    // ========== Components ==========

    public MergedViewService views() {
        return mergedViewService;
    }

    public DeltaLifecycleService drafts() {
        return deltaLifecycleService;
    }

    public WriteBackSyncWorker syncWorker() {
        return syncWorker;
    }

    public ConflictResolutionService conflicts() {
        return conflictResolutionService;
    }

    public SyncStatusService syncStatus() {
        return syncStatusService;
    }

    public RetentionService retention() {
        return retentionService;
    }

    public AuditService auditService() {
        return auditService;
    }

    /**
     * Mirror rows are promoted from intake by the ingestion pipeline through this store.
     */
    public MirrorStore mirrorStore() {
        return mirrorStore;
    }

    public ModificationRepository modificationRepository() {
        return modificationRepository;
    }

    public RawIntakeStore rawIntakeStore() {
        return rawIntakeStore;
    }

    // ========== Jobs ==========

    public SyncCycleResult runSyncCycle() {
        return syncWorker.runSyncCycle();
    }

    public RetentionResult runRetentionJob() {
        return retentionService.prune();
    }

    /**
     * Schedules both jobs. Stop them with {@link JobScheduler#stop(ScheduledJobs)}.
     */
    public ScheduledJobs start(JobScheduler scheduler, SchedulerConfig config) {
        return scheduler.start(config, this::runSyncCycle, this::runRetentionJob);
    }

    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    @Override
    public void close() {
        syncWorker.close();
        if (ownsConnection && connection != null) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                log.warn("engine.closeFailed graph={}", connection.getGraphName(), e);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private GraphConnection connection;
        private boolean ownsConnection = false;
        private boolean createIndexes = true;
        private MirrorStore mirrorStore;
        private ModificationRepository modificationRepository;
        private ConflictRepository conflictRepository;
        private RawIntakeStore rawIntakeStore;
        private ExternalSystemClient externalSystemClient;
        private ValidationGate validationGate;
        private UserDirectory userDirectory;
        private DistributedLock distributedLock;
        private AuditService auditService;
        private AuditRepository auditRepository;
        private MetricsService metricsService;
        private ArchivalBackend archivalBackend;
        private ArchivalConfig archivalConfig;
        private SyncConfig syncConfig = SyncConfig.defaults();
        private RetentionPolicy retentionPolicy = RetentionPolicy.defaults();
        private CountCacheConfig countCacheConfig = CountCacheConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private final List<String> monitoredOrganizations = new ArrayList<>();

        /**
         * Uses an existing graph connection. The caller keeps ownership.
         */
        public Builder graphConnection(GraphConnection connection) {
            this.connection = connection;
            this.ownsConnection = false;
            return this;
        }

        /**
         * Opens a FalkorDB connection owned and closed by the engine.
         */
        public Builder falkorDB(String host, int port, String graphName) {
            this.connection = new FalkorDBConnection(host, port, graphName);
            this.ownsConnection = true;
            return this;
        }

        public Builder createIndexes(boolean createIndexes) {
            this.createIndexes = createIndexes;
            return this;
        }

        public Builder mirrorStore(MirrorStore mirrorStore) {
            this.mirrorStore = mirrorStore;
            return this;
        }

        public Builder modificationRepository(ModificationRepository modificationRepository) {
            this.modificationRepository = modificationRepository;
            return this;
        }

        public Builder conflictRepository(ConflictRepository conflictRepository) {
            this.conflictRepository = conflictRepository;
            return this;
        }

        public Builder rawIntakeStore(RawIntakeStore rawIntakeStore) {
            this.rawIntakeStore = rawIntakeStore;
            return this;
        }

        public Builder externalSystemClient(ExternalSystemClient client) {
            this.externalSystemClient = client;
            return this;
        }

        public Builder validationGate(ValidationGate validationGate) {
            this.validationGate = validationGate;
            return this;
        }

        public Builder userDirectory(UserDirectory userDirectory) {
            this.userDirectory = userDirectory;
            return this;
        }

        public Builder distributedLock(DistributedLock lock) {
            this.distributedLock = lock;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder auditRepository(AuditRepository auditRepository) {
            this.auditRepository = auditRepository;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder archivalBackend(ArchivalBackend archivalBackend) {
            this.archivalBackend = archivalBackend;
            return this;
        }

        public Builder archivalConfig(ArchivalConfig archivalConfig) {
            this.archivalConfig = archivalConfig;
            return this;
        }

        public Builder syncConfig(SyncConfig syncConfig) {
            this.syncConfig = Objects.requireNonNull(syncConfig);
            return this;
        }

        public Builder retentionPolicy(RetentionPolicy retentionPolicy) {
            this.retentionPolicy = Objects.requireNonNull(retentionPolicy);
            return this;
        }

        public Builder countCache(CountCacheConfig countCacheConfig) {
            this.countCacheConfig = Objects.requireNonNull(countCacheConfig);
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock);
            return this;
        }

        /**
         * Adds a sync backlog health check per organization.
         */
        public Builder monitorOrganizations(String... organizationIds) {
            monitoredOrganizations.addAll(Arrays.asList(organizationIds));
            return this;
        }

        /**
         * @throws IllegalStateException if no external system client is set
         */
        public MirrorSyncEngine build() {
            if (externalSystemClient == null) {
                throw new IllegalStateException("externalSystemClient is required");
            }
            return new MirrorSyncEngine(this);
        }
    }
}
