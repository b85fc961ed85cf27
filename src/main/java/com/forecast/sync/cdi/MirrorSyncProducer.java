package com.forecast.sync.cdi;

import com.forecast.sync.api.MirrorSyncEngine;
import com.forecast.sync.archival.ArchivalConfig;
import com.forecast.sync.retention.RetentionPolicy;
import com.forecast.sync.schedule.JobScheduler;
import com.forecast.sync.schedule.ScheduledJobs;
import com.forecast.sync.schedule.SchedulerConfig;
import com.forecast.sync.sync.HttpExternalSystemClient;
import com.forecast.sync.sync.SyncConfig;
import com.forecast.sync.validation.ForecastValidationGate;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * CDI producer that wires the sync engine from MicroProfile Config properties.
 *
 * <pre>
 * mirror-sync:
 *   falkordb:
 *     host: localhost
 *     port: 6379
 *     graph-name: forecast
 *   external:
 *     base-url: https://pems.example.com/api
 *   archival:
 *     enabled: true
 *     type: filesystem
 *     directory: /var/lib/forecast/archive
 * </pre>
 */
@ApplicationScoped
public class MirrorSyncProducer {

    private static final Logger log = LoggerFactory.getLogger(MirrorSyncProducer.class);

    // ── FalkorDB ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "mirror-sync.falkordb.host", defaultValue = "localhost")
    String falkordbHost;

    @Inject
    @ConfigProperty(name = "mirror-sync.falkordb.port", defaultValue = "6379")
    int falkordbPort;

    @Inject
    @ConfigProperty(name = "mirror-sync.falkordb.graph-name", defaultValue = "forecast-mirror")
    String falkordbGraphName;

    // ── External system ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "mirror-sync.external.base-url")
    String externalBaseUrl;

    @Inject
    @ConfigProperty(name = "mirror-sync.external.api-token")
    Optional<String> externalApiToken;

    @Inject
    @ConfigProperty(name = "mirror-sync.external.timeout-seconds", defaultValue = "30")
    int externalTimeoutSeconds;

    // ── Write-back sync ───────────────────────────────────────

    @Inject
    @ConfigProperty(name = "mirror-sync.sync.batch-size", defaultValue = "100")
    int syncBatchSize;

    @Inject
    @ConfigProperty(name = "mirror-sync.sync.max-attempts", defaultValue = "3")
    int syncMaxAttempts;

    @Inject
    @ConfigProperty(name = "mirror-sync.sync.backoff-base-ms", defaultValue = "5000")
    long syncBackoffBaseMs;

    @Inject
    @ConfigProperty(name = "mirror-sync.sync.backoff-max-ms", defaultValue = "300000")
    long syncBackoffMaxMs;

    @Inject
    @ConfigProperty(name = "mirror-sync.sync.rate-limit-per-second", defaultValue = "10")
    double syncRateLimit;

    @Inject
    @ConfigProperty(name = "mirror-sync.sync.cycle-timeout-seconds", defaultValue = "300")
    int syncCycleTimeoutSeconds;

    // ── Retention and archival ────────────────────────────────

    @Inject
    @ConfigProperty(name = "mirror-sync.retention.days", defaultValue = "90")
    int retentionDays;

    @Inject
    @ConfigProperty(name = "mirror-sync.retention.batch-size", defaultValue = "1000")
    int retentionBatchSize;

    @Inject
    @ConfigProperty(name = "mirror-sync.retention.dry-run", defaultValue = "false")
    boolean retentionDryRun;

    @Inject
    @ConfigProperty(name = "mirror-sync.archival.enabled", defaultValue = "false")
    boolean archivalEnabled;

    @Inject
    @ConfigProperty(name = "mirror-sync.archival.type", defaultValue = "filesystem")
    String archivalType;

    @Inject
    @ConfigProperty(name = "mirror-sync.archival.directory", defaultValue = "./archives/bronze")
    String archivalDirectory;

    // ── Scheduler ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "mirror-sync.schedule.sync-enabled", defaultValue = "true")
    boolean syncJobEnabled;

    @Inject
    @ConfigProperty(name = "mirror-sync.schedule.sync-interval-seconds", defaultValue = "60")
    long syncIntervalSeconds;

    @Inject
    @ConfigProperty(name = "mirror-sync.schedule.retention-enabled", defaultValue = "true")
    boolean retentionJobEnabled;

    @Inject
    @ConfigProperty(name = "mirror-sync.schedule.retention-interval-hours", defaultValue = "24")
    long retentionIntervalHours;

    private final JobScheduler scheduler = new JobScheduler();

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public MirrorSyncEngine mirrorSyncEngine() {
        log.info("Producing MirrorSyncEngine: falkordb={}:{}/{} external={}",
                falkordbHost, falkordbPort, falkordbGraphName, externalBaseUrl);

        HttpExternalSystemClient.Builder client = HttpExternalSystemClient.builder()
                .baseUrl(externalBaseUrl)
                .timeout(Duration.ofSeconds(externalTimeoutSeconds));
        externalApiToken.ifPresent(client::apiToken);

        MirrorSyncEngine.Builder builder = MirrorSyncEngine.builder()
                .falkorDB(falkordbHost, falkordbPort, falkordbGraphName)
                .externalSystemClient(client.build())
                .validationGate(new ForecastValidationGate())
                .syncConfig(syncConfig())
                .retentionPolicy(retentionPolicy());

        if (archivalEnabled) {
            builder.archivalConfig(new ArchivalConfig(ArchivalConfig.Type.fromName(archivalType),
                    Path.of(archivalDirectory)));
            log.info("Archival enabled: type={} directory={}", archivalType, archivalDirectory);
        } else {
            log.info("Archival disabled");
        }
        return builder.build();
    }

    public void closeEngine(@Disposes MirrorSyncEngine engine) {
        log.info("Closing MirrorSyncEngine");
        engine.close();
    }

    @Produces
    @ApplicationScoped
    public ScheduledJobs scheduledJobs(MirrorSyncEngine engine) {
        SchedulerConfig config = SchedulerConfig.builder()
                .syncEnabled(syncJobEnabled)
                .syncInterval(Duration.ofSeconds(syncIntervalSeconds))
                .retentionEnabled(retentionJobEnabled)
                .retentionInterval(Duration.ofHours(retentionIntervalHours))
                .build();
        return engine.start(scheduler, config);
    }

    public void stopJobs(@Disposes ScheduledJobs jobs) {
        log.info("Stopping scheduled jobs");
        scheduler.stop(jobs);
    }

    // ══════════════════════════════════════════════════════════
    //  Internal
    // ══════════════════════════════════════════════════════════

    SyncConfig syncConfig() {
        return SyncConfig.builder()
                .batchSize(syncBatchSize)
                .maxAttempts(syncMaxAttempts)
                .backoffBase(Duration.ofMillis(syncBackoffBaseMs))
                .backoffMax(Duration.ofMillis(syncBackoffMaxMs))
                .requestsPerSecond(syncRateLimit)
                .cycleTimeout(Duration.ofSeconds(syncCycleTimeoutSeconds))
                .build();
    }

    RetentionPolicy retentionPolicy() {
        return RetentionPolicy.builder()
                .retentionDays(retentionDays)
                .batchSize(retentionBatchSize)
                .archivalEnabled(archivalEnabled)
                .dryRun(retentionDryRun)
                .build();
    }
}
