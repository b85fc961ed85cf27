package com.forecast.sync.cdi;

import com.forecast.sync.retention.RetentionPolicy;
import com.forecast.sync.sync.SyncConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MirrorSyncProducer")
class MirrorSyncProducerTest {

    private MirrorSyncProducer producer;

    @BeforeEach
    void setUp() {
        producer = new MirrorSyncProducer();
        producer.syncBatchSize = 100;
        producer.syncMaxAttempts = 3;
        producer.syncBackoffBaseMs = 5000;
        producer.syncBackoffMaxMs = 300000;
        producer.syncRateLimit = 10;
        producer.syncCycleTimeoutSeconds = 300;
        producer.retentionDays = 90;
        producer.retentionBatchSize = 1000;
        producer.retentionDryRun = false;
        producer.archivalEnabled = false;
    }

    @Test
    @DisplayName("Sync properties map onto SyncConfig")
    void syncConfigFromProperties() {
        producer.syncBatchSize = 25;
        producer.syncMaxAttempts = 5;
        producer.syncBackoffBaseMs = 1000;
        producer.syncBackoffMaxMs = 60000;

        SyncConfig config = producer.syncConfig();

        assertEquals(25, config.batchSize());
        assertEquals(5, config.maxAttempts());
        assertEquals(Duration.ofSeconds(1), config.backoff().baseDelay());
        assertEquals(Duration.ofMinutes(1), config.backoff().maxDelay());
        assertEquals(10.0, config.requestsPerSecond());
        assertEquals(Duration.ofMinutes(5), config.cycleTimeout());
    }

    @Test
    @DisplayName("Retention properties map onto RetentionPolicy")
    void retentionPolicyFromProperties() {
        producer.retentionDays = 30;
        producer.retentionDryRun = true;
        producer.archivalEnabled = true;

        RetentionPolicy policy = producer.retentionPolicy();

        assertEquals(30, policy.retentionDays());
        assertEquals(1000, policy.batchSize());
        assertTrue(policy.dryRun());
        assertTrue(policy.archivalEnabled());
    }

    @Test
    @DisplayName("Invalid properties are rejected when the config is built")
    void invalidPropertiesRejected() {
        producer.syncBatchSize = 0;
        assertThrows(IllegalArgumentException.class, producer::syncConfig);

        producer.retentionDays = 0;
        assertThrows(IllegalArgumentException.class, producer::retentionPolicy);
    }
}
