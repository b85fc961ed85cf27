package com.forecast.sync.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable wrapper around the SLF4J MDC. Keys added through a context are removed when it
 * closes.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSyncCycle(batchId)) {
 *     log.info("sync.cycleStarted claimed={}", claimed.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forSyncCycle(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("syncBatchId", batchId);
        ctx.put("operation", "sync");
        return ctx;
    }

    public static LogContext forModification(String modificationId, String entityId) {
        LogContext ctx = new LogContext();
        ctx.put("modificationId", modificationId);
        ctx.put("entityId", entityId);
        return ctx;
    }

    public static LogContext forRetention(String runId) {
        LogContext ctx = new LogContext();
        ctx.put("retentionRunId", runId);
        ctx.put("operation", "retention");
        return ctx;
    }

    public static LogContext forDrafts(String organizationId, String userId, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("organizationId", organizationId);
        ctx.put("userId", userId);
        ctx.put("operation", operation);
        return ctx;
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
