package com.raredisease.prioritization.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. Puts key-value pairs on the SLF4J MDC and removes
 * them again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forRun("ORPHA:558", "prevalence")) {
 *     log.info("run.recorded run={} status={}", runNumber, status);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forRun(String entityId, String criterion) {
        LogContext ctx = new LogContext();
        ctx.put("entityId", entityId);
        ctx.put("criterion", criterion);
        ctx.put("operation", "run");
        return ctx;
    }

    public static LogContext forCuration(String entityId, String criterion) {
        LogContext ctx = new LogContext();
        ctx.put("entityId", entityId);
        ctx.put("criterion", criterion);
        ctx.put("operation", "curate");
        return ctx;
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "batch");
        return ctx;
    }

    public static String generateBatchId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds one more key-value pair to this context.
     */
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
