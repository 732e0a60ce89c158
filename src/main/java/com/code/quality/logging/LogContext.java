package com.code.quality.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them again on close.
 *
 * <p>MDC is thread-local, so worker-pool tasks open their own context with
 * {@link #forTask(String, String, String)}:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forRun(analysisId, root.toString())) {
 *     log.info("analysis.started analysisId={} root={}", analysisId, root);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a whole analysis run.
     */
    public static LogContext forRun(String analysisId, String root) {
        LogContext ctx = new LogContext();
        ctx.put("analysisId", analysisId);
        ctx.put("root", root);
        ctx.put("operation", "analyze");
        return ctx;
    }

    /**
     * Creates a log context for a single worker-pool task.
     *
     * @param stage   {@code parse} or {@code analyze}
     * @param subject the file or analyzer unit the task works on
     */
    public static LogContext forTask(String analysisId, String stage, String subject) {
        LogContext ctx = new LogContext();
        ctx.put("analysisId", analysisId);
        ctx.put("operation", stage);
        ctx.put("subject", subject);
        return ctx;
    }

    /**
     * Creates a log context for cache maintenance.
     */
    public static LogContext forCacheMaintenance() {
        LogContext ctx = new LogContext();
        ctx.put("operation", "cache-maintenance");
        return ctx;
    }

    /**
     * Generates a unique analysis ID.
     */
    public static String generateAnalysisId() {
        return "analysis-" + UUID.randomUUID();
    }

    /**
     * Adds an additional key-value pair to this log context.
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
