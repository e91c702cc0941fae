package com.entity.pipeline.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forStage("extract", correlationId)) {
 *     log.info("extract.batch.committed lastEntityId={} mentions={}", lastId, written);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previous = new HashMap<>();

    private LogContext() {
    }

    /**
     * Creates a log context for a stage run.
     */
    public static LogContext forStage(String stage, String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("stage", stage);
        return ctx;
    }

    /**
     * Creates a log context for one batch of a stage run.
     */
    public static LogContext forBatch(String stage, long batchNumber) {
        LogContext ctx = new LogContext();
        ctx.put("stage", stage);
        ctx.put("batch", Long.toString(batchNumber));
        return ctx;
    }

    /**
     * Creates a log context for merge operations.
     */
    public static LogContext forMerge(String correlationId, long sourceId, long targetId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("sourceEntityId", Long.toString(sourceId));
        ctx.put("targetEntityId", Long.toString(targetId));
        ctx.put("operation", "merge");
        return ctx;
    }

    /**
     * Generates a unique correlation ID.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        String outer = MDC.get(key);
        if (outer != null && !keys.contains(key)) {
            previous.put(key, outer);
        }
        keys.add(key);
        MDC.put(key, value);
    }

    /**
     * Removes this context's entries, restoring values of an enclosing context.
     */
    @Override
    public void close() {
        for (String key : keys) {
            String outer = previous.get(key);
            if (outer != null) {
                MDC.put(key, outer);
            } else {
                MDC.remove(key);
            }
        }
        keys.clear();
        previous.clear();
    }
}
