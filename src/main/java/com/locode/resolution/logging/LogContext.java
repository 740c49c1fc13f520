package com.locode.resolution.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forQuery(correlationId, "LOCODE@US")) {
 *     log.debug("analyse.completed results={}", results.size());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for catalog queries.
     */
    public static LogContext forQuery(String correlationId, String scope) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("scope", scope);
        ctx.put("operation", "analyse");
        return ctx;
    }

    /**
     * Creates a log context for a consistency audit.
     */
    public static LogContext forConsistency(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("operation", "consistency");
        return ctx;
    }

    /**
     * Creates a log context for a catalog import.
     */
    public static LogContext forImport(String source) {
        LogContext ctx = new LogContext();
        ctx.put("source", source);
        ctx.put("operation", "import");
        return ctx;
    }

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
