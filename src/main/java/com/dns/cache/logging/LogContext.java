package com.dns.cache.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and automatically removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forSweep("resolver-cache")) {
 *     log.info("cache.sweep.completed removed={}", removed);
 * } // MDC entries are automatically cleared
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for an expiry sweep run.
     */
    public static LogContext forSweep(String cacheName) {
        LogContext ctx = new LogContext();
        ctx.put("cacheName", cacheName);
        ctx.put("sweepId", UUID.randomUUID().toString());
        ctx.put("operation", "sweep");
        return ctx;
    }

    /**
     * Creates a log context for cache lifecycle events (creation, teardown).
     */
    public static LogContext forLifecycle(String cacheName, String operation) {
        LogContext ctx = new LogContext();
        ctx.put("cacheName", cacheName);
        ctx.put("operation", operation);
        return ctx;
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
