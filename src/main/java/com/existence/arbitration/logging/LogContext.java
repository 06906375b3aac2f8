package com.existence.arbitration.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forTransition(bindingId, "user_hide")) {
 *     log.info("binding.transition from={} to={}", previous, next);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final Map<String, String> previous = new HashMap<>();

    private LogContext() {
    }

    public static LogContext forTransition(String bindingId, String cause) {
        LogContext ctx = new LogContext();
        ctx.put("bindingId", bindingId);
        ctx.put("cause", cause);
        ctx.put("operation", "transition");
        return ctx;
    }

    public static LogContext forReconciliation(String scopeId, String runId) {
        LogContext ctx = new LogContext();
        ctx.put("scopeId", scopeId);
        ctx.put("reconcileRunId", runId);
        ctx.put("operation", "reconcile");
        return ctx;
    }

    public static LogContext forArbitration(String bindingId, String userId) {
        LogContext ctx = new LogContext();
        ctx.put("bindingId", bindingId);
        ctx.put("arbiterId", userId);
        ctx.put("operation", "arbitration");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (!keys.contains(key)) {
            keys.add(key);
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    /**
     * Removes the keys added by this context, restoring values an enclosing context had set.
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
