package com.cloud.emulator.logging;

import com.cloud.emulator.core.model.RelationshipKind;
import com.cloud.emulator.core.model.ResourceId;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and removes them on close.
 *
 * <p>Usage with try-with-resources:</p>
 * <pre>
 * try (LogContext ctx = LogContext.forResource("unregister", id)) {
 *     log.info("resource.unregistered");
 * } // MDC entries are cleared here
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for an operation on a single resource.
     */
    public static LogContext forResource(String operation, ResourceId id) {
        LogContext ctx = new LogContext();
        ctx.put("operation", operation);
        ctx.put("resourceId", id.toString());
        return ctx;
    }

    /**
     * Creates a log context for a relationship mutation.
     */
    public static LogContext forRelationship(String operation, ResourceId from, ResourceId to,
                                             RelationshipKind kind) {
        LogContext ctx = new LogContext();
        ctx.put("operation", operation);
        ctx.put("fromResourceId", from.toString());
        ctx.put("toResourceId", to.toString());
        ctx.put("relationshipKind", kind.getLabel());
        return ctx;
    }

    /**
     * Creates a log context for an emulated API call.
     */
    public static LogContext forServiceCall(String service, String action) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", generateCorrelationId());
        ctx.put("service", service);
        ctx.put("action", action);
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
