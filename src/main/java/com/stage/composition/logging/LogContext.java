package com.stage.composition.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper: entries put here are removed again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forEdit(correlationId, "building.usda", "/World/Wall")) {
 *     log.info("edit.property.updated name={}", name);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    public static final String CORRELATION_ID = "correlationId";
    public static final String LAYER = "layer";
    public static final String PRIM_PATH = "primPath";
    public static final String OPERATION = "operation";

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Context for a text edit of one prim in one layer.
     */
    public static LogContext forEdit(String correlationId, String layer, String primPath) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(LAYER, layer);
        ctx.put(PRIM_PATH, primPath);
        ctx.put(OPERATION, "edit");
        return ctx;
    }

    /**
     * Context for a full recomposition of the stage.
     */
    public static LogContext forResolve(String correlationId) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(OPERATION, "resolve");
        return ctx;
    }

    public static LogContext forRefresh(String correlationId, String layer) {
        LogContext ctx = new LogContext();
        ctx.put(CORRELATION_ID, correlationId);
        ctx.put(LAYER, layer);
        ctx.put(OPERATION, "refresh");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
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
