package com.roster.matching.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * MDC scope for structured log lines, removed again on close.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forResolution(correlationId, "APTA_CHICAGO")) {
 *     log.info("player.resolved playerId={} tier={}", playerId, tier);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Scope for a single player resolution.
     */
    public static LogContext forResolution(String correlationId, String leagueId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("leagueId", leagueId);
        ctx.put("operation", "resolve");
        return ctx;
    }

    /**
     * Scope for a registration-correction lookup.
     */
    public static LogContext forSuggestion(String correlationId, String leagueId) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("leagueId", leagueId);
        ctx.put("operation", "suggest");
        return ctx;
    }

    /**
     * Scope for loading a directory snapshot.
     */
    public static LogContext forSnapshotLoad(String source) {
        LogContext ctx = new LogContext();
        ctx.put("snapshotSource", source);
        ctx.put("operation", "load");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    /**
     * Adds another key to this scope.
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
