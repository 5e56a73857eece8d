package com.switchyard.core.model;

/**
 * Aggregated counters for one route.
 */
public record RouteStats(
    long count,
    long successCount,
    long failureCount,
    long totalLatencyMs,
    long minLatencyMs,
    long maxLatencyMs
) {

    public static final RouteStats EMPTY = new RouteStats(0, 0, 0, 0, 0, 0);

    public long averageLatencyMs() {
        return count > 0 ? Math.round((double) totalLatencyMs / count) : 0;
    }

    public double successRate() {
        return count > 0 ? (successCount * 100.0) / count : 0.0;
    }
}
