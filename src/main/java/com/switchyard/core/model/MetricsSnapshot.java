package com.switchyard.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time copy of the process-wide performance counters.
 *
 * @param routes         counters keyed by {@link Route#key()}
 * @param cacheHitCount  cache hits since start (or last reset)
 * @param cacheMissCount cache misses since start (or last reset)
 * @param queueDepth     jobs queued or processing when the snapshot was taken
 * @param lastSyncTime   end of the most recent successful drain pass; may be {@code null}
 * @param topTools       most used tools, descending by count
 * @param sessionStart   when counters were initialised or last reset
 * @param takenAt        when this snapshot was built
 */
public record MetricsSnapshot(
    Map<String, RouteStats> routes,
    long cacheHitCount,
    long cacheMissCount,
    long queueDepth,
    Instant lastSyncTime,
    List<ToolStats> topTools,
    Instant sessionStart,
    Instant takenAt
) {

    public RouteStats route(Route route) {
        return routes.getOrDefault(route.key(), RouteStats.EMPTY);
    }

    public long totalExecutions() {
        return route(Route.LOCAL).count() + route(Route.REMOTE).count();
    }

    public double cacheHitRate() {
        long lookups = cacheHitCount + cacheMissCount;
        return lookups > 0 ? (cacheHitCount * 100.0) / lookups : 0.0;
    }

    public Duration uptime() {
        return Duration.between(sessionStart, takenAt);
    }
}
