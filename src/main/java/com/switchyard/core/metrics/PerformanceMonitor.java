package com.switchyard.core.metrics;

import com.switchyard.core.model.MetricsSnapshot;
import com.switchyard.core.model.Route;
import com.switchyard.core.model.RouteStats;
import com.switchyard.core.model.ToolStats;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-wide performance counters for routing outcomes.
 * <p>
 * Counters only grow until an explicit {@link #reset()}. {@link #snapshot()} copies
 * them under the lock and never mutates them. Every recorded execution is also
 * mirrored to Micrometer via {@link SwitchyardMetrics}.
 * <p>
 * When {@code switchyard.monitor.persist-interval-seconds} is positive, a snapshot is
 * written to {@code snapshot-path} periodically and once more on shutdown. Persistence
 * is best effort: failures are logged and never reach callers.
 */
@Service
public class PerformanceMonitor {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    private final MonitorProperties properties;
    private final SwitchyardMetrics metrics;
    private final MetricsExporter exporter;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final EnumMap<Route, RouteCounter> routes = new EnumMap<>(Route.class);
    private final Map<String, ToolCounter> tools = new HashMap<>();
    private long cacheHits;
    private long cacheMisses;
    private long queueDepth;
    private Instant lastSyncTime;
    private Instant sessionStart;

    private ScheduledExecutorService persister;

    public PerformanceMonitor(MonitorProperties properties, SwitchyardMetrics metrics,
                              MetricsExporter exporter, Clock clock) {
        this.properties = properties;
        this.metrics = metrics;
        this.exporter = exporter;
        this.clock = clock;
        initCounters();
    }

    @PostConstruct
    void startPersistence() {
        long interval = properties.getPersistIntervalSeconds();
        if (interval <= 0) {
            log.info("Metrics snapshot persistence disabled");
            return;
        }
        persister = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "metrics-persist");
            t.setDaemon(true);
            return t;
        });
        persister.scheduleAtFixedRate(this::persistSnapshot, interval, interval, TimeUnit.SECONDS);
        log.info("Persisting metrics snapshot to {} every {}s", properties.getSnapshotPath(), interval);
    }

    @PreDestroy
    void stopPersistence() {
        if (persister != null) {
            persister.shutdownNow();
            persistSnapshot();
        }
    }

    /**
     * Records one terminal outcome for the given route.
     */
    public void record(Route route, String tool, long latencyMs, boolean success) {
        Instant now = clock.instant();
        lock.lock();
        try {
            routes.get(route).add(latencyMs, success);
            if (route != Route.CACHE && tool != null) {
                tools.computeIfAbsent(tool, ToolCounter::new).add(latencyMs, success, now);
            }
        } finally {
            lock.unlock();
        }
        metrics.recordExecution(route.key(), success, latencyMs);
    }

    public void recordCacheHit() {
        lock.lock();
        try {
            cacheHits++;
            routes.get(Route.CACHE).add(0, true);
        } finally {
            lock.unlock();
        }
        metrics.recordCacheLookup(true);
    }

    public void recordCacheMiss() {
        lock.lock();
        try {
            cacheMisses++;
        } finally {
            lock.unlock();
        }
        metrics.recordCacheLookup(false);
    }

    public void updateQueueDepth(long depth) {
        lock.lock();
        try {
            queueDepth = depth;
        } finally {
            lock.unlock();
        }
    }

    public void recordSync(Instant at) {
        lock.lock();
        try {
            lastSyncTime = at;
        } finally {
            lock.unlock();
        }
    }

    public MetricsSnapshot snapshot() {
        Instant now = clock.instant();
        lock.lock();
        try {
            var routeStats = new LinkedHashMap<String, RouteStats>();
            for (var entry : routes.entrySet()) {
                routeStats.put(entry.getKey().key(), entry.getValue().toStats());
            }
            List<ToolStats> top = tools.values().stream()
                    .map(ToolCounter::toStats)
                    .sorted(Comparator.comparingLong(ToolStats::count).reversed()
                            .thenComparing(ToolStats::tool))
                    .limit(Math.max(0, properties.getTopTools()))
                    .toList();
            return new MetricsSnapshot(routeStats, cacheHits, cacheMisses, queueDepth,
                    lastSyncTime, top, sessionStart, now);
        } finally {
            lock.unlock();
        }
    }

    public ToolStats toolStats(String tool) {
        lock.lock();
        try {
            ToolCounter counter = tools.get(tool);
            return counter == null ? new ToolStats(tool, 0, 0, 0, null) : counter.toStats();
        } finally {
            lock.unlock();
        }
    }

    public byte[] export(ExportFormat format) {
        return exporter.export(snapshot(), format);
    }

    /**
     * Zeroes all counters. Queue depth is kept, since it reflects live queue state.
     */
    public void reset() {
        lock.lock();
        try {
            initCounters();
        } finally {
            lock.unlock();
        }
        log.info("Performance metrics reset");
    }

    /**
     * Writes the current snapshot as JSON to the configured path.
     *
     * @return {@code true} if the snapshot was written
     */
    public boolean persistSnapshot() {
        Path target = Path.of(properties.getSnapshotPath());
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            Files.write(tmp, exporter.export(snapshot(), ExportFormat.JSON));
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Metrics snapshot written to {}", target);
            return true;
        } catch (IOException | RuntimeException e) {
            log.warn("Failed to persist metrics snapshot to {}: {}", target, e.getMessage());
            return false;
        }
    }

    private void initCounters() {
        for (Route route : Route.values()) {
            routes.put(route, new RouteCounter());
        }
        tools.clear();
        cacheHits = 0;
        cacheMisses = 0;
        lastSyncTime = null;
        sessionStart = clock.instant();
    }

    private static final class RouteCounter {
        private long count;
        private long successCount;
        private long failureCount;
        private long totalLatencyMs;
        private long minLatencyMs = Long.MAX_VALUE;
        private long maxLatencyMs;

        void add(long latencyMs, boolean success) {
            count++;
            if (success) {
                successCount++;
            } else {
                failureCount++;
            }
            totalLatencyMs += latencyMs;
            minLatencyMs = Math.min(minLatencyMs, latencyMs);
            maxLatencyMs = Math.max(maxLatencyMs, latencyMs);
        }

        RouteStats toStats() {
            return new RouteStats(count, successCount, failureCount, totalLatencyMs,
                    count == 0 ? 0 : minLatencyMs, maxLatencyMs);
        }
    }

    private static final class ToolCounter {
        private final String tool;
        private long count;
        private long totalLatencyMs;
        private long errors;
        private Instant lastExecution;

        ToolCounter(String tool) {
            this.tool = tool;
        }

        void add(long latencyMs, boolean success, Instant at) {
            count++;
            totalLatencyMs += latencyMs;
            if (!success) {
                errors++;
            }
            lastExecution = at;
        }

        ToolStats toStats() {
            return new ToolStats(tool, count, totalLatencyMs, errors, lastExecution);
        }
    }
}
