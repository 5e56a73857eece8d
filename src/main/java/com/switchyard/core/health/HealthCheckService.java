package com.switchyard.core.health;

import com.switchyard.core.cache.CacheProperties;
import com.switchyard.core.cache.ResultCache;
import com.switchyard.core.classifier.ToolClassifier;
import com.switchyard.core.connectivity.ConnectivityMonitor;
import com.switchyard.core.executor.LocalToolRegistry;
import com.switchyard.core.executor.RemoteExecutor;
import com.switchyard.core.model.QueueStatus;
import com.switchyard.core.model.Tier;
import com.switchyard.core.model.ToolDescriptor;
import com.switchyard.core.queue.OfflineQueue;
import com.switchyard.core.queue.QueueProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final OfflineQueue queue;
    private final QueueProperties queueProperties;
    private final ConnectivityMonitor connectivity;
    private final RemoteExecutor remoteExecutor;
    private final ResultCache cache;
    private final CacheProperties cacheProperties;
    private final ToolClassifier classifier;
    private final LocalToolRegistry localTools;

    public HealthCheckService(OfflineQueue queue, QueueProperties queueProperties,
                              ConnectivityMonitor connectivity, RemoteExecutor remoteExecutor,
                              ResultCache cache, CacheProperties cacheProperties,
                              ToolClassifier classifier, LocalToolRegistry localTools) {
        this.queue = queue;
        this.queueProperties = queueProperties;
        this.connectivity = connectivity;
        this.remoteExecutor = remoteExecutor;
        this.cache = cache;
        this.cacheProperties = cacheProperties;
        this.classifier = classifier;
        this.localTools = localTools;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkJobStore());
        results.add(checkConnectivity());
        results.add(checkCache());
        results.add(checkLocalTools());
        return results;
    }

    /** DOWN if any component is DOWN, DEGRADED if any is DEGRADED, otherwise UP. */
    public static HealthStatus.Status overall(List<HealthStatus> statuses) {
        var overall = HealthStatus.Status.UP;
        for (HealthStatus s : statuses) {
            if (s.status() == HealthStatus.Status.DOWN) {
                return HealthStatus.Status.DOWN;
            }
            if (s.status() == HealthStatus.Status.DEGRADED) {
                overall = HealthStatus.Status.DEGRADED;
            }
        }
        return overall;
    }

    HealthStatus checkJobStore() {
        try {
            QueueStatus status = queue.status();
            var metadata = Map.of(
                    "store", queue.storeDescription(),
                    "queued", String.valueOf(status.queued()),
                    "processing", String.valueOf(status.processing()),
                    "failed", String.valueOf(status.failed()));
            if (status.pending() >= queueProperties.getCapacity()) {
                return new HealthStatus("jobStore", HealthStatus.Status.DEGRADED,
                        "Queue at capacity (" + queueProperties.getCapacity() + ")", metadata);
            }
            return new HealthStatus("jobStore", HealthStatus.Status.UP,
                    "Job store readable", metadata);
        } catch (Exception e) {
            log.warn("Job store health check failed: {}", e.getMessage());
            return new HealthStatus("jobStore", HealthStatus.Status.DOWN,
                    "Job store error: " + e.getMessage(), Map.of());
        }
    }

    HealthStatus checkConnectivity() {
        var metadata = Map.of("endpoint", remoteExecutor.endpoint());
        if (connectivity.isOnline()) {
            return new HealthStatus("connectivity", HealthStatus.Status.UP,
                    "Remote backend reachable", metadata);
        }
        return new HealthStatus("connectivity", HealthStatus.Status.DEGRADED,
                "Offline; remote work is being queued", metadata);
    }

    HealthStatus checkCache() {
        int size = cache.size();
        long bytes = cache.totalBytes();
        var metadata = Map.of(
                "entries", String.valueOf(size),
                "bytes", String.valueOf(bytes),
                "maxEntries", String.valueOf(cacheProperties.getMaxEntries()),
                "maxBytes", String.valueOf(cacheProperties.getMaxBytes()));
        return new HealthStatus("cache", HealthStatus.Status.UP,
                size + " entries, " + bytes + " bytes", metadata);
    }

    /**
     * Simple-tier tools can only run locally, so a missing implementation is fatal for them.
     */
    HealthStatus checkLocalTools() {
        List<String> missing = classifier.all().stream()
                .filter(d -> d.tier() == Tier.SIMPLE)
                .map(ToolDescriptor::name)
                .filter(name -> !localTools.contains(name))
                .toList();
        var metadata = Map.of("registered", String.join(",", localTools.names()));
        if (!missing.isEmpty()) {
            return new HealthStatus("localTools", HealthStatus.Status.DOWN,
                    "Simple tools without a local implementation: " + String.join(", ", missing), metadata);
        }
        return new HealthStatus("localTools", HealthStatus.Status.UP,
                localTools.names().size() + " local tools registered", metadata);
    }
}
