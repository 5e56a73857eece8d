package com.switchyard.core.router;

import com.switchyard.core.cache.CacheEntry;
import com.switchyard.core.cache.Fingerprints;
import com.switchyard.core.cache.ResultCache;
import com.switchyard.core.classifier.ToolClassifier;
import com.switchyard.core.connectivity.ConnectivityMonitor;
import com.switchyard.core.executor.LocalExecutor;
import com.switchyard.core.executor.RemoteExecutor;
import com.switchyard.core.executor.RemoteUnreachableException;
import com.switchyard.core.executor.ToolExecutionException;
import com.switchyard.core.logging.MdcContext;
import com.switchyard.core.metrics.PerformanceMonitor;
import com.switchyard.core.model.ExecutionOutcome;
import com.switchyard.core.model.InvalidParametersException;
import com.switchyard.core.model.InvocationRequest;
import com.switchyard.core.model.QueuedJob;
import com.switchyard.core.model.Route;
import com.switchyard.core.model.Tier;
import com.switchyard.core.model.ToolDescriptor;
import com.switchyard.core.queue.JobHandler;
import com.switchyard.core.queue.OfflineQueue;
import com.switchyard.core.queue.QueueFullException;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Decides where each tool invocation runs and records the outcome.
 * <p>
 * A request is answered from the cache when a fresh result exists. Otherwise the tool's
 * tier picks the strategy:
 * <ul>
 *   <li>{@code simple}: local only; failures are surfaced to the caller.</li>
 *   <li>{@code medium}: local under the tier timeout, then remote, then the offline queue.</li>
 *   <li>{@code complex}: remote when online, otherwise straight to the offline queue.</li>
 * </ul>
 * Timeouts and backend failures never reach the caller; a request that cannot finish now
 * returns a deferred outcome carrying the queued job id. Only unknown tools, invalid
 * parameters, a full queue and simple-tier failures are thrown.
 * <p>
 * This is the only writer of cache entries. It also runs queued jobs on behalf of the
 * {@link OfflineQueue}, see {@link #handle(QueuedJob)}.
 */
@Service
public class ExecutionRouter implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionRouter.class);

    private final ToolClassifier classifier;
    private final ResultCache cache;
    private final LocalExecutor localExecutor;
    private final RemoteExecutor remoteExecutor;
    private final OfflineQueue queue;
    private final ConnectivityMonitor connectivity;
    private final PerformanceMonitor monitor;
    private final Clock clock;

    public ExecutionRouter(ToolClassifier classifier, ResultCache cache, LocalExecutor localExecutor,
                           RemoteExecutor remoteExecutor, OfflineQueue queue,
                           ConnectivityMonitor connectivity, PerformanceMonitor monitor, Clock clock) {
        this.classifier = classifier;
        this.cache = cache;
        this.localExecutor = localExecutor;
        this.remoteExecutor = remoteExecutor;
        this.queue = queue;
        this.connectivity = connectivity;
        this.monitor = monitor;
        this.clock = clock;
    }

    @PostConstruct
    public void registerWithQueue() {
        queue.registerHandler(this);
    }

    /**
     * Builds the request (fingerprint included) and routes it.
     *
     * @throws InvalidParametersException if the tool name is blank or the parameters cannot be canonicalised
     */
    public ExecutionOutcome execute(String tool, Map<String, Object> parameters) {
        if (tool == null || tool.isBlank()) {
            throw new InvalidParametersException("Tool name must not be blank");
        }
        Map<String, Object> params = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        String fingerprint = Fingerprints.of(tool, params);
        return execute(new InvocationRequest(tool, params, clock.instant(), fingerprint));
    }

    public ExecutionOutcome execute(InvocationRequest request) {
        MdcContext.setInvocation(request.tool(), request.fingerprint());
        try {
            Optional<CacheEntry> hit = cache.get(request.fingerprint());
            if (hit.isPresent()) {
                monitor.recordCacheHit();
                log.debug("Cache hit for {}", request.tool());
                return ExecutionOutcome.cached(hit.get().payload(), hit.get().storedAt());
            }
            monitor.recordCacheMiss();

            ToolDescriptor descriptor = classifier.require(request.tool());
            long start = System.nanoTime();
            return switch (descriptor.tier()) {
                case SIMPLE -> runSimple(request, descriptor, start);
                case MEDIUM -> runMedium(request, descriptor, start);
                case COMPLEX -> runComplex(request, descriptor, start);
            };
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Removes a cached result so the next identical request executes again.
     */
    public boolean invalidate(String fingerprint) {
        return cache.invalidate(fingerprint);
    }

    public boolean invalidate(String tool, Map<String, Object> parameters) {
        return cache.invalidate(tool, parameters);
    }

    // ── Tier strategies ──────────────────────────────────────────────────

    private ExecutionOutcome runSimple(InvocationRequest request, ToolDescriptor descriptor, long start) {
        try {
            Object result = runLocal(request.tool(), request.parameters(), descriptor);
            cache.put(request.fingerprint(), result, descriptor.cacheTtl());
            return ExecutionOutcome.completed(result, Route.LOCAL, elapsedMs(start));
        } catch (ToolExecutionException e) {
            log.error("Simple tool {} failed: {}", request.tool(), e.getMessage());
            throw e;
        }
    }

    private ExecutionOutcome runMedium(InvocationRequest request, ToolDescriptor descriptor, long start) {
        try {
            Object result = runLocal(request.tool(), request.parameters(), descriptor);
            cache.put(request.fingerprint(), result, descriptor.cacheTtl());
            return ExecutionOutcome.completed(result, Route.LOCAL, elapsedMs(start));
        } catch (ToolExecutionException e) {
            log.warn("Local {} failed ({}), falling back to remote: {}",
                    request.tool(), e.kind(), e.getMessage());
        }
        return remoteOrDefer(request, descriptor, start);
    }

    private ExecutionOutcome runComplex(InvocationRequest request, ToolDescriptor descriptor, long start) {
        return remoteOrDefer(request, descriptor, start);
    }

    private ExecutionOutcome remoteOrDefer(InvocationRequest request, ToolDescriptor descriptor, long start) {
        if (!connectivity.isOnline()) {
            log.info("Offline; deferring {}", request.tool());
            return defer(request, descriptor, start);
        }
        try {
            Object result = runRemote(request.tool(), request.parameters());
            cache.put(request.fingerprint(), result, descriptor.cacheTtl());
            return ExecutionOutcome.completed(result, Route.REMOTE, elapsedMs(start));
        } catch (RemoteUnreachableException e) {
            log.warn("Remote backend unreachable for {}, deferring: {}", request.tool(), e.getMessage());
        } catch (ToolExecutionException e) {
            log.warn("Remote {} failed, deferring: {}", request.tool(), e.getMessage());
        }
        return defer(request, descriptor, start);
    }

    private ExecutionOutcome defer(InvocationRequest request, ToolDescriptor descriptor, long start) {
        String jobId;
        try {
            jobId = queue.enqueue(request, descriptor.priority());
        } catch (QueueFullException e) {
            monitor.record(Route.QUEUE, request.tool(), elapsedMs(start), false);
            log.error("Cannot defer {}: {}", request.tool(), e.getMessage());
            throw e;
        }
        long latency = elapsedMs(start);
        monitor.record(Route.QUEUE, request.tool(), latency, true);
        return ExecutionOutcome.deferred(jobId, latency);
    }

    // ── Queue attempts ───────────────────────────────────────────────────

    /**
     * Runs one attempt of a queued job: locally for simple tools, remotely otherwise.
     * A successful result is cached under the job's fingerprint.
     */
    @Override
    public Object handle(QueuedJob job) {
        ToolDescriptor descriptor = classifier.require(job.tool());
        Object result = descriptor.tier() == Tier.SIMPLE
                ? runLocal(job.tool(), job.parameters(), descriptor)
                : runRemote(job.tool(), job.parameters());
        cache.put(job.fingerprint(), result, descriptor.cacheTtl());
        return result;
    }

    private Object runLocal(String tool, Map<String, Object> parameters, ToolDescriptor descriptor) {
        long t0 = System.nanoTime();
        try {
            Object result = localExecutor.execute(descriptor, parameters);
            monitor.record(Route.LOCAL, tool, elapsedMs(t0), true);
            return result;
        } catch (ToolExecutionException e) {
            monitor.record(Route.LOCAL, tool, elapsedMs(t0), false);
            throw e;
        }
    }

    private Object runRemote(String tool, Map<String, Object> parameters) {
        long t0 = System.nanoTime();
        try {
            Object result = remoteExecutor.execute(tool, parameters);
            monitor.record(Route.REMOTE, tool, elapsedMs(t0), true);
            return result;
        } catch (RemoteUnreachableException | ToolExecutionException e) {
            monitor.record(Route.REMOTE, tool, elapsedMs(t0), false);
            throw e;
        }
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
