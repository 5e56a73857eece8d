package com.switchyard.core.executor;

import com.switchyard.core.model.ErrorKind;
import com.switchyard.core.model.ToolDescriptor;
import com.switchyard.core.router.RouterProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs {@link LocalTool}s on a worker pool and enforces a deadline per call.
 * <p>
 * Tiers without a local timeout are still bounded by a hard safety ceiling. A call
 * that exceeds its deadline is cancelled (the worker thread is interrupted) and
 * reported as {@link ErrorKind#LOCAL_TIMEOUT}; the caller never waits on it again.
 * <p>
 * Calls are handed straight to a thread, never queued, so the deadline covers only
 * the tool's own run time. A tool that ignores the interrupt keeps its thread until
 * it returns; such abandoned calls are counted and the pool grows past its core size
 * up to {@code switchyard.router.local.max-threads} to keep serving new calls.
 */
@Service
public class LocalExecutor {

    private static final Logger log = LoggerFactory.getLogger(LocalExecutor.class);

    private static final int RUNNING = 0;
    private static final int FINISHED = 1;
    private static final int ABANDONED = 2;

    private final LocalToolRegistry registry;
    private final Duration safetyCeiling;
    private final ThreadPoolExecutor pool;
    private final AtomicInteger abandonedCalls = new AtomicInteger();

    public LocalExecutor(LocalToolRegistry registry, RouterProperties properties) {
        this.registry = registry;
        this.safetyCeiling = Duration.ofMillis(properties.getLocal().getSafetyCeilingMs());
        int core = Math.max(1, properties.getLocal().getThreads());
        int max = Math.max(core, properties.getLocal().getMaxThreads());
        var counter = new AtomicInteger();
        this.pool = new ThreadPoolExecutor(core, max, 60, TimeUnit.SECONDS, new SynchronousQueue<>(), r -> {
            Thread t = new Thread(r, "local-exec-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public boolean supports(String tool) {
        return registry.contains(tool);
    }

    /**
     * Timed-out calls whose tool has not returned yet.
     */
    public int abandonedCalls() {
        return abandonedCalls.get();
    }

    /**
     * Executes the tool locally.
     *
     * @throws ToolExecutionException with kind {@code LOCAL_TIMEOUT} or {@code LOCAL_EXECUTION_FAILED}
     */
    public Object execute(ToolDescriptor descriptor, Map<String, Object> parameters) {
        LocalTool tool = registry.lookup(descriptor.name())
                .orElseThrow(() -> new ToolExecutionException(ErrorKind.LOCAL_EXECUTION_FAILED,
                        "No local implementation for tool " + descriptor.name()));

        Duration deadline = descriptor.hasLocalTimeout() ? descriptor.localTimeout() : safetyCeiling;
        var state = new AtomicInteger(RUNNING);
        Future<Object> future;
        try {
            future = pool.submit(() -> {
                try {
                    return tool.execute(parameters);
                } finally {
                    if (!state.compareAndSet(RUNNING, FINISHED)) {
                        int left = abandonedCalls.decrementAndGet();
                        log.info("Abandoned call to {} returned; {} still running", descriptor.name(), left);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Local executor saturated: {} workers busy, {} abandoned calls",
                    pool.getActiveCount(), abandonedCalls.get());
            throw new ToolExecutionException(ErrorKind.LOCAL_EXECUTION_FAILED,
                    "Local executor saturated; cannot run " + descriptor.name(), e);
        }
        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            if (state.compareAndSet(RUNNING, ABANDONED)) {
                int abandoned = abandonedCalls.incrementAndGet();
                log.warn("Local execution of {} exceeded {}ms; abandoning call ({} abandoned)",
                        descriptor.name(), deadline.toMillis(), abandoned);
            }
            future.cancel(true);
            throw new ToolExecutionException(ErrorKind.LOCAL_TIMEOUT,
                    "Local execution of " + descriptor.name() + " exceeded " + deadline.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new ToolExecutionException(ErrorKind.LOCAL_EXECUTION_FAILED,
                    "Local execution of " + descriptor.name() + " failed: " + cause.getMessage(), cause);
        } catch (CancellationException e) {
            throw new ToolExecutionException(ErrorKind.LOCAL_EXECUTION_FAILED,
                    "Local execution of " + descriptor.name() + " was cancelled", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ToolExecutionException(ErrorKind.LOCAL_EXECUTION_FAILED,
                    "Interrupted while waiting for " + descriptor.name(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down local executor ({} abandoned calls)", abandonedCalls.get());
        pool.shutdownNow();
    }
}
