package com.switchyard.core.model;

import java.time.Instant;

/**
 * What a caller receives from an execution: either a result or a
 * deferred handle pointing at a queued job.
 *
 * @param result    the tool result; {@code null} when deferred
 * @param route     where the result came from ({@link Route#QUEUE} when deferred)
 * @param latencyMs wall-clock time spent serving the call
 * @param cachedAt  when the cached result was stored (cache hits only)
 * @param jobId     queued job id (deferred only)
 */
public record ExecutionOutcome(
    Object result,
    Route route,
    long latencyMs,
    Instant cachedAt,
    String jobId
) {

    public static ExecutionOutcome completed(Object result, Route route, long latencyMs) {
        return new ExecutionOutcome(result, route, latencyMs, null, null);
    }

    public static ExecutionOutcome cached(Object result, Instant cachedAt) {
        return new ExecutionOutcome(result, Route.CACHE, 0L, cachedAt, null);
    }

    public static ExecutionOutcome deferred(String jobId, long latencyMs) {
        return new ExecutionOutcome(null, Route.QUEUE, latencyMs, null, jobId);
    }

    public boolean isDeferred() {
        return route == Route.QUEUE;
    }
}
