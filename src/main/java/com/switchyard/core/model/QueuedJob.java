package com.switchyard.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * A deferred invocation persisted by the offline queue.
 *
 * @param id            unique job id
 * @param fingerprint   dedup key shared with the cache
 * @param tool          tool name
 * @param parameters    invocation parameters
 * @param priority      higher runs first
 * @param createdAt     enqueue time; tie-breaker after priority
 * @param attempts      attempts consumed so far
 * @param maxAttempts   attempts allowed before the job fails permanently
 * @param status        current lifecycle status
 * @param lastError     message of the most recent failed attempt
 * @param nextAttemptAt earliest time the job may be picked up again (backoff)
 * @param updatedAt     last status change
 * @param result        result payload once completed
 */
public record QueuedJob(
    String id,
    String fingerprint,
    String tool,
    Map<String, Object> parameters,
    int priority,
    Instant createdAt,
    int attempts,
    int maxAttempts,
    JobStatus status,
    String lastError,
    Instant nextAttemptAt,
    Instant updatedAt,
    Object result
) {

    public static QueuedJob create(String id, InvocationRequest request, int priority,
                                   int maxAttempts, Instant now) {
        return new QueuedJob(id, request.fingerprint(), request.tool(), request.parameters(),
                priority, now, 0, maxAttempts, JobStatus.QUEUED, null, now, now, null);
    }

    public QueuedJob startAttempt(Instant now) {
        return new QueuedJob(id, fingerprint, tool, parameters, priority, createdAt,
                attempts, maxAttempts, JobStatus.PROCESSING, lastError, nextAttemptAt, now, null);
    }

    public QueuedJob complete(Object payload, Instant now) {
        return new QueuedJob(id, fingerprint, tool, parameters, priority, createdAt,
                attempts + 1, maxAttempts, JobStatus.COMPLETED, null, null, now, payload);
    }

    public QueuedJob retryLater(String error, Instant retryAt, Instant now) {
        return new QueuedJob(id, fingerprint, tool, parameters, priority, createdAt,
                attempts + 1, maxAttempts, JobStatus.QUEUED, error, retryAt, now, null);
    }

    public QueuedJob fail(String error, Instant now) {
        return new QueuedJob(id, fingerprint, tool, parameters, priority, createdAt,
                attempts + 1, maxAttempts, JobStatus.FAILED, error, null, now, null);
    }

    /** Returns the job to the queue without consuming an attempt. */
    public QueuedJob release(Instant now) {
        return new QueuedJob(id, fingerprint, tool, parameters, priority, createdAt,
                attempts, maxAttempts, JobStatus.QUEUED, lastError, now, now, null);
    }

    /** Operator retry: back to queued with a fresh attempt budget. */
    public QueuedJob resetForRetry(Instant now) {
        return new QueuedJob(id, fingerprint, tool, parameters, priority, createdAt,
                0, maxAttempts, JobStatus.QUEUED, null, now, now, null);
    }

    public boolean isDue(Instant now) {
        return status == JobStatus.QUEUED && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }
}
