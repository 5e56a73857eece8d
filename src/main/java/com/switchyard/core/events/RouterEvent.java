package com.switchyard.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A queue lifecycle event.
 *
 * @param eventType event type (e.g. "job.queued", "job.completed", "job.failed")
 * @param jobId     the job this event belongs to
 * @param tool      tool name of the job
 * @param payload   extra event data (attempt, error, next retry time)
 * @param timestamp when the event occurred
 */
public record RouterEvent(
    String eventType,
    String jobId,
    String tool,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String JOB_QUEUED = "job.queued";
    public static final String JOB_STARTED = "job.started";
    public static final String JOB_COMPLETED = "job.completed";
    public static final String JOB_RETRY_SCHEDULED = "job.retry_scheduled";
    public static final String JOB_FAILED = "job.failed";
    public static final String JOB_REMOVED = "job.removed";

    /** Whether no further events will follow for this job. */
    public boolean isTerminal() {
        return JOB_COMPLETED.equals(eventType) || JOB_FAILED.equals(eventType) || JOB_REMOVED.equals(eventType);
    }
}
