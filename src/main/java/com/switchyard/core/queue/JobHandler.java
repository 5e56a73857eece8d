package com.switchyard.core.queue;

import com.switchyard.core.model.QueuedJob;

/**
 * Runs one attempt of a queued job.
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * @return the result payload on success
     * @throws com.switchyard.core.model.RouterException describing why the attempt failed;
     *         {@code REMOTE_UNREACHABLE} returns the job to the queue without consuming an attempt
     */
    Object handle(QueuedJob job);
}
