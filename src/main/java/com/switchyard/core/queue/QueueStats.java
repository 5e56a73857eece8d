package com.switchyard.core.queue;

import com.switchyard.core.model.QueueStatus;

import java.time.Instant;

/**
 * Current queue counts plus lifetime counters since process start.
 *
 * @param status              per-status job counts
 * @param processed           attempts that reached a terminal or retry decision
 * @param succeeded           jobs completed
 * @param failed              jobs failed permanently
 * @param lastSyncAttempt     last time a drain pass started
 * @param lastSuccessfulSync  last drain pass that completed at least one job
 * @param draining            whether a drain pass is running now
 */
public record QueueStats(
    QueueStatus status,
    long processed,
    long succeeded,
    long failed,
    Instant lastSyncAttempt,
    Instant lastSuccessfulSync,
    boolean draining
) {}
