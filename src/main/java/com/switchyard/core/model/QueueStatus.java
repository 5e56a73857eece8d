package com.switchyard.core.model;

/**
 * Job counts per status.
 */
public record QueueStatus(long queued, long processing, long completed, long failed) {

    public long pending() {
        return queued + processing;
    }

    public long total() {
        return queued + processing + completed + failed;
    }
}
