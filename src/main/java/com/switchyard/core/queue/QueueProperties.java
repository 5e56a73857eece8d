package com.switchyard.core.queue;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Offline queue settings: storage backend, worker slots, retry policy and capacity.
 */
@Component
@ConfigurationProperties(prefix = "switchyard.queue")
public class QueueProperties {

    /** {@code file} (default) or {@code jdbc}. */
    private String store = "file";
    private String directory = System.getProperty("user.home") + "/.switchyard/jobs";
    private int workers = 1;
    private int maxAttempts = 3;
    private long baseBackoffMs = 2_000;
    private long maxBackoffMs = 60_000;
    private long syncIntervalSeconds = 30;
    /** Maximum number of queued plus processing jobs. */
    private int capacity = 1000;

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public String getDirectory() { return directory; }
    public void setDirectory(String directory) { this.directory = directory; }
    public int getWorkers() { return workers; }
    public void setWorkers(int workers) { this.workers = workers; }
    public int getMaxAttempts() { return maxAttempts; }
    public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    public long getBaseBackoffMs() { return baseBackoffMs; }
    public void setBaseBackoffMs(long baseBackoffMs) { this.baseBackoffMs = baseBackoffMs; }
    public long getMaxBackoffMs() { return maxBackoffMs; }
    public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
    public long getSyncIntervalSeconds() { return syncIntervalSeconds; }
    public void setSyncIntervalSeconds(long syncIntervalSeconds) { this.syncIntervalSeconds = syncIntervalSeconds; }
    public int getCapacity() { return capacity; }
    public void setCapacity(int capacity) { this.capacity = capacity; }
}
