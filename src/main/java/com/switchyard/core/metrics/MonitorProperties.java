package com.switchyard.core.metrics;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "switchyard.monitor")
public class MonitorProperties {

    /** 0 disables periodic snapshot persistence. */
    private long persistIntervalSeconds = 300;
    private String snapshotPath = System.getProperty("user.home") + "/.switchyard/metrics.json";
    private int topTools = 10;

    public long getPersistIntervalSeconds() { return persistIntervalSeconds; }
    public void setPersistIntervalSeconds(long persistIntervalSeconds) { this.persistIntervalSeconds = persistIntervalSeconds; }
    public String getSnapshotPath() { return snapshotPath; }
    public void setSnapshotPath(String snapshotPath) { this.snapshotPath = snapshotPath; }
    public int getTopTools() { return topTools; }
    public void setTopTools(int topTools) { this.topTools = topTools; }
}
