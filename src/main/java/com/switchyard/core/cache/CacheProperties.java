package com.switchyard.core.cache;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "switchyard.cache")
public class CacheProperties {

    private int maxEntries = 1000;
    private long maxBytes = 50L * 1024 * 1024;
    private long sweepIntervalSeconds = 300;

    public int getMaxEntries() { return maxEntries; }
    public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }
    public long getMaxBytes() { return maxBytes; }
    public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }
    public long getSweepIntervalSeconds() { return sweepIntervalSeconds; }
    public void setSweepIntervalSeconds(long sweepIntervalSeconds) { this.sweepIntervalSeconds = sweepIntervalSeconds; }
}
