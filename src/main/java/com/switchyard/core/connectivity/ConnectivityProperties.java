package com.switchyard.core.connectivity;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "switchyard.connectivity")
public class ConnectivityProperties {

    private boolean initiallyOnline = true;
    private boolean probeEnabled = false;
    private String probeUrl = "";
    private long probeIntervalSeconds = 15;
    private long probeTimeoutMs = 3_000;

    public boolean isInitiallyOnline() { return initiallyOnline; }
    public void setInitiallyOnline(boolean initiallyOnline) { this.initiallyOnline = initiallyOnline; }
    public boolean isProbeEnabled() { return probeEnabled; }
    public void setProbeEnabled(boolean probeEnabled) { this.probeEnabled = probeEnabled; }
    public String getProbeUrl() { return probeUrl; }
    public void setProbeUrl(String probeUrl) { this.probeUrl = probeUrl; }
    public long getProbeIntervalSeconds() { return probeIntervalSeconds; }
    public void setProbeIntervalSeconds(long probeIntervalSeconds) { this.probeIntervalSeconds = probeIntervalSeconds; }
    public long getProbeTimeoutMs() { return probeTimeoutMs; }
    public void setProbeTimeoutMs(long probeTimeoutMs) { this.probeTimeoutMs = probeTimeoutMs; }
}
