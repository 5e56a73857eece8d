package com.switchyard.core.router;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Routing policy: per-tier defaults, the tool registry, and the settings of
 * the local and remote executors.
 */
@Component
@ConfigurationProperties(prefix = "switchyard.router")
public class RouterProperties {

    private Tiers tiers = new Tiers();
    /** Tool name to tier name, e.g. {@code calculate_reading_time: simple}. */
    private Map<String, String> tools = new LinkedHashMap<>();
    private Local local = new Local();
    private Remote remote = new Remote();

    public Tiers getTiers() { return tiers; }
    public void setTiers(Tiers tiers) { this.tiers = tiers; }
    public Map<String, String> getTools() { return tools; }
    public void setTools(Map<String, String> tools) { this.tools = tools; }
    public Local getLocal() { return local; }
    public void setLocal(Local local) { this.local = local; }
    public Remote getRemote() { return remote; }
    public void setRemote(Remote remote) { this.remote = remote; }

    public static class Tiers {
        private TierSettings simple = new TierSettings(3600, 0, 10);
        private TierSettings medium = new TierSettings(1800, 2000, 5);
        private TierSettings complex = new TierSettings(7200, 0, 1);

        public TierSettings getSimple() { return simple; }
        public void setSimple(TierSettings simple) { this.simple = simple; }
        public TierSettings getMedium() { return medium; }
        public void setMedium(TierSettings medium) { this.medium = medium; }
        public TierSettings getComplex() { return complex; }
        public void setComplex(TierSettings complex) { this.complex = complex; }
    }

    public static class TierSettings {
        private long cacheTtlSeconds;
        /** 0 means the tier has no local deadline (the safety ceiling still applies). */
        private long localTimeoutMs;
        private int priority;

        public TierSettings() {
        }

        public TierSettings(long cacheTtlSeconds, long localTimeoutMs, int priority) {
            this.cacheTtlSeconds = cacheTtlSeconds;
            this.localTimeoutMs = localTimeoutMs;
            this.priority = priority;
        }

        public long getCacheTtlSeconds() { return cacheTtlSeconds; }
        public void setCacheTtlSeconds(long cacheTtlSeconds) { this.cacheTtlSeconds = cacheTtlSeconds; }
        public long getLocalTimeoutMs() { return localTimeoutMs; }
        public void setLocalTimeoutMs(long localTimeoutMs) { this.localTimeoutMs = localTimeoutMs; }
        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }
    }

    public static class Local {
        private int threads = 4;
        /** Upper bound on workers, including threads held by timed-out calls that ignore interrupts. */
        private int maxThreads = 64;
        private long safetyCeilingMs = 30_000;

        public int getThreads() { return threads; }
        public void setThreads(int threads) { this.threads = threads; }
        public int getMaxThreads() { return maxThreads; }
        public void setMaxThreads(int maxThreads) { this.maxThreads = maxThreads; }
        public long getSafetyCeilingMs() { return safetyCeilingMs; }
        public void setSafetyCeilingMs(long safetyCeilingMs) { this.safetyCeilingMs = safetyCeilingMs; }
    }

    public static class Remote {
        private String endpoint = "http://localhost:8000/api/tools";
        private long timeoutMs = 30_000;
        private long connectTimeoutMs = 5_000;

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }
    }
}
