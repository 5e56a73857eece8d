package com.switchyard.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for routing, cache and queue outcomes.
 */
@Service
public class SwitchyardMetrics {

    private final MeterRegistry registry;

    public SwitchyardMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordExecution(String route, boolean success, long ms) {
        Timer.builder("switchyard.execution.duration")
                .description("Tool execution latency by route")
                .tag("route", route)
                .tag("outcome", success ? "success" : "failure")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordCacheLookup(boolean hit) {
        Counter.builder("switchyard.cache.lookups")
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    /**
     * @param event "queued", "completed", "retried", "failed" or "removed"
     */
    public void recordQueueEvent(String event) {
        Counter.builder("switchyard.queue.jobs")
                .tag("event", event)
                .register(registry)
                .increment();
    }
}
