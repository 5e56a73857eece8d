package com.switchyard.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SwitchyardMetricsTest {

    private SimpleMeterRegistry registry;
    private SwitchyardMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new SwitchyardMetrics(registry);
    }

    @Test
    void recordsExecutionTimerPerRouteAndOutcome() {
        metrics.recordExecution("local", true, 120);
        metrics.recordExecution("local", true, 80);
        metrics.recordExecution("remote", false, 900);

        var localOk = registry.find("switchyard.execution.duration")
                .tags("route", "local", "outcome", "success").timer();
        assertNotNull(localOk);
        assertEquals(2, localOk.count());
        assertEquals(200, localOk.totalTime(TimeUnit.MILLISECONDS), 0.001);

        var remoteFailed = registry.find("switchyard.execution.duration")
                .tags("route", "remote", "outcome", "failure").timer();
        assertNotNull(remoteFailed);
        assertEquals(1, remoteFailed.count());
    }

    @Test
    void countsCacheLookups() {
        metrics.recordCacheLookup(true);
        metrics.recordCacheLookup(true);
        metrics.recordCacheLookup(false);

        assertEquals(2.0, registry.get("switchyard.cache.lookups").tag("result", "hit").counter().count());
        assertEquals(1.0, registry.get("switchyard.cache.lookups").tag("result", "miss").counter().count());
    }

    @Test
    void countsQueueEvents() {
        metrics.recordQueueEvent("queued");
        metrics.recordQueueEvent("retried");
        metrics.recordQueueEvent("queued");

        assertEquals(2.0, registry.get("switchyard.queue.jobs").tag("event", "queued").counter().count());
        assertEquals(1.0, registry.get("switchyard.queue.jobs").tag("event", "retried").counter().count());
    }
}
