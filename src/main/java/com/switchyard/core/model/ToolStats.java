package com.switchyard.core.model;

import java.time.Instant;

/**
 * Per-tool execution counters.
 */
public record ToolStats(
    String tool,
    long count,
    long totalLatencyMs,
    long errors,
    Instant lastExecution
) {

    public long averageLatencyMs() {
        return count > 0 ? Math.round((double) totalLatencyMs / count) : 0;
    }
}
