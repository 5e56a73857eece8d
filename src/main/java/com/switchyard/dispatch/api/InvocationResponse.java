package com.switchyard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.switchyard.core.model.ExecutionOutcome;

import java.time.Instant;

/**
 * JSON response for a tool invocation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record InvocationResponse(
    String tool,
    String status,
    String route,
    Object result,
    @JsonProperty("latency_ms") long latencyMs,
    @JsonProperty("cached_at") Instant cachedAt,
    @JsonProperty("job_id") String jobId
) {

    public static InvocationResponse from(String tool, ExecutionOutcome outcome) {
        return new InvocationResponse(
                tool,
                outcome.isDeferred() ? "deferred" : "completed",
                outcome.route().key(),
                outcome.result(),
                outcome.latencyMs(),
                outcome.cachedAt(),
                outcome.jobId());
    }
}
