package com.switchyard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.switchyard.core.model.QueuedJob;

import java.time.Instant;
import java.util.Map;

/**
 * JSON view of a queued job.
 */
public record JobResponse(
    String id,
    String tool,
    String status,
    int priority,
    int attempts,
    @JsonProperty("max_attempts") int maxAttempts,
    @JsonProperty("last_error") String lastError,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt,
    @JsonProperty("next_attempt_at") Instant nextAttemptAt,
    String fingerprint,
    Map<String, Object> parameters,
    Object result
) {

    public static JobResponse from(QueuedJob job) {
        return new JobResponse(job.id(), job.tool(), job.status().key(), job.priority(),
                job.attempts(), job.maxAttempts(), job.lastError(), job.createdAt(), job.updatedAt(),
                job.nextAttemptAt(), job.fingerprint(), job.parameters(), job.result());
    }
}
