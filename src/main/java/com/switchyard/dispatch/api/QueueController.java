package com.switchyard.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.switchyard.core.model.JobStatus;
import com.switchyard.core.model.QueueStatus;
import com.switchyard.core.model.RouterException;
import com.switchyard.core.queue.OfflineQueue;
import com.switchyard.core.queue.QueueStats;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST controller for the offline queue: status, job inspection and operator actions.
 */
@RestController
@RequestMapping("/api/v1/queue")
public class QueueController {

    private final OfflineQueue queue;

    public QueueController(OfflineQueue queue) {
        this.queue = queue;
    }

    /**
     * GET /api/v1/queue: Counts per status plus lifetime statistics.
     */
    @GetMapping
    public ResponseEntity<QueueStatusResponse> status() {
        return ResponseEntity.ok(QueueStatusResponse.from(queue.stats()));
    }

    @GetMapping("/jobs")
    public ResponseEntity<?> jobs(@RequestParam(required = false) String status) {
        JobStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = JobStatus.fromString(status);
            } catch (IllegalArgumentException e) {
                return ApiErrors.badRequest("Invalid status: " + status);
            }
        }
        List<JobResponse> jobs = queue.listJobs(filter).stream().map(JobResponse::from).toList();
        return ResponseEntity.ok(jobs);
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<JobResponse> job(@PathVariable String id) {
        return queue.getJob(id)
                .map(j -> ResponseEntity.ok(JobResponse.from(j)))
                .orElse(ResponseEntity.notFound().build());
    }

    /**
     * POST /api/v1/queue/jobs/{id}/retry: Re-queue a failed job.
     */
    @PostMapping("/jobs/{id}/retry")
    public ResponseEntity<?> retry(@PathVariable String id) {
        try {
            return ResponseEntity.ok(JobResponse.from(queue.retryJob(id)));
        } catch (RouterException e) {
            return ApiErrors.of(e);
        }
    }

    @PostMapping("/retry-failed")
    public ResponseEntity<Map<String, Integer>> retryFailed() {
        return ResponseEntity.ok(Map.of("retried", queue.retryAllFailed()));
    }

    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<?> remove(@PathVariable String id) {
        try {
            queue.removeJob(id);
            return ResponseEntity.noContent().build();
        } catch (RouterException e) {
            return ApiErrors.of(e);
        }
    }

    @DeleteMapping("/completed")
    public ResponseEntity<Map<String, Integer>> clearCompleted() {
        return ResponseEntity.ok(Map.of("removed", queue.clearCompleted()));
    }

    @DeleteMapping("/failed")
    public ResponseEntity<Map<String, Integer>> clearFailed() {
        return ResponseEntity.ok(Map.of("removed", queue.clearFailed()));
    }

    /**
     * POST /api/v1/queue/sync: Start a drain pass now.
     */
    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> sync() {
        boolean accepted = queue.requestDrain();
        if (!accepted) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body(Map.of("error", "Queue is stopped"));
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of("sync", "requested"));
    }

    public record QueueStatusResponse(
        long queued,
        long processing,
        long completed,
        long failed,
        @JsonProperty("total_processed") long totalProcessed,
        @JsonProperty("total_succeeded") long totalSucceeded,
        @JsonProperty("total_failed") long totalFailed,
        @JsonProperty("last_sync_attempt") Instant lastSyncAttempt,
        @JsonProperty("last_successful_sync") Instant lastSuccessfulSync,
        boolean draining
    ) {
        static QueueStatusResponse from(QueueStats stats) {
            QueueStatus s = stats.status();
            return new QueueStatusResponse(s.queued(), s.processing(), s.completed(), s.failed(),
                    stats.processed(), stats.succeeded(), stats.failed(),
                    stats.lastSyncAttempt(), stats.lastSuccessfulSync(), stats.draining());
        }
    }
}
