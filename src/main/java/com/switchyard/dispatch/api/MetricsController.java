package com.switchyard.dispatch.api;

import com.switchyard.core.metrics.ExportFormat;
import com.switchyard.core.metrics.PerformanceMonitor;
import com.switchyard.core.model.MetricsSnapshot;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for routing performance metrics.
 */
@RestController
@RequestMapping("/api/v1/metrics")
public class MetricsController {

    private final PerformanceMonitor monitor;

    public MetricsController(PerformanceMonitor monitor) {
        this.monitor = monitor;
    }

    /**
     * GET /api/v1/metrics: Current snapshot, same layout as the JSON export.
     */
    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> snapshot() {
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .body(monitor.export(ExportFormat.JSON));
    }

    /**
     * GET /api/v1/metrics/export?format=json|csv: Download the snapshot.
     */
    @GetMapping("/export")
    public ResponseEntity<?> export(@RequestParam(defaultValue = "json") String format) {
        ExportFormat exportFormat;
        try {
            exportFormat = ExportFormat.fromString(format);
        } catch (IllegalArgumentException e) {
            return ApiErrors.badRequest(e.getMessage());
        }
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(exportFormat.contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"switchyard-metrics." + exportFormat.extension() + "\"")
                .body(monitor.export(exportFormat));
    }

    @PostMapping("/reset")
    public ResponseEntity<Map<String, Object>> reset() {
        monitor.reset();
        MetricsSnapshot snapshot = monitor.snapshot();
        return ResponseEntity.ok(Map.of("reset", true, "session_start", snapshot.sessionStart().toString()));
    }
}
