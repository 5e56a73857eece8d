package com.switchyard.core.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.switchyard.core.model.MetricsSnapshot;
import com.switchyard.core.model.Route;
import com.switchyard.core.model.RouteStats;
import com.switchyard.core.model.ToolStats;
import org.springframework.stereotype.Component;
import org.supercsv.io.CsvListWriter;
import org.supercsv.io.ICsvListWriter;
import org.supercsv.prefs.CsvPreference;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders a {@link MetricsSnapshot} as JSON or CSV.
 * <p>
 * The CSV layout has three sections separated by a blank line:
 * {@code Summary}, {@code Routing} and {@code Top Tools}.
 */
@Component
public class MetricsExporter {

    static final String EXPORT_VERSION = "1.0";

    private final ObjectMapper objectMapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public byte[] export(MetricsSnapshot snapshot, ExportFormat format) {
        return switch (format) {
            case JSON -> toJson(snapshot);
            case CSV -> toCsv(snapshot);
        };
    }

    byte[] toJson(MetricsSnapshot snapshot) {
        var root = new LinkedHashMap<String, Object>();
        root.put("exported_at", snapshot.takenAt());
        root.put("version", EXPORT_VERSION);
        root.put("session_start", snapshot.sessionStart());
        root.put("uptime_seconds", snapshot.uptime().toSeconds());

        var summary = new LinkedHashMap<String, Object>();
        summary.put("total_executions", snapshot.totalExecutions());
        summary.put("cache_hit_count", snapshot.cacheHitCount());
        summary.put("cache_miss_count", snapshot.cacheMissCount());
        summary.put("cache_hit_rate", round(snapshot.cacheHitRate()));
        summary.put("queue_depth", snapshot.queueDepth());
        summary.put("last_sync_time", snapshot.lastSyncTime());
        root.put("summary", summary);

        var routes = new LinkedHashMap<String, Object>();
        for (Route route : Route.values()) {
            routes.put(route.key(), routeJson(snapshot.route(route)));
        }
        root.put("routes", routes);

        List<Map<String, Object>> top = new ArrayList<>();
        for (ToolStats tool : snapshot.topTools()) {
            var t = new LinkedHashMap<String, Object>();
            t.put("tool", tool.tool());
            t.put("count", tool.count());
            t.put("avg_latency_ms", tool.averageLatencyMs());
            t.put("errors", tool.errors());
            t.put("last_execution", tool.lastExecution());
            top.add(t);
        }
        root.put("top_tools", top);

        try {
            return objectMapper.writeValueAsBytes(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render metrics as JSON", e);
        }
    }

    byte[] toCsv(MetricsSnapshot snapshot) {
        var out = new StringWriter();
        try (ICsvListWriter csv = new CsvListWriter(out, CsvPreference.STANDARD_PREFERENCE)) {
            csv.write("Summary");
            csv.writeHeader("Metric", "Value");
            csv.write("Exported At", snapshot.takenAt());
            csv.write("Session Start", snapshot.sessionStart());
            csv.write("Total Executions", snapshot.totalExecutions());
            csv.write("Cache Hits", snapshot.cacheHitCount());
            csv.write("Cache Misses", snapshot.cacheMissCount());
            csv.write("Cache Hit Rate", round(snapshot.cacheHitRate()) + "%");
            csv.write("Queue Depth", snapshot.queueDepth());
            csv.write("Last Sync", snapshot.lastSyncTime() == null ? "" : snapshot.lastSyncTime());
            csv.writeComment("");

            csv.write("Routing");
            csv.writeHeader("Route", "Count", "Success", "Failure", "Avg Latency (ms)",
                    "Min Latency (ms)", "Max Latency (ms)", "Success Rate");
            for (Route route : Route.values()) {
                RouteStats s = snapshot.route(route);
                csv.write(route.key(), s.count(), s.successCount(), s.failureCount(),
                        s.averageLatencyMs(), s.minLatencyMs(), s.maxLatencyMs(),
                        round(s.successRate()) + "%");
            }
            csv.writeComment("");

            csv.write("Top Tools");
            csv.writeHeader("Tool", "Count", "Avg Latency (ms)", "Errors", "Last Execution");
            for (ToolStats tool : snapshot.topTools()) {
                Instant last = tool.lastExecution();
                csv.write(tool.tool(), tool.count(), tool.averageLatencyMs(), tool.errors(),
                        last == null ? "" : last);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render metrics as CSV", e);
        }
        return out.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static Map<String, Object> routeJson(RouteStats s) {
        var m = new LinkedHashMap<String, Object>();
        m.put("count", s.count());
        m.put("success_count", s.successCount());
        m.put("failure_count", s.failureCount());
        m.put("total_latency_ms", s.totalLatencyMs());
        m.put("avg_latency_ms", s.averageLatencyMs());
        m.put("min_latency_ms", s.minLatencyMs());
        m.put("max_latency_ms", s.maxLatencyMs());
        m.put("success_rate", round(s.successRate()));
        return m;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
