package com.switchyard.dispatch.cli;

import com.switchyard.core.metrics.ExportFormat;
import com.switchyard.core.metrics.PerformanceMonitor;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * CLI command: switchyard metrics [--format json|csv] [--output FILE]
 */
@Command(name = "metrics", mixinStandardHelpOptions = true, description = "Export performance metrics")
@Component
public class MetricsCommand implements Runnable {

    @Option(names = {"--format", "-f"}, description = "json or csv (default: ${DEFAULT-VALUE})",
            defaultValue = "json")
    private String format;

    @Option(names = {"--output", "-o"}, description = "Write to this file instead of stdout")
    private Path output;

    private final PerformanceMonitor monitor;

    public MetricsCommand(PerformanceMonitor monitor) {
        this.monitor = monitor;
    }

    @Override
    public void run() {
        ExportFormat exportFormat;
        try {
            exportFormat = ExportFormat.fromString(format);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return;
        }
        byte[] data = monitor.export(exportFormat);
        if (output == null) {
            System.out.println(new String(data, StandardCharsets.UTF_8));
            return;
        }
        try {
            Files.write(output, data);
            ConsoleOutput.success("Metrics written to " + output);
        } catch (IOException e) {
            ConsoleOutput.error("Cannot write " + output + ": " + e.getMessage());
        }
    }
}
