package com.switchyard.dispatch.cli;

import com.switchyard.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: switchyard health
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        var checks = healthCheckService.checkAll();
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        System.out.println("──────────────────────────────────");
        switch (HealthCheckService.overall(checks)) {
            case UP -> ConsoleOutput.success("Overall: all systems operational");
            case DEGRADED -> ConsoleOutput.warn("Overall: degraded");
            case DOWN -> ConsoleOutput.error("Overall: one or more components down");
        }
    }
}
