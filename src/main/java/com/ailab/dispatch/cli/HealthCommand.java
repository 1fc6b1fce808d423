package com.ailab.dispatch.cli;

import com.ailab.core.health.HealthCheckService;
import com.ailab.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: ailab health
 * <p>
 * Runs all health checks and displays results with colored output.
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
        HealthStatus.Status overall = HealthStatus.worst(checks);
        if (overall == HealthStatus.Status.UP) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components " + overall.name().toLowerCase());
        }
    }
}
