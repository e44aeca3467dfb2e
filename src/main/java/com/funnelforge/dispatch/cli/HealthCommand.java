package com.funnelforge.dispatch.cli;

import com.funnelforge.core.health.HealthCheckService;
import com.funnelforge.core.health.HealthStatus;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI command: funnelforge health
 * <p>
 * Runs all health checks and prints them with colored output. Exits 1 if any component is down.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check engine health")
@Component
public class HealthCommand implements Callable<Integer> {

    private final HealthCheckService healthCheckService;

    public HealthCommand(@Autowired(required = false) HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        if (healthCheckService == null) {
            ConsoleOutput.error("Health check service not available");
            return 1;
        }

        List<HealthStatus> checks = healthCheckService.checkAll();
        for (HealthStatus check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.info(label);
            }
        }

        HealthStatus.Status overall = HealthCheckService.overallStatus(checks);
        System.out.println("──────────────────────────────────");
        if (overall == HealthStatus.Status.UP) {
            ConsoleOutput.success("Overall: all systems operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
        return overall == HealthStatus.Status.DOWN ? 1 : 0;
    }
}
