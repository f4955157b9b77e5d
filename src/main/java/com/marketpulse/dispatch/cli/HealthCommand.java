package com.marketpulse.dispatch.cli;

import com.marketpulse.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: marketpulse health
 * <p>
 * Runs the checkpoint store and provider checks and prints each verdict.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check pipeline health")
@Component
public class HealthCommand implements Runnable {

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();

        boolean allUp = true;
        for (var check : healthCheckService.checkAll()) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    allUp = false;
                }
                case DEGRADED -> {
                    ConsoleOutput.warn(label);
                    allUp = false;
                }
            }
        }

        System.out.println("──────────────────────────────────");
        if (allUp) {
            ConsoleOutput.success("Overall: all components operational");
        } else {
            ConsoleOutput.error("Overall: one or more components degraded or down");
        }
    }
}
