package com.lad.dispatch.cli;

import com.lad.core.health.HealthCheckService;
import com.lad.core.health.HealthStatus;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: lad health
 * <p>
 * Checks credentials, both reviewer models and the project index, and prints the
 * results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check system health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Option(names = "--project-root", description = "Project root to probe for a project index (default: current directory)")
    Path projectRoot;

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        Path root = projectRoot != null ? projectRoot : Path.of("").toAbsolutePath();
        var checks = healthCheckService.checkAll(root);
        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> ConsoleOutput.error(label);
                case DEGRADED -> ConsoleOutput.warn(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (HealthStatus.anyDown(checks)) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        ConsoleOutput.success("Overall: ready to review");
        return 0;
    }
}
