package com.podmachine.dispatch.cli;

import com.podmachine.core.health.HealthCheckService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * CLI command: podmachine health
 * <p>
 * Checks the local machine store and cluster connectivity and displays
 * results with colored output.
 */
@Command(name = "health", mixinStandardHelpOptions = true, description = "Check store and cluster health")
@Component
public class HealthCommand implements Callable<Integer> {

    @Mixin
    private ClusterOptions clusterOptions = new ClusterOptions();

    private final HealthCheckService healthCheckService;

    public HealthCommand(HealthCheckService healthCheckService) {
        this.healthCheckService = healthCheckService;
    }

    @Override
    public Integer call() {
        var checks = healthCheckService.checkAll(clusterOptions.kubeconfigToken());
        boolean anyDown = false;

        for (var check : checks) {
            String label = check.component() + ": " + check.detail();
            switch (check.status()) {
                case UP -> ConsoleOutput.success(label);
                case DOWN -> {
                    ConsoleOutput.error(label);
                    anyDown = true;
                }
                case DEGRADED -> ConsoleOutput.info(label);
            }
        }

        System.out.println("──────────────────────────────────");
        if (anyDown) {
            ConsoleOutput.error("Overall: one or more components down");
            return 1;
        }
        ConsoleOutput.success("Overall: ready");
        return 0;
    }
}
