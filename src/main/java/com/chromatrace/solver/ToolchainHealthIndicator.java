package com.chromatrace.solver;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Actuator health indicator for the external toolchain.
 * Reports the resolved paths and goes DOWN if a resolved executable has since disappeared.
 */
@Component
public class ToolchainHealthIndicator implements HealthIndicator {

    private final SolverDriver solverDriver;

    public ToolchainHealthIndicator(SolverDriver solverDriver) {
        this.solverDriver = solverDriver;
    }

    @Override
    public Health health() {
        Map<String, String> details = solverDriver.describe();
        if (details.isEmpty()) {
            return Health.unknown().withDetail("reason", "driver does not describe its toolchain").build();
        }

        var builder = Health.up().withDetails(details);
        for (String key : new String[] {"compiler", "solver"}) {
            String location = details.get(key);
            if (location != null && !Files.isExecutable(Path.of(location))) {
                builder.down().withDetail(key + "Status", "missing: " + location);
            }
        }
        return builder.build();
    }
}
