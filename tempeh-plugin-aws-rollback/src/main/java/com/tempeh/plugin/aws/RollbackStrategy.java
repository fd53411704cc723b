package com.tempeh.plugin.aws;

import java.util.List;
import java.util.Objects;

/**
 * A named rollback strategy contributed under the {@code rollback-strategy} capability.
 * Health-check steps are dropped when health checks are disabled.
 */
public final class RollbackStrategy {

    public static final String GRACEFUL = "aws-graceful-rollback";
    public static final String EMERGENCY = "aws-emergency-rollback";

    private final String name;
    private final String description;
    private final List<RollbackStep> steps;
    private final List<String> warnings;

    RollbackStrategy(String name, String description, List<RollbackStep> steps, List<String> warnings) {
        this.name = Objects.requireNonNull(name, "name");
        this.description = Objects.requireNonNull(description, "description");
        this.steps = List.copyOf(steps);
        this.warnings = List.copyOf(warnings);
    }

    static RollbackStrategy graceful(boolean healthChecks) {
        List<RollbackStep> steps = healthChecks
                ? List.of(new RollbackStep("health-check", "validation", 100),
                        new RollbackStep("drain-connections", "drain", 500),
                        new RollbackStep("terminate-instances", "destruction", 2000),
                        new RollbackStep("cleanup-resources", "cleanup", 300))
                : List.of(new RollbackStep("drain-connections", "drain", 500),
                        new RollbackStep("terminate-instances", "destruction", 2000),
                        new RollbackStep("cleanup-resources", "cleanup", 300));
        return new RollbackStrategy(GRACEFUL, "Graceful AWS resource rollback with health checks", steps, List.of());
    }

    static RollbackStrategy emergency() {
        return new RollbackStrategy(EMERGENCY, "Emergency AWS resource destruction for critical failures",
                List.of(new RollbackStep("force-terminate", "destruction", 1000),
                        new RollbackStep("cleanup-all", "cleanup", 500)),
                List.of("Emergency rollback executed - some resources may be left in inconsistent state"));
    }

    public String getName() { return name; }
    public String getDescription() { return description; }
    public List<RollbackStep> getSteps() { return steps; }
    public List<String> getWarnings() { return warnings; }

    public long getExpectedDurationMillis() {
        return steps.stream().mapToLong(RollbackStep::getDurationMillis).sum();
    }
}
