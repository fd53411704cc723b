package com.tempeh.plugin.aws;

import com.tempeh.plugin.Plugin;
import com.tempeh.plugin.PluginContext;
import com.tempeh.plugin.ResourceCleanup;
import com.tempeh.plugin.manifest.ValidationResult;
import org.slf4j.Logger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * AWS rollback plugin. Activation reads and validates the configuration; strategies, the resource validator
 * and the health check are only available while the plugin is active.
 */
public final class AwsRollbackPlugin implements Plugin, ResourceCleanup {

    public static final String HEALTH_CHECK_COMMAND = "aws-health-check";

    private volatile AwsRollbackSettings settings;
    private volatile List<RollbackStrategy> strategies = List.of();
    private volatile Logger logger;
    private final AwsResourceValidator resourceValidator = new AwsResourceValidator();

    @Override
    public void activate(PluginContext context) {
        AwsRollbackSettings parsed = AwsRollbackSettings.from(context.getConfiguration());
        ValidationResult result = parsed.validate();
        if (!result.isValid()) {
            throw new IllegalArgumentException("Invalid aws-rollback configuration: " + String.join("; ", result.getErrors()));
        }
        Logger log = context.getLogger();
        for (String warning : result.getWarnings()) {
            log.warn("{}", warning);
        }
        this.logger = log;
        this.strategies = List.of(RollbackStrategy.graceful(parsed.isEnableHealthChecks()), RollbackStrategy.emergency());
        this.settings = parsed;
        log.info("AWS rollback plugin active: region={}, healthChecks={}, maxRetries={}, timeoutSeconds={}",
                parsed.getAwsRegion(), parsed.isEnableHealthChecks(), parsed.getMaxRetries(), parsed.getTimeoutSeconds());
    }

    @Override
    public void deactivate() {
        settings = null;
        strategies = List.of();
    }

    @Override
    public void onExit() {
        logger = null;
    }

    public boolean isActive() {
        return settings != null;
    }

    /** Settings in effect; throws when the plugin is not active. */
    public AwsRollbackSettings getSettings() {
        AwsRollbackSettings s = settings;
        if (s == null) {
            throw new IllegalStateException("aws-rollback plugin is not active");
        }
        return s;
    }

    /** Rollback strategies; empty unless active. */
    public List<RollbackStrategy> getStrategies() {
        return strategies;
    }

    /** Strategy by name, or null. */
    public RollbackStrategy getStrategy(String name) {
        for (RollbackStrategy s : strategies) {
            if (s.getName().equals(name)) {
                return s;
            }
        }
        return null;
    }

    public AwsResourceValidator getResourceValidator() {
        getSettings();
        return resourceValidator;
    }

    /**
     * Health status per resource group for a resource id (or "all") in the given region; region defaults to
     * the configured one. Status values are static until an AWS client is wired in.
     */
    public Map<String, String> healthCheck(String resourceId, String region) {
        AwsRollbackSettings s = getSettings();
        String target = resourceId == null || resourceId.isBlank() ? "all" : resourceId;
        String effectiveRegion = region == null || region.isBlank() ? s.getAwsRegion() : region;
        Logger log = logger;
        if (log != null) {
            log.info("Checking AWS resource health in region {} for {}", effectiveRegion, target);
        }
        Map<String, String> status = new LinkedHashMap<>();
        status.put("ec2-instances", "healthy");
        status.put("rds-databases", "healthy");
        status.put("load-balancers", s.isEnableHealthChecks() ? "1 unhealthy" : "unchecked");
        status.put("auto-scaling-groups", "healthy");
        return status;
    }
}
