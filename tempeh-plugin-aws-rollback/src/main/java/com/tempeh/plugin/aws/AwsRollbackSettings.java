package com.tempeh.plugin.aws;

import com.tempeh.plugin.manifest.ValidationResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Plugin settings read from the manifest {@code configuration} block. Missing keys take the defaults;
 * values of the wrong type are validation errors.
 */
public final class AwsRollbackSettings {

    public static final String AWS_REGION = "awsRegion";
    public static final String ENABLE_HEALTH_CHECKS = "enableHealthChecks";
    public static final String MAX_RETRIES = "maxRetries";
    public static final String TIMEOUT_SECONDS = "timeoutSeconds";

    public static final String DEFAULT_REGION = "us-east-1";
    public static final boolean DEFAULT_HEALTH_CHECKS = true;
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final int DEFAULT_TIMEOUT_SECONDS = 300;

    static final int MIN_TIMEOUT_SECONDS = 60;
    static final int RETRY_WARNING_THRESHOLD = 10;

    private final String awsRegion;
    private final boolean enableHealthChecks;
    private final int maxRetries;
    private final int timeoutSeconds;
    private final List<String> typeErrors;

    private AwsRollbackSettings(String awsRegion, boolean enableHealthChecks, int maxRetries, int timeoutSeconds,
                                List<String> typeErrors) {
        this.awsRegion = awsRegion;
        this.enableHealthChecks = enableHealthChecks;
        this.maxRetries = maxRetries;
        this.timeoutSeconds = timeoutSeconds;
        this.typeErrors = List.copyOf(typeErrors);
    }

    public static AwsRollbackSettings defaults() {
        return from(Map.of());
    }

    public static AwsRollbackSettings from(Map<String, Object> configuration) {
        Map<String, Object> cfg = configuration != null ? configuration : Map.of();
        List<String> errors = new ArrayList<>();
        String region = stringValue(cfg, AWS_REGION, DEFAULT_REGION, errors);
        boolean healthChecks = booleanValue(cfg, ENABLE_HEALTH_CHECKS, DEFAULT_HEALTH_CHECKS, errors);
        int retries = intValue(cfg, MAX_RETRIES, DEFAULT_MAX_RETRIES, errors);
        int timeout = intValue(cfg, TIMEOUT_SECONDS, DEFAULT_TIMEOUT_SECONDS, errors);
        return new AwsRollbackSettings(region, healthChecks, retries, timeout, errors);
    }

    /**
     * Errors: wrong value types, {@code timeoutSeconds} below 60. Warnings: {@code maxRetries} above 10.
     */
    public ValidationResult validate() {
        List<String> errors = new ArrayList<>(typeErrors);
        List<String> warnings = new ArrayList<>();
        if (timeoutSeconds < MIN_TIMEOUT_SECONDS) {
            errors.add("Timeout must be at least " + MIN_TIMEOUT_SECONDS + " seconds (timeoutSeconds=" + timeoutSeconds + ")");
        }
        if (maxRetries < 0) {
            errors.add("maxRetries must not be negative");
        } else if (maxRetries > RETRY_WARNING_THRESHOLD) {
            warnings.add("High retry count may cause long delays (maxRetries=" + maxRetries + ")");
        }
        return ValidationResult.of(errors, warnings);
    }

    public String getAwsRegion() { return awsRegion; }
    public boolean isEnableHealthChecks() { return enableHealthChecks; }
    public int getMaxRetries() { return maxRetries; }
    public int getTimeoutSeconds() { return timeoutSeconds; }

    private static String stringValue(Map<String, Object> cfg, String key, String defaultValue, List<String> errors) {
        Object v = cfg.get(key);
        if (v == null) return defaultValue;
        if (v instanceof String && !((String) v).isBlank()) return ((String) v).trim();
        errors.add(key + " must be a non-blank string");
        return defaultValue;
    }

    private static boolean booleanValue(Map<String, Object> cfg, String key, boolean defaultValue, List<String> errors) {
        Object v = cfg.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof String && ("true".equalsIgnoreCase((String) v) || "false".equalsIgnoreCase((String) v))) {
            return Boolean.parseBoolean((String) v);
        }
        errors.add(key + " must be a boolean");
        return defaultValue;
    }

    private static int intValue(Map<String, Object> cfg, String key, int defaultValue, List<String> errors) {
        Object v = cfg.get(key);
        if (v == null) return defaultValue;
        if (v instanceof Number) return ((Number) v).intValue();
        if (v instanceof String) {
            try {
                return Integer.parseInt(((String) v).trim());
            } catch (NumberFormatException e) {
                errors.add(key + " must be a number, got '" + v + "'");
                return defaultValue;
            }
        }
        errors.add(key + " must be a number");
        return defaultValue;
    }
}
