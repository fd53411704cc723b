package com.tempeh.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration loaded from environment variables for the Tempeh plugin system.
 * <p>
 * Directories: TEMPEH_HOME (default {@code ~/.tempeh}), TEMPEH_PLUGINS_DIR (default {@code $TEMPEH_HOME/plugins}),
 * TEMPEH_PLUGIN_STATE_FILE (default {@code $TEMPEH_HOME/plugins.json}).
 * <p>
 * Loading: TEMPEH_PLUGIN_LOAD_CONCURRENCY, TEMPEH_PLUGIN_LOAD_TIMEOUT_SECONDS.
 * Audit: TEMPEH_AUDIT_ENABLED, TEMPEH_AUDIT_SEVERITY_THRESHOLD.
 */
public final class TempehConfig {

    private static final Logger log = LoggerFactory.getLogger(TempehConfig.class);

    private static final String ENV_HOME = "TEMPEH_HOME";
    private static final String ENV_PLUGINS_DIR = "TEMPEH_PLUGINS_DIR";
    private static final String ENV_PLUGIN_STATE_FILE = "TEMPEH_PLUGIN_STATE_FILE";
    private static final String ENV_LOAD_CONCURRENCY = "TEMPEH_PLUGIN_LOAD_CONCURRENCY";
    private static final String ENV_LOAD_TIMEOUT_SECONDS = "TEMPEH_PLUGIN_LOAD_TIMEOUT_SECONDS";
    private static final String ENV_AUDIT_ENABLED = "TEMPEH_AUDIT_ENABLED";
    private static final String ENV_AUDIT_SEVERITY_THRESHOLD = "TEMPEH_AUDIT_SEVERITY_THRESHOLD";

    private static final String DEFAULT_HOME_DIR_NAME = ".tempeh";
    private static final String DEFAULT_PLUGINS_DIR_NAME = "plugins";
    private static final String DEFAULT_STATE_FILE_NAME = "plugins.json";
    private static final int DEFAULT_LOAD_CONCURRENCY = 4;
    private static final int DEFAULT_LOAD_TIMEOUT_SECONDS = 30;
    private static final boolean DEFAULT_AUDIT_ENABLED = true;
    private static final String DEFAULT_AUDIT_SEVERITY_THRESHOLD = "HIGH";

    private final Path homeDir;
    private final Path pluginsDir;
    private final Path pluginStateFile;
    private final int loadConcurrency;
    private final int loadTimeoutSeconds;
    private final boolean auditEnabled;
    private final String auditSeverityThreshold;

    private TempehConfig(Builder b) {
        this.homeDir = b.homeDir != null ? b.homeDir : defaultHomeDir();
        this.pluginsDir = b.pluginsDir != null ? b.pluginsDir : homeDir.resolve(DEFAULT_PLUGINS_DIR_NAME);
        this.pluginStateFile = b.pluginStateFile != null ? b.pluginStateFile : homeDir.resolve(DEFAULT_STATE_FILE_NAME);
        this.loadConcurrency = b.loadConcurrency;
        this.loadTimeoutSeconds = b.loadTimeoutSeconds;
        this.auditEnabled = b.auditEnabled;
        this.auditSeverityThreshold = b.auditSeverityThreshold;
    }

    /** Base directory for Tempeh state (TEMPEH_HOME). Default {@code ~/.tempeh}. */
    public Path getHomeDir() {
        return homeDir;
    }

    /** Directory scanned for plugin directories, each holding a {@code plugin.json} (TEMPEH_PLUGINS_DIR). */
    public Path getPluginsDir() {
        return pluginsDir;
    }

    /** JSON file that records installed plugin sources and their enabled flag (TEMPEH_PLUGIN_STATE_FILE). */
    public Path getPluginStateFile() {
        return pluginStateFile;
    }

    /** Maximum number of plugin loads (manifest read + audit) running at the same time. Default 4. */
    public int getLoadConcurrency() {
        return loadConcurrency;
    }

    /** Seconds a single plugin load may take before it is cancelled; 0 means no limit. Default 30. */
    public int getLoadTimeoutSeconds() {
        return loadTimeoutSeconds;
    }

    /** Whether plugin sources are audited before activation (TEMPEH_AUDIT_ENABLED). Default true. */
    public boolean isAuditEnabled() {
        return auditEnabled;
    }

    /**
     * Lowest finding severity that fails an audit (TEMPEH_AUDIT_SEVERITY_THRESHOLD): LOW, MEDIUM, HIGH or CRITICAL.
     * Default HIGH. Parsed by the audit implementation.
     */
    public String getAuditSeverityThreshold() {
        return auditSeverityThreshold;
    }

    public static TempehConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Builds configuration from the given variables (e.g. {@link System#getenv()}). Missing or invalid values
     * fall back to defaults; invalid numbers are logged at warn level.
     */
    public static TempehConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Path home = getPath(env, ENV_HOME, defaultHomeDir());
        return builder()
                .homeDir(home)
                .pluginsDir(getPath(env, ENV_PLUGINS_DIR, home.resolve(DEFAULT_PLUGINS_DIR_NAME)))
                .pluginStateFile(getPath(env, ENV_PLUGIN_STATE_FILE, home.resolve(DEFAULT_STATE_FILE_NAME)))
                .loadConcurrency(parsePositiveInt(env, ENV_LOAD_CONCURRENCY, DEFAULT_LOAD_CONCURRENCY, 1))
                .loadTimeoutSeconds(parsePositiveInt(env, ENV_LOAD_TIMEOUT_SECONDS, DEFAULT_LOAD_TIMEOUT_SECONDS, 0))
                .auditEnabled(parseBoolean(env.get(ENV_AUDIT_ENABLED), DEFAULT_AUDIT_ENABLED))
                .auditSeverityThreshold(getEnv(env, ENV_AUDIT_SEVERITY_THRESHOLD, DEFAULT_AUDIT_SEVERITY_THRESHOLD))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Path defaultHomeDir() {
        return Paths.get(System.getProperty("user.home", "."), DEFAULT_HOME_DIR_NAME);
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parsePositiveInt(Map<String, String> env, String key, int defaultValue, int min) {
        String value = env.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < min) {
                log.warn("{}={} is below the minimum {}; using default {}", key, value, min, defaultValue);
                return defaultValue;
            }
            return parsed;
        } catch (NumberFormatException e) {
            log.warn("{}={} is not a number; using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private static Path getPath(Map<String, String> env, String key, Path defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? Paths.get(v.trim()) : defaultValue;
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private Path homeDir;
        private Path pluginsDir;
        private Path pluginStateFile;
        private int loadConcurrency = DEFAULT_LOAD_CONCURRENCY;
        private int loadTimeoutSeconds = DEFAULT_LOAD_TIMEOUT_SECONDS;
        private boolean auditEnabled = DEFAULT_AUDIT_ENABLED;
        private String auditSeverityThreshold = DEFAULT_AUDIT_SEVERITY_THRESHOLD;

        public Builder homeDir(Path homeDir) {
            this.homeDir = homeDir;
            return this;
        }

        public Builder pluginsDir(Path pluginsDir) {
            this.pluginsDir = pluginsDir;
            return this;
        }

        public Builder pluginStateFile(Path pluginStateFile) {
            this.pluginStateFile = pluginStateFile;
            return this;
        }

        public Builder loadConcurrency(int loadConcurrency) {
            if (loadConcurrency < 1) {
                throw new IllegalArgumentException("loadConcurrency must be >= 1: " + loadConcurrency);
            }
            this.loadConcurrency = loadConcurrency;
            return this;
        }

        public Builder loadTimeoutSeconds(int loadTimeoutSeconds) {
            this.loadTimeoutSeconds = Math.max(0, loadTimeoutSeconds);
            return this;
        }

        public Builder auditEnabled(boolean auditEnabled) {
            this.auditEnabled = auditEnabled;
            return this;
        }

        public Builder auditSeverityThreshold(String auditSeverityThreshold) {
            this.auditSeverityThreshold = auditSeverityThreshold != null ? auditSeverityThreshold : DEFAULT_AUDIT_SEVERITY_THRESHOLD;
            return this;
        }

        public TempehConfig build() {
            return new TempehConfig(this);
        }
    }
}
