package com.tempeh.plugin;

/**
 * A dependency is missing, outside the required version range, failed itself, or (for disable/remove)
 * still has enabled dependents.
 */
public class PluginDependencyException extends PluginException {

    private final String dependencyId;

    public PluginDependencyException(String message, String pluginId, String dependencyId) {
        super(message, pluginId, null);
        this.dependencyId = dependencyId;
    }

    /** The dependency (or dependent, for disable/remove refusals) that caused the failure. */
    public String getDependencyId() {
        return dependencyId;
    }
}
