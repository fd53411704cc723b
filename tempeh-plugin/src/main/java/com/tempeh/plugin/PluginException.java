package com.tempeh.plugin;

/**
 * Base of all plugin system failures. Carries the plugin id and source location when known (either may
 * be null, e.g. when a manifest could not be parsed far enough to yield an id).
 */
public class PluginException extends RuntimeException {

    private final String pluginId;
    private final String source;

    public PluginException(String message, String pluginId, String source) {
        super(message);
        this.pluginId = pluginId;
        this.source = source;
    }

    public PluginException(String message, String pluginId, String source, Throwable cause) {
        super(message, cause);
        this.pluginId = pluginId;
        this.source = source;
    }

    public String getPluginId() {
        return pluginId;
    }

    public String getSource() {
        return source;
    }
}
