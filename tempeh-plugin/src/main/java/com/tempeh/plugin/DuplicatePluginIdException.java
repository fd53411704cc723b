package com.tempeh.plugin;

/**
 * A plugin id is already registered, tracked, or being loaded from a different source.
 */
public class DuplicatePluginIdException extends PluginException {

    public DuplicatePluginIdException(String pluginId) {
        super("Plugin already registered: " + pluginId, pluginId, null);
    }

    public DuplicatePluginIdException(String message, String pluginId, String source) {
        super(message, pluginId, source);
    }
}
