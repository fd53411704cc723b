package com.tempeh.plugin;

public class PluginNotFoundException extends PluginException {

    public PluginNotFoundException(String pluginId) {
        super("Plugin not found: " + pluginId, pluginId, null);
    }
}
