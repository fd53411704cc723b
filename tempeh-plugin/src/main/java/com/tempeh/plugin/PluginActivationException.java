package com.tempeh.plugin;

/**
 * {@link Plugin#activate(PluginContext)} or {@link Plugin#deactivate()} threw.
 */
public class PluginActivationException extends PluginException {

    public PluginActivationException(String message, String pluginId, Throwable cause) {
        super(message, pluginId, null, cause);
    }
}
