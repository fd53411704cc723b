package com.tempeh.plugin;

/**
 * Executable side of a plugin. Instances are created by a {@link PluginProvider} and driven by the
 * manager: {@link #activate(PluginContext)} when the plugin is enabled, {@link #deactivate()} when it is
 * disabled or removed. A plugin may be activated again after a deactivate.
 * <p>
 * Plugins that hold resources beyond an activation should also implement {@link ResourceCleanup}.
 */
public interface Plugin {

    /**
     * Activates the plugin. Throwing fails the activation; the manager rolls the plugin back and marks it
     * failed.
     *
     * @param context descriptor, configuration and logger for this plugin
     */
    void activate(PluginContext context) throws Exception;

    /** Deactivates the plugin. The descriptor stays registered. */
    void deactivate() throws Exception;
}
