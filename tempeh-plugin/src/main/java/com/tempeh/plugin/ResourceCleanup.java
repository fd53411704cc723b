package com.tempeh.plugin;

/**
 * Contract for releasing resources when a plugin is unloaded.
 * Plugins that hold resources (connections, threads, caches) should implement this and release them in
 * {@link #onExit()}. The loader invokes {@code onExit()} once when the plugin's handle is released, after
 * any deactivation.
 */
public interface ResourceCleanup {

    /**
     * Called once when the plugin is unloaded. Exceptions are logged by the caller and not rethrown so
     * other plugins still get a chance to clean up.
     */
    void onExit();
}
