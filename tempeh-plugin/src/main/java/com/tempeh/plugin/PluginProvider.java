package com.tempeh.plugin;

/**
 * Supplies the executable entry point of a plugin. Providers are registered explicitly in a
 * {@link com.tempeh.plugin.loader.PluginCatalog}; the loader matches a manifest's {@code entryPoint}
 * (or, when absent, its id) against {@link #getEntryPoint()}. Nothing is instantiated reflectively.
 */
public interface PluginProvider {

    /**
     * Entry point name (e.g. "aws-rollback"). Must match the manifest {@code entryPoint} or plugin id.
     */
    String getEntryPoint();

    /**
     * Creates a new plugin instance. Called once per load; the instance performs no work until
     * {@link Plugin#activate(PluginContext)}.
     */
    Plugin createPlugin();

    /**
     * Provider version, for diagnostics only. The plugin version comes from the manifest.
     */
    default String getVersion() {
        return "1.0.0";
    }

    /**
     * Whether this provider should be added to the catalog. Override to skip registration (e.g. when a
     * required environment variable is unset).
     */
    default boolean isEnabled() {
        return true;
    }
}
