package com.tempeh.plugin;

import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.Map;

/**
 * What a plugin sees at activation time.
 */
public interface PluginContext {

    PluginDescriptor getDescriptor();

    /** Plugin directory for directory sources; null for classpath plugins. */
    Path getWorkingDirectory();

    /** Manifest {@code configuration} defaults. Never null; unmodifiable. */
    Map<String, Object> getConfiguration();

    /** Logger named after the plugin id ({@code tempeh.plugin.<id>}). */
    Logger getLogger();
}
