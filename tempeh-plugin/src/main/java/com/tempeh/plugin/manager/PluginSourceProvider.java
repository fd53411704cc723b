package com.tempeh.plugin.manager;

import com.tempeh.plugin.PluginSource;

import java.util.List;

/**
 * Supplies candidate plugin sources for {@link PluginManager#discover()}. Must not throw; unreadable
 * locations are logged and skipped.
 */
@FunctionalInterface
public interface PluginSourceProvider {

    List<PluginSource> sources();
}
