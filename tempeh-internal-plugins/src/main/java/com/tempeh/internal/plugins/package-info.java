/**
 * Bootstrap for the plugin system: built-in providers, the configured audit service and plugin sources,
 * wired into a {@link com.tempeh.plugin.manager.PluginManager} by {@link com.tempeh.internal.plugins.InternalPlugins}.
 */
package com.tempeh.internal.plugins;
