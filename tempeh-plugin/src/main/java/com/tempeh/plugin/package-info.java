/**
 * Tempeh plugin contracts. Plugins declare capabilities in a {@code plugin.json} manifest and, when they
 * carry code, expose it through a {@link com.tempeh.plugin.PluginProvider} registered in a
 * {@link com.tempeh.plugin.loader.PluginCatalog}.
 * <ul>
 *   <li>{@link com.tempeh.plugin.Plugin} – activate(PluginContext) / deactivate()</li>
 *   <li>{@link com.tempeh.plugin.PluginProvider} – entry point name and plugin factory</li>
 *   <li>{@link com.tempeh.plugin.PluginDescriptor} – immutable id, version, capabilities, keywords, dependencies</li>
 *   <li>{@link com.tempeh.plugin.CapabilityType} – rollback-strategy, validator, command, workflow-extension, hook, provider, custom</li>
 *   <li>{@link com.tempeh.plugin.registry.PluginRegistry} – descriptors indexed by capability and keyword</li>
 *   <li>{@link com.tempeh.plugin.loader.PluginLoader} – manifest, validation, audit, entry point</li>
 *   <li>{@link com.tempeh.plugin.manager.PluginManager} – discovery, dependency order, lifecycle</li>
 *   <li>{@link com.tempeh.plugin.ResourceCleanup} – onExit() when a plugin is unloaded</li>
 * </ul>
 * All failures extend {@link com.tempeh.plugin.PluginException}.
 */
package com.tempeh.plugin;
