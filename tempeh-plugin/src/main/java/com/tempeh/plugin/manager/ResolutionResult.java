package com.tempeh.plugin.manager;

import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.loader.LoadedPlugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Dependency order for a batch: plugins that can be enabled, dependencies first, plus the plugins that
 * cannot with their {@link com.tempeh.plugin.PluginDependencyException} or
 * {@link com.tempeh.plugin.DependencyCycleException}.
 */
public final class ResolutionResult {

    private final List<LoadedPlugin> ordered;
    private final Map<String, PluginException> failures;

    ResolutionResult(List<LoadedPlugin> ordered, Map<String, PluginException> failures) {
        this.ordered = List.copyOf(ordered);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public List<LoadedPlugin> getOrdered() {
        return ordered;
    }

    /** Failed plugin id → cause, in lexicographic id order. */
    public Map<String, PluginException> getFailures() {
        return failures;
    }
}
