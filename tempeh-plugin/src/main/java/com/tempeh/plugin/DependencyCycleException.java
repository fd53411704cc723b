package com.tempeh.plugin;

import java.util.List;

/**
 * The plugin is a member of a dependency cycle. Every member of the cycle fails with this exception.
 */
public class DependencyCycleException extends PluginException {

    private final List<String> cycle;

    public DependencyCycleException(String pluginId, List<String> cycle) {
        super("Circular dependency: " + String.join(" -> ", cycle), pluginId, null);
        this.cycle = List.copyOf(cycle);
    }

    /** Cycle members in lexicographic order. */
    public List<String> getCycle() {
        return cycle;
    }
}
