package com.tempeh.plugin.manager;

import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.loader.LoadedPlugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of {@link PluginManager#loadAll}: validated plugins in candidate order and per-source failures.
 */
public final class LoadReport {

    private final List<LoadedPlugin> loaded;
    private final Map<PluginSource, PluginException> failures;

    LoadReport(List<LoadedPlugin> loaded, Map<PluginSource, PluginException> failures) {
        this.loaded = List.copyOf(loaded);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public List<LoadedPlugin> getLoaded() {
        return loaded;
    }

    public Map<PluginSource, PluginException> getFailures() {
        return failures;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
