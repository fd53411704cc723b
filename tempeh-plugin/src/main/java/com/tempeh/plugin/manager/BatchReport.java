package com.tempeh.plugin.manager;

import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.PluginSource;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a register-and-enable batch: ids enabled in activation order, per-id failures, and the
 * per-source load failures of the batch when it started from sources.
 */
public final class BatchReport {

    private final List<String> enabled;
    private final Map<String, PluginException> failures;
    private final Map<PluginSource, PluginException> loadFailures;

    BatchReport(List<String> enabled, Map<String, PluginException> failures,
                Map<PluginSource, PluginException> loadFailures) {
        this.enabled = List.copyOf(enabled);
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
        this.loadFailures = Collections.unmodifiableMap(new LinkedHashMap<>(loadFailures));
    }

    public List<String> getEnabled() {
        return enabled;
    }

    public Map<String, PluginException> getFailures() {
        return failures;
    }

    public Map<PluginSource, PluginException> getLoadFailures() {
        return loadFailures;
    }

    public boolean isSuccessful() {
        return failures.isEmpty() && loadFailures.isEmpty();
    }
}
