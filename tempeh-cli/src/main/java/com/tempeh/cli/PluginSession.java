package com.tempeh.cli;

import com.tempeh.config.TempehConfig;
import com.tempeh.internal.plugins.InternalPlugins;
import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.loader.LoadedPlugin;
import com.tempeh.plugin.manager.LifecycleState;
import com.tempeh.plugin.manager.LoadReport;
import com.tempeh.plugin.manager.ManagedPlugin;
import com.tempeh.plugin.manager.PluginManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One CLI invocation's plugin state: a manager loaded with the installed, directory and built-in plugins,
 * with those recorded as disabled only registered, and the installed-plugin store to write back.
 */
final class PluginSession implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginSession.class);

    private final PluginManager manager;
    private final InstalledPluginStore store;
    private final Map<String, InstalledPlugin> installed;

    private PluginSession(PluginManager manager, InstalledPluginStore store, Map<String, InstalledPlugin> installed) {
        this.manager = manager;
        this.store = store;
        this.installed = installed;
    }

    static PluginSession open(TempehConfig config) {
        InstalledPluginStore store = new InstalledPluginStore(config.getPluginStateFile());
        Map<String, InstalledPlugin> installed = new LinkedHashMap<>();
        for (InstalledPlugin entry : store.load()) {
            installed.put(entry.getId(), entry);
        }
        PluginManager manager = InternalPlugins.createPluginManager(config);
        try {
            Set<PluginSource> candidates = new LinkedHashSet<>();
            for (InstalledPlugin entry : installed.values()) {
                try {
                    candidates.add(entry.toPluginSource());
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring installed plugin {} with invalid source {}: {}", entry.getId(), entry.getSource(),
                            e.getMessage());
                }
            }
            candidates.addAll(manager.discover());
            LoadReport report = manager.loadAll(new ArrayList<>(candidates));
            List<LoadedPlugin> toEnable = new ArrayList<>();
            for (LoadedPlugin loaded : report.getLoaded()) {
                InstalledPlugin entry = installed.get(loaded.getId());
                if (entry != null && !entry.isEnabled()) {
                    manager.register(loaded.getId());
                } else {
                    toEnable.add(loaded);
                }
            }
            manager.enableAll(toEnable);
        } catch (RuntimeException e) {
            manager.close();
            throw e;
        }
        return new PluginSession(manager, store, installed);
    }

    PluginManager getManager() {
        return manager;
    }

    /**
     * Writes the enabled flag of every registered plugin to the store and drops unloaded ones. Entries of
     * plugins that failed in this session are kept as they were.
     */
    void persist() {
        for (ManagedPlugin record : manager.getPlugins()) {
            switch (record.getState()) {
                case REGISTERED:
                case ENABLED:
                case DISABLED:
                    installed.put(record.getId(), InstalledPlugin.of(record.getId(), record.getSource(),
                            record.getState() == LifecycleState.ENABLED));
                    break;
                case UNLOADED:
                    installed.remove(record.getId());
                    break;
                default:
                    break;
            }
        }
        store.save(installed.values());
    }

    @Override
    public void close() {
        try {
            manager.close();
        } catch (PluginException e) {
            log.warn("Error closing plugin manager: {}", e.getMessage());
        }
    }
}
