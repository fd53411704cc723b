package com.tempeh.plugin.loader;

import com.tempeh.plugin.PluginProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Explicit table of plugin entry points: entry point name → {@link PluginProvider}. The loader resolves
 * a manifest's {@code entryPoint} (or its id when none is declared) here; a plugin without a catalog
 * entry and without a declared entry point is declarative.
 */
public final class PluginCatalog {

    private static final Logger log = LoggerFactory.getLogger(PluginCatalog.class);

    private final Map<String, PluginProvider> providers = new LinkedHashMap<>();

    /**
     * Adds a provider under its entry point. Disabled providers ({@link PluginProvider#isEnabled()} false)
     * are skipped.
     *
     * @throws IllegalArgumentException if the entry point is blank or already registered
     */
    public synchronized void registerProvider(PluginProvider provider) {
        Objects.requireNonNull(provider, "provider");
        String entryPoint = provider.getEntryPoint();
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new IllegalArgumentException("Provider entry point must be non-blank: " + provider.getClass().getName());
        }
        if (!provider.isEnabled()) {
            log.info("Skipping disabled plugin provider {}", entryPoint);
            return;
        }
        if (providers.putIfAbsent(entryPoint.trim(), provider) != null) {
            throw new IllegalArgumentException("Plugin provider already registered: " + entryPoint);
        }
        log.debug("Registered plugin provider {} (version {})", entryPoint, provider.getVersion());
    }

    /** Provider for the entry point, or null. */
    public synchronized PluginProvider get(String entryPoint) {
        return entryPoint == null ? null : providers.get(entryPoint);
    }

    public synchronized boolean contains(String entryPoint) {
        return entryPoint != null && providers.containsKey(entryPoint);
    }

    public synchronized Map<String, PluginProvider> getAll() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(providers));
    }

    /** Mainly for tests. */
    public synchronized void clear() {
        providers.clear();
    }
}
