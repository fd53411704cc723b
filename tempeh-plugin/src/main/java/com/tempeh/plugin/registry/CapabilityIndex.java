package com.tempeh.plugin.registry;

import com.tempeh.plugin.Capability;
import com.tempeh.plugin.PluginDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable multi-key index: capability key ({@code type:name}) → plugin ids and keyword → plugin ids.
 * Id sets keep insertion (registration) order. {@link #with} and {@link #without} return new instances;
 * keys whose id set becomes empty are dropped.
 */
final class CapabilityIndex {

    static final CapabilityIndex EMPTY = new CapabilityIndex(Map.of(), Map.of());

    private final Map<String, Set<String>> byCapability;
    private final Map<String, Set<String>> byKeyword;

    private CapabilityIndex(Map<String, Set<String>> byCapability, Map<String, Set<String>> byKeyword) {
        this.byCapability = byCapability;
        this.byKeyword = byKeyword;
    }

    CapabilityIndex with(PluginDescriptor descriptor) {
        Map<String, Set<String>> caps = new LinkedHashMap<>(byCapability);
        for (Capability c : descriptor.getCapabilities()) {
            add(caps, c.key(), descriptor.getId());
        }
        Map<String, Set<String>> kws = new LinkedHashMap<>(byKeyword);
        for (String k : descriptor.getKeywords()) {
            add(kws, k, descriptor.getId());
        }
        return new CapabilityIndex(Collections.unmodifiableMap(caps), Collections.unmodifiableMap(kws));
    }

    CapabilityIndex without(PluginDescriptor descriptor) {
        Map<String, Set<String>> caps = new LinkedHashMap<>(byCapability);
        for (Capability c : descriptor.getCapabilities()) {
            remove(caps, c.key(), descriptor.getId());
        }
        Map<String, Set<String>> kws = new LinkedHashMap<>(byKeyword);
        for (String k : descriptor.getKeywords()) {
            remove(kws, k, descriptor.getId());
        }
        return new CapabilityIndex(Collections.unmodifiableMap(caps), Collections.unmodifiableMap(kws));
    }

    Set<String> idsForCapability(String key) {
        return byCapability.getOrDefault(key, Set.of());
    }

    Set<String> idsForKeyword(String keyword) {
        return byKeyword.getOrDefault(keyword, Set.of());
    }

    Set<String> capabilityKeys() {
        return byCapability.keySet();
    }

    Set<String> keywords() {
        return byKeyword.keySet();
    }

    private static void add(Map<String, Set<String>> index, String key, String id) {
        Set<String> ids = new LinkedHashSet<>(index.getOrDefault(key, Set.of()));
        ids.add(id);
        index.put(key, Collections.unmodifiableSet(ids));
    }

    private static void remove(Map<String, Set<String>> index, String key, String id) {
        Set<String> current = index.get(key);
        if (current == null) {
            return;
        }
        Set<String> ids = new LinkedHashSet<>(current);
        ids.remove(id);
        if (ids.isEmpty()) {
            index.remove(key);
        } else {
            index.put(key, Collections.unmodifiableSet(ids));
        }
    }
}
