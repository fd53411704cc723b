package com.tempeh.plugin.registry;

import com.tempeh.plugin.Capability;
import com.tempeh.plugin.DuplicatePluginIdException;
import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginNotFoundException;
import com.tempeh.plugin.version.SemanticVersion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Registry of plugin descriptors by id, indexed by capability and keyword.
 * <p>
 * Mutations run under a single lock and publish a new immutable snapshot (descriptors plus
 * {@link CapabilityIndex}) in one volatile write. Queries read the current snapshot without locking, so
 * a reader sees the registry either before or after a mutation, never in between. Every id reachable
 * from the index is registered and every registered descriptor is fully indexed.
 * <p>
 * One registry per manager; there is no shared instance.
 */
public final class PluginRegistry {

    private final ReentrantLock writeLock = new ReentrantLock();
    private volatile Snapshot snapshot = Snapshot.EMPTY;

    /**
     * Registers a descriptor and indexes its capabilities and keywords.
     *
     * @throws DuplicatePluginIdException if a descriptor with the same id is already registered
     */
    public void register(PluginDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            if (current.descriptors.containsKey(descriptor.getId())) {
                throw new DuplicatePluginIdException(descriptor.getId());
            }
            Map<String, PluginDescriptor> next = new LinkedHashMap<>(current.descriptors);
            next.put(descriptor.getId(), descriptor);
            snapshot = new Snapshot(Collections.unmodifiableMap(next), current.index.with(descriptor));
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Removes a descriptor and every index entry pointing at it.
     *
     * @return the removed descriptor
     * @throws PluginNotFoundException if the id is not registered
     */
    public PluginDescriptor unregister(String id) {
        Objects.requireNonNull(id, "id");
        writeLock.lock();
        try {
            Snapshot current = snapshot;
            PluginDescriptor removed = current.descriptors.get(id);
            if (removed == null) {
                throw new PluginNotFoundException(id);
            }
            Map<String, PluginDescriptor> next = new LinkedHashMap<>(current.descriptors);
            next.remove(id);
            snapshot = new Snapshot(Collections.unmodifiableMap(next), current.index.without(removed));
            return removed;
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Returns the descriptor for the id, or null if not registered.
     */
    public PluginDescriptor get(String id) {
        return id == null ? null : snapshot.descriptors.get(id);
    }

    public boolean contains(String id) {
        return id != null && snapshot.descriptors.containsKey(id);
    }

    /** All descriptors in registration order. */
    public List<PluginDescriptor> list() {
        return List.copyOf(snapshot.descriptors.values());
    }

    /**
     * Descriptors declaring the capability key ({@code type:name}), in registration order. Empty for
     * unknown keys.
     */
    public List<PluginDescriptor> findByCapability(String capabilityKey) {
        Snapshot s = snapshot;
        return resolve(s, s.index.idsForCapability(capabilityKey));
    }

    public List<PluginDescriptor> findByCapability(Capability capability) {
        return findByCapability(capability.key());
    }

    public List<PluginDescriptor> findByKeyword(String keyword) {
        Snapshot s = snapshot;
        return resolve(s, s.index.idsForKeyword(keyword));
    }

    /** Descriptors with at least one capability of the given type. */
    public List<PluginDescriptor> findByType(String capabilityType) {
        return filter(d -> d.hasCapabilityType(capabilityType));
    }

    public List<PluginDescriptor> findByAuthor(String author) {
        return filter(d -> author != null && author.equals(d.getAuthor()));
    }

    /** Descriptors whose version equals the given version; empty if it is not a valid version. */
    public List<PluginDescriptor> findByVersion(String version) {
        if (!SemanticVersion.isValid(version)) {
            return List.of();
        }
        SemanticVersion v = SemanticVersion.parse(version);
        return filter(d -> d.getVersion().equals(v));
    }

    /** Capability keys with at least one registered plugin. */
    public Set<String> getCapabilityKeys() {
        return snapshot.index.capabilityKeys();
    }

    public Set<String> getKeywords() {
        return snapshot.index.keywords();
    }

    public int size() {
        return snapshot.descriptors.size();
    }

    /**
     * Drops every descriptor and index entry. Mainly for tests.
     */
    public void clear() {
        writeLock.lock();
        try {
            snapshot = Snapshot.EMPTY;
        } finally {
            writeLock.unlock();
        }
    }

    private List<PluginDescriptor> filter(Predicate<PluginDescriptor> predicate) {
        List<PluginDescriptor> out = new ArrayList<>();
        for (PluginDescriptor d : snapshot.descriptors.values()) {
            if (predicate.test(d)) {
                out.add(d);
            }
        }
        return Collections.unmodifiableList(out);
    }

    private static List<PluginDescriptor> resolve(Snapshot s, Set<String> ids) {
        List<PluginDescriptor> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            out.add(s.descriptors.get(id));
        }
        return Collections.unmodifiableList(out);
    }

    private static final class Snapshot {
        static final Snapshot EMPTY = new Snapshot(Map.of(), CapabilityIndex.EMPTY);

        final Map<String, PluginDescriptor> descriptors;
        final CapabilityIndex index;

        Snapshot(Map<String, PluginDescriptor> descriptors, CapabilityIndex index) {
            this.descriptors = descriptors;
            this.index = index;
        }
    }
}
