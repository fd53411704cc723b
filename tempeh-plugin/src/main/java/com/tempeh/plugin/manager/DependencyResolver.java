package com.tempeh.plugin.manager;

import com.tempeh.plugin.DependencyCycleException;
import com.tempeh.plugin.PluginDependencyException;
import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.version.VersionRange;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * Orders a batch of descriptors so every plugin comes after its dependencies.
 * <p>
 * A dependency is satisfied by a batch member or by an external (already registered) descriptor whose
 * version is in the declared range. Plugins with a missing or out-of-range dependency fail with
 * {@link PluginDependencyException}; members of a cycle fail with {@link DependencyCycleException};
 * dependents of any failed plugin fail in turn. The rest are ordered by Kahn's algorithm, always taking
 * the lexicographically smallest ready id, so the order is deterministic.
 */
public final class DependencyResolver {

    private DependencyResolver() {
    }

    public static final class Resolution {
        private final List<String> order;
        private final Map<String, PluginException> failures;

        private Resolution(List<String> order, Map<String, PluginException> failures) {
            this.order = List.copyOf(order);
            this.failures = Collections.unmodifiableMap(failures);
        }

        /** Ids that can be enabled, dependencies first. */
        public List<String> getOrder() {
            return order;
        }

        /** Failed id → cause, sorted by id. */
        public Map<String, PluginException> getFailures() {
            return failures;
        }
    }

    /**
     * @param batch    descriptors to order (ids unique)
     * @param external lookup for dependencies outside the batch; returns null when unknown
     */
    public static Resolution resolve(Collection<PluginDescriptor> batch, Function<String, PluginDescriptor> external) {
        Objects.requireNonNull(batch, "batch");
        Objects.requireNonNull(external, "external");
        TreeMap<String, PluginDescriptor> byId = new TreeMap<>();
        for (PluginDescriptor d : batch) {
            byId.putIfAbsent(d.getId(), d);
        }
        TreeMap<String, PluginException> failures = new TreeMap<>();
        Map<String, List<String>> batchDeps = new HashMap<>();

        for (PluginDescriptor d : byId.values()) {
            List<String> inBatch = new ArrayList<>();
            for (Map.Entry<String, String> dep : new TreeMap<>(d.getDependencies()).entrySet()) {
                String depId = dep.getKey();
                PluginDescriptor target = byId.containsKey(depId) ? byId.get(depId) : external.apply(depId);
                if (byId.containsKey(depId)) {
                    inBatch.add(depId);
                }
                if (failures.containsKey(d.getId())) {
                    continue;
                }
                PluginException problem = checkDependency(d, depId, dep.getValue(), target);
                if (problem != null) {
                    failures.put(d.getId(), problem);
                }
            }
            batchDeps.put(d.getId(), inBatch);
        }

        for (List<String> scc : new Tarjan(byId.keySet(), batchDeps).run()) {
            boolean cyclic = scc.size() > 1 || batchDeps.get(scc.get(0)).contains(scc.get(0));
            if (!cyclic) {
                continue;
            }
            List<String> members = new ArrayList<>(new TreeSet<>(scc));
            for (String member : members) {
                failures.putIfAbsent(member, new DependencyCycleException(member, members));
            }
        }

        // dependents of failed plugins fail too; repeat until nothing changes
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String id : byId.keySet()) {
                if (failures.containsKey(id)) {
                    continue;
                }
                for (String depId : batchDeps.get(id)) {
                    if (failures.containsKey(depId)) {
                        failures.put(id, new PluginDependencyException(
                                "Plugin " + id + " depends on " + depId + ", which failed", id, depId));
                        changed = true;
                        break;
                    }
                }
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        TreeSet<String> ready = new TreeSet<>();
        for (String id : byId.keySet()) {
            if (failures.containsKey(id)) {
                continue;
            }
            List<String> deps = batchDeps.get(id);
            inDegree.put(id, deps.size());
            for (String depId : deps) {
                dependents.computeIfAbsent(depId, k -> new ArrayList<>()).add(id);
            }
            if (deps.isEmpty()) {
                ready.add(id);
            }
        }
        List<String> order = new ArrayList<>();
        while (!ready.isEmpty()) {
            String next = ready.pollFirst();
            order.add(next);
            for (String dependent : dependents.getOrDefault(next, List.of())) {
                int remaining = inDegree.merge(dependent, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(dependent);
                }
            }
        }
        return new Resolution(order, failures);
    }

    private static PluginException checkDependency(PluginDescriptor plugin, String depId, String range,
                                                   PluginDescriptor target) {
        if (target == null) {
            return new PluginDependencyException(
                    "Plugin " + plugin.getId() + " requires " + depId + "@" + range + ", which is not available",
                    plugin.getId(), depId);
        }
        VersionRange parsed;
        try {
            parsed = VersionRange.parse(range);
        } catch (IllegalArgumentException e) {
            return new PluginDependencyException(
                    "Plugin " + plugin.getId() + " declares an invalid range for " + depId + ": " + range,
                    plugin.getId(), depId);
        }
        if (!parsed.isSatisfiedBy(target.getVersion())) {
            return new PluginDependencyException(
                    "Plugin " + plugin.getId() + " requires " + depId + "@" + range + " but found " + target.getVersion(),
                    plugin.getId(), depId);
        }
        return null;
    }

    /** Strongly connected components over the in-batch dependency edges. */
    private static final class Tarjan {
        private final Collection<String> nodes;
        private final Map<String, List<String>> edges;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final List<String> stack = new ArrayList<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;

        Tarjan(Collection<String> nodes, Map<String, List<String>> edges) {
            this.nodes = nodes;
            this.edges = edges;
        }

        List<List<String>> run() {
            for (String n : nodes) {
                if (!index.containsKey(n)) {
                    visit(n);
                }
            }
            return components;
        }

        private void visit(String v) {
            index.put(v, counter);
            lowLink.put(v, counter);
            counter++;
            stack.add(v);
            onStack.add(v);
            for (String w : edges.getOrDefault(v, List.of())) {
                if (!index.containsKey(w)) {
                    visit(w);
                    lowLink.put(v, Math.min(lowLink.get(v), lowLink.get(w)));
                } else if (onStack.contains(w)) {
                    lowLink.put(v, Math.min(lowLink.get(v), index.get(w)));
                }
            }
            if (lowLink.get(v).equals(index.get(v))) {
                List<String> component = new ArrayList<>();
                String w;
                do {
                    w = stack.remove(stack.size() - 1);
                    onStack.remove(w);
                    component.add(w);
                } while (!w.equals(v));
                components.add(component);
            }
        }
    }
}
