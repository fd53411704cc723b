package com.tempeh.plugin.manager;

import com.tempeh.plugin.DependencyCycleException;
import com.tempeh.plugin.PluginDependencyException;
import com.tempeh.plugin.PluginDescriptor;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DependencyResolverTest {

    private static PluginDescriptor plugin(String id, String version, String... deps) {
        PluginDescriptor.Builder b = PluginDescriptor.builder(id, version);
        for (int i = 0; i < deps.length; i += 2) {
            b.dependency(deps[i], deps[i + 1]);
        }
        return b.build();
    }

    private static DependencyResolver.Resolution resolve(PluginDescriptor... batch) {
        return DependencyResolver.resolve(List.of(batch), id -> null);
    }

    @Test
    void dependenciesComeFirstWithLexicographicTieBreak() {
        DependencyResolver.Resolution r = resolve(
                plugin("d", "1.0.0", "b", "*", "c", "*"),
                plugin("c", "1.0.0", "a", "^1.0.0"),
                plugin("b", "1.0.0", "a", "^1.0.0"),
                plugin("a", "1.2.0"),
                plugin("e", "1.0.0"));

        assertEquals(List.of("a", "b", "c", "d", "e"), r.getOrder());
        assertTrue(r.getFailures().isEmpty());
    }

    @Test
    void orderIsIndependentOfInputOrder() {
        DependencyResolver.Resolution one = resolve(plugin("x", "1.0.0"), plugin("m", "1.0.0", "x", "*"), plugin("b", "1.0.0"));
        DependencyResolver.Resolution two = resolve(plugin("b", "1.0.0"), plugin("m", "1.0.0", "x", "*"), plugin("x", "1.0.0"));

        assertEquals(List.of("b", "x", "m"), one.getOrder());
        assertEquals(one.getOrder(), two.getOrder());
    }

    @Test
    void unsatisfiedRangeFailsOnlyTheDependent() {
        DependencyResolver.Resolution r = resolve(plugin("b", "1.0.0", "a", "^1.0.0"), plugin("a", "2.0.0"));

        assertEquals(List.of("a"), r.getOrder());
        PluginDependencyException ex = assertInstanceOf(PluginDependencyException.class, r.getFailures().get("b"));
        assertEquals("a", ex.getDependencyId());
    }

    @Test
    void missingDependencyFailsAndPropagatesToDependents() {
        DependencyResolver.Resolution r = resolve(
                plugin("b", "1.0.0", "missing", "^1.0.0"),
                plugin("c", "1.0.0", "b", "*"),
                plugin("d", "1.0.0"));

        assertEquals(List.of("d"), r.getOrder());
        assertInstanceOf(PluginDependencyException.class, r.getFailures().get("b"));
        PluginDependencyException propagated = assertInstanceOf(PluginDependencyException.class, r.getFailures().get("c"));
        assertEquals("b", propagated.getDependencyId());
    }

    @Test
    void cycleMembersFailAndOthersProceed() {
        DependencyResolver.Resolution r = resolve(
                plugin("a", "1.0.0", "c", "*"),
                plugin("b", "1.0.0", "a", "*"),
                plugin("c", "1.0.0", "b", "*"),
                plugin("user", "1.0.0", "a", "*"),
                plugin("free", "1.0.0"));

        assertEquals(List.of("free"), r.getOrder());
        for (String member : List.of("a", "b", "c")) {
            DependencyCycleException ex = assertInstanceOf(DependencyCycleException.class, r.getFailures().get(member));
            assertEquals(List.of("a", "b", "c"), ex.getCycle());
        }
        assertInstanceOf(PluginDependencyException.class, r.getFailures().get("user"));
    }

    @Test
    void externalDescriptorsSatisfyDependencies() {
        Map<String, PluginDescriptor> registered = Map.of("core", plugin("core", "1.4.0"));

        DependencyResolver.Resolution r = DependencyResolver.resolve(
                List.of(plugin("ext", "1.0.0", "core", "~1.4.0"), plugin("old", "1.0.0", "core", "^2.0.0")),
                registered::get);

        assertEquals(List.of("ext"), r.getOrder());
        assertInstanceOf(PluginDependencyException.class, r.getFailures().get("old"));
    }
}
