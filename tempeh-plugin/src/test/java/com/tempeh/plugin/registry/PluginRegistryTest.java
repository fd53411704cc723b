package com.tempeh.plugin.registry;

import com.tempeh.plugin.Capability;
import com.tempeh.plugin.DuplicatePluginIdException;
import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginNotFoundException;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginRegistryTest {

    private static PluginDescriptor aws() {
        return PluginDescriptor.builder("aws", "1.0.0")
                .author("Tempeh Team")
                .capability("provider", "aws")
                .capability("rollback-strategy", "aws-graceful-rollback")
                .keyword("aws")
                .keyword("cloud")
                .build();
    }

    private static List<String> ids(List<PluginDescriptor> descriptors) {
        return descriptors.stream().map(PluginDescriptor::getId).collect(Collectors.toList());
    }

    @Test
    void capabilityKeysSplitAtTheOnlyColonInTheType() {
        assertThrows(IllegalArgumentException.class, () -> new Capability("a:b", "c"));
        assertThrows(IllegalArgumentException.class,
                () -> PluginDescriptor.builder("odd", "1.0.0").capability("a:b", "c").build());

        Capability parsed = Capability.parse("a:b:c");
        assertEquals("a", parsed.getType());
        assertEquals("b:c", parsed.getName());

        PluginRegistry registry = new PluginRegistry();
        registry.register(PluginDescriptor.builder("colon", "1.0.0").capability("a", "b:c").build());
        assertEquals(List.of("colon"), ids(registry.findByCapability("a:b:c")));
        assertEquals(List.of("colon"), ids(registry.findByType("a")));
        assertEquals(List.of(), ids(registry.findByType("a:b")));
    }

    @Test
    void register_indexesCapabilitiesAndKeywords() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(aws());

        assertEquals(List.of("aws"), ids(registry.findByCapability("provider:aws")));
        assertEquals(List.of("aws"), ids(registry.findByCapability(new Capability("rollback-strategy", "aws-graceful-rollback"))));
        assertEquals(List.of("aws"), ids(registry.findByKeyword("cloud")));
        assertTrue(registry.contains("aws"));
        assertEquals(1, registry.size());
    }

    @Test
    void unregister_removesIdFromEveryIndex() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(aws());

        registry.unregister("aws");

        assertNull(registry.get("aws"));
        assertEquals(List.of(), registry.findByCapability("provider:aws"));
        assertEquals(List.of(), registry.findByKeyword("aws"));
        assertTrue(registry.getCapabilityKeys().isEmpty());
        assertTrue(registry.getKeywords().isEmpty());
    }

    @Test
    void register_sameIdTwiceFails() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(aws());

        DuplicatePluginIdException ex = assertThrows(DuplicatePluginIdException.class, () -> registry.register(aws()));
        assertEquals("aws", ex.getPluginId());
        assertEquals(1, registry.size());
    }

    @Test
    void register_differentIdsSucceed() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(PluginDescriptor.builder("a", "1.0.0").build());
        registry.register(PluginDescriptor.builder("b", "1.0.0").build());

        assertEquals(List.of("a", "b"), ids(registry.list()));
    }

    @Test
    void unregister_unknownIdFails() {
        PluginRegistry registry = new PluginRegistry();
        assertThrows(PluginNotFoundException.class, () -> registry.unregister("missing"));
    }

    @Test
    void sharedCapability_returnsBothInRegistrationOrder() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(PluginDescriptor.builder("zeta", "1.0.0").capability("validator", "lint").build());
        registry.register(PluginDescriptor.builder("alpha", "1.0.0").capability("validator", "lint").build());

        assertEquals(List.of("zeta", "alpha"), ids(registry.findByCapability("validator:lint")));

        registry.unregister("zeta");
        assertEquals(List.of("alpha"), ids(registry.findByCapability("validator:lint")));
        assertTrue(registry.getCapabilityKeys().contains("validator:lint"));
    }

    @Test
    void filters_byTypeAuthorAndVersion() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(aws());
        registry.register(PluginDescriptor.builder("lint", "2.1.0").author("Someone").capability("validator", "lint").build());

        assertEquals(List.of("aws"), ids(registry.findByType("provider")));
        assertEquals(List.of("lint"), ids(registry.findByType("validator")));
        assertEquals(List.of("aws"), ids(registry.findByAuthor("Tempeh Team")));
        assertEquals(List.of("lint"), ids(registry.findByVersion("2.1.0")));
        assertEquals(List.of(), registry.findByVersion("not-a-version"));
        assertEquals(List.of(), registry.findByCapability("unknown:key"));
    }

    @Test
    void clear_dropsEverything() {
        PluginRegistry registry = new PluginRegistry();
        registry.register(aws());
        registry.clear();

        assertEquals(0, registry.size());
        assertTrue(registry.getKeywords().isEmpty());
    }

    @Test
    void indexMatchesDescriptorsAfterRandomOperations() {
        PluginRegistry registry = new PluginRegistry();
        Random random = new Random(42);
        String[] caps = {"validator:a", "validator:b", "hook:c"};
        String[] keywords = {"x", "y", "z"};
        for (int i = 0; i < 500; i++) {
            String id = "p" + random.nextInt(20);
            if (registry.contains(id)) {
                registry.unregister(id);
            } else {
                PluginDescriptor.Builder b = PluginDescriptor.builder(id, "1.0." + i);
                b.capability(Capability.parse(caps[random.nextInt(caps.length)]));
                b.keyword(keywords[random.nextInt(keywords.length)]);
                registry.register(b.build());
            }
            assertIndexConsistent(registry);
        }
    }

    @Test
    void readersSeeWholeDescriptorsDuringConcurrentMutation() throws Exception {
        PluginRegistry registry = new PluginRegistry();
        AtomicBoolean stop = new AtomicBoolean();
        AtomicBoolean broken = new AtomicBoolean();
        CountDownLatch started = new CountDownLatch(1);
        Thread reader = new Thread(() -> {
            started.countDown();
            while (!stop.get()) {
                for (PluginDescriptor d : registry.findByCapability("provider:aws")) {
                    if (d == null || !d.hasCapability("provider:aws")) {
                        broken.set(true);
                    }
                }
            }
        });
        reader.start();
        started.await();
        for (int i = 0; i < 2000; i++) {
            registry.register(aws());
            registry.unregister("aws");
        }
        stop.set(true);
        reader.join();

        assertFalse(broken.get());
    }

    @Test
    void get_returnsRegisteredInstance() {
        PluginRegistry registry = new PluginRegistry();
        PluginDescriptor d = aws();
        registry.register(d);
        assertSame(d, registry.get("aws"));
        assertNull(registry.get(null));
    }

    private static void assertIndexConsistent(PluginRegistry registry) {
        Set<String> registered = registry.list().stream().map(PluginDescriptor::getId).collect(Collectors.toSet());
        Set<String> indexed = new HashSet<>();
        for (String key : registry.getCapabilityKeys()) {
            List<PluginDescriptor> found = registry.findByCapability(key);
            assertFalse(found.isEmpty(), "empty key left behind: " + key);
            for (PluginDescriptor d : found) {
                assertTrue(d.hasCapability(key));
                indexed.add(d.getId());
            }
        }
        for (String keyword : registry.getKeywords()) {
            for (PluginDescriptor d : registry.findByKeyword(keyword)) {
                assertTrue(d.getKeywords().contains(keyword));
                indexed.add(d.getId());
            }
        }
        assertEquals(registered, indexed);
    }
}
