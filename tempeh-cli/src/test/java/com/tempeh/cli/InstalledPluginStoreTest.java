package com.tempeh.cli;

import com.tempeh.plugin.PluginSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InstalledPluginStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileIsEmpty() {
        assertEquals(List.of(), new InstalledPluginStore(tempDir.resolve("absent.json")).load());
    }

    @Test
    void savedEntriesKeepSourceKind() {
        InstalledPluginStore store = new InstalledPluginStore(tempDir.resolve("state").resolve("plugins.json"));
        PluginSource dir = PluginSource.directory(tempDir.resolve("notify"));

        store.save(List.of(InstalledPlugin.of("notify", dir, true),
                InstalledPlugin.of("aws-rollback", PluginSource.classpath("aws-rollback"), false)));
        List<InstalledPlugin> loaded = store.load();

        assertEquals(2, loaded.size());
        assertEquals(dir, loaded.get(0).toPluginSource());
        assertEquals("classpath", loaded.get(1).getKind());
        assertEquals(PluginSource.classpath("aws-rollback"), loaded.get(1).toPluginSource());
        assertTrue(loaded.get(0).isEnabled());
    }

    @Test
    void unreadableFileFails() throws Exception {
        Path file = tempDir.resolve("plugins.json");
        Files.writeString(file, "{ not a list");

        assertThrows(UncheckedIOException.class, () -> new InstalledPluginStore(file).load());
    }
}
