package com.tempeh.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Installed-plugin bookkeeping kept as a JSON array in one file. A missing file is an empty store.
 * Writes go to a sibling temp file that then replaces the store file.
 */
public final class InstalledPluginStore {

    private static final Logger log = LoggerFactory.getLogger(InstalledPluginStore.class);
    private static final TypeReference<List<InstalledPlugin>> ENTRIES = new TypeReference<>() { };

    private final Path file;
    private final ObjectMapper mapper;

    public InstalledPluginStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Path getFile() {
        return file;
    }

    /**
     * @throws UncheckedIOException if the file exists but cannot be read or parsed
     */
    public List<InstalledPlugin> load() {
        if (!Files.exists(file)) {
            log.debug("No installed-plugin file at {}", file);
            return List.of();
        }
        try {
            List<InstalledPlugin> entries = mapper.readValue(file.toFile(), ENTRIES);
            return entries != null ? List.copyOf(entries) : List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read installed plugins from " + file + ": " + e.getMessage(), e);
        }
    }

    public void save(Collection<InstalledPlugin> entries) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), new ArrayList<>(entries));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            log.debug("Saved {} installed plugin(s) to {}", entries.size(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write installed plugins to " + file + ": " + e.getMessage(), e);
        }
    }
}
