package com.tempeh.plugin.manager;

import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.manifest.ManifestReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Scans one plugins directory: every immediate subdirectory holding a {@code plugin.json} is a candidate.
 * Only the configured directory is scanned; results are sorted by directory name.
 */
public final class DirectoryPluginSourceProvider implements PluginSourceProvider {

    private static final Logger log = LoggerFactory.getLogger(DirectoryPluginSourceProvider.class);

    private final Path pluginsDir;

    public DirectoryPluginSourceProvider(Path pluginsDir) {
        this.pluginsDir = pluginsDir;
    }

    @Override
    public List<PluginSource> sources() {
        if (pluginsDir == null) {
            return List.of();
        }
        if (!Files.exists(pluginsDir)) {
            log.debug("Plugins directory does not exist: {}", pluginsDir);
            return List.of();
        }
        if (!Files.isDirectory(pluginsDir)) {
            log.warn("Plugins path is not a directory: {}", pluginsDir);
            return List.of();
        }
        List<Path> dirs = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(pluginsDir, Files::isDirectory)) {
            for (Path dir : stream) {
                if (Files.isRegularFile(dir.resolve(ManifestReader.MANIFEST_FILE))) {
                    dirs.add(dir);
                } else {
                    log.debug("Skipping {}: no {}", dir, ManifestReader.MANIFEST_FILE);
                }
            }
        } catch (IOException e) {
            log.warn("Failed to list plugins directory {}: {}", pluginsDir, e.getMessage());
            return List.of();
        }
        Collections.sort(dirs);
        List<PluginSource> out = new ArrayList<>(dirs.size());
        for (Path dir : dirs) {
            out.add(PluginSource.directory(dir));
        }
        return out;
    }

    public Path getPluginsDir() {
        return pluginsDir;
    }
}
