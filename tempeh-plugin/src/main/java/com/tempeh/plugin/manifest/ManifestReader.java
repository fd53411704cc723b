package com.tempeh.plugin.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.PluginValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads {@code plugin.json} for a {@link PluginSource}: {@code <dir>/plugin.json} for directory sources,
 * {@code META-INF/tempeh/plugins/<name>/plugin.json} on the class loader for classpath sources.
 * A missing, unreadable or malformed manifest fails with {@link PluginValidationException}.
 */
public final class ManifestReader {

    private static final Logger log = LoggerFactory.getLogger(ManifestReader.class);

    public static final String MANIFEST_FILE = "plugin.json";
    public static final String CLASSPATH_ROOT = "META-INF/tempeh/plugins/";

    private final ObjectMapper mapper;
    private final ClassLoader classLoader;

    public ManifestReader() {
        this(ManifestReader.class.getClassLoader());
    }

    public ManifestReader(ClassLoader classLoader) {
        this.mapper = new ObjectMapper();
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader");
    }

    /** Classpath resource holding the manifest of a built-in plugin. */
    public static String classpathResource(String name) {
        return CLASSPATH_ROOT + name + "/" + MANIFEST_FILE;
    }

    public PluginManifest read(PluginSource source) {
        Objects.requireNonNull(source, "source");
        if (source.isDirectory()) {
            Path file = source.getPath().resolve(MANIFEST_FILE);
            log.debug("Reading manifest {}", file);
            try (InputStream in = Files.newInputStream(file)) {
                return parse(in, source);
            } catch (NoSuchFileException e) {
                throw invalid(source, "Manifest not found: " + file);
            } catch (IOException e) {
                throw invalid(source, "Cannot read manifest " + file + ": " + e.getMessage());
            }
        }
        String resource = classpathResource(source.getLocation());
        log.debug("Reading classpath manifest {}", resource);
        InputStream in = classLoader.getResourceAsStream(resource);
        if (in == null) {
            throw invalid(source, "Manifest not found on classpath: " + resource);
        }
        try (InputStream stream = in) {
            return parse(stream, source);
        } catch (IOException e) {
            throw invalid(source, "Cannot read manifest " + resource + ": " + e.getMessage());
        }
    }

    private PluginManifest parse(InputStream in, PluginSource source) throws IOException {
        PluginManifest manifest;
        try {
            manifest = mapper.readValue(in, PluginManifest.class);
        } catch (JsonProcessingException e) {
            throw invalid(source, "Malformed manifest JSON: " + e.getOriginalMessage());
        }
        if (manifest == null) {
            throw invalid(source, "Manifest is empty");
        }
        return manifest;
    }

    private static PluginValidationException invalid(PluginSource source, String error) {
        return new PluginValidationException(null, source.toString(), ValidationResult.failure(error));
    }
}
