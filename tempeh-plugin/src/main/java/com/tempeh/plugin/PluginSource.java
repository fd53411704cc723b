package com.tempeh.plugin;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Where a plugin comes from: a directory holding {@code plugin.json}, or a named manifest on the classpath
 * at {@code META-INF/tempeh/plugins/<name>/plugin.json}. Two sources are equal when kind and location
 * are equal; directory paths are normalized to absolute form.
 */
public final class PluginSource {

    public enum Kind {
        DIRECTORY,
        CLASSPATH
    }

    private final Kind kind;
    private final String location;
    private final Path path;

    private PluginSource(Kind kind, String location, Path path) {
        this.kind = kind;
        this.location = location;
        this.path = path;
    }

    public static PluginSource directory(Path directory) {
        Path normalized = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        return new PluginSource(Kind.DIRECTORY, normalized.toString(), normalized);
    }

    public static PluginSource classpath(String name) {
        Objects.requireNonNull(name, "name");
        String trimmed = name.trim();
        if (trimmed.isEmpty() || trimmed.contains("/") || trimmed.contains("..")) {
            throw new IllegalArgumentException("Invalid classpath plugin name: " + name);
        }
        return new PluginSource(Kind.CLASSPATH, trimmed, null);
    }

    /**
     * Recreates a source from its kind name and location (as recorded by {@link #getKind()} and
     * {@link #getLocation()}).
     */
    public static PluginSource of(String kind, String location) {
        Kind k = Kind.valueOf(Objects.requireNonNull(kind, "kind").trim().toUpperCase(Locale.ROOT));
        return k == Kind.DIRECTORY ? directory(Path.of(location)) : classpath(location);
    }

    public Kind getKind() {
        return kind;
    }

    /** Absolute directory path, or the classpath plugin name. */
    public String getLocation() {
        return location;
    }

    /** Directory of a directory source; null for classpath sources. */
    public Path getPath() {
        return path;
    }

    public boolean isDirectory() {
        return kind == Kind.DIRECTORY;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PluginSource)) return false;
        PluginSource that = (PluginSource) o;
        return kind == that.kind && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, location);
    }

    @Override
    public String toString() {
        return kind.name().toLowerCase(Locale.ROOT) + ":" + location;
    }
}
