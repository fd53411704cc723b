package com.tempeh.cli;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tempeh.plugin.PluginSource;

import java.util.Locale;
import java.util.Objects;

/**
 * One entry of the installed-plugin file: {@code {"id", "source", "kind", "enabled"}}.
 */
public final class InstalledPlugin {

    private final String id;
    private final String source;
    private final String kind;
    private final boolean enabled;

    @JsonCreator
    public InstalledPlugin(
            @JsonProperty("id") String id,
            @JsonProperty("source") String source,
            @JsonProperty("kind") String kind,
            @JsonProperty("enabled") boolean enabled) {
        this.id = Objects.requireNonNull(id, "id");
        this.source = Objects.requireNonNull(source, "source");
        this.kind = kind != null ? kind : "directory";
        this.enabled = enabled;
    }

    public static InstalledPlugin of(String id, PluginSource source, boolean enabled) {
        return new InstalledPlugin(id, source.getLocation(), source.getKind().name().toLowerCase(Locale.ROOT), enabled);
    }

    public String getId() {
        return id;
    }

    /** Directory path or classpath plugin name. */
    public String getSource() {
        return source;
    }

    public String getKind() {
        return kind;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @JsonIgnore
    public PluginSource toPluginSource() {
        return PluginSource.of(kind, source);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof InstalledPlugin)) return false;
        InstalledPlugin that = (InstalledPlugin) o;
        return enabled == that.enabled && id.equals(that.id) && source.equals(that.source) && kind.equals(that.kind);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, kind, enabled);
    }
}
