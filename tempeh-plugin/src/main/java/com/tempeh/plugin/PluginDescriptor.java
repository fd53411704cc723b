package com.tempeh.plugin;

import com.tempeh.plugin.version.SemanticVersion;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable description of a plugin: identity, version, capabilities, keywords and dependencies.
 * Created by the loader from a validated manifest and owned by the registry once registered.
 * Capabilities and keywords keep declaration order with duplicates removed.
 */
public final class PluginDescriptor {

    private final String id;
    private final SemanticVersion version;
    private final String author;
    private final String name;
    private final String description;
    private final String license;
    private final Set<Capability> capabilities;
    private final Set<String> keywords;
    private final Map<String, String> dependencies;
    private final String entryPoint;
    private final Map<String, Object> configuration;

    private PluginDescriptor(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id").trim();
        if (id.isEmpty()) {
            throw new IllegalArgumentException("Plugin id must be non-blank");
        }
        this.version = Objects.requireNonNull(b.version, "version");
        this.author = b.author;
        this.name = b.name != null ? b.name : id;
        this.description = b.description;
        this.license = b.license;
        this.capabilities = Collections.unmodifiableSet(new LinkedHashSet<>(b.capabilities));
        this.keywords = Collections.unmodifiableSet(new LinkedHashSet<>(b.keywords));
        this.dependencies = Collections.unmodifiableMap(new LinkedHashMap<>(b.dependencies));
        this.entryPoint = b.entryPoint;
        this.configuration = Collections.unmodifiableMap(new LinkedHashMap<>(b.configuration));
    }

    public static Builder builder(String id, String version) {
        return new Builder(id, SemanticVersion.parse(version));
    }

    public static Builder builder(String id, SemanticVersion version) {
        return new Builder(id, version);
    }

    public String getId() {
        return id;
    }

    public SemanticVersion getVersion() {
        return version;
    }

    /** Author, or null when the manifest omits it. */
    public String getAuthor() {
        return author;
    }

    /** Display name; the id when the manifest omits it. */
    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getLicense() {
        return license;
    }

    public Set<Capability> getCapabilities() {
        return capabilities;
    }

    public Set<String> getKeywords() {
        return keywords;
    }

    /** Dependency id → version range expression (e.g. {@code ^1.0.0}). */
    public Map<String, String> getDependencies() {
        return dependencies;
    }

    /** Declared entry point, or null (catalog is then looked up by id). */
    public String getEntryPoint() {
        return entryPoint;
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    public boolean hasCapability(String key) {
        for (Capability c : capabilities) {
            if (c.key().equals(key)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasCapabilityType(String type) {
        for (Capability c : capabilities) {
            if (c.getType().equals(type)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return id + "@" + version;
    }

    public static final class Builder {
        private final String id;
        private final SemanticVersion version;
        private String author;
        private String name;
        private String description;
        private String license;
        private final List<Capability> capabilities = new ArrayList<>();
        private final List<String> keywords = new ArrayList<>();
        private final Map<String, String> dependencies = new LinkedHashMap<>();
        private String entryPoint;
        private final Map<String, Object> configuration = new LinkedHashMap<>();

        private Builder(String id, SemanticVersion version) {
            this.id = id;
            this.version = version;
        }

        public Builder author(String author) {
            this.author = author;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder license(String license) {
            this.license = license;
            return this;
        }

        public Builder capability(String type, String name) {
            this.capabilities.add(new Capability(type, name));
            return this;
        }

        public Builder capability(Capability capability) {
            this.capabilities.add(Objects.requireNonNull(capability, "capability"));
            return this;
        }

        public Builder keyword(String keyword) {
            if (keyword != null && !keyword.isBlank()) {
                this.keywords.add(keyword.trim());
            }
            return this;
        }

        public Builder keywords(Iterable<String> keywords) {
            if (keywords != null) {
                for (String k : keywords) {
                    keyword(k);
                }
            }
            return this;
        }

        public Builder dependency(String pluginId, String versionRange) {
            this.dependencies.put(Objects.requireNonNull(pluginId, "pluginId").trim(),
                    Objects.requireNonNull(versionRange, "versionRange").trim());
            return this;
        }

        public Builder entryPoint(String entryPoint) {
            this.entryPoint = entryPoint;
            return this;
        }

        public Builder configuration(Map<String, Object> configuration) {
            if (configuration != null) {
                this.configuration.putAll(configuration);
            }
            return this;
        }

        public PluginDescriptor build() {
            return new PluginDescriptor(this);
        }
    }
}
