package com.tempeh.plugin.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tempeh.plugin.PluginDescriptor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed {@code plugin.json}. Fields keep what the file says (null when absent) so validation can tell a
 * missing {@code capabilities} array from an empty one. Unknown fields are ignored.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class PluginManifest {

    private final String id;
    private final String version;
    private final String author;
    private final String name;
    private final String description;
    private final String license;
    private final List<CapabilityDef> capabilities;
    private final List<String> keywords;
    private final Map<String, String> dependencies;
    private final String entryPoint;
    private final Map<String, Object> configuration;

    @JsonCreator
    public PluginManifest(
            @JsonProperty("id") String id,
            @JsonProperty("version") String version,
            @JsonProperty("author") String author,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description,
            @JsonProperty("license") String license,
            @JsonProperty("capabilities") List<CapabilityDef> capabilities,
            @JsonProperty("keywords") List<String> keywords,
            @JsonProperty("dependencies") Map<String, String> dependencies,
            @JsonProperty("entryPoint") String entryPoint,
            @JsonProperty("configuration") Map<String, Object> configuration) {
        this.id = id;
        this.version = version;
        this.author = author;
        this.name = name;
        this.description = description;
        this.license = license;
        this.capabilities = capabilities != null ? Collections.unmodifiableList(capabilities) : null;
        this.keywords = keywords != null ? Collections.unmodifiableList(keywords) : List.of();
        this.dependencies = dependencies != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(dependencies)) : Map.of();
        this.entryPoint = entryPoint;
        this.configuration = configuration != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(configuration)) : Map.of();
    }

    public String getId() {
        return id;
    }

    public String getVersion() {
        return version;
    }

    public String getAuthor() {
        return author;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getLicense() {
        return license;
    }

    /** Declared capabilities, or null when the manifest has no {@code capabilities} field. */
    public List<CapabilityDef> getCapabilities() {
        return capabilities;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public Map<String, String> getDependencies() {
        return dependencies;
    }

    public String getEntryPoint() {
        return entryPoint;
    }

    public Map<String, Object> getConfiguration() {
        return configuration;
    }

    /**
     * Builds the descriptor. Call only on a manifest that passed {@link ManifestValidator}.
     *
     * @throws IllegalArgumentException if required fields are missing or malformed
     */
    public PluginDescriptor toDescriptor() {
        PluginDescriptor.Builder b = PluginDescriptor.builder(id.trim(), version.trim())
                .author(blankToNull(author))
                .name(blankToNull(name))
                .description(blankToNull(description))
                .license(blankToNull(license))
                .entryPoint(blankToNull(entryPoint))
                .keywords(keywords)
                .configuration(configuration);
        if (capabilities != null) {
            for (CapabilityDef c : capabilities) {
                b.capability(c.getType(), c.getName());
            }
        }
        dependencies.forEach(b::dependency);
        return b.build();
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
