package com.tempeh.plugin.manifest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Capability entry in {@code plugin.json}: {@code {"type": "...", "name": "..."}}. Fields may be null when
 * the manifest omits them; {@link ManifestValidator} reports that.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CapabilityDef {

    private final String type;
    private final String name;
    private final String description;

    @JsonCreator
    public CapabilityDef(
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("description") String description) {
        this.type = type;
        this.name = name;
        this.description = description;
    }

    public String getType() {
        return type;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }
}
