package com.tempeh.plugin.manifest;

import com.tempeh.plugin.version.SemanticVersion;
import com.tempeh.plugin.version.VersionRange;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Checks a {@link PluginManifest} against the manifest schema.
 * <p>
 * Errors: blank or malformed {@code id}; missing or non-semver {@code version}; missing
 * {@code capabilities}; a capability without type or name, or whose type contains a colon; a dependency with a blank id, an invalid
 * range, or on the plugin itself; an {@code entryPoint} the catalog does not know.
 * Warnings: no capabilities; missing author, description or license.
 */
public final class ManifestValidator {

    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]*");

    private final Predicate<String> entryPointKnown;

    /** Validator that accepts any entry point. */
    public ManifestValidator() {
        this(entryPoint -> true);
    }

    public ManifestValidator(Predicate<String> entryPointKnown) {
        this.entryPointKnown = Objects.requireNonNull(entryPointKnown, "entryPointKnown");
    }

    public ValidationResult validate(PluginManifest manifest) {
        Objects.requireNonNull(manifest, "manifest");
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        String id = manifest.getId();
        if (id == null || id.isBlank()) {
            errors.add("Missing required field: id");
        } else if (!ID_PATTERN.matcher(id.trim()).matches()) {
            errors.add("Invalid id '" + id + "': must start with a letter or digit and contain only letters, digits, '.', '_' or '-'");
        }

        String version = manifest.getVersion();
        if (version == null || version.isBlank()) {
            errors.add("Missing required field: version");
        } else if (!SemanticVersion.isValid(version)) {
            errors.add("Invalid version '" + version + "': expected semantic version major.minor.patch");
        }

        List<CapabilityDef> capabilities = manifest.getCapabilities();
        if (capabilities == null) {
            errors.add("Missing required field: capabilities");
        } else if (capabilities.isEmpty()) {
            warnings.add("Plugin declares no capabilities");
        } else {
            for (int i = 0; i < capabilities.size(); i++) {
                CapabilityDef c = capabilities.get(i);
                if (c == null) {
                    errors.add("capabilities[" + i + "] is null");
                    continue;
                }
                if (c.getType() == null || c.getType().isBlank()) {
                    errors.add("capabilities[" + i + "] is missing type");
                } else if (c.getType().indexOf(':') >= 0) {
                    errors.add("capabilities[" + i + "] type must not contain ':'");
                }
                if (c.getName() == null || c.getName().isBlank()) {
                    errors.add("capabilities[" + i + "] is missing name");
                }
            }
        }

        for (Map.Entry<String, String> dep : manifest.getDependencies().entrySet()) {
            String depId = dep.getKey();
            if (depId == null || depId.isBlank()) {
                errors.add("Dependency with blank id");
                continue;
            }
            if (id != null && depId.trim().equals(id.trim())) {
                errors.add("Plugin depends on itself: " + depId);
            }
            String range = dep.getValue();
            if (range == null || range.isBlank() || !VersionRange.isValid(range)) {
                errors.add("Invalid version range for dependency " + depId + ": '" + range + "'");
            }
        }

        String entryPoint = manifest.getEntryPoint();
        if (entryPoint != null && !entryPoint.isBlank() && !entryPointKnown.test(entryPoint.trim())) {
            errors.add("Unknown entry point: " + entryPoint);
        }

        if (isBlank(manifest.getAuthor())) {
            warnings.add("Missing author");
        }
        if (isBlank(manifest.getDescription())) {
            warnings.add("Missing description");
        }
        if (isBlank(manifest.getLicense())) {
            warnings.add("Missing license");
        }
        return ValidationResult.of(errors, warnings);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
