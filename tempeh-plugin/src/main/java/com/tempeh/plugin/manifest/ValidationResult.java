package com.tempeh.plugin.manifest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of manifest validation. Valid when there are no errors; warnings never fail a load.
 */
public final class ValidationResult {

    private final List<String> errors;
    private final List<String> warnings;

    private ValidationResult(List<String> errors, List<String> warnings) {
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
        this.warnings = warnings != null ? Collections.unmodifiableList(new ArrayList<>(warnings)) : List.of();
    }

    public static ValidationResult success() {
        return new ValidationResult(List.of(), List.of());
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors, warnings);
    }

    public static ValidationResult failure(String singleError) {
        return new ValidationResult(List.of(Objects.requireNonNull(singleError, "singleError")), List.of());
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    public List<String> getErrors() {
        return errors;
    }

    public List<String> getWarnings() {
        return warnings;
    }
}
