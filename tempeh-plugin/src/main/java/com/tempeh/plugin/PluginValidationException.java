package com.tempeh.plugin;

import com.tempeh.plugin.manifest.ValidationResult;

/**
 * Manifest missing, unreadable or invalid. {@link #getValidationResult()} lists every error and warning.
 */
public class PluginValidationException extends PluginException {

    private final ValidationResult validationResult;

    public PluginValidationException(String pluginId, String source, ValidationResult validationResult) {
        super("Invalid plugin manifest" + (pluginId != null ? " for " + pluginId : "") + " at " + source
                + ": " + String.join("; ", validationResult.getErrors()), pluginId, source);
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
