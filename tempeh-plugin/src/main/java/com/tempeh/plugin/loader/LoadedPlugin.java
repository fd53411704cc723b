package com.tempeh.plugin.loader;

import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.audit.AuditResult;

import java.util.List;

/**
 * Result of a successful load: validated descriptor, source, manifest warnings, audit outcome and the
 * handle that activates the plugin.
 */
public final class LoadedPlugin {

    private final PluginDescriptor descriptor;
    private final PluginSource source;
    private final List<String> warnings;
    private final AuditResult auditResult;
    private final ActivationHandle handle;

    LoadedPlugin(PluginDescriptor descriptor, PluginSource source, List<String> warnings,
                 AuditResult auditResult, ActivationHandle handle) {
        this.descriptor = descriptor;
        this.source = source;
        this.warnings = List.copyOf(warnings);
        this.auditResult = auditResult;
        this.handle = handle;
    }

    public PluginDescriptor getDescriptor() {
        return descriptor;
    }

    public String getId() {
        return descriptor.getId();
    }

    public PluginSource getSource() {
        return source;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public AuditResult getAuditResult() {
        return auditResult;
    }

    public ActivationHandle getHandle() {
        return handle;
    }
}
