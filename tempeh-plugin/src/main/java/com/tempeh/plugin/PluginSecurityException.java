package com.tempeh.plugin;

import com.tempeh.plugin.audit.AuditResult;

/**
 * The audit service rejected a plugin source. The plugin is never registered.
 */
public class PluginSecurityException extends PluginException {

    private final AuditResult auditResult;

    public PluginSecurityException(String pluginId, String source, AuditResult auditResult) {
        super("Security audit failed for " + pluginId + " (" + auditResult.getFindings().size() + " finding(s))",
                pluginId, source);
        this.auditResult = auditResult;
    }

    public AuditResult getAuditResult() {
        return auditResult;
    }
}
