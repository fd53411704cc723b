package com.tempeh.plugin.audit;

import com.tempeh.plugin.PluginSource;

/**
 * Security audit run by the loader after manifest validation and before the plugin can be activated.
 * Implementations may block on I/O and should honour interruption.
 */
@FunctionalInterface
public interface AuditService {

    /**
     * Audits a plugin source.
     *
     * @param source directory or classpath source of the plugin
     * @return result; {@code passed=false} rejects the plugin
     * @throws InterruptedException if the calling load was cancelled
     */
    AuditResult validate(PluginSource source) throws InterruptedException;
}
