package com.tempeh.internal.plugins;

import com.tempeh.config.TempehConfig;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.audit.AuditResult;
import com.tempeh.plugin.audit.AuditService;
import com.tempeh.plugin.audit.Severity;
import com.tempeh.plugin.aws.AwsRollbackPluginProvider;
import com.tempeh.plugin.loader.PluginCatalog;
import com.tempeh.plugin.loader.PluginLoader;
import com.tempeh.plugin.manager.DirectoryPluginSourceProvider;
import com.tempeh.plugin.manager.PluginManager;
import com.tempeh.plugin.manager.PluginSourceProvider;
import com.tempeh.security.RuleBasedAuditService;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Plugin-side bootstrap: creates a {@link PluginManager} whose catalog holds the built-in providers, whose
 * loader audits with the configured {@link AuditService}, and whose sources are the plugins directory plus
 * the built-in classpath manifests. Callers run {@link PluginManager#initialize()} (or load their own
 * sources) and close the manager when done.
 */
public final class InternalPlugins {

    private static final Logger log = LoggerFactory.getLogger(InternalPlugins.class);

    /** Classpath names of the manifests shipped with the built-in plugins. */
    public static final List<String> BUILT_IN_PLUGINS = List.of(AwsRollbackPluginProvider.CLASSPATH_NAME);

    private InternalPlugins() {
    }

    public static PluginManager createPluginManager(TempehConfig config) {
        return createPluginManager(config, new SimpleMeterRegistry());
    }

    /**
     * @param config        plugins directory, load concurrency and timeout, audit settings
     * @param meterRegistry registry for the manager's meters
     */
    public static PluginManager createPluginManager(TempehConfig config, MeterRegistry meterRegistry) {
        PluginCatalog catalog = createCatalog();
        PluginLoader loader = new PluginLoader(catalog, createAuditService(config));
        PluginManager manager = PluginManager.builder()
                .loader(loader)
                .config(config)
                .meterRegistry(meterRegistry)
                .sourceProvider(new DirectoryPluginSourceProvider(config.getPluginsDir()))
                .sourceProvider(builtInSources())
                .build();
        log.info("Plugins: {} built-in provider(s), plugins dir {}", catalog.getAll().size(), config.getPluginsDir());
        return manager;
    }

    /** Catalog with every built-in provider registered. */
    public static PluginCatalog createCatalog() {
        PluginCatalog catalog = new PluginCatalog();
        catalog.registerProvider(new AwsRollbackPluginProvider());
        return catalog;
    }

    /**
     * Rule-based audit at the configured threshold, or a pass-through when auditing is disabled.
     * An unknown threshold falls back to {@link Severity#HIGH}.
     */
    public static AuditService createAuditService(TempehConfig config) {
        if (!config.isAuditEnabled()) {
            log.warn("Plugin security audit is disabled; every plugin source will pass");
            return source -> {
                log.warn("Skipping security audit for {}", source);
                return AuditResult.pass();
            };
        }
        Severity threshold;
        try {
            threshold = Severity.parse(config.getAuditSeverityThreshold());
        } catch (IllegalArgumentException e) {
            log.warn("Invalid audit severity threshold '{}', using {}", config.getAuditSeverityThreshold(), Severity.HIGH);
            threshold = Severity.HIGH;
        }
        return new RuleBasedAuditService(threshold);
    }

    /** Sources of the built-in plugins' classpath manifests. */
    public static PluginSourceProvider builtInSources() {
        return () -> BUILT_IN_PLUGINS.stream().map(PluginSource::classpath).collect(Collectors.toList());
    }
}
