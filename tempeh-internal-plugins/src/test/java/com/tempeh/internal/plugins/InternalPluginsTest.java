package com.tempeh.internal.plugins;

import com.tempeh.config.TempehConfig;
import com.tempeh.plugin.PluginSecurityException;
import com.tempeh.plugin.audit.AuditService;
import com.tempeh.plugin.manager.BatchReport;
import com.tempeh.plugin.manager.LifecycleState;
import com.tempeh.plugin.manager.PluginManager;
import com.tempeh.security.RuleBasedAuditService;
import com.tempeh.plugin.audit.Severity;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InternalPluginsTest {

    @TempDir
    Path tempDir;

    private TempehConfig config(boolean auditEnabled, String threshold) {
        return TempehConfig.builder()
                .homeDir(tempDir)
                .pluginsDir(tempDir.resolve("plugins"))
                .auditEnabled(auditEnabled)
                .auditSeverityThreshold(threshold)
                .build();
    }

    private void plugin(String id, String sourceFile, String code) throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("plugins").resolve(id));
        Files.writeString(dir.resolve("plugin.json"), "{\"id\": \"" + id + "\", \"version\": \"1.0.0\", "
                + "\"author\": \"Tempeh Team\", \"description\": \"test\", \"license\": \"MIT\", "
                + "\"capabilities\": [{\"type\": \"hook\", \"name\": \"" + id + "-hook\"}], "
                + "\"dependencies\": {\"aws-rollback\": \"^1.0.0\"}}");
        Files.writeString(dir.resolve(sourceFile), code);
    }

    @Test
    void initializeEnablesBuiltInAndDirectoryPlugins() throws Exception {
        plugin("notify", "Notify.java", "class Notify { String channel = \"#deploys\"; }");

        try (PluginManager manager = InternalPlugins.createPluginManager(config(true, "HIGH"), new SimpleMeterRegistry())) {
            BatchReport report = manager.initialize();

            assertTrue(report.isSuccessful());
            assertEquals(List.of("aws-rollback", "notify"), report.getEnabled());
            assertEquals("aws-rollback", manager.getRegistry().findByKeyword("rollback").get(0).getId());
            assertEquals(1, manager.getRegistry().findByCapability("hook:notify-hook").size());
        }
    }

    @Test
    void auditRejectsDangerousDirectoryPlugin() throws Exception {
        plugin("shell", "Shell.java", "class Shell { void run() throws Exception { new ProcessBuilder(\"sh\").start(); } }");

        try (PluginManager manager = InternalPlugins.createPluginManager(config(true, "HIGH"))) {
            BatchReport report = manager.initialize();

            assertEquals(List.of("aws-rollback"), report.getEnabled());
            assertEquals(1, report.getLoadFailures().size());
            assertInstanceOf(PluginSecurityException.class, report.getLoadFailures().values().iterator().next());
            assertFalse(manager.getRegistry().contains("shell"));
            assertEquals(LifecycleState.FAILED, manager.getState("shell"));
        }
    }

    @Test
    void disabledAuditLetsEverythingThrough() throws Exception {
        plugin("shell", "Shell.java", "class Shell { void run() throws Exception { new ProcessBuilder(\"sh\").start(); } }");

        try (PluginManager manager = InternalPlugins.createPluginManager(config(false, "HIGH"))) {
            BatchReport report = manager.initialize();

            assertTrue(report.isSuccessful());
            assertEquals(LifecycleState.ENABLED, manager.getState("shell"));
        }
    }

    @Test
    void auditServiceFollowsConfiguredThreshold() {
        AuditService strict = InternalPlugins.createAuditService(config(true, "low"));
        AuditService fallback = InternalPlugins.createAuditService(config(true, "severe"));

        assertEquals(Severity.LOW, assertInstanceOf(RuleBasedAuditService.class, strict).getThreshold());
        assertEquals(Severity.HIGH, assertInstanceOf(RuleBasedAuditService.class, fallback).getThreshold());
        assertTrue(InternalPlugins.createCatalog().contains("aws-rollback"));
    }
}
