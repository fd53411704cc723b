package com.tempeh.security;

import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.audit.AuditFinding;
import com.tempeh.plugin.audit.AuditResult;
import com.tempeh.plugin.audit.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleBasedAuditServiceTest {

    private static final String MANIFEST = "{\"id\": \"p\", \"version\": \"1.0.0\", \"capabilities\": []}";

    @TempDir
    Path tempDir;

    private Path pluginDir() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("plugin"));
        Files.writeString(dir.resolve("plugin.json"), MANIFEST);
        return dir;
    }

    @Test
    void cleanDirectoryPasses() throws Exception {
        Path dir = pluginDir();
        Files.writeString(dir.resolve("Strategy.java"), "class Strategy { int retries = 3; }");

        AuditResult result = new RuleBasedAuditService(Severity.HIGH).validate(PluginSource.directory(dir));

        assertTrue(result.isPassed());
        assertEquals(List.of(), result.getFindings());
    }

    @Test
    void processExecutionFailsAudit() throws Exception {
        Path dir = pluginDir();
        Files.createDirectories(dir.resolve("src"));
        Files.writeString(dir.resolve("src/Deploy.java"),
                "class Deploy { void run() throws Exception { Runtime.getRuntime().exec(\"rm -rf /\"); "
                        + "new ProcessBuilder(\"sh\").start(); } }");

        AuditResult result = new RuleBasedAuditService(Severity.HIGH).validate(PluginSource.directory(dir));

        assertFalse(result.isPassed());
        assertEquals(1, result.getFindings().size());
        AuditFinding finding = result.getFindings().get(0);
        assertEquals(DefaultAuditRules.PROCESS_EXECUTION, finding.getRuleId());
        assertEquals(Severity.CRITICAL, finding.getSeverity());
        assertEquals("src/Deploy.java", finding.getLocation());
    }

    @Test
    void findingsBelowThresholdAreReportedButPass() throws Exception {
        Path dir = pluginDir();
        Files.writeString(dir.resolve("Reflect.java"), "class Reflect { void f(java.lang.reflect.Field f) { f.setAccessible(true); } }");

        AuditResult lenient = new RuleBasedAuditService(Severity.HIGH).validate(PluginSource.directory(dir));
        AuditResult strict = new RuleBasedAuditService(Severity.MEDIUM).validate(PluginSource.directory(dir));

        assertTrue(lenient.isPassed());
        assertEquals(DefaultAuditRules.ACCESS_SUPPRESSION, lenient.getFindings().get(0).getRuleId());
        assertFalse(strict.isPassed());
    }

    @Test
    void nonTextFilesAreNotScanned() throws Exception {
        Path dir = pluginDir();
        Files.writeString(dir.resolve("notes.txt"), "System.exit(1)");

        AuditResult result = new RuleBasedAuditService(Severity.LOW).validate(PluginSource.directory(dir));

        assertTrue(result.isPassed());
        assertEquals(List.of(), result.getFindings());
    }

    @Test
    void oversizedFileFailsAuditInsteadOfBeingSkipped() throws Exception {
        Path dir = pluginDir();
        Files.writeString(dir.resolve("big.js"), "x".repeat((int) RuleBasedAuditService.MAX_FILE_BYTES) + "process.exit(1)");

        AuditResult result = new RuleBasedAuditService(Severity.CRITICAL).validate(PluginSource.directory(dir));

        assertFalse(result.isPassed());
        AuditFinding finding = result.getFindings().get(0);
        assertEquals(RuleBasedAuditService.OVERSIZED_FILE, finding.getRuleId());
        assertEquals("big.js", finding.getLocation());
    }

    @Test
    void invalidUtf8BytesDoNotHideMatches() throws Exception {
        Path dir = pluginDir();
        ByteArrayOutputStream content = new ByteArrayOutputStream();
        content.write("require('child_process').exec('rm -rf /'); // \0".getBytes(StandardCharsets.UTF_8));
        content.write(0xFF);
        Files.write(dir.resolve("index.js"), content.toByteArray());

        AuditResult result = new RuleBasedAuditService(Severity.HIGH).validate(PluginSource.directory(dir));

        assertFalse(result.isPassed());
        assertEquals(DefaultAuditRules.PROCESS_EXECUTION, result.getFindings().get(0).getRuleId());
        assertEquals("index.js", result.getFindings().get(0).getLocation());
    }

    @Test
    void customRulesReplaceDefaults() throws Exception {
        Path dir = pluginDir();
        Files.writeString(dir.resolve("settings.yaml"), "endpoint: http://internal.example\n");
        List<AuditRule> rules = List.of(new AuditRule("plain-http", "Uses plain HTTP", "http://", Severity.HIGH));

        AuditResult result = new RuleBasedAuditService(rules, Severity.HIGH).validate(PluginSource.directory(dir));

        assertFalse(result.isPassed());
        assertEquals("settings.yaml", result.getFindings().get(0).getLocation());
    }

    @Test
    void classpathSourcesScanOnlyTheManifest() throws Exception {
        RuleBasedAuditService audit = new RuleBasedAuditService(Severity.HIGH);

        assertTrue(audit.validate(PluginSource.classpath("clean")).isPassed());
        AuditResult exits = audit.validate(PluginSource.classpath("exits"));
        assertFalse(exits.isPassed());
        assertEquals(DefaultAuditRules.SYSTEM_EXIT, exits.getFindings().get(0).getRuleId());
        assertTrue(audit.validate(PluginSource.classpath("absent")).isPassed());
    }

    @Test
    void interruptedAuditStops() throws Exception {
        Path dir = pluginDir();
        AtomicReference<Throwable> failure = new AtomicReference<>();
        Thread t = new Thread(() -> {
            Thread.currentThread().interrupt();
            try {
                new RuleBasedAuditService(Severity.HIGH).validate(PluginSource.directory(dir));
            } catch (Throwable e) {
                failure.set(e);
            }
        });
        t.start();
        t.join(5000);

        assertInstanceOf(InterruptedException.class, failure.get());
    }
}
