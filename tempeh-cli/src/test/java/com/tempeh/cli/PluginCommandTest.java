package com.tempeh.cli;

import com.tempeh.config.TempehConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginCommandTest {

    @TempDir
    Path tempDir;

    private TempehConfig config;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        config = TempehConfig.builder()
                .homeDir(tempDir)
                .pluginsDir(tempDir.resolve("plugins"))
                .pluginStateFile(tempDir.resolve("plugins.json"))
                .loadTimeoutSeconds(10)
                .build();
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine cli = TempehCli.newCommandLine(config);
        cli.setOut(new PrintWriter(out, true));
        cli.setErr(new PrintWriter(err, true));
        return cli.execute(args);
    }

    private Path pluginDir(String id, String dependencies, String code) throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("src").resolve(id));
        Files.writeString(dir.resolve("plugin.json"), "{\"id\": \"" + id + "\", \"version\": \"1.2.0\", "
                + "\"author\": \"Ops\", \"description\": \"test\", \"license\": \"MIT\", "
                + "\"capabilities\": [{\"type\": \"hook\", \"name\": \"" + id + "-hook\"}], "
                + "\"keywords\": [\"ops\"], \"dependencies\": {" + dependencies + "}}");
        if (code != null) {
            Files.writeString(dir.resolve("Plugin.java"), code);
        }
        return dir;
    }

    private List<InstalledPlugin> installed() {
        return new InstalledPluginStore(config.getPluginStateFile()).load();
    }

    @Test
    void listShowsBuiltInPluginEnabled() {
        assertEquals(0, run("plugin", "list"));

        assertTrue(out.toString().contains("aws-rollback"));
        assertTrue(out.toString().contains("ENABLED"));
        assertTrue(out.toString().contains("rollback-strategy:aws-graceful-rollback"));
    }

    @Test
    void installRecordsPluginAndLaterRunsLoadIt() throws Exception {
        Path dir = pluginDir("notify", "\"aws-rollback\": \"^1.0.0\"", null);

        assertEquals(0, run("plugin", "install", dir.toString()));
        assertTrue(out.toString().contains("Installed notify@1.2.0"));
        assertTrue(installed().stream().anyMatch(p -> p.getId().equals("notify") && p.isEnabled()));

        assertEquals(0, run("plugin", "list", "--enabled", "--keyword", "ops"));
        assertTrue(out.toString().contains("notify"));
        assertFalse(out.toString().contains("aws-rollback"));

        assertEquals(0, run("plugin", "install", dir.toString()));
        assertTrue(out.toString().contains("already installed"));
    }

    @Test
    void disableAndEnablePersistAcrossRuns() throws Exception {
        Path dir = pluginDir("notify", "", null);
        assertEquals(0, run("plugin", "install", dir.toString()));

        assertEquals(0, run("plugin", "disable", "notify"));
        assertTrue(installed().stream().anyMatch(p -> p.getId().equals("notify") && !p.isEnabled()));

        assertEquals(0, run("plugin", "list", "--disabled"));
        assertTrue(out.toString().contains("notify"));
        assertTrue(out.toString().contains("REGISTERED"));

        assertEquals(0, run("plugin", "enable", "notify"));
        assertEquals(0, run("plugin", "list", "--enabled", "--author", "Ops"));
        assertTrue(out.toString().contains("notify"));
    }

    @Test
    void disableWithEnabledDependentNeedsForce() throws Exception {
        assertEquals(0, run("plugin", "install", pluginDir("base", "", null).toString()));
        assertEquals(0, run("plugin", "install", pluginDir("addon", "\"base\": \"^1.0.0\"", null).toString()));

        assertEquals(1, run("plugin", "disable", "base"));
        assertTrue(err.toString().contains("addon"));

        assertEquals(0, run("plugin", "disable", "base", "--force"));
        assertTrue(installed().stream()
                .filter(p -> p.getId().equals("base") || p.getId().equals("addon"))
                .noneMatch(InstalledPlugin::isEnabled));
    }

    @Test
    void removeForgetsPlugin() throws Exception {
        assertEquals(0, run("plugin", "install", pluginDir("notify", "", null).toString()));

        assertEquals(0, run("plugin", "remove", "notify"));

        assertTrue(installed().stream().noneMatch(p -> p.getId().equals("notify")));
        assertEquals(1, run("plugin", "info", "notify"));
        assertTrue(err.toString().contains("Plugin not found: notify"));
    }

    @Test
    void installRejectsPluginThatFailsAudit() throws Exception {
        Path dir = pluginDir("shell", "", "class Plugin { void run() throws Exception { Runtime.getRuntime().exec(\"id\"); } }");

        assertEquals(1, run("plugin", "install", dir.toString()));

        assertTrue(err.toString().contains("finding:"));
        assertTrue(installed().stream().noneMatch(p -> p.getId().equals("shell")));
    }

    @Test
    void validateReportsErrorsWithoutInstalling() throws Exception {
        Path dir = Files.createDirectories(tempDir.resolve("src").resolve("broken"));
        Files.writeString(dir.resolve("plugin.json"), "{\"id\": \"broken\", \"version\": \"one\"}");

        assertEquals(1, run("plugin", "validate", dir.toString(), "--json"));
        assertTrue(out.toString().contains("\"valid\" : false"));
        assertTrue(out.toString().contains("Invalid version"));

        assertEquals(0, run("plugin", "validate", pluginDir("fine", "", null).toString()));
        assertTrue(out.toString().contains("Plugin fine is valid"));
        assertFalse(Files.exists(config.getPluginStateFile()));
    }

    @Test
    void infoPrintsDescriptorDetails() {
        assertEquals(0, run("plugin", "info", "aws-rollback", "--json"));

        assertTrue(out.toString().contains("\"entryPoint\" : \"aws-rollback\""));
        assertTrue(out.toString().contains("\"state\" : \"ENABLED\""));
    }

    @Test
    void usageErrorsExitWithTwo() {
        assertEquals(2, run("plugin", "install"));
        assertEquals(2, run("plugin", "list", "--enabled", "--disabled"));
        assertEquals(2, run("plugin", "frobnicate"));
        assertEquals(2, run("plugin"));
    }
}
