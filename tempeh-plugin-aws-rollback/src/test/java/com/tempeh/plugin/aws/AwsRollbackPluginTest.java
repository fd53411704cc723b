package com.tempeh.plugin.aws;

import com.tempeh.plugin.PluginActivationException;
import com.tempeh.plugin.PluginContext;
import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.audit.AuditResult;
import com.tempeh.plugin.loader.LoadedPlugin;
import com.tempeh.plugin.loader.PluginCatalog;
import com.tempeh.plugin.loader.PluginLoader;
import com.tempeh.plugin.manifest.ValidationResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AwsRollbackPluginTest {

    private static PluginContext context(Map<String, Object> configuration) {
        return new PluginContext() {
            @Override
            public PluginDescriptor getDescriptor() {
                return PluginDescriptor.builder("aws-rollback", "1.0.0").build();
            }

            @Override
            public Path getWorkingDirectory() {
                return null;
            }

            @Override
            public Map<String, Object> getConfiguration() {
                return configuration;
            }

            @Override
            public Logger getLogger() {
                return LoggerFactory.getLogger("tempeh.plugin.aws-rollback");
            }
        };
    }

    @Test
    void builtInManifestLoadsFromClasspathAndActivates() throws Exception {
        PluginCatalog catalog = new PluginCatalog();
        catalog.registerProvider(new AwsRollbackPluginProvider());
        PluginLoader loader = new PluginLoader(catalog, source -> AuditResult.pass());

        LoadedPlugin loaded = loader.load(PluginSource.classpath(AwsRollbackPluginProvider.CLASSPATH_NAME));
        PluginDescriptor descriptor = loaded.getDescriptor();

        assertEquals("aws-rollback", descriptor.getId());
        assertTrue(descriptor.hasCapability("rollback-strategy:aws-graceful-rollback"));
        assertTrue(descriptor.hasCapability("rollback-strategy:aws-emergency-rollback"));
        assertTrue(descriptor.hasCapability("validator:aws-resource-validator"));
        assertTrue(descriptor.hasCapability("command:aws-health-check"));
        assertEquals(Set.of("aws", "rollback"), descriptor.getKeywords());
        assertEquals(List.of(), loaded.getWarnings());

        loaded.getHandle().activate();
        AwsRollbackPlugin plugin = assertInstanceOf(AwsRollbackPlugin.class, loaded.getHandle().getPlugin());
        assertEquals("us-east-1", plugin.getSettings().getAwsRegion());
        assertEquals(List.of(RollbackStrategy.GRACEFUL, RollbackStrategy.EMERGENCY),
                plugin.getStrategies().stream().map(RollbackStrategy::getName).collect(Collectors.toList()));
    }

    @Test
    void shortTimeoutFailsActivation() {
        AwsRollbackPlugin plugin = new AwsRollbackPlugin();

        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> plugin.activate(context(Map.of("timeoutSeconds", 30))));

        assertTrue(ex.getMessage().contains("at least 60 seconds"));
        assertFalse(plugin.isActive());
        assertEquals(List.of(), plugin.getStrategies());
    }

    @Test
    void manifestOverridesReachActivation(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("plugin.json"), "{\"id\": \"aws-custom\", \"version\": \"1.0.0\", "
                + "\"capabilities\": [{\"type\": \"rollback-strategy\", \"name\": \"aws-graceful-rollback\"}], "
                + "\"entryPoint\": \"aws-rollback\", \"configuration\": {\"timeoutSeconds\": 30}}");
        PluginCatalog catalog = new PluginCatalog();
        catalog.registerProvider(new AwsRollbackPluginProvider());
        LoadedPlugin loaded = new PluginLoader(catalog, source -> AuditResult.pass()).load(PluginSource.directory(dir));

        PluginActivationException ex = assertThrows(PluginActivationException.class, () -> loaded.getHandle().activate());

        assertEquals("aws-custom", ex.getPluginId());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        assertFalse(((AwsRollbackPlugin) loaded.getHandle().getPlugin()).isActive());
    }

    @Test
    void malformedValuesAreRejected() {
        ValidationResult result = AwsRollbackSettings.from(Map.of("timeoutSeconds", "soon", "enableHealthChecks", "maybe"))
                .validate();

        assertEquals(2, result.getErrors().size());
        assertTrue(AwsRollbackSettings.from(Map.of("timeoutSeconds", "120")).validate().isValid());
    }

    @Test
    void highRetryCountIsOnlyAWarning() {
        ValidationResult result = AwsRollbackSettings.from(Map.of("maxRetries", 11)).validate();

        assertTrue(result.isValid());
        assertEquals(1, result.getWarnings().size());

        AwsRollbackPlugin plugin = new AwsRollbackPlugin();
        plugin.activate(context(Map.of("maxRetries", 11, "enableHealthChecks", false)));
        assertEquals(11, plugin.getSettings().getMaxRetries());
        assertEquals(List.of("drain-connections", "terminate-instances", "cleanup-resources"),
                plugin.getStrategy(RollbackStrategy.GRACEFUL).getSteps().stream()
                        .map(RollbackStep::getName).collect(Collectors.toList()));
    }

    @Test
    void strategiesAndHealthCheckOnlyWhileActive() {
        AwsRollbackPlugin plugin = new AwsRollbackPlugin();
        assertThrows(IllegalStateException.class, () -> plugin.healthCheck(null, null));

        plugin.activate(context(Map.of("awsRegion", "eu-west-1")));
        RollbackStrategy graceful = plugin.getStrategy(RollbackStrategy.GRACEFUL);
        assertEquals(2900, graceful.getExpectedDurationMillis());
        assertEquals(1, plugin.getStrategy(RollbackStrategy.EMERGENCY).getWarnings().size());
        assertNull(plugin.getStrategy("gcp-rollback"));
        assertEquals("healthy", plugin.healthCheck("i-123", null).get("ec2-instances"));

        plugin.deactivate();
        assertEquals(List.of(), plugin.getStrategies());
        assertThrows(IllegalStateException.class, plugin::getResourceValidator);
    }

    @Test
    void resourceValidatorChecksInstanceTypes() {
        AwsResourceValidator validator = new AwsResourceValidator();

        assertFalse(validator.validate(Map.of("resourceType", "aws_instance")).isValid());
        ValidationResult deprecated = validator.validate(Map.of("resourceType", "aws_instance", "instanceType", "t1.micro"));
        assertTrue(deprecated.isValid());
        assertEquals(1, deprecated.getWarnings().size());
        assertTrue(validator.validate(Map.of("resourceType", "aws_s3_bucket")).isValid());
    }
}
