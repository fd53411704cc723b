package com.tempeh.plugin.loader;

import com.tempeh.plugin.DuplicatePluginIdException;
import com.tempeh.plugin.Plugin;
import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.PluginProvider;
import com.tempeh.plugin.PluginSecurityException;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.PluginValidationException;
import com.tempeh.plugin.audit.AuditResult;
import com.tempeh.plugin.audit.AuditService;
import com.tempeh.plugin.manifest.ManifestReader;
import com.tempeh.plugin.manifest.ManifestValidator;
import com.tempeh.plugin.manifest.PluginManifest;
import com.tempeh.plugin.manifest.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Turns a {@link PluginSource} into a {@link LoadedPlugin}: read manifest, validate, audit, resolve the
 * entry point from the {@link PluginCatalog}. Never touches a registry.
 * <p>
 * At most one load per plugin id is in flight. The id is claimed once the manifest is parsed; a
 * concurrent load of the same source waits for and shares the in-flight result. A concurrent load of a
 * different source declaring the same id waits for the claimant: it fails with
 * {@link DuplicatePluginIdException} if the claimant loaded, and takes over the claim if it failed.
 * <p>
 * Loads are cancellable by interrupting the loading thread: the interrupt status is checked between
 * stages, and a cancelled load releases its claim and any plugin instance it created.
 */
public final class PluginLoader {

    private static final Logger log = LoggerFactory.getLogger(PluginLoader.class);

    private final ManifestReader manifestReader;
    private final ManifestValidator validator;
    private final PluginCatalog catalog;
    private final AuditService auditService;
    private final ConcurrentHashMap<String, InFlight> inFlight = new ConcurrentHashMap<>();

    public PluginLoader(PluginCatalog catalog, AuditService auditService) {
        this(new ManifestReader(), catalog, auditService);
    }

    public PluginLoader(ManifestReader manifestReader, PluginCatalog catalog, AuditService auditService) {
        this.manifestReader = Objects.requireNonNull(manifestReader, "manifestReader");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.auditService = Objects.requireNonNull(auditService, "auditService");
        this.validator = new ManifestValidator(catalog::contains);
    }

    /**
     * Loads a plugin source.
     *
     * @return descriptor plus an inactive handle
     * @throws PluginValidationException manifest missing, malformed or invalid
     * @throws PluginSecurityException   audit did not pass
     * @throws DuplicatePluginIdException another source with the same id loaded while this one waited
     * @throws PluginException           the provider failed to create the plugin
     * @throws InterruptedException      the load was cancelled
     */
    public LoadedPlugin load(PluginSource source) throws InterruptedException {
        Objects.requireNonNull(source, "source");
        checkCancelled(source);
        PluginManifest manifest = manifestReader.read(source);
        ValidationResult validation = validator.validate(manifest);
        String declaredId = manifest.getId() != null && !manifest.getId().isBlank() ? manifest.getId().trim() : null;
        if (!validation.isValid()) {
            log.debug("Manifest at {} failed validation: {}", source, validation.getErrors());
            throw new PluginValidationException(declaredId, source.toString(), validation);
        }
        String id = declaredId;

        InFlight mine = new InFlight(source);
        InFlight existing;
        while ((existing = inFlight.putIfAbsent(id, mine)) != null) {
            if (existing.source.equals(source)) {
                log.debug("Joining in-flight load of {} from {}", id, source);
                return join(existing, id, source);
            }
            log.debug("Waiting for in-flight load of {} from {} before loading {}", id, existing.source, source);
            if (succeeded(existing)) {
                throw new DuplicatePluginIdException("Plugin " + id + " is already loaded from " + existing.source,
                        id, source.toString());
            }
            log.debug("In-flight load of {} from {} failed; claiming it for {}", id, existing.source, source);
        }
        try {
            LoadedPlugin loaded = doLoad(id, source, manifest, validation);
            mine.result.complete(loaded);
            return loaded;
        } catch (InterruptedException | RuntimeException e) {
            mine.result.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(id, mine);
        }
    }

    private LoadedPlugin doLoad(String id, PluginSource source, PluginManifest manifest, ValidationResult validation)
            throws InterruptedException {
        PluginDescriptor descriptor = manifest.toDescriptor();
        checkCancelled(source);

        log.debug("Auditing {} from {}", id, source);
        AuditResult audit = auditService.validate(source);
        if (audit == null || !audit.isPassed()) {
            AuditResult result = audit != null ? audit : AuditResult.fail(List.of());
            log.warn("Security audit rejected plugin {} from {} ({} finding(s))", id, source, result.getFindings().size());
            throw new PluginSecurityException(id, source.toString(), result);
        }
        checkCancelled(source);

        String entryPoint = descriptor.getEntryPoint() != null ? descriptor.getEntryPoint() : id;
        PluginProvider provider = catalog.get(entryPoint);
        Plugin plugin;
        try {
            plugin = provider != null ? provider.createPlugin() : new DeclarativePlugin();
        } catch (RuntimeException e) {
            throw new PluginException("Provider " + entryPoint + " failed to create plugin " + id + ": " + e.getMessage(),
                    id, source.toString(), e);
        }
        if (plugin == null) {
            throw new PluginException("Provider " + entryPoint + " returned no plugin for " + id, id, source.toString());
        }
        ActivationHandle handle = new ActivationHandle(plugin,
                new DefaultPluginContext(descriptor, source.getPath()), provider == null);
        if (Thread.interrupted()) {
            handle.release();
            throw new InterruptedException("Load of " + source + " cancelled");
        }
        log.info("Loaded plugin {} from {}{}", descriptor, source, provider == null ? " (declarative)" : "");
        return new LoadedPlugin(descriptor, source, validation.getWarnings(), audit, handle);
    }

    private static LoadedPlugin join(InFlight existing, String id, PluginSource source) throws InterruptedException {
        try {
            return existing.result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new PluginException("Load of " + id + " failed: " + cause, id, source.toString(), cause);
        }
    }

    private static boolean succeeded(InFlight existing) throws InterruptedException {
        try {
            existing.result.get();
            return true;
        } catch (ExecutionException e) {
            return false;
        }
    }

    /**
     * Validates a manifest without loading it, using this loader's catalog for entry point checks.
     */
    public ValidationResult validate(PluginManifest manifest) {
        return validator.validate(manifest);
    }

    /**
     * Deactivates and releases a loaded plugin. Idempotent.
     */
    public void unload(LoadedPlugin loaded) {
        if (loaded != null) {
            loaded.getHandle().release();
            log.debug("Unloaded plugin {}", loaded.getId());
        }
    }

    /** Number of loads currently holding an id claim. */
    public int inFlightCount() {
        return inFlight.size();
    }

    private static void checkCancelled(PluginSource source) throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException("Load of " + source + " cancelled");
        }
    }

    private static final class InFlight {
        final PluginSource source;
        final CompletableFuture<LoadedPlugin> result = new CompletableFuture<>();

        InFlight(PluginSource source) {
            this.source = source;
        }
    }
}
