package com.tempeh.plugin.manager;

import com.tempeh.config.TempehConfig;
import com.tempeh.plugin.DuplicatePluginIdException;
import com.tempeh.plugin.PluginActivationException;
import com.tempeh.plugin.PluginDependencyException;
import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.PluginNotFoundException;
import com.tempeh.plugin.PluginSecurityException;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.PluginValidationException;
import com.tempeh.plugin.loader.LoadedPlugin;
import com.tempeh.plugin.loader.PluginLoader;
import com.tempeh.plugin.registry.PluginRegistry;
import com.tempeh.plugin.version.VersionRange;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.FutureTask;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Central plugin manager: discovers plugin sources, loads them through the {@link PluginLoader} on a
 * bounded executor, orders them by dependency, registers them in the {@link PluginRegistry} and drives
 * each plugin's {@link LifecycleState}. The only component that calls loader and registry together.
 * <p>
 * <b>Operational:</b> per-plugin failures (invalid manifest, rejected audit, missing dependency, failed
 * activation) are <b>logged and reported</b> in {@link LoadReport} / {@link BatchReport}; the batch
 * continues. Nothing is retried. Lifecycle changes run under one lock; loads run outside it.
 * <p>
 * Metrics: {@code tempeh.plugin.loads{outcome}}, {@code tempeh.plugin.load.duration},
 * {@code tempeh.plugin.activations{outcome}}, gauge {@code tempeh.plugin.enabled}.
 */
public final class PluginManager implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PluginManager.class);

    private final PluginRegistry registry;
    private final PluginLoader loader;
    private final List<PluginSourceProvider> sourceProviders;
    private final int loadTimeoutSeconds;
    private final ExecutorService loadExecutor;
    private final ScheduledExecutorService watchdog;
    private final MeterRegistry meterRegistry;
    private final Timer loadTimer;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ManagedPlugin> records = new LinkedHashMap<>();
    private long activationCounter;
    private volatile boolean closed;

    private PluginManager(Builder b) {
        this.registry = b.registry != null ? b.registry : new PluginRegistry();
        this.loader = Objects.requireNonNull(b.loader, "loader");
        this.sourceProviders = List.copyOf(b.sourceProviders);
        this.loadTimeoutSeconds = b.loadTimeoutSeconds;
        this.loadExecutor = Executors.newFixedThreadPool(b.loadConcurrency, daemonThreads("tempeh-plugin-load-"));
        this.watchdog = Executors.newSingleThreadScheduledExecutor(daemonThreads("tempeh-plugin-watchdog-"));
        this.meterRegistry = b.meterRegistry != null ? b.meterRegistry : new SimpleMeterRegistry();
        this.loadTimer = Timer.builder("tempeh.plugin.load.duration")
                .description("Time to read, validate and audit one plugin")
                .register(meterRegistry);
        Gauge.builder("tempeh.plugin.enabled", this, PluginManager::countEnabled)
                .description("Plugins currently enabled")
                .register(meterRegistry);
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- discovery and loading ---

    /** Candidate sources from the configured providers, duplicates collapsed. Does not touch the registry. */
    public List<PluginSource> discover() {
        return discover(sourceProviders);
    }

    public List<PluginSource> discover(List<PluginSourceProvider> providers) {
        Set<PluginSource> sources = new LinkedHashSet<>();
        for (PluginSourceProvider provider : providers) {
            try {
                List<PluginSource> found = provider.sources();
                if (found != null) {
                    sources.addAll(found);
                }
            } catch (RuntimeException e) {
                log.warn("Plugin source provider {} failed: {}", provider.getClass().getName(), e.getMessage());
            }
        }
        log.debug("Discovered {} plugin source(s)", sources.size());
        return List.copyOf(sources);
    }

    /**
     * Loads candidates concurrently, then records results in candidate order. The first source to
     * validate an id wins; later sources with that id, and ids already tracked in a live state, fail
     * with {@link DuplicatePluginIdException}.
     */
    public LoadReport loadAll(List<PluginSource> candidates) {
        ensureOpen();
        List<PluginSource> unique = new ArrayList<>(new LinkedHashSet<>(candidates));
        List<TimedLoad> tasks = new ArrayList<>(unique.size());
        for (PluginSource source : unique) {
            TimedLoad task = new TimedLoad(loader, source, watchdog, loadTimeoutSeconds, loadTimer);
            tasks.add(task);
            loadExecutor.execute(task);
        }

        List<Object> outcomes = new ArrayList<>(tasks.size());
        boolean interrupted = false;
        for (TimedLoad task : tasks) {
            if (interrupted) {
                task.cancel(true);
            }
            try {
                outcomes.add(awaitOutcome(task));
            } catch (InterruptedException e) {
                interrupted = true;
                task.cancel(true);
                outcomes.add(cancelled(task.source, e));
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }

        List<LoadedPlugin> loaded = new ArrayList<>();
        Map<PluginSource, PluginException> failures = new LinkedHashMap<>();
        lock.lock();
        try {
            Set<String> batchIds = new LinkedHashSet<>();
            for (int i = 0; i < tasks.size(); i++) {
                PluginSource source = tasks.get(i).source;
                Object outcome = outcomes.get(i);
                if (outcome instanceof LoadedPlugin) {
                    LoadedPlugin lp = (LoadedPlugin) outcome;
                    String id = lp.getId();
                    ManagedPlugin existing = records.get(id);
                    if (batchIds.contains(id) || (existing != null && !existing.getState().isTerminal())) {
                        PluginException dup = new DuplicatePluginIdException("Plugin " + id + " from " + source
                                + " duplicates the one loaded from " + (existing != null ? existing.getSource() : "this batch"),
                                id, source.toString());
                        if (existing == null || existing.getLoaded() != lp) {
                            loader.unload(lp);
                        }
                        recordLoadFailure(failures, source, dup);
                        continue;
                    }
                    ManagedPlugin record = new ManagedPlugin(id, source);
                    record.setLoaded(lp);
                    record.transitionTo(LifecycleState.VALIDATED);
                    records.remove(id);
                    records.put(id, record);
                    batchIds.add(id);
                    loaded.add(lp);
                    meterRegistry.counter("tempeh.plugin.loads", "outcome", "success").increment();
                    for (String warning : lp.getWarnings()) {
                        log.warn("Plugin {}: {}", id, warning);
                    }
                } else {
                    PluginException ex = (PluginException) outcome;
                    recordLoadFailure(failures, source, ex);
                    String id = ex.getPluginId();
                    if (id != null && !(ex instanceof DuplicatePluginIdException) && !batchIds.contains(id)) {
                        ManagedPlugin existing = records.get(id);
                        if (existing == null || existing.getState().isTerminal()) {
                            ManagedPlugin record = new ManagedPlugin(id, source);
                            record.fail(ex);
                            records.remove(id);
                            records.put(id, record);
                        }
                    }
                }
            }
        } finally {
            lock.unlock();
        }
        log.info("Loaded {} plugin(s), {} failure(s)", loaded.size(), failures.size());
        return new LoadReport(loaded, failures);
    }

    private void recordLoadFailure(Map<PluginSource, PluginException> failures, PluginSource source, PluginException ex) {
        failures.put(source, ex);
        meterRegistry.counter("tempeh.plugin.loads", "outcome", loadOutcome(ex)).increment();
        log.warn("Failed to load plugin from {}: {}", source, ex.getMessage());
    }

    private static Object awaitOutcome(TimedLoad task) throws InterruptedException {
        try {
            return task.get();
        } catch (CancellationException e) {
            if (task.timedOut) {
                return new PluginException("Load of " + task.source + " timed out after " + task.timeoutSeconds + "s",
                        null, task.source.toString());
            }
            return cancelled(task.source, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof PluginException) {
                return cause;
            }
            if (cause instanceof InterruptedException) {
                return cancelled(task.source, cause);
            }
            return new PluginException("Load of " + task.source + " failed: " + cause, null,
                    task.source.toString(), cause);
        }
    }

    private static PluginException cancelled(PluginSource source, Throwable cause) {
        return new PluginException("Load of " + source + " cancelled", null, source.toString(), cause);
    }

    private static String loadOutcome(PluginException ex) {
        if (ex instanceof PluginValidationException) return "invalid";
        if (ex instanceof PluginSecurityException) return "rejected";
        if (ex instanceof DuplicatePluginIdException) return "duplicate";
        if (ex.getMessage() != null && ex.getMessage().contains("timed out")) return "timeout";
        return "error";
    }

    // --- dependency order and batch enable ---

    /**
     * Dependency order for loaded plugins. Dependencies may be satisfied within the batch or by
     * registered plugins. Does not change any state.
     */
    public ResolutionResult resolveOrder(Collection<LoadedPlugin> loaded) {
        Map<String, LoadedPlugin> byId = new LinkedHashMap<>();
        List<PluginDescriptor> descriptors = new ArrayList<>();
        for (LoadedPlugin lp : loaded) {
            if (byId.putIfAbsent(lp.getId(), lp) == null) {
                descriptors.add(lp.getDescriptor());
            }
        }
        DependencyResolver.Resolution resolution = DependencyResolver.resolve(descriptors, registry::get);
        List<LoadedPlugin> ordered = new ArrayList<>();
        for (String id : resolution.getOrder()) {
            ordered.add(byId.get(id));
        }
        return new ResolutionResult(ordered, resolution.getFailures());
    }

    /** Registers and enables the successfully loaded plugins of a report in dependency order. */
    public BatchReport enableAll(LoadReport report) {
        return enableBatch(report.getLoaded(), report.getFailures());
    }

    public BatchReport enableAll(Collection<LoadedPlugin> loaded) {
        return enableBatch(loaded, Map.of());
    }

    public BatchReport loadAndEnable(List<PluginSource> candidates) {
        return enableAll(loadAll(candidates));
    }

    /** Discovers, loads and enables everything the configured providers supply. */
    public BatchReport initialize() {
        return loadAndEnable(discover());
    }

    private BatchReport enableBatch(Collection<LoadedPlugin> loaded, Map<PluginSource, PluginException> loadFailures) {
        ensureOpen();
        lock.lock();
        try {
            ResolutionResult resolution = resolveOrder(loaded);
            Map<String, PluginException> failures = new LinkedHashMap<>();
            List<String> enabled = new ArrayList<>();
            resolution.getFailures().forEach((id, ex) -> {
                log.warn("Cannot enable plugin {}: {}", id, ex.getMessage());
                failRecord(id, ex);
                failures.put(id, ex);
            });
            for (LoadedPlugin lp : resolution.getOrdered()) {
                String id = lp.getId();
                String failedDependency = firstFailed(lp.getDescriptor().getDependencies().keySet(), failures.keySet());
                if (failedDependency != null) {
                    PluginException ex = new PluginDependencyException(
                            "Plugin " + id + " depends on " + failedDependency + ", which failed", id, failedDependency);
                    log.warn("Cannot enable plugin {}: {}", id, ex.getMessage());
                    failRecord(id, ex);
                    failures.put(id, ex);
                    continue;
                }
                try {
                    enable(id);
                    enabled.add(id);
                } catch (PluginException e) {
                    failRecord(id, e);
                    failures.put(id, e);
                }
            }
            return new BatchReport(enabled, failures, loadFailures);
        } finally {
            lock.unlock();
        }
    }

    private static String firstFailed(Collection<String> dependencies, Set<String> failed) {
        for (String dep : dependencies) {
            if (failed.contains(dep)) {
                return dep;
            }
        }
        return null;
    }

    // --- single-plugin lifecycle ---

    /**
     * Puts a validated plugin into the registry without activating it. No-op when already registered.
     */
    public void register(String id) {
        lock.lock();
        try {
            ManagedPlugin record = liveRecord(id);
            requireNotFailed(record);
            registerIfNeeded(record);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers (if needed) and activates a plugin. Every dependency must already be enabled (or be a
     * registered plugin the manager does not track) and within its version range. No-op when enabled.
     *
     * @throws PluginNotFoundException    unknown or unloaded id
     * @throws PluginDependencyException  a dependency is not enabled or out of range; state unchanged
     * @throws PluginActivationException  activate threw; the plugin is rolled back and FAILED
     */
    public void enable(String id) {
        ensureOpen();
        lock.lock();
        try {
            ManagedPlugin record = liveRecord(id);
            requireNotFailed(record);
            if (record.getState() == LifecycleState.ENABLED) {
                return;
            }
            PluginDescriptor descriptor = record.getDescriptor();
            checkDependenciesEnabled(descriptor);
            registerIfNeeded(record);
            try {
                record.getLoaded().getHandle().activate();
            } catch (PluginActivationException e) {
                log.error("Failed to activate plugin {}: {}", id, e.getMessage(), e.getCause());
                meterRegistry.counter("tempeh.plugin.activations", "outcome", "failure").increment();
                failRecord(id, e);
                throw e;
            }
            record.transitionTo(LifecycleState.ENABLED);
            record.markActivated(++activationCounter);
            meterRegistry.counter("tempeh.plugin.activations", "outcome", "success").increment();
            log.info("Enabled plugin {}", descriptor);
        } finally {
            lock.unlock();
        }
    }

    public void disable(String id) {
        disable(id, false);
    }

    /**
     * Deactivates a plugin; its descriptor stays registered. No-op unless enabled.
     *
     * @param force also disable enabled dependents (most recently enabled first) instead of refusing
     * @throws PluginDependencyException enabled dependents exist and {@code force} is false
     */
    public void disable(String id, boolean force) {
        lock.lock();
        try {
            ManagedPlugin record = liveRecord(id);
            if (!record.getState().canDisable()) {
                return;
            }
            List<ManagedPlugin> dependents = enabledDependents(id);
            if (!dependents.isEmpty()) {
                if (!force) {
                    List<String> ids = new ArrayList<>();
                    dependents.forEach(d -> ids.add(d.getId()));
                    throw new PluginDependencyException("Plugin " + id + " is required by enabled plugin(s) " + ids,
                            id, ids.get(0));
                }
                for (ManagedPlugin dependent : dependents) {
                    disable(dependent.getId(), true);
                }
            }
            try {
                record.getLoaded().getHandle().deactivate();
            } catch (PluginActivationException e) {
                log.error("Failed to deactivate plugin {}: {}", id, e.getMessage(), e.getCause());
                failRecord(id, e);
                throw e;
            }
            record.transitionTo(LifecycleState.DISABLED);
            log.info("Disabled plugin {}", record.getDescriptor());
        } finally {
            lock.unlock();
        }
    }

    public void remove(String id) {
        remove(id, false);
    }

    /**
     * Disables (if enabled), unregisters and releases a plugin; the record ends UNLOADED. Removing a
     * FAILED plugin drops its record.
     *
     * @param force disable enabled dependents instead of refusing
     */
    public void remove(String id, boolean force) {
        lock.lock();
        try {
            ManagedPlugin record = liveRecord(id);
            if (record.getState() == LifecycleState.FAILED) {
                records.remove(id);
                log.info("Removed failed plugin {}", id);
                return;
            }
            if (record.getState() == LifecycleState.ENABLED) {
                disable(id, force);
            }
            if (record.getState().isRegistered() && registry.contains(id)) {
                registry.unregister(id);
            }
            loader.unload(record.getLoaded());
            record.transitionTo(LifecycleState.UNLOADED);
            log.info("Removed plugin {}", id);
        } finally {
            lock.unlock();
        }
    }

    private void registerIfNeeded(ManagedPlugin record) {
        if (record.getState() != LifecycleState.VALIDATED) {
            return;
        }
        try {
            registry.register(record.getDescriptor());
        } catch (DuplicatePluginIdException e) {
            failRecord(record.getId(), e);
            throw e;
        }
        record.transitionTo(LifecycleState.REGISTERED);
        log.debug("Registered plugin {}", record.getDescriptor());
    }

    private void checkDependenciesEnabled(PluginDescriptor descriptor) {
        String id = descriptor.getId();
        for (Map.Entry<String, String> dep : descriptor.getDependencies().entrySet()) {
            String depId = dep.getKey();
            ManagedPlugin depRecord = records.get(depId);
            PluginDescriptor target;
            if (depRecord != null) {
                if (depRecord.getState() != LifecycleState.ENABLED) {
                    throw new PluginDependencyException("Plugin " + id + " requires " + depId
                            + " to be enabled (currently " + depRecord.getState() + ")", id, depId);
                }
                target = depRecord.getDescriptor();
            } else {
                target = registry.get(depId);
                if (target == null) {
                    throw new PluginDependencyException("Plugin " + id + " requires " + depId
                            + ", which is not available", id, depId);
                }
            }
            boolean satisfied;
            try {
                satisfied = VersionRange.parse(dep.getValue()).isSatisfiedBy(target.getVersion());
            } catch (IllegalArgumentException e) {
                satisfied = false;
            }
            if (!satisfied) {
                throw new PluginDependencyException("Plugin " + id + " requires " + depId + "@" + dep.getValue()
                        + " but found " + target.getVersion(), id, depId);
            }
        }
    }

    private List<ManagedPlugin> enabledDependents(String id) {
        List<ManagedPlugin> out = new ArrayList<>();
        for (ManagedPlugin r : records.values()) {
            if (r.getState() == LifecycleState.ENABLED && r.getDescriptor().getDependencies().containsKey(id)) {
                out.add(r);
            }
        }
        out.sort(Comparator.comparingLong(ManagedPlugin::getActivationSequence).reversed());
        return out;
    }

    /** Rolls a live record back (unregister, release) and marks it FAILED. */
    private void failRecord(String id, PluginException cause) {
        ManagedPlugin record = records.get(id);
        if (record == null || record.getState().isTerminal()) {
            return;
        }
        if (record.getState().isRegistered() && registry.contains(id)) {
            registry.unregister(id);
        }
        loader.unload(record.getLoaded());
        record.fail(cause);
        log.warn("Plugin {} failed: {}", id, cause.getMessage());
    }

    private ManagedPlugin liveRecord(String id) {
        ManagedPlugin record = id == null ? null : records.get(id);
        if (record == null || record.getState() == LifecycleState.UNLOADED) {
            throw new PluginNotFoundException(id);
        }
        return record;
    }

    private static void requireNotFailed(ManagedPlugin record) {
        if (record.getState() == LifecycleState.FAILED) {
            PluginException failure = record.getFailure();
            throw new PluginException("Plugin " + record.getId() + " failed"
                    + (failure != null ? ": " + failure.getMessage() : ""), record.getId(),
                    record.getSource() != null ? record.getSource().toString() : null, failure);
        }
    }

    // --- queries ---

    /** Current state, or null for ids the manager never saw. */
    public LifecycleState getState(String id) {
        lock.lock();
        try {
            ManagedPlugin record = records.get(id);
            return record != null ? record.getState() : null;
        } finally {
            lock.unlock();
        }
    }

    /** Record for the id, or null. */
    public ManagedPlugin getPlugin(String id) {
        lock.lock();
        try {
            return records.get(id);
        } finally {
            lock.unlock();
        }
    }

    /** Every record, including FAILED and UNLOADED ones, in the order first seen. */
    public List<ManagedPlugin> getPlugins() {
        lock.lock();
        try {
            return List.copyOf(records.values());
        } finally {
            lock.unlock();
        }
    }

    public List<ManagedPlugin> getEnabledPlugins() {
        lock.lock();
        try {
            List<ManagedPlugin> out = new ArrayList<>();
            for (ManagedPlugin r : records.values()) {
                if (r.getState() == LifecycleState.ENABLED) {
                    out.add(r);
                }
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    public PluginRegistry getRegistry() {
        return registry;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    private double countEnabled() {
        lock.lock();
        try {
            int n = 0;
            for (ManagedPlugin r : records.values()) {
                if (r.getState() == LifecycleState.ENABLED) {
                    n++;
                }
            }
            return n;
        } finally {
            lock.unlock();
        }
    }

    // --- shutdown ---

    /**
     * Removes every live plugin (enabled ones in reverse activation order first) and stops the load
     * executor. Failures are logged so every plugin gets released.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        lock.lock();
        try {
            List<ManagedPlugin> live = new ArrayList<>();
            for (ManagedPlugin r : records.values()) {
                if (!r.getState().isTerminal()) {
                    live.add(0, r);
                }
            }
            live.sort(Comparator.comparing((ManagedPlugin r) -> r.getState() != LifecycleState.ENABLED)
                    .thenComparing(Comparator.comparingLong(ManagedPlugin::getActivationSequence).reversed()));
            for (ManagedPlugin r : live) {
                try {
                    remove(r.getId(), true);
                } catch (PluginException | IllegalStateException e) {
                    log.warn("Failed to remove plugin {} on close: {}", r.getId(), e.getMessage());
                }
            }
            closed = true;
        } finally {
            lock.unlock();
        }
        loadExecutor.shutdownNow();
        watchdog.shutdownNow();
        log.debug("Plugin manager closed");
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Plugin manager is closed");
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /** One load task; cancels (interrupts) itself when it runs longer than the timeout. */
    private static final class TimedLoad extends FutureTask<LoadedPlugin> {
        private final PluginSource source;
        private final ScheduledExecutorService watchdog;
        private final int timeoutSeconds;
        private final Timer timer;
        private volatile boolean timedOut;

        TimedLoad(PluginLoader loader, PluginSource source, ScheduledExecutorService watchdog,
                  int timeoutSeconds, Timer timer) {
            super(() -> loader.load(source));
            this.source = source;
            this.watchdog = watchdog;
            this.timeoutSeconds = timeoutSeconds;
            this.timer = timer;
        }

        @Override
        public void run() {
            ScheduledFuture<?> deadline = timeoutSeconds > 0
                    ? watchdog.schedule(this::expire, timeoutSeconds, TimeUnit.SECONDS)
                    : null;
            long start = System.nanoTime();
            try {
                super.run();
            } finally {
                timer.record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
                if (deadline != null) {
                    deadline.cancel(false);
                }
            }
        }

        private void expire() {
            if (!isDone()) {
                timedOut = true;
                cancel(true);
            }
        }
    }

    public static final class Builder {
        private PluginRegistry registry;
        private PluginLoader loader;
        private final List<PluginSourceProvider> sourceProviders = new ArrayList<>();
        private int loadConcurrency = 4;
        private int loadTimeoutSeconds = 30;
        private MeterRegistry meterRegistry;

        public Builder registry(PluginRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder loader(PluginLoader loader) {
            this.loader = loader;
            return this;
        }

        public Builder sourceProvider(PluginSourceProvider provider) {
            this.sourceProviders.add(Objects.requireNonNull(provider, "provider"));
            return this;
        }

        public Builder loadConcurrency(int loadConcurrency) {
            if (loadConcurrency < 1) {
                throw new IllegalArgumentException("loadConcurrency must be >= 1: " + loadConcurrency);
            }
            this.loadConcurrency = loadConcurrency;
            return this;
        }

        /** Per-load timeout; 0 disables it. */
        public Builder loadTimeoutSeconds(int loadTimeoutSeconds) {
            this.loadTimeoutSeconds = Math.max(0, loadTimeoutSeconds);
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        /** Applies load concurrency and timeout from configuration. */
        public Builder config(TempehConfig config) {
            return loadConcurrency(config.getLoadConcurrency()).loadTimeoutSeconds(config.getLoadTimeoutSeconds());
        }

        public PluginManager build() {
            return new PluginManager(this);
        }
    }
}
