package com.tempeh.plugin.loader;

import com.tempeh.plugin.Plugin;
import com.tempeh.plugin.PluginActivationException;
import com.tempeh.plugin.PluginContext;
import com.tempeh.plugin.ResourceCleanup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Controls one loaded plugin instance. Creating a handle has no side effects; the plugin only runs on
 * {@link #activate()}. After {@link #release()} the handle is dead and cannot be activated again.
 */
public final class ActivationHandle {

    private static final Logger log = LoggerFactory.getLogger(ActivationHandle.class);

    public enum State {
        LOADED,
        ACTIVE,
        INACTIVE,
        RELEASED
    }

    private final Plugin plugin;
    private final PluginContext context;
    private final boolean declarative;
    private State state = State.LOADED;

    ActivationHandle(Plugin plugin, PluginContext context, boolean declarative) {
        this.plugin = plugin;
        this.context = context;
        this.declarative = declarative;
    }

    /**
     * Activates the plugin. No-op when already active.
     *
     * @throws PluginActivationException if the plugin's activate throws; the handle stays inactive
     * @throws IllegalStateException if the handle was released
     */
    public synchronized void activate() {
        if (state == State.RELEASED) {
            throw new IllegalStateException("Plugin handle released: " + pluginId());
        }
        if (state == State.ACTIVE) {
            return;
        }
        try {
            plugin.activate(context);
            state = State.ACTIVE;
        } catch (Exception e) {
            throw new PluginActivationException("Activation of " + pluginId() + " failed: " + e.getMessage(),
                    pluginId(), e);
        }
    }

    /**
     * Deactivates the plugin if active. The handle is inactive afterwards even when deactivate throws.
     *
     * @throws PluginActivationException if the plugin's deactivate throws
     */
    public synchronized void deactivate() {
        if (state != State.ACTIVE) {
            return;
        }
        try {
            plugin.deactivate();
        } catch (Exception e) {
            throw new PluginActivationException("Deactivation of " + pluginId() + " failed: " + e.getMessage(),
                    pluginId(), e);
        } finally {
            state = State.INACTIVE;
        }
    }

    /**
     * Deactivates if active and runs {@link ResourceCleanup#onExit()}. Idempotent; failures are logged.
     */
    public synchronized void release() {
        if (state == State.RELEASED) {
            return;
        }
        try {
            deactivate();
        } catch (PluginActivationException e) {
            log.warn("{} while releasing plugin", e.getMessage(), e.getCause());
        }
        if (plugin instanceof ResourceCleanup) {
            try {
                ((ResourceCleanup) plugin).onExit();
            } catch (RuntimeException e) {
                log.warn("onExit failed for plugin {}: {}", pluginId(), e.getMessage(), e);
            }
        }
        state = State.RELEASED;
    }

    public synchronized State getState() {
        return state;
    }

    /** True when the plugin has no entry point and activation is a no-op. */
    public boolean isDeclarative() {
        return declarative;
    }

    /** The plugin instance; callers use it to reach capabilities the plugin exposes once active. */
    public Plugin getPlugin() {
        return plugin;
    }

    private String pluginId() {
        return context.getDescriptor().getId();
    }
}
