package com.tempeh.plugin.manager;

import com.tempeh.plugin.PluginDescriptor;
import com.tempeh.plugin.PluginException;
import com.tempeh.plugin.PluginSource;
import com.tempeh.plugin.loader.LoadedPlugin;

/**
 * The manager's record for one plugin id. Mutated only under the manager's lock; readers get the values
 * current at the time of the call.
 */
public final class ManagedPlugin {

    private final String id;
    private final PluginSource source;
    private volatile LifecycleState state = LifecycleState.DISCOVERED;
    private volatile LoadedPlugin loaded;
    private volatile PluginException failure;
    private volatile long activationSequence;

    ManagedPlugin(String id, PluginSource source) {
        this.id = id;
        this.source = source;
    }

    public String getId() {
        return id;
    }

    public PluginSource getSource() {
        return source;
    }

    public LifecycleState getState() {
        return state;
    }

    /** Descriptor, or null when the plugin failed before its manifest was validated. */
    public PluginDescriptor getDescriptor() {
        LoadedPlugin l = loaded;
        return l != null ? l.getDescriptor() : null;
    }

    /** Load result, or null when the plugin failed before loading completed. */
    public LoadedPlugin getLoaded() {
        return loaded;
    }

    /** Cause of the FAILED state, or null. */
    public PluginException getFailure() {
        return failure;
    }

    long getActivationSequence() {
        return activationSequence;
    }

    void setLoaded(LoadedPlugin loaded) {
        this.loaded = loaded;
    }

    void transitionTo(LifecycleState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Plugin " + id + " cannot move from " + state + " to " + next);
        }
        this.state = next;
    }

    void fail(PluginException cause) {
        this.failure = cause;
        this.state = LifecycleState.FAILED;
    }

    void markActivated(long sequence) {
        this.activationSequence = sequence;
    }

    @Override
    public String toString() {
        return id + " [" + state + "]";
    }
}
