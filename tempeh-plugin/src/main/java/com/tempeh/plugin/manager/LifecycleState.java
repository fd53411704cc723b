package com.tempeh.plugin.manager;

/**
 * Per-plugin lifecycle: {@code DISCOVERED → VALIDATED → REGISTERED → ENABLED ⇄ DISABLED → UNLOADED},
 * with {@code FAILED} reachable from every non-terminal state. {@code UNLOADED} and {@code FAILED} are
 * terminal; an id whose record is terminal may be loaded again.
 */
public enum LifecycleState {

    /** Source found; manifest not yet read. */
    DISCOVERED,

    /** Manifest valid and audit passed; not in the registry. */
    VALIDATED,

    /** Descriptor in the registry; plugin not active. */
    REGISTERED,

    /** Plugin activated. */
    ENABLED,

    /** Deactivated; descriptor still registered. */
    DISABLED,

    /** Removed from the registry and released. */
    UNLOADED,

    /** A lifecycle step failed; see the record's failure. */
    FAILED;

    public boolean isTerminal() {
        return this == UNLOADED || this == FAILED;
    }

    /** Whether the plugin's descriptor is in the registry in this state. */
    public boolean isRegistered() {
        return this == REGISTERED || this == ENABLED || this == DISABLED;
    }

    public boolean canEnable() {
        return this == VALIDATED || this == REGISTERED || this == DISABLED;
    }

    public boolean canDisable() {
        return this == ENABLED;
    }

    public boolean canTransitionTo(LifecycleState next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        switch (this) {
            case DISCOVERED:
                return next == VALIDATED;
            case VALIDATED:
                return next == REGISTERED || next == ENABLED || next == UNLOADED;
            case REGISTERED:
                return next == ENABLED || next == UNLOADED;
            case ENABLED:
                return next == DISABLED;
            case DISABLED:
                return next == ENABLED || next == UNLOADED;
            default:
                return false;
        }
    }
}
