package com.tempeh.plugin;

/**
 * Well-known capability types. Any other non-blank type is accepted as-is.
 */
public final class CapabilityType {

    /** Strategy for undoing a failed deployment (e.g. graceful or emergency rollback). */
    public static final String ROLLBACK_STRATEGY = "rollback-strategy";

    /** Pre-deployment validation of resources or configuration. */
    public static final String VALIDATOR = "validator";

    /** Additional CLI command. */
    public static final String COMMAND = "command";

    /** Step injected into the provisioning workflow. */
    public static final String WORKFLOW_EXTENSION = "workflow-extension";

    /** Callback on workflow events. */
    public static final String HOOK = "hook";

    /** Infrastructure provider (e.g. aws). */
    public static final String PROVIDER = "provider";

    public static final String CUSTOM = "custom";

    private CapabilityType() {
    }
}
