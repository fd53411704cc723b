package com.tempeh.plugin.audit;

import java.util.Objects;

/**
 * One audit finding: severity, description and optionally the rule and file that produced it.
 */
public final class AuditFinding {

    private final Severity severity;
    private final String description;
    private final String ruleId;
    private final String location;

    public AuditFinding(Severity severity, String description) {
        this(severity, description, null, null);
    }

    public AuditFinding(Severity severity, String description, String ruleId, String location) {
        this.severity = Objects.requireNonNull(severity, "severity");
        this.description = Objects.requireNonNull(description, "description");
        this.ruleId = ruleId;
        this.location = location;
    }

    public Severity getSeverity() {
        return severity;
    }

    public String getDescription() {
        return description;
    }

    /** Rule id, or null. */
    public String getRuleId() {
        return ruleId;
    }

    /** File the finding was raised for, relative to the plugin source; null when not file based. */
    public String getLocation() {
        return location;
    }

    @Override
    public String toString() {
        return severity + " " + description + (location != null ? " (" + location + ")" : "");
    }
}
