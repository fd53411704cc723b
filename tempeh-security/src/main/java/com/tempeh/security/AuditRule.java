package com.tempeh.security;

import com.tempeh.plugin.audit.Severity;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A pattern checked against each scanned file. A match produces one finding of {@link #getSeverity()}
 * for that file.
 */
public final class AuditRule {

    private final String id;
    private final String description;
    private final Pattern pattern;
    private final Severity severity;

    public AuditRule(String id, String description, String regex, Severity severity) {
        this(id, description, Pattern.compile(Objects.requireNonNull(regex, "regex")), severity);
    }

    public AuditRule(String id, String description, Pattern pattern, Severity severity) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Audit rule id must be non-blank");
        }
        this.id = id;
        this.description = Objects.requireNonNull(description, "description");
        this.pattern = Objects.requireNonNull(pattern, "pattern");
        this.severity = Objects.requireNonNull(severity, "severity");
    }

    public String getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public Pattern getPattern() {
        return pattern;
    }

    public Severity getSeverity() {
        return severity;
    }

    public boolean matches(CharSequence content) {
        return pattern.matcher(content).find();
    }

    @Override
    public String toString() {
        return id + " (" + severity + ")";
    }
}
