package com.tempeh.plugin.audit;

import java.util.List;

/**
 * Outcome of auditing a plugin source. {@code passed=false} rejects that plugin only.
 */
public final class AuditResult {

    private static final AuditResult PASS = new AuditResult(true, List.of());

    private final boolean passed;
    private final List<AuditFinding> findings;

    public AuditResult(boolean passed, List<AuditFinding> findings) {
        this.passed = passed;
        this.findings = findings != null ? List.copyOf(findings) : List.of();
    }

    /** Passed with no findings. */
    public static AuditResult pass() {
        return PASS;
    }

    public static AuditResult fail(List<AuditFinding> findings) {
        return new AuditResult(false, findings);
    }

    public boolean isPassed() {
        return passed;
    }

    public List<AuditFinding> getFindings() {
        return findings;
    }
}
