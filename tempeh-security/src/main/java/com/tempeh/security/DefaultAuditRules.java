package com.tempeh.security;

import com.tempeh.plugin.audit.Severity;

import java.util.List;

/**
 * Built-in rule set of {@link RuleBasedAuditService}. Rule ids are stable and appear in findings.
 */
public final class DefaultAuditRules {

    public static final String PROCESS_EXECUTION = "process-execution";
    public static final String NATIVE_LIBRARY = "native-library";
    public static final String ACCESS_SUPPRESSION = "access-suppression";
    public static final String CLASS_LOADER_CREATION = "class-loader-creation";
    public static final String SYSTEM_EXIT = "system-exit";

    private static final List<AuditRule> RULES = List.of(
            new AuditRule(PROCESS_EXECUTION, "Spawns operating system processes",
                    "Runtime\\s*\\.\\s*getRuntime\\s*\\(\\s*\\)\\s*\\.\\s*exec\\s*\\(|new\\s+ProcessBuilder\\s*\\(|child_process",
                    Severity.CRITICAL),
            new AuditRule(NATIVE_LIBRARY, "Loads native libraries",
                    "System\\s*\\.\\s*(loadLibrary|load)\\s*\\(|Runtime\\s*\\.\\s*getRuntime\\s*\\(\\s*\\)\\s*\\.\\s*load(Library)?\\s*\\(",
                    Severity.HIGH),
            new AuditRule(ACCESS_SUPPRESSION, "Suppresses Java language access checks",
                    "\\.\\s*setAccessible\\s*\\(\\s*true\\s*\\)",
                    Severity.MEDIUM),
            new AuditRule(CLASS_LOADER_CREATION, "Creates class loaders",
                    "new\\s+(URLClassLoader|[A-Za-z_$][\\w$]*ClassLoader)\\s*\\(|defineClass\\s*\\(",
                    Severity.HIGH),
            new AuditRule(SYSTEM_EXIT, "Terminates the host process",
                    "System\\s*\\.\\s*exit\\s*\\(|Runtime\\s*\\.\\s*getRuntime\\s*\\(\\s*\\)\\s*\\.\\s*halt\\s*\\(|process\\.exit\\s*\\(",
                    Severity.HIGH));

    private DefaultAuditRules() {
    }

    public static List<AuditRule> rules() {
        return RULES;
    }
}
