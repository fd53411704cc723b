package com.tempeh.plugin.audit;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(Severity threshold) {
        return compareTo(threshold) >= 0;
    }

    /**
     * Case-insensitive parse.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Severity parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must be one of LOW, MEDIUM, HIGH, CRITICAL");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
