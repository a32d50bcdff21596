package com.williamcallahan.agentknowledge.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Impact level attached to bug entries.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Parses an optional severity. Blank input means "not supplied".
     *
     * @param rawSeverity severity text, may be null
     * @return parsed severity or empty when absent
     * @throws IllegalArgumentException when text is present but not a known severity
     */
    public static Optional<Severity> parseOptional(String rawSeverity) {
        if (rawSeverity == null || rawSeverity.isBlank()) {
            return Optional.empty();
        }
        String normalized = rawSeverity.trim().toLowerCase(Locale.ROOT);
        for (Severity severity : values()) {
            if (severity.wireName.equals(normalized)) {
                return Optional.of(severity);
            }
        }
        throw new IllegalArgumentException(
                "Unknown severity: " + rawSeverity + " (expected low, medium, high, or critical)");
    }
}
