package dev.uimigrator.diagnostics;

/**
 * Severity attached to every diagnostic, ordered from least to most severe.
 */
public enum Severity {
    INFO,
    WARNING,
    ERROR;

    public static Severity from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Severity must be provided");
        }
        for (Severity severity : values()) {
            if (severity.name().equalsIgnoreCase(raw.trim())) {
                return severity;
            }
        }
        throw new IllegalArgumentException("Unsupported severity: " + raw);
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }
}
