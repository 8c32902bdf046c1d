package dev.uimigrator.diagnostics;

import java.util.Objects;
import java.util.Optional;

/**
 * A machine-readable finding produced while transforming a document.
 */
public record Diagnostic(String code, Severity severity, String message, Optional<SourceLocation> location) {

    public Diagnostic {
        code = requireNonBlank(code, "code");
        Objects.requireNonNull(severity, "severity");
        message = message == null ? "" : message;
        location = location == null ? Optional.empty() : location;
    }

    public static Diagnostic of(String code, Severity severity, String message, SourceLocation location) {
        return new Diagnostic(code, severity, message, Optional.ofNullable(location));
    }

    public Optional<String> file() {
        return location.map(SourceLocation::file);
    }

    public String format() {
        String where = location.map(SourceLocation::toString).map(value -> value + ": ").orElse("");
        return where + severity.name().toLowerCase(java.util.Locale.ROOT) + ' ' + code + ": " + message;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
