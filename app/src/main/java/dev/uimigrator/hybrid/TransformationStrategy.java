package dev.uimigrator.hybrid;

import java.util.Locale;

/**
 * Which document layers a transformer works from.
 */
public enum TransformationStrategy {
    STRUCTURAL_ONLY,
    TYPED_ONLY,
    HYBRID;

    public static TransformationStrategy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return HYBRID;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (normalized) {
            case "STRUCTURAL":
            case "STRUCTURAL_ONLY":
                return STRUCTURAL_ONLY;
            case "TYPED":
            case "TYPED_ONLY":
                return TYPED_ONLY;
            case "HYBRID":
                return HYBRID;
            default:
                throw new IllegalArgumentException("Unsupported transformation strategy: " + raw);
        }
    }
}
