package dev.uimigrator.mapping;

import java.util.Objects;

/**
 * Maps a source type, by qualified name, to its target type and XML namespace.
 */
public record TypeMapping(
        String sourceType,
        String targetType,
        String targetNamespace,
        boolean requiresManualReview,
        String notes
) {

    public TypeMapping {
        sourceType = requireNonBlank(sourceType, "sourceType");
        targetType = requireNonBlank(targetType, "targetType");
        notes = notes == null ? "" : notes;
    }

    public TypeMapping(String sourceType, String targetType, String targetNamespace) {
        this(sourceType, targetType, targetNamespace, false, "");
    }

    public String sourceSimpleName() {
        return simpleName(sourceType);
    }

    public String targetSimpleName() {
        return simpleName(targetType);
    }

    private static String simpleName(String qualifiedName) {
        int dot = qualifiedName.lastIndexOf('.');
        return dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return Objects.requireNonNull(value).trim();
    }
}
