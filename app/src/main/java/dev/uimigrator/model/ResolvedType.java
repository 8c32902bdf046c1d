package dev.uimigrator.model;

/**
 * Type identity taken from the typed view of a document, such as
 * {@code System.Windows.Controls.Button}.
 */
public record ResolvedType(String qualifiedName) {

    public ResolvedType {
        if (qualifiedName == null || qualifiedName.isBlank()) {
            throw new IllegalArgumentException("qualifiedName must not be blank");
        }
        qualifiedName = qualifiedName.trim();
    }

    public String simpleName() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot >= 0 ? qualifiedName.substring(dot + 1) : qualifiedName;
    }

    public String namespaceName() {
        int dot = qualifiedName.lastIndexOf('.');
        return dot >= 0 ? qualifiedName.substring(0, dot) : "";
    }
}
