package dev.uimigrator.mapping;

/**
 * Maps a source XML namespace URI to the target dialect's URI.
 */
public record NamespaceMapping(String sourceNamespace, String targetNamespace, String notes) {

    public NamespaceMapping {
        if (sourceNamespace == null || sourceNamespace.isBlank()) {
            throw new IllegalArgumentException("sourceNamespace must not be blank");
        }
        if (targetNamespace == null || targetNamespace.isBlank()) {
            throw new IllegalArgumentException("targetNamespace must not be blank");
        }
        notes = notes == null ? "" : notes;
    }
}
