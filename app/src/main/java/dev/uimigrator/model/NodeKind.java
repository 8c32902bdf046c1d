package dev.uimigrator.model;

/**
 * The closed set of node kinds in a unified document.
 */
public enum NodeKind {
    ELEMENT("Element"),
    PROPERTY("Property"),
    MARKUP_EXTENSION("MarkupExtension");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    /**
     * Stable label used when grouping statistics.
     */
    public String label() {
        return label;
    }
}
