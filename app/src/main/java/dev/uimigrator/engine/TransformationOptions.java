package dev.uimigrator.engine;

/**
 * Switches that change how built-in rules rewrite a document.
 *
 * @param elementNameShorthand rewrite {@code ElementName} bindings to {@code #name.Path}
 * @param reportManualReview emit a warning for mappings flagged for manual review
 * @param compiledBindings rewrite {@code Binding} to {@code CompiledBinding}
 */
public record TransformationOptions(boolean elementNameShorthand, boolean reportManualReview, boolean compiledBindings) {

    public TransformationOptions(boolean elementNameShorthand, boolean reportManualReview) {
        this(elementNameShorthand, reportManualReview, false);
    }

    public static TransformationOptions defaults() {
        return new TransformationOptions(true, true, false);
    }
}
