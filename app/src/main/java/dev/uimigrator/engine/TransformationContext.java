package dev.uimigrator.engine;

import dev.uimigrator.diagnostics.Diagnostic;
import dev.uimigrator.diagnostics.DiagnosticSink;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.diagnostics.SourceLocation;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.model.MarkupNode;
import dev.uimigrator.model.NodeKind;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-document state threaded through every stage and rule: options, mappings, the diagnostic sink and
 * the statistics collector. Its methods are the only way rules record diagnostics and statistics.
 */
public final class TransformationContext {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformationContext.class);

    private final String sourceId;
    private final TransformationOptions options;
    private final MappingSource mappings;
    private final DiagnosticSink diagnostics;
    private final TransformationStatistics statistics = new TransformationStatistics();
    private final ConversionLedger conversions = new ConversionLedger();

    public TransformationContext(String sourceId, TransformationOptions options, MappingSource mappings,
                                 DiagnosticSink diagnostics) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
        this.sourceId = sourceId;
        this.options = Objects.requireNonNull(options, "options");
        this.mappings = Objects.requireNonNull(mappings, "mappings");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    public TransformationContext(String sourceId, DiagnosticSink diagnostics) {
        this(sourceId, TransformationOptions.defaults(), MappingSource.empty(), diagnostics);
    }

    public String sourceId() {
        return sourceId;
    }

    public TransformationOptions options() {
        return options;
    }

    public MappingSource mappings() {
        return mappings;
    }

    public TransformationStatistics statistics() {
        return statistics;
    }

    public ConversionLedger conversions() {
        return conversions;
    }

    public void recordTransformation(String ruleName, NodeKind kind, String detail) {
        recordTransformation(ruleName, kind.label(), detail);
    }

    /**
     * Records a rule application under a free-form node label such as {@code Binding}.
     */
    public void recordTransformation(String ruleName, String nodeKind, String detail) {
        statistics.record(ruleName, nodeKind, detail);
        LOGGER.debug("{} [{}] {}", ruleName, nodeKind, detail);
    }

    public Diagnostic info(MarkupNode node, String code, String message) {
        return attach(node, code, Severity.INFO, message);
    }

    public Diagnostic warn(MarkupNode node, String code, String message) {
        return attach(node, code, Severity.WARNING, message);
    }

    public Diagnostic error(MarkupNode node, String code, String message) {
        return attach(node, code, Severity.ERROR, message);
    }

    /**
     * Reports a document-level diagnostic that belongs to no particular node.
     */
    public Diagnostic report(Severity severity, String code, String message) {
        Diagnostic diagnostic = Diagnostic.of(code, severity, message, SourceLocation.fileOnly(sourceId));
        diagnostics.report(diagnostic);
        return diagnostic;
    }

    private Diagnostic attach(MarkupNode node, String code, Severity severity, String message) {
        Objects.requireNonNull(node, "node");
        SourceLocation location = node.location().orElseGet(() -> SourceLocation.fileOnly(sourceId));
        Diagnostic diagnostic = Diagnostic.of(code, severity, message, location);
        node.addDiagnostic(diagnostic);
        diagnostics.report(diagnostic);
        return diagnostic;
    }
}
