package dev.uimigrator.engine;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.model.UnifiedDocument;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a rule registry to a document: the pre-order dispatch pass followed by post-processing.
 * The document is modified in place.
 */
public class TransformationEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TransformationEngine.class);

    private final RuleRegistry registry;

    public TransformationEngine(RuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public RuleRegistry registry() {
        return registry;
    }

    public TransformationStatistics transform(UnifiedDocument document, TransformationContext context) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(context, "context");
        if (document.root().isEmpty()) {
            context.report(Severity.WARNING, DiagnosticCodes.TRANSFORM_NO_ROOT,
                    "Document " + document.sourceId() + " has no root element; nothing to transform");
            return context.statistics();
        }
        int before = context.statistics().total();
        new RuleDispatchVisitor(registry, context).visitDocument(document);
        new RestructuringPostProcessor(registry, context).process(document);

        TransformationStatistics statistics = context.statistics();
        int applied = statistics.total() - before;
        context.report(Severity.INFO, DiagnosticCodes.TRANSFORM_COMPLETE,
                "Applied " + applied + " transformation(s) using " + registry.size() + " rule(s)");
        for (Map.Entry<String, Integer> entry : statistics.countsByRule().entrySet()) {
            context.report(Severity.INFO, DiagnosticCodes.TRANSFORM_RULE_STATS,
                    entry.getKey() + ": " + entry.getValue());
        }
        LOGGER.info("Transformed {} with {} rule application(s)", document.sourceId(), applied);
        return statistics;
    }
}
