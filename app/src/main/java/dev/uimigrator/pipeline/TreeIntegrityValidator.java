package dev.uimigrator.pipeline;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.UnifiedDocument;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks the tree after a stage: no cycles, and every element's parent link matches the element or
 * property owner that holds it. Cycles are errors and stop descent into the offending subtree only.
 * Parent mismatches are warnings.
 */
public class TreeIntegrityValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TreeIntegrityValidator.class);

    public IntegrityReport validate(UnifiedDocument document, String stageName, TransformationContext context) {
        Optional<MarkupElement> root = document.root();
        if (root.isEmpty()) {
            context.report(Severity.ERROR, DiagnosticCodes.PIPELINE_INTEGRITY_NO_ROOT,
                    "Document has no root element after stage " + stageName);
            LOGGER.warn("Stage {} left {} without a root element", stageName, document.sourceId());
            return new IntegrityReport(stageName, 0, 0, true);
        }
        Walk walk = new Walk(stageName, context);
        walk.visit(root.get(), null);
        IntegrityReport report = new IntegrityReport(stageName, walk.cycles, walk.mismatches, false);
        if (!report.isClean()) {
            LOGGER.warn("Integrity check after {}: {} cycle(s), {} parent mismatch(es)", stageName, walk.cycles, walk.mismatches);
        }
        return report;
    }

    private static final class Walk {

        private final String stageName;
        private final TransformationContext context;
        private final Set<MarkupElement> onStack = Collections.newSetFromMap(new IdentityHashMap<>());
        private final Set<MarkupElement> finished = Collections.newSetFromMap(new IdentityHashMap<>());
        private int cycles;
        private int mismatches;

        Walk(String stageName, TransformationContext context) {
            this.stageName = stageName;
            this.context = context;
        }

        void visit(MarkupElement element, MarkupElement expectedParent) {
            if (onStack.contains(element)) {
                cycles++;
                context.error(element, DiagnosticCodes.PIPELINE_INTEGRITY_CYCLE,
                        "Cycle detected at " + element + " after stage " + stageName);
                return;
            }
            MarkupElement recorded = element.parent().orElse(null);
            if (recorded != expectedParent) {
                mismatches++;
                context.warn(element, DiagnosticCodes.PIPELINE_INTEGRITY_PARENT_MISMATCH,
                        element + " records parent " + describe(recorded) + " but is held by " + describe(expectedParent)
                                + " after stage " + stageName);
            }
            // An element held in two places is checked against each holder but descended into once.
            if (finished.contains(element)) {
                return;
            }
            onStack.add(element);
            for (MarkupProperty property : List.copyOf(element.properties())) {
                property.elementValue().ifPresent(value -> visit(value, element));
            }
            for (MarkupElement child : List.copyOf(element.children())) {
                visit(child, element);
            }
            onStack.remove(element);
            finished.add(element);
        }

        private static String describe(MarkupElement element) {
            return element == null ? "none" : element.toString();
        }
    }
}
