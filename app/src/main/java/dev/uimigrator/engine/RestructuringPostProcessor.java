package dev.uimigrator.engine;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.PropertyValue;
import dev.uimigrator.model.UnifiedDocument;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs post-processing rules after the main dispatch, one whole-tree pass per phase.
 *
 * <p>Each pass is a strict post-order walk: element-valued properties, then children, then the element
 * itself, so a restructuring rule always sees subtrees that are already final. The cleanup pass only
 * starts once every restructuring has happened.
 */
public final class RestructuringPostProcessor {

    private static final Logger LOGGER = LoggerFactory.getLogger(RestructuringPostProcessor.class);

    private final RuleRegistry registry;
    private final TransformationContext context;

    public RestructuringPostProcessor(RuleRegistry registry, TransformationContext context) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.context = Objects.requireNonNull(context, "context");
    }

    public void process(UnifiedDocument document) {
        for (PostProcessingPhase phase : PostProcessingPhase.values()) {
            List<PostProcessingRule> rules = registry.postProcessingRules(phase);
            if (rules.isEmpty() || document.root().isEmpty()) {
                continue;
            }
            LOGGER.debug("Post-processing phase {} with {} rule(s)", phase, rules.size());
            MarkupElement root = document.root().get();
            Optional<MarkupElement> outcome = new Pass(rules).visit(root);
            if (outcome.isEmpty()) {
                document.setRoot(null);
                context.report(Severity.WARNING, DiagnosticCodes.TRANSFORM_ROOT_REMOVED,
                        "Post-processing removed the root element " + root.typeName());
            } else if (outcome.get() != root) {
                document.setRoot(outcome.get());
            }
        }
    }

    private final class Pass {

        private final List<PostProcessingRule> rules;
        private final Set<MarkupElement> visited = Collections.newSetFromMap(new IdentityHashMap<>());

        Pass(List<PostProcessingRule> rules) {
            this.rules = rules;
        }

        Optional<MarkupElement> visit(MarkupElement element) {
            if (!visited.add(element)) {
                return Optional.of(element);
            }
            visitPropertyValues(element);
            visitChildren(element);
            return applyRules(element);
        }

        private void visitPropertyValues(MarkupElement element) {
            for (MarkupProperty property : List.copyOf(element.properties())) {
                Optional<MarkupElement> value = property.elementValue();
                if (value.isEmpty() || element.indexOfProperty(property) < 0) {
                    continue;
                }
                Optional<MarkupElement> outcome = visit(value.get());
                if (outcome.isEmpty()) {
                    element.removeProperty(property);
                } else if (outcome.get() != value.get()) {
                    property.setValue(PropertyValue.element(outcome.get()));
                }
            }
        }

        private void visitChildren(MarkupElement element) {
            List<MarkupElement> removed = new ArrayList<>();
            List<MarkupElement[]> replaced = new ArrayList<>();
            for (MarkupElement child : List.copyOf(element.children())) {
                if (!element.containsChild(child)) {
                    continue;
                }
                Optional<MarkupElement> outcome = visit(child);
                if (outcome.isEmpty()) {
                    removed.add(child);
                } else if (outcome.get() != child) {
                    replaced.add(new MarkupElement[] {child, outcome.get()});
                }
            }
            removed.forEach(element::removeChild);
            replaced.forEach(pair -> element.replaceChild(pair[0], pair[1]));
        }

        private Optional<MarkupElement> applyRules(MarkupElement element) {
            MarkupElement current = element;
            for (PostProcessingRule rule : rules) {
                if (!rule.canHandleElement(current)) {
                    continue;
                }
                Optional<MarkupElement> outcome;
                try {
                    outcome = Objects.requireNonNull(rule.transformElement(current, context),
                            () -> "Rule " + rule.name() + " returned null");
                } catch (TypeResolutionException ex) {
                    context.warn(current, DiagnosticCodes.TYPE_RESOLUTION_FAILED, rule.name() + ": " + ex.getMessage());
                    continue;
                }
                if (outcome.isEmpty()) {
                    return Optional.empty();
                }
                current = outcome.get();
            }
            return Optional.of(current);
        }
    }
}
