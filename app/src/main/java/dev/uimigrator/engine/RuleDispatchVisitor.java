package dev.uimigrator.engine;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.model.ExtensionArgument;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.MarkupNode;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.PropertyValue;
import dev.uimigrator.model.UnifiedDocument;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Depth-first, pre-order walk applying every matching rule to each node before descending.
 *
 * <p>Order at an element: element rules, then each property (property rules, then its markup
 * extension or element value), then the children. Each level is traversed over a snapshot; removals
 * and replacements are collected and applied once the level has been visited.
 */
public final class RuleDispatchVisitor {

    private final RuleRegistry registry;
    private final TransformationContext context;
    private final Set<MarkupElement> visited = Collections.newSetFromMap(new IdentityHashMap<>());

    public RuleDispatchVisitor(RuleRegistry registry, TransformationContext context) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.context = Objects.requireNonNull(context, "context");
    }

    public void visitDocument(UnifiedDocument document) {
        Optional<MarkupElement> root = document.root();
        if (root.isEmpty()) {
            return;
        }
        Optional<MarkupElement> outcome = visitElement(root.get());
        if (outcome.isEmpty()) {
            document.setRoot(null);
            context.report(Severity.WARNING, DiagnosticCodes.TRANSFORM_ROOT_REMOVED,
                    "A rule removed the root element " + root.get().typeName());
        } else if (outcome.get() != root.get()) {
            document.setRoot(outcome.get());
        }
    }

    /**
     * Visits one element and its subtree.
     *
     * @return the element now in this position, or empty when a rule removed it
     */
    public Optional<MarkupElement> visitElement(MarkupElement element) {
        if (!visited.add(element)) {
            return Optional.of(element);
        }
        Optional<MarkupElement> outcome = applyElementRules(element);
        if (outcome.isEmpty()) {
            return outcome;
        }
        MarkupElement current = outcome.get();
        visited.add(current);
        visitProperties(current);
        visitChildren(current);
        return Optional.of(current);
    }

    private Optional<MarkupElement> applyElementRules(MarkupElement element) {
        MarkupElement current = element;
        for (ElementRule rule : registry.elementRules()) {
            if (!rule.canHandleElement(current)) {
                continue;
            }
            MarkupElement target = current;
            Optional<Optional<MarkupElement>> outcome = guarded(rule, target, () -> rule.transformElement(target, context));
            if (outcome.isEmpty()) {
                continue;
            }
            if (outcome.get().isEmpty()) {
                return Optional.empty();
            }
            current = outcome.get().get();
        }
        return Optional.of(current);
    }

    private void visitProperties(MarkupElement element) {
        List<MarkupProperty> snapshot = List.copyOf(element.properties());
        List<Patch<MarkupProperty>> patches = new ArrayList<>();
        for (MarkupProperty property : snapshot) {
            if (element.indexOfProperty(property) < 0) {
                continue;
            }
            Optional<MarkupProperty> outcome = applyPropertyRules(property);
            if (outcome.isEmpty()) {
                patches.add(Patch.removal(property));
                continue;
            }
            MarkupProperty current = outcome.get();
            if (current != property) {
                patches.add(Patch.replacement(property, current));
            }
            if (!visitPropertyValue(current)) {
                patches.add(Patch.removal(current));
            }
        }
        for (Patch<MarkupProperty> patch : patches) {
            if (patch.isRemoval()) {
                element.removeProperty(patch.original());
            } else {
                element.replaceProperty(patch.original(), patch.replacement());
            }
        }
    }

    private Optional<MarkupProperty> applyPropertyRules(MarkupProperty property) {
        MarkupProperty current = property;
        for (PropertyRule rule : registry.propertyRules()) {
            if (!rule.canHandleProperty(current)) {
                continue;
            }
            MarkupProperty target = current;
            Optional<Optional<MarkupProperty>> outcome = guarded(rule, target, () -> rule.transformProperty(target, context));
            if (outcome.isEmpty()) {
                continue;
            }
            if (outcome.get().isEmpty()) {
                return Optional.empty();
            }
            current = outcome.get().get();
        }
        return Optional.of(current);
    }

    /**
     * @return false when the property's value was removed and the property should go with it
     */
    private boolean visitPropertyValue(MarkupProperty property) {
        PropertyValue value = property.value();
        if (value instanceof PropertyValue.ExtensionValue extensionValue) {
            Optional<MarkupExtension> outcome = visitExtension(extensionValue.extension());
            if (outcome.isEmpty()) {
                return false;
            }
            if (outcome.get() != extensionValue.extension()) {
                property.setValue(PropertyValue.extension(outcome.get()));
            }
        } else if (value instanceof PropertyValue.ElementValue elementValue) {
            Optional<MarkupElement> outcome = visitElement(elementValue.element());
            if (outcome.isEmpty()) {
                return false;
            }
            if (outcome.get() != elementValue.element()) {
                property.setValue(PropertyValue.element(outcome.get()));
            }
        }
        return true;
    }

    private Optional<MarkupExtension> visitExtension(MarkupExtension extension) {
        MarkupExtension current = extension;
        for (MarkupExtensionRule rule : registry.extensionRules()) {
            if (!rule.canHandleExtension(current)) {
                continue;
            }
            MarkupExtension target = current;
            Optional<Optional<MarkupExtension>> outcome = guarded(rule, target, () -> rule.transformExtension(target, context));
            if (outcome.isEmpty()) {
                continue;
            }
            if (outcome.get().isEmpty()) {
                return Optional.empty();
            }
            current = outcome.get().get();
        }
        visitNestedExtensions(current);
        return Optional.of(current);
    }

    private void visitNestedExtensions(MarkupExtension extension) {
        List<ExtensionArgument> positional = List.copyOf(extension.positionalArguments());
        List<Integer> removedPositions = new ArrayList<>();
        for (int i = 0; i < positional.size(); i++) {
            Optional<MarkupExtension> nested = positional.get(i).extension();
            if (nested.isEmpty()) {
                continue;
            }
            Optional<MarkupExtension> outcome = visitExtension(nested.get());
            if (outcome.isEmpty()) {
                removedPositions.add(i);
            } else if (outcome.get() != nested.get()) {
                extension.setPositional(i, ExtensionArgument.nested(outcome.get()));
            }
        }
        for (int i = removedPositions.size() - 1; i >= 0; i--) {
            extension.removePositional(removedPositions.get(i));
        }

        Map<String, ExtensionArgument> named = Map.copyOf(extension.namedArguments());
        for (String key : List.copyOf(extension.namedArguments().keySet())) {
            Optional<MarkupExtension> nested = named.get(key).extension();
            if (nested.isEmpty()) {
                continue;
            }
            Optional<MarkupExtension> outcome = visitExtension(nested.get());
            if (outcome.isEmpty()) {
                extension.removeNamedArgument(key);
            } else if (outcome.get() != nested.get()) {
                extension.setNamedArgument(key, ExtensionArgument.nested(outcome.get()));
            }
        }
    }

    private void visitChildren(MarkupElement element) {
        List<MarkupElement> snapshot = List.copyOf(element.children());
        List<Patch<MarkupElement>> patches = new ArrayList<>();
        for (MarkupElement child : snapshot) {
            if (!element.containsChild(child)) {
                continue;
            }
            Optional<MarkupElement> outcome = visitElement(child);
            if (outcome.isEmpty()) {
                patches.add(Patch.removal(child));
            } else if (outcome.get() != child) {
                patches.add(Patch.replacement(child, outcome.get()));
            }
        }
        for (Patch<MarkupElement> patch : patches) {
            if (patch.isRemoval()) {
                element.removeChild(patch.original());
            } else {
                element.replaceChild(patch.original(), patch.replacement());
            }
        }
    }

    // A type resolution failure leaves the node as it was; anything else propagates to the stage.
    private <T> Optional<T> guarded(TransformationRule rule, MarkupNode node, Supplier<T> application) {
        try {
            T outcome = application.get();
            return Optional.of(Objects.requireNonNull(outcome, () -> "Rule " + rule.name() + " returned null"));
        } catch (TypeResolutionException ex) {
            context.warn(node, DiagnosticCodes.TYPE_RESOLUTION_FAILED, rule.name() + ": " + ex.getMessage());
            return Optional.empty();
        }
    }

    private record Patch<T>(T original, T replacement) {

        static <T> Patch<T> removal(T original) {
            return new Patch<>(original, null);
        }

        static <T> Patch<T> replacement(T original, T replacement) {
            return new Patch<>(original, replacement);
        }

        boolean isRemoval() {
            return replacement == null;
        }
    }
}
