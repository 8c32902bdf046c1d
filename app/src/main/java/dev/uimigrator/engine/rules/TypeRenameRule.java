package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.ElementRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.NodeKind;
import dev.uimigrator.model.XamlNamespaces;
import java.util.Optional;

/**
 * Renames a framework element type and moves it into the target dialect's namespace. Elements from
 * {@code clr-namespace:} URIs are user types and keep their name.
 */
public class TypeRenameRule extends ElementRule {

    private final String sourceType;
    private final String targetType;

    public TypeRenameRule(String sourceType, String targetType) {
        if (sourceType == null || sourceType.isBlank() || targetType == null || targetType.isBlank()) {
            throw new IllegalArgumentException("Source and target type must not be blank");
        }
        this.sourceType = sourceType;
        this.targetType = targetType;
    }

    @Override
    public String name() {
        return sourceType.equals(targetType) ? "Transform" + sourceType : "Rename" + sourceType + "To" + targetType;
    }

    @Override
    public int priority() {
        return 100;
    }

    public String sourceType() {
        return sourceType;
    }

    public String targetType() {
        return targetType;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return element.isType(sourceType) && !element.namespace().map(XamlNamespaces::isClrNamespace).orElse(false);
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement element, TransformationContext context) {
        element.setTypeName(targetType);
        if (element.namespace().map(XamlNamespaces.WPF_PRESENTATION::equals).orElse(false)) {
            element.setNamespace(XamlNamespaces.AVALONIA);
        }
        context.recordTransformation(name(), NodeKind.ELEMENT, sourceType + " -> " + targetType);
        afterRename(element, context);
        element.renamePropertyElements(sourceType, targetType);
        return Optional.of(element);
    }

    /**
     * Hook for type-specific property clean-up once the element carries its new name.
     */
    protected void afterRename(MarkupElement element, TransformationContext context) {
    }
}
