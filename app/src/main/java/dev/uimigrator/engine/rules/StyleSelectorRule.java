package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.ElementRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * Unkeyed styles apply by selector in the target dialect, so {@code TargetType} turns into
 * {@code Selector}. Keyed styles are left to {@link ControlThemeRule}.
 */
public class StyleSelectorRule extends ElementRule {

    @Override
    public String name() {
        return "ConvertStyleTargetType";
    }

    @Override
    public int priority() {
        return 80;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return element.isType("Style") && element.key().isEmpty()
                && element.hasProperty("TargetType") && !element.hasProperty("Selector");
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement element, TransformationContext context) {
        MarkupProperty targetType = element.property("TargetType").orElseThrow();
        Optional<String> selector = Selectors.fromTargetType(targetType);
        if (selector.isEmpty()) {
            context.warn(element, DiagnosticCodes.STYLE_NO_TARGET_TYPE, "Style TargetType could not be read: " + targetType);
            return Optional.of(element);
        }
        element.replaceProperty(targetType, MarkupProperty.literal("Selector", selector.get()));
        context.recordTransformation(name(), NodeKind.ELEMENT, "TargetType -> Selector=" + selector.get());
        return Optional.of(element);
    }
}
