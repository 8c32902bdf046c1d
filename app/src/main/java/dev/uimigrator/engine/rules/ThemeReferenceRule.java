package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.PostProcessingPhase;
import dev.uimigrator.engine.PostProcessingRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.ExtensionArgument;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * Points {@code Style="{StaticResource Key}"} at the control theme that replaced the keyed style, as
 * {@code Theme="{StaticResource Key}"}. Keys are looked up in the same document only.
 */
public class ThemeReferenceRule extends PostProcessingRule {

    @Override
    public String name() {
        return "ConvertStyleReferenceToTheme";
    }

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public PostProcessingPhase phase() {
        return PostProcessingPhase.RESTRUCTURE;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return resourceKey(element).isPresent();
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement element, TransformationContext context) {
        String key = resourceKey(element).orElseThrow();
        Optional<MarkupElement> resource = topOf(element).descendantsAndSelf().stream()
                .filter(candidate -> candidate.key().filter(key::equals).isPresent())
                .findFirst();
        if (resource.isEmpty()) {
            context.info(element, DiagnosticCodes.THEME_REFERENCE_EXTERNAL, "Style resource '" + key
                    + "' is not defined in this document; use Theme instead of Style if it is a ControlTheme");
            return Optional.of(element);
        }
        if (resource.get().isType("ControlTheme")) {
            element.property("Style").orElseThrow().setName("Theme");
            context.recordTransformation(name(), NodeKind.PROPERTY, "Style -> Theme " + key);
        }
        return Optional.of(element);
    }

    private static Optional<String> resourceKey(MarkupElement element) {
        return element.property("Style")
                .flatMap(MarkupProperty::markupExtension)
                .filter(extension -> extension.isNamed("StaticResource") || extension.isNamed("DynamicResource"))
                .flatMap(MarkupExtension::firstPositional)
                .flatMap(ExtensionArgument::text);
    }

    private static MarkupElement topOf(MarkupElement element) {
        MarkupElement top = element;
        while (top.parent().isPresent()) {
            top = top.parent().get();
        }
        return top;
    }
}
