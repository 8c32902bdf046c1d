package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.ElementRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * Control templates keep their shape. {@code TargetType} is reduced to a plain type name, content
 * presenters get the explicit {@code TemplateBinding} the target dialect requires, and template
 * triggers are flagged since they only exist as theme styles there.
 */
public class ControlTemplateRule extends ElementRule {

    @Override
    public String name() {
        return "TransformControlTemplate";
    }

    @Override
    public int priority() {
        return 70;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return element.isType("ControlTemplate");
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement template, TransformationContext context) {
        if (!template.hasProperty("TargetType")) {
            context.warn(template, DiagnosticCodes.CONTROL_TEMPLATE_NO_TARGET_TYPE,
                    "ControlTemplate has no TargetType; it is required by the target dialect");
        } else {
            Selectors.simplifyTypeReference(template, "TargetType").ifPresent(type ->
                    context.recordTransformation(name(), NodeKind.PROPERTY, "TargetType={x:Type " + type + "} -> " + type));
        }
        if (!template.propertyContent("Triggers").isEmpty()) {
            context.warn(template, DiagnosticCodes.CONTROL_TEMPLATE_TRIGGERS,
                    "ControlTemplate.Triggers were left in place; express them as ControlTheme styles with pseudoclasses");
        }
        for (MarkupElement element : template.descendantsAndSelf()) {
            if (element.isType("ContentPresenter")) {
                bindContent(element, context);
            }
        }
        return Optional.of(template);
    }

    // ContentSource="Header" names the templated property; without it the presenter shows Content.
    private void bindContent(MarkupElement presenter, TransformationContext context) {
        if (presenter.hasProperty("Content")) {
            return;
        }
        String source = presenter.removeProperty("ContentSource").flatMap(MarkupProperty::literal).orElse("Content");
        MarkupExtension binding = new MarkupExtension("TemplateBinding").addPositional(source);
        presenter.addProperty(MarkupProperty.extension("Content", binding));
        context.recordTransformation(name(), NodeKind.ELEMENT, "ContentPresenter Content=" + binding.toMarkup());
    }
}
