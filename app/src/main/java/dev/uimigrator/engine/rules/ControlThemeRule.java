package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.ElementRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Keyed styles and styles that replace a control's template become control themes:
 *
 * <pre>
 * &lt;Style x:Key="Primary" TargetType="{x:Type Button}"&gt;   =&gt;   &lt;ControlTheme x:Key="Primary" TargetType="Button"&gt;
 * </pre>
 *
 * <p>An unkeyed templated style is keyed by its type so it stays the default look of that control.
 * Runs ahead of {@link StyleSelectorRule}, which only sees the styles left over.
 */
public class ControlThemeRule extends ElementRule {

    @Override
    public String name() {
        return "ConvertStyleToControlTheme";
    }

    @Override
    public int priority() {
        return 85;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return element.isType("Style") && !element.hasProperty("Selector")
                && (element.key().isPresent() || replacesTemplate(element));
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement style, TransformationContext context) {
        Optional<MarkupProperty> targetType = style.property("TargetType");
        Optional<String> typeName = targetType.flatMap(Selectors::typeNameOf);
        if (typeName.isEmpty()) {
            if (style.key().isPresent()) {
                context.warn(style, DiagnosticCodes.STYLE_KEYED, "Style '" + style.key().get()
                        + "' has no TargetType and stays a Style; keyed styles are not applied implicitly");
            } else {
                context.warn(style, DiagnosticCodes.STYLE_NO_TARGET_TYPE,
                        "Style sets a Template but has no TargetType; it was not converted to a ControlTheme");
            }
            return Optional.of(style);
        }
        style.setTypeName("ControlTheme");
        style.replaceProperty(targetType.get(), MarkupProperty.literal("TargetType", typeName.get()));
        if (style.key().isEmpty()) {
            style.setKey("{x:Type " + typeName.get() + "}");
        }
        style.renamePropertyElements("Style", "ControlTheme");
        context.recordTransformation(name(), NodeKind.ELEMENT, "Style -> ControlTheme " + style.key().get());
        return Optional.of(style);
    }

    static boolean replacesTemplate(MarkupElement style) {
        List<MarkupElement> setters = new ArrayList<>(style.children("Setter"));
        setters.addAll(style.propertyContent("Setters"));
        for (MarkupElement setter : setters) {
            if (!setter.isType("Setter") || !setter.literal("Property").filter("Template"::equals).isPresent()) {
                continue;
            }
            boolean template = setter.propertyContent("Value").stream().anyMatch(value -> value.isType("ControlTemplate"))
                    || !setter.children("ControlTemplate").isEmpty();
            if (template) {
                return true;
            }
        }
        return false;
    }
}
