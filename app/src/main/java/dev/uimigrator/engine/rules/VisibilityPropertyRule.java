package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.PropertyRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * {@code Visibility} becomes the boolean {@code IsVisible}. {@code Hidden} has no layout-preserving
 * counterpart and maps to false with a warning. Bound values need a converter and are left alone.
 */
public class VisibilityPropertyRule extends PropertyRule {

    @Override
    public String name() {
        return "VisibilityToIsVisible";
    }

    @Override
    public int priority() {
        return 60;
    }

    @Override
    public boolean canHandleProperty(MarkupProperty property) {
        return property.name().equals("Visibility");
    }

    @Override
    public Optional<MarkupProperty> transformProperty(MarkupProperty property, TransformationContext context) {
        if (property.hasMarkupExtension()) {
            context.warn(property, DiagnosticCodes.VISIBILITY_BINDING,
                    "Bound Visibility needs a bool converter before it can become IsVisible");
            return Optional.of(property);
        }
        Optional<String> value = property.literal().map(String::trim);
        if (value.isEmpty()) {
            return Optional.of(property);
        }
        String converted;
        if (value.get().equalsIgnoreCase("Visible")) {
            converted = "True";
        } else if (value.get().equalsIgnoreCase("Collapsed")) {
            converted = "False";
        } else if (value.get().equalsIgnoreCase("Hidden")) {
            converted = "False";
            context.warn(property, DiagnosticCodes.VISIBILITY_HIDDEN,
                    "Visibility=Hidden keeps layout space; IsVisible=False does not. Consider Opacity=0");
        } else {
            return Optional.of(property);
        }
        property.setName("IsVisible");
        property.setLiteral(converted);
        context.recordTransformation(name(), NodeKind.PROPERTY, "Visibility=" + value.get() + " -> IsVisible=" + converted);
        return Optional.of(property);
    }
}
