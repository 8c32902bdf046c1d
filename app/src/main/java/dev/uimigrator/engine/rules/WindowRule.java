package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.ElementRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * Window chrome properties: {@code WindowStyle} becomes {@code SystemDecorations} and the
 * {@code ResizeMode} enum collapses to the {@code CanResize} flag.
 */
public class WindowRule extends ElementRule {

    @Override
    public String name() {
        return "TransformWindowProperties";
    }

    @Override
    public int priority() {
        return 90;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return element.isType("Window") && (element.hasProperty("WindowStyle") || element.hasProperty("ResizeMode"));
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement element, TransformationContext context) {
        element.property("WindowStyle").ifPresent(property -> {
            property.setName("SystemDecorations");
            property.literal().ifPresent(value -> property.setLiteral(systemDecorations(value)));
            context.recordTransformation(name(), NodeKind.PROPERTY, "WindowStyle -> SystemDecorations");
        });
        element.property("ResizeMode").ifPresent(property -> convertResizeMode(property, context));
        return Optional.of(element);
    }

    private void convertResizeMode(MarkupProperty property, TransformationContext context) {
        Optional<String> value = property.literal();
        if (value.isEmpty()) {
            return;
        }
        boolean resizable = value.get().equals("CanResize") || value.get().equals("CanResizeWithGrip");
        property.setName("CanResize");
        property.setLiteral(resizable ? "True" : "False");
        context.recordTransformation(name(), NodeKind.PROPERTY, "ResizeMode=" + value.get() + " -> CanResize");
    }

    static String systemDecorations(String windowStyle) {
        switch (windowStyle) {
            case "None":
                return "None";
            case "ToolWindow":
                return "BorderOnly";
            default:
                return "Full";
        }
    }
}
