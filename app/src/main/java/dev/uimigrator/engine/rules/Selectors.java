package dev.uimigrator.engine.rules;

import dev.uimigrator.model.ExtensionArgument;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.MarkupProperty;
import java.util.Optional;

final class Selectors {

    private Selectors() {
    }

    /**
     * Selector base of a style: its {@code Selector} when already converted, else its target type.
     */
    static Optional<String> baseOf(MarkupElement style) {
        Optional<String> selector = style.literal("Selector").filter(value -> !value.isBlank());
        if (selector.isPresent()) {
            return selector;
        }
        return style.property("TargetType").flatMap(Selectors::fromTargetType);
    }

    /**
     * Accepts {@code Button}, {@code local:MyButton} or {@code {x:Type Button}}. Prefixed types use
     * the selector syntax {@code local|MyButton}.
     */
    static Optional<String> fromTargetType(MarkupProperty targetType) {
        return typeNameOf(targetType).map(value -> value.replace(':', '|'));
    }

    /**
     * Type named by a {@code TargetType} or {@code DataType} value, literal or {@code {x:Type}}.
     */
    static Optional<String> typeNameOf(MarkupProperty property) {
        Optional<String> typeName = property.literal();
        if (typeName.isEmpty()) {
            typeName = property.markupExtension()
                    .filter(extension -> extension.isNamed("Type"))
                    .flatMap(Selectors::typeArgument);
        }
        return typeName.map(String::trim).filter(value -> !value.isEmpty());
    }

    /**
     * Replaces an {@code {x:Type X}} value with the literal {@code X}.
     *
     * @return the type name when the value was rewritten
     */
    static Optional<String> simplifyTypeReference(MarkupElement element, String propertyName) {
        Optional<MarkupProperty> property = element.property(propertyName).filter(MarkupProperty::hasMarkupExtension);
        Optional<String> typeName = property.flatMap(Selectors::typeNameOf);
        if (typeName.isEmpty()) {
            return Optional.empty();
        }
        element.replaceProperty(property.get(), MarkupProperty.literal(propertyName, typeName.get()));
        return typeName;
    }

    private static Optional<String> typeArgument(MarkupExtension extension) {
        Optional<String> named = extension.namedText("TypeName");
        return named.isPresent() ? named : extension.firstPositional().flatMap(ExtensionArgument::text);
    }
}
