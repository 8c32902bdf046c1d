package dev.uimigrator.model;

import java.util.Objects;

/**
 * The value of a property: exactly one of a literal string, a nested element or a markup extension.
 */
public interface PropertyValue {

    static PropertyValue literal(String text) {
        return new Literal(text);
    }

    static PropertyValue element(MarkupElement element) {
        return new ElementValue(element);
    }

    static PropertyValue extension(MarkupExtension extension) {
        return new ExtensionValue(extension);
    }

    record Literal(String text) implements PropertyValue {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    record ElementValue(MarkupElement element) implements PropertyValue {
        public ElementValue {
            Objects.requireNonNull(element, "element");
        }
    }

    record ExtensionValue(MarkupExtension extension) implements PropertyValue {
        public ExtensionValue {
            Objects.requireNonNull(extension, "extension");
        }
    }
}
