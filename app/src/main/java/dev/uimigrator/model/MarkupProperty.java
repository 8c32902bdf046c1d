package dev.uimigrator.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A named value on an element. Attached properties keep their owner prefix in the name, for
 * example {@code Grid.Row}.
 */
public final class MarkupProperty extends MarkupNode {

    private MarkupElement owner;
    private String name;
    private PropertyValue value;

    public MarkupProperty(String name, PropertyValue value) {
        setName(name);
        this.value = Objects.requireNonNull(value, "value");
    }

    public static MarkupProperty literal(String name, String text) {
        return new MarkupProperty(name, PropertyValue.literal(text));
    }

    public static MarkupProperty element(String name, MarkupElement element) {
        return new MarkupProperty(name, PropertyValue.element(element));
    }

    public static MarkupProperty extension(String name, MarkupExtension extension) {
        return new MarkupProperty(name, PropertyValue.extension(extension));
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PROPERTY;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Property name must not be blank");
        }
        this.name = name.trim();
    }

    public Optional<MarkupElement> owner() {
        return Optional.ofNullable(owner);
    }

    void setOwner(MarkupElement owner) {
        this.owner = owner;
        if (value instanceof PropertyValue.ElementValue elementValue) {
            elementValue.element().setParent(owner);
        }
    }

    public PropertyValue value() {
        return value;
    }

    /**
     * Replaces the value, keeping the parent links of element values consistent with the owner.
     */
    public void setValue(PropertyValue newValue) {
        Objects.requireNonNull(newValue, "newValue");
        if (value instanceof PropertyValue.ElementValue previous && previous.element().parent().orElse(null) == owner) {
            previous.element().setParent(null);
        }
        value = newValue;
        if (newValue instanceof PropertyValue.ElementValue next) {
            next.element().setParent(owner);
        }
    }

    public void setLiteral(String text) {
        setValue(PropertyValue.literal(text));
    }

    public Optional<String> literal() {
        return value instanceof PropertyValue.Literal literal ? Optional.of(literal.text()) : Optional.empty();
    }

    public Optional<MarkupElement> elementValue() {
        return value instanceof PropertyValue.ElementValue element ? Optional.of(element.element()) : Optional.empty();
    }

    public Optional<MarkupExtension> markupExtension() {
        return value instanceof PropertyValue.ExtensionValue extension ? Optional.of(extension.extension()) : Optional.empty();
    }

    public boolean hasMarkupExtension() {
        return value instanceof PropertyValue.ExtensionValue;
    }

    public boolean isAttached() {
        return name.indexOf('.') > 0;
    }

    /**
     * Owner type of an attached property, {@code Grid} for {@code Grid.Row}.
     */
    public Optional<String> attachedOwnerType() {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? Optional.of(name.substring(0, dot)) : Optional.empty();
    }

    /**
     * Name without any attached owner prefix.
     */
    public String localName() {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot + 1) : name;
    }

    public MarkupProperty deepCopy() {
        PropertyValue copiedValue;
        if (value instanceof PropertyValue.ElementValue element) {
            copiedValue = PropertyValue.element(element.element().deepCopy());
        } else if (value instanceof PropertyValue.ExtensionValue extension) {
            copiedValue = PropertyValue.extension(extension.extension().deepCopy());
        } else {
            copiedValue = value;
        }
        MarkupProperty copy = new MarkupProperty(name, copiedValue);
        copy.setLocation(location().orElse(null));
        return copy;
    }

    /**
     * Copy used by document snapshots: same name, location and diagnostics around an already copied value.
     */
    MarkupProperty snapshotWith(PropertyValue copiedValue) {
        MarkupProperty copy = new MarkupProperty(name, copiedValue);
        copy.copyNodeStateFrom(this);
        return copy;
    }

    @Override
    public String toString() {
        String rendered;
        if (value instanceof PropertyValue.Literal literal) {
            rendered = '"' + literal.text() + '"';
        } else if (value instanceof PropertyValue.ExtensionValue extension) {
            rendered = extension.extension().toMarkup();
        } else {
            rendered = "<" + ((PropertyValue.ElementValue) value).element().typeName() + ">";
        }
        return name + '=' + rendered;
    }
}
