package dev.uimigrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One tag of the markup tree. Keeps ordered properties and children and a single parent link.
 *
 * <p>Children are compared by identity. The mutators keep parent links consistent; an element that is
 * added while owned by another element is detached from that owner first.
 */
public final class MarkupElement extends MarkupNode {

    private String typeName;
    private String namespace;
    private String name;
    private String key;
    private String textContent;
    private MarkupElement parent;
    private final List<MarkupProperty> properties = new ArrayList<>();
    private final List<MarkupElement> children = new ArrayList<>();
    private org.w3c.dom.Element structuralAnchor;
    private ResolvedType resolvedType;

    public MarkupElement(String typeName) {
        this(typeName, null);
    }

    public MarkupElement(String typeName, String namespace) {
        setTypeName(typeName);
        this.namespace = namespace;
    }

    @Override
    public NodeKind kind() {
        return NodeKind.ELEMENT;
    }

    public String typeName() {
        return typeName;
    }

    public void setTypeName(String typeName) {
        this.typeName = typeName == null ? "" : typeName.trim();
    }

    public boolean hasTypeName() {
        return !typeName.isBlank();
    }

    public boolean isType(String candidate) {
        return typeName.equals(candidate);
    }

    /**
     * Property elements such as {@code Style.Triggers} carry their owner type in the tag name. Once read,
     * they only appear as the collection value of a property holding several items.
     */
    public boolean isPropertyElement() {
        return typeName.indexOf('.') > 0;
    }

    public Optional<String> propertyElementName() {
        int dot = typeName.lastIndexOf('.');
        return dot > 0 ? Optional.of(typeName.substring(dot + 1)) : Optional.empty();
    }

    public Optional<String> namespace() {
        return Optional.ofNullable(namespace);
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    /**
     * The {@code x:Name} identifier.
     */
    public Optional<String> name() {
        return Optional.ofNullable(name);
    }

    public void setName(String name) {
        this.name = name;
    }

    /**
     * The {@code x:Key} resource key.
     */
    public Optional<String> key() {
        return Optional.ofNullable(key);
    }

    public void setKey(String key) {
        this.key = key;
    }

    public Optional<String> textContent() {
        return Optional.ofNullable(textContent);
    }

    public void setTextContent(String textContent) {
        this.textContent = textContent;
    }

    public Optional<MarkupElement> parent() {
        return Optional.ofNullable(parent);
    }

    /**
     * Low-level back-reference update. Prefer the child and property mutators, which maintain both
     * sides of the link.
     */
    public void setParent(MarkupElement parent) {
        this.parent = parent;
    }

    public Optional<org.w3c.dom.Element> structuralAnchor() {
        return Optional.ofNullable(structuralAnchor);
    }

    public void setStructuralAnchor(org.w3c.dom.Element structuralAnchor) {
        this.structuralAnchor = structuralAnchor;
    }

    public Optional<ResolvedType> resolvedType() {
        return Optional.ofNullable(resolvedType);
    }

    public void setResolvedType(ResolvedType resolvedType) {
        this.resolvedType = resolvedType;
    }

    // Properties

    public List<MarkupProperty> properties() {
        return Collections.unmodifiableList(properties);
    }

    public Optional<MarkupProperty> property(String propertyName) {
        for (MarkupProperty property : properties) {
            if (property.name().equals(propertyName)) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    public boolean hasProperty(String propertyName) {
        return property(propertyName).isPresent();
    }

    public Optional<String> literal(String propertyName) {
        return property(propertyName).flatMap(MarkupProperty::literal);
    }

    public MarkupProperty addProperty(MarkupProperty property) {
        Objects.requireNonNull(property, "property");
        release(property);
        properties.add(property);
        property.setOwner(this);
        return property;
    }

    public MarkupProperty insertProperty(int index, MarkupProperty property) {
        Objects.requireNonNull(property, "property");
        release(property);
        properties.add(index, property);
        property.setOwner(this);
        return property;
    }

    /**
     * Sets a literal value, updating the existing property of that name or appending a new one.
     */
    public MarkupProperty setProperty(String propertyName, String text) {
        Optional<MarkupProperty> existing = property(propertyName);
        if (existing.isPresent()) {
            existing.get().setLiteral(text);
            return existing.get();
        }
        return addProperty(MarkupProperty.literal(propertyName, text));
    }

    public boolean removeProperty(MarkupProperty property) {
        int index = indexOfProperty(property);
        if (index < 0) {
            return false;
        }
        properties.remove(index);
        property.setOwner(null);
        return true;
    }

    public Optional<MarkupProperty> removeProperty(String propertyName) {
        Optional<MarkupProperty> existing = property(propertyName);
        existing.ifPresent(this::removeProperty);
        return existing;
    }

    public boolean replaceProperty(MarkupProperty original, MarkupProperty replacement) {
        int index = indexOfProperty(original);
        if (index < 0) {
            return false;
        }
        release(replacement);
        properties.set(index, replacement);
        original.setOwner(null);
        replacement.setOwner(this);
        return true;
    }

    public int indexOfProperty(MarkupProperty property) {
        for (int i = 0; i < properties.size(); i++) {
            if (properties.get(i) == property) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Finds the property whose value is the given element.
     */
    public Optional<MarkupProperty> propertyHolding(MarkupElement element) {
        for (MarkupProperty property : properties) {
            if (property.elementValue().orElse(null) == element) {
                return Optional.of(property);
            }
        }
        return Optional.empty();
    }

    /**
     * Elements set through a property, matched by its local name so {@code Triggers} also finds
     * {@code Style.Triggers}. A property-element collection yields its items, any other element value
     * yields itself.
     */
    public List<MarkupElement> propertyContent(String localName) {
        List<MarkupElement> content = new ArrayList<>();
        for (MarkupProperty property : properties) {
            if (!property.localName().equals(localName) || property.elementValue().isEmpty()) {
                continue;
            }
            MarkupElement value = property.elementValue().get();
            if (value.isPropertyElement()) {
                content.addAll(value.children);
            } else {
                content.add(value);
            }
        }
        return content;
    }

    // Children

    public List<MarkupElement> children() {
        return Collections.unmodifiableList(children);
    }

    public List<MarkupElement> children(String childTypeName) {
        List<MarkupElement> matches = new ArrayList<>();
        for (MarkupElement child : children) {
            if (child.isType(childTypeName)) {
                matches.add(child);
            }
        }
        return matches;
    }

    public MarkupElement addChild(MarkupElement child) {
        Objects.requireNonNull(child, "child");
        adopt(child);
        children.add(child);
        return child;
    }

    public MarkupElement insertChild(int index, MarkupElement child) {
        Objects.requireNonNull(child, "child");
        adopt(child);
        children.add(index, child);
        return child;
    }

    public boolean removeChild(MarkupElement child) {
        int index = indexOfChild(child);
        if (index < 0) {
            return false;
        }
        children.remove(index);
        if (child.parent == this) {
            child.parent = null;
        }
        return true;
    }

    public boolean replaceChild(MarkupElement original, MarkupElement replacement) {
        Objects.requireNonNull(replacement, "replacement");
        int index = indexOfChild(original);
        if (index < 0) {
            return false;
        }
        if (replacement == original) {
            return true;
        }
        adopt(replacement);
        int existing = indexOfChild(replacement);
        if (existing >= 0) {
            children.remove(existing);
        }
        index = indexOfChild(original);
        children.set(index, replacement);
        if (original.parent == this) {
            original.parent = null;
        }
        return true;
    }

    /**
     * Renames property-element collections such as {@code Page.Resources} after the owner type changed.
     */
    public void renamePropertyElements(String oldOwner, String newOwner) {
        String prefix = oldOwner + ".";
        for (MarkupProperty property : properties) {
            property.elementValue()
                    .filter(value -> value.typeName.startsWith(prefix))
                    .ifPresent(value -> value.setTypeName(newOwner + value.typeName.substring(oldOwner.length())));
        }
        for (MarkupElement child : children) {
            if (child.typeName.startsWith(prefix)) {
                child.setTypeName(newOwner + child.typeName.substring(oldOwner.length()));
            }
        }
    }

    public int indexOfChild(MarkupElement child) {
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i) == child) {
                return i;
            }
        }
        return -1;
    }

    public boolean containsChild(MarkupElement child) {
        return indexOfChild(child) >= 0;
    }

    /**
     * Removes this element from whatever currently owns it, child list or property value.
     */
    public void detach() {
        if (parent != null) {
            parent.release(this);
        }
        parent = null;
    }

    private void adopt(MarkupElement child) {
        MarkupElement previous = child.parent;
        if (previous != null && previous != this) {
            previous.release(child);
        }
        child.parent = this;
    }

    private void release(MarkupElement child) {
        int index = indexOfChild(child);
        if (index >= 0) {
            children.remove(index);
            return;
        }
        propertyHolding(child).ifPresent(this::removeProperty);
    }

    private void release(MarkupProperty property) {
        property.owner().filter(current -> current != this).ifPresent(current -> current.removeProperty(property));
    }

    // Traversal

    /**
     * Every element of this subtree in pre-order, including element-valued properties. Each element is
     * listed once even if the tree is malformed.
     */
    public List<MarkupElement> descendantsAndSelf() {
        List<MarkupElement> result = new ArrayList<>();
        Set<MarkupElement> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        collect(this, result, seen);
        return result;
    }

    private static void collect(MarkupElement element, List<MarkupElement> result, Set<MarkupElement> seen) {
        if (!seen.add(element)) {
            return;
        }
        result.add(element);
        for (MarkupProperty property : element.properties) {
            property.elementValue().ifPresent(value -> collect(value, result, seen));
        }
        for (MarkupElement child : element.children) {
            collect(child, result, seen);
        }
    }

    /**
     * Copies this subtree without its parent link, structural anchor or diagnostics.
     */
    public MarkupElement deepCopy() {
        MarkupElement copy = new MarkupElement(typeName, namespace);
        copy.name = name;
        copy.key = key;
        copy.textContent = textContent;
        copy.resolvedType = resolvedType;
        copy.setLocation(location().orElse(null));
        for (MarkupProperty property : properties) {
            copy.addProperty(property.deepCopy());
        }
        for (MarkupElement child : children) {
            copy.addChild(child.deepCopy());
        }
        return copy;
    }

    /**
     * Full copy for document snapshots. Unlike {@link #deepCopy()} it keeps diagnostics and re-points
     * structural anchors through {@code anchors}; an element reachable twice is copied at its first
     * position only.
     */
    MarkupElement snapshot(Map<org.w3c.dom.Node, org.w3c.dom.Node> anchors, Set<MarkupElement> visited) {
        MarkupElement copy = new MarkupElement(typeName, namespace);
        visited.add(this);
        copy.name = name;
        copy.key = key;
        copy.textContent = textContent;
        copy.resolvedType = resolvedType;
        copy.copyNodeStateFrom(this);
        if (structuralAnchor != null) {
            copy.structuralAnchor = (org.w3c.dom.Element) anchors.getOrDefault(structuralAnchor, structuralAnchor);
        }
        for (MarkupProperty property : properties) {
            PropertyValue value = property.value();
            if (value instanceof PropertyValue.ElementValue element) {
                if (visited.contains(element.element())) {
                    continue;
                }
                value = PropertyValue.element(element.element().snapshot(anchors, visited));
            } else if (value instanceof PropertyValue.ExtensionValue extension) {
                value = PropertyValue.extension(extension.extension().deepCopy());
            }
            copy.addProperty(property.snapshotWith(value));
        }
        for (MarkupElement child : children) {
            if (!visited.contains(child)) {
                copy.addChild(child.snapshot(anchors, visited));
            }
        }
        return copy;
    }

    @Override
    public String toString() {
        StringBuilder builder = new StringBuilder("<").append(typeName);
        name().ifPresent(value -> builder.append(" x:Name=\"").append(value).append('"'));
        key().ifPresent(value -> builder.append(" x:Key=\"").append(value).append('"'));
        return builder.append('>').toString();
    }
}
