package dev.uimigrator.model;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.w3c.dom.Node;

/**
 * One parsed source file: the unified element tree plus the optional structural (DOM) and typed views.
 */
public final class UnifiedDocument {

    private final String sourceId;
    private final Map<String, String> namespaces = new LinkedHashMap<>();
    private MarkupElement root;
    private org.w3c.dom.Document structuralLayer;
    private TypeResolver typedLayer;

    public UnifiedDocument(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("sourceId must not be blank");
        }
        this.sourceId = sourceId;
    }

    public UnifiedDocument(String sourceId, MarkupElement root) {
        this(sourceId);
        setRoot(root);
    }

    public String sourceId() {
        return sourceId;
    }

    public Optional<MarkupElement> root() {
        return Optional.ofNullable(root);
    }

    public void setRoot(MarkupElement root) {
        this.root = root;
    }

    public Optional<org.w3c.dom.Document> structuralLayer() {
        return Optional.ofNullable(structuralLayer);
    }

    public void setStructuralLayer(org.w3c.dom.Document structuralLayer) {
        this.structuralLayer = structuralLayer;
    }

    public Optional<TypeResolver> typedLayer() {
        return Optional.ofNullable(typedLayer);
    }

    /**
     * Installs the typed view and resolves every element currently in the tree against it.
     *
     * @return number of elements that received a resolved type
     */
    public int attachTypedLayer(TypeResolver resolver) {
        this.typedLayer = Objects.requireNonNull(resolver, "resolver");
        int resolved = 0;
        for (MarkupElement element : elements()) {
            Optional<ResolvedType> type = resolver.resolve(element.namespace().orElse(null), element.typeName());
            element.setResolvedType(type.orElse(null));
            if (type.isPresent()) {
                resolved++;
            }
        }
        return resolved;
    }

    public void detachTypedLayer() {
        typedLayer = null;
        elements().forEach(element -> element.setResolvedType(null));
    }

    /**
     * Namespace declarations, prefix to URI. The default namespace uses the empty prefix.
     */
    public Map<String, String> namespaces() {
        return Collections.unmodifiableMap(namespaces);
    }

    public void declareNamespace(String prefix, String uri) {
        namespaces.put(prefix == null ? "" : prefix, Objects.requireNonNull(uri, "uri"));
    }

    public Optional<String> prefixFor(String uri) {
        return namespaces.entrySet().stream()
                .filter(entry -> entry.getValue().equals(uri))
                .map(Map.Entry::getKey)
                .findFirst();
    }

    public List<MarkupElement> elements() {
        return root == null ? List.of() : root.descendantsAndSelf();
    }

    /**
     * Independent copy of the tree and the structural layer. Element anchors point into the cloned DOM;
     * the typed layer is shared since resolvers hold no per-document state.
     */
    public UnifiedDocument snapshot() {
        UnifiedDocument copy = new UnifiedDocument(sourceId);
        copy.namespaces.putAll(namespaces);
        copy.typedLayer = typedLayer;
        Map<Node, Node> anchors = new IdentityHashMap<>();
        if (structuralLayer != null) {
            org.w3c.dom.Document clone = (org.w3c.dom.Document) structuralLayer.cloneNode(true);
            pairNodes(structuralLayer, clone, anchors);
            copy.structuralLayer = clone;
        }
        if (root != null) {
            copy.root = root.snapshot(anchors, Collections.newSetFromMap(new IdentityHashMap<>()));
        }
        return copy;
    }

    private static void pairNodes(Node original, Node clone, Map<Node, Node> anchors) {
        anchors.put(original, clone);
        Node left = original.getFirstChild();
        Node right = clone.getFirstChild();
        while (left != null && right != null) {
            pairNodes(left, right, anchors);
            left = left.getNextSibling();
            right = right.getNextSibling();
        }
    }
}
