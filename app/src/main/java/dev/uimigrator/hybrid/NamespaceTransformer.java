package dev.uimigrator.hybrid;

import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.mapping.NamespaceMapping;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.NodeKind;
import dev.uimigrator.model.ResolvedType;
import dev.uimigrator.model.UnifiedDocument;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Moves the document onto the target dialect's XML namespaces: the prefix table first, then every
 * element and, when present, its DOM counterpart.
 */
public class NamespaceTransformer extends ModeAdaptiveTransformer {

    private final MappingSource mappings;

    public NamespaceTransformer(TransformationStrategy strategy, MappingSource mappings) {
        super(strategy);
        this.mappings = Objects.requireNonNull(mappings, "mappings");
    }

    @Override
    public String name() {
        return "NamespaceTransformer";
    }

    @Override
    protected void beforeTransform(UnifiedDocument document, TransformationContext context) {
        Map<String, String> declared = new LinkedHashMap<>(document.namespaces());
        declared.forEach((prefix, uri) -> mappings.findNamespace(uri).ifPresent(mapping -> {
            document.declareNamespace(prefix, mapping.targetNamespace());
            context.recordTransformation(name(), "Namespace", displayPrefix(prefix) + uri + " -> " + mapping.targetNamespace());
        }));
    }

    @Override
    protected boolean canTransform(MarkupElement element) {
        return element.namespace().flatMap(mappings::findNamespace).isPresent();
    }

    @Override
    protected void transformStructural(MarkupElement element, UnifiedDocument document, TransformationContext context) {
        Optional<NamespaceMapping> mapping = element.namespace().flatMap(mappings::findNamespace);
        if (mapping.isEmpty()) {
            return;
        }
        String target = mapping.get().targetNamespace();
        element.setNamespace(target);
        element.structuralAnchor().ifPresent(anchor -> {
            org.w3c.dom.Node renamed = anchor.getOwnerDocument().renameNode(anchor, target, anchor.getNodeName());
            if (renamed instanceof org.w3c.dom.Element renamedElement && renamedElement != anchor) {
                element.setStructuralAnchor(renamedElement);
            }
        });
        context.recordTransformation(name(), NodeKind.ELEMENT, element.typeName() + " -> " + target);
    }

    @Override
    protected void transformTyped(MarkupElement element, ResolvedType type, UnifiedDocument document, TransformationContext context) {
        transformStructural(element, document, context);
    }

    private static String displayPrefix(String prefix) {
        return prefix.isEmpty() ? "" : prefix + "=";
    }
}
