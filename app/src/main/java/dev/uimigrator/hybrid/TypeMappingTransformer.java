package dev.uimigrator.hybrid;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TypeResolutionException;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.mapping.TypeMapping;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.NodeKind;
import dev.uimigrator.model.ResolvedType;
import dev.uimigrator.model.UnifiedDocument;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Renames element types through the mapping source. A simple name with one mapping is rewritten
 * structurally; a simple name shared by several source types needs the element's resolved type to
 * pick the right mapping.
 */
public class TypeMappingTransformer extends ModeAdaptiveTransformer {

    private final MappingSource mappings;

    public TypeMappingTransformer(TransformationStrategy strategy, MappingSource mappings) {
        super(strategy);
        this.mappings = Objects.requireNonNull(mappings, "mappings");
    }

    @Override
    public String name() {
        return "TypeMappingTransformer";
    }

    @Override
    protected boolean canTransform(MarkupElement element) {
        return !element.isPropertyElement() && !mappings.typesNamed(element.typeName()).isEmpty();
    }

    @Override
    protected boolean requiresTypedView(MarkupElement element) {
        return mappings.typesNamed(element.typeName()).size() > 1;
    }

    @Override
    protected void transformStructural(MarkupElement element, UnifiedDocument document, TransformationContext context) {
        List<TypeMapping> candidates = mappings.typesNamed(element.typeName());
        if (!candidates.isEmpty()) {
            apply(element, candidates.get(0), context);
        }
    }

    @Override
    protected void transformTyped(MarkupElement element, ResolvedType type, UnifiedDocument document, TransformationContext context) {
        if (!type.simpleName().equals(element.typeName())) {
            throw new TypeResolutionException("Resolved type " + type.qualifiedName() + " is stale for element " + element.typeName());
        }
        Optional<TypeMapping> mapping = mappings.findTypeByQualifiedName(type.qualifiedName());
        if (mapping.isPresent()) {
            apply(element, mapping.get(), context);
        } else {
            transformStructural(element, document, context);
        }
    }

    private void apply(MarkupElement element, TypeMapping mapping, TransformationContext context) {
        String target = mapping.targetSimpleName();
        String source = element.typeName();
        element.setTypeName(target);
        element.renamePropertyElements(source, target);
        if (mapping.targetNamespace() != null && !mapping.targetNamespace().isBlank()) {
            element.setNamespace(mapping.targetNamespace());
        }
        element.setResolvedType(new ResolvedType(mapping.targetType()));
        element.structuralAnchor().ifPresent(anchor -> {
            String prefix = anchor.getPrefix();
            String qualified = prefix == null || prefix.isEmpty() ? target : prefix + ":" + target;
            org.w3c.dom.Node renamed = anchor.getOwnerDocument().renameNode(anchor, anchor.getNamespaceURI(), qualified);
            if (renamed instanceof org.w3c.dom.Element renamedElement && renamedElement != anchor) {
                element.setStructuralAnchor(renamedElement);
            }
        });
        if (mapping.requiresManualReview() && context.options().reportManualReview()) {
            String notes = mapping.notes().isBlank() ? "" : ": " + mapping.notes();
            context.warn(element, DiagnosticCodes.TYPE_MANUAL_REVIEW, source + " mapped to " + target + " needs manual review" + notes);
        }
        context.recordTransformation(name(), NodeKind.ELEMENT, source + " -> " + target);
    }
}
