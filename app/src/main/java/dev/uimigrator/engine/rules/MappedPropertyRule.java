package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.PropertyRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.mapping.PropertyMapping;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * Applies the property mappings of the context's mapping source: scoped to the owning element type
 * first, then unscoped. A mapping without target name drops the property.
 */
public class MappedPropertyRule extends PropertyRule {

    @Override
    public String name() {
        return "ApplyPropertyMappings";
    }

    @Override
    public int priority() {
        return 20;
    }

    @Override
    public boolean canHandleProperty(MarkupProperty property) {
        return true;
    }

    @Override
    public Optional<MarkupProperty> transformProperty(MarkupProperty property, TransformationContext context) {
        String ownerType = property.owner().map(MarkupElement::typeName).orElse(null);
        Optional<PropertyMapping> found = context.mappings().findProperty(property.name(), ownerType);
        if (found.isEmpty()) {
            return Optional.of(property);
        }
        PropertyMapping mapping = found.get();
        if (mapping.isRemoval()) {
            String message = "Property " + property.name() + " has no equivalent and was removed";
            if (mapping.requiresManualReview() && context.options().reportManualReview()) {
                context.warn(property, DiagnosticCodes.PROPERTY_MANUAL_REVIEW, withNotes(message, mapping));
            } else {
                context.info(property, DiagnosticCodes.PROPERTY_UNSUPPORTED, withNotes(message, mapping));
            }
            context.recordTransformation(name(), NodeKind.PROPERTY, "removed " + property.name());
            return Optional.empty();
        }

        boolean changed = false;
        StringBuilder detail = new StringBuilder(property.name());
        if (mapping.isRename()) {
            property.setName(mapping.targetName());
            detail.append(" -> ").append(mapping.targetName());
            changed = true;
        }
        Optional<String> literal = property.literal();
        Optional<String> converted = literal.flatMap(mapping::convertValue);
        if (converted.isPresent() && !converted.get().equals(literal.get())) {
            property.setLiteral(converted.get());
            detail.append(" (").append(literal.get()).append(" -> ").append(converted.get()).append(')');
            changed = true;
        }
        if (mapping.requiresManualReview() && context.options().reportManualReview()) {
            context.warn(property, DiagnosticCodes.PROPERTY_MANUAL_REVIEW,
                    withNotes("Property " + mapping.sourceName() + " needs manual review", mapping));
        }
        if (changed) {
            context.recordTransformation(name(), NodeKind.PROPERTY, detail.toString());
        }
        return Optional.of(property);
    }

    private static String withNotes(String message, PropertyMapping mapping) {
        return mapping.notes().isBlank() ? message : message + ": " + mapping.notes();
    }
}
