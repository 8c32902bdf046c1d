package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.PropertyRule;
import dev.uimigrator.engine.RenamingRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Map;
import java.util.Optional;

/**
 * Renames a property, optionally only on one owner type, and rewrites literal values through a
 * conversion table. Only the old name matches, so a second visit leaves the property alone.
 */
public class PropertyRenameRule extends PropertyRule implements RenamingRule {

    private final String sourceName;
    private final String targetName;
    private final Map<String, String> valueConversions;
    private final String ownerType;

    public PropertyRenameRule(String sourceName, String targetName) {
        this(sourceName, targetName, Map.of(), null);
    }

    public PropertyRenameRule(String sourceName, String targetName, Map<String, String> valueConversions, String ownerType) {
        if (sourceName == null || sourceName.isBlank() || targetName == null || targetName.isBlank()) {
            throw new IllegalArgumentException("Source and target property names must not be blank");
        }
        this.sourceName = sourceName;
        this.targetName = targetName;
        this.valueConversions = valueConversions == null ? Map.of() : Map.copyOf(valueConversions);
        this.ownerType = ownerType;
    }

    @Override
    public String name() {
        return ownerType == null ? "Rename" + sourceName : "Rename" + ownerType + sourceName;
    }

    @Override
    public int priority() {
        return 40;
    }

    @Override
    public String sourceName() {
        return sourceName;
    }

    @Override
    public String targetName() {
        return targetName;
    }

    @Override
    public boolean canHandleProperty(MarkupProperty property) {
        if (!property.name().equals(sourceName)) {
            return false;
        }
        return ownerType == null || property.owner().map(MarkupElement::typeName).map(ownerType::equals).orElse(false);
    }

    @Override
    public Optional<MarkupProperty> transformProperty(MarkupProperty property, TransformationContext context) {
        property.setName(targetName);
        String detail = sourceName + " -> " + targetName;
        Optional<String> converted = property.literal().map(valueConversions::get);
        if (converted.isPresent()) {
            detail += " (" + property.literal().orElseThrow() + " -> " + converted.get() + ")";
            property.setLiteral(converted.get());
        }
        context.recordTransformation(name(), NodeKind.PROPERTY, detail);
        return Optional.of(property);
    }
}
