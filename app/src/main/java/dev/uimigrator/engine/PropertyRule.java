package dev.uimigrator.engine;

import dev.uimigrator.model.MarkupNode;
import dev.uimigrator.model.MarkupProperty;
import java.util.Optional;

/**
 * Base class for rules that rewrite properties.
 */
public abstract class PropertyRule implements TransformationRule {

    public abstract boolean canHandleProperty(MarkupProperty property);

    public abstract Optional<MarkupProperty> transformProperty(MarkupProperty property, TransformationContext context);

    @Override
    public final boolean canHandle(MarkupNode node) {
        return node instanceof MarkupProperty property && canHandleProperty(property);
    }

    @Override
    public final Optional<MarkupNode> apply(MarkupNode node, TransformationContext context) {
        return transformProperty((MarkupProperty) node, context).map(MarkupNode.class::cast);
    }

    @Override
    public String toString() {
        return name() + " (priority " + priority() + ")";
    }
}
