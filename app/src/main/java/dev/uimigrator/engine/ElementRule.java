package dev.uimigrator.engine;

import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupNode;
import java.util.Optional;

/**
 * Base class for rules that rewrite elements.
 */
public abstract class ElementRule implements TransformationRule {

    public abstract boolean canHandleElement(MarkupElement element);

    public abstract Optional<MarkupElement> transformElement(MarkupElement element, TransformationContext context);

    @Override
    public final boolean canHandle(MarkupNode node) {
        return node instanceof MarkupElement element && canHandleElement(element);
    }

    @Override
    public final Optional<MarkupNode> apply(MarkupNode node, TransformationContext context) {
        return transformElement((MarkupElement) node, context).map(MarkupNode.class::cast);
    }

    @Override
    public String toString() {
        return name() + " (priority " + priority() + ")";
    }
}
