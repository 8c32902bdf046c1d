package dev.uimigrator.engine;

import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.MarkupNode;
import java.util.Optional;

/**
 * Base class for rules that rewrite markup extensions, including nested ones.
 */
public abstract class MarkupExtensionRule implements TransformationRule {

    public abstract boolean canHandleExtension(MarkupExtension extension);

    public abstract Optional<MarkupExtension> transformExtension(MarkupExtension extension, TransformationContext context);

    @Override
    public final boolean canHandle(MarkupNode node) {
        return node instanceof MarkupExtension extension && canHandleExtension(extension);
    }

    @Override
    public final Optional<MarkupNode> apply(MarkupNode node, TransformationContext context) {
        return transformExtension((MarkupExtension) node, context).map(MarkupNode.class::cast);
    }

    @Override
    public String toString() {
        return name() + " (priority " + priority() + ")";
    }
}
