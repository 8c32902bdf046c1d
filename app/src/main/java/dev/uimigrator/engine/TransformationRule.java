package dev.uimigrator.engine;

import dev.uimigrator.model.MarkupNode;
import java.util.Optional;

/**
 * A pluggable unit of rewrite logic. Rules with a higher priority run first; equal priorities keep
 * registration order.
 *
 * <p>{@link #apply} returns the node that now occupies the position (the same node when rewritten in
 * place, a different one when replaced) or empty when the node is to be removed.
 */
public interface TransformationRule {

    String name();

    default int priority() {
        return 0;
    }

    boolean canHandle(MarkupNode node);

    Optional<MarkupNode> apply(MarkupNode node, TransformationContext context);
}
