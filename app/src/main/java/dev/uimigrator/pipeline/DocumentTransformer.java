package dev.uimigrator.pipeline;

import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.UnifiedDocument;

/**
 * One pipeline stage. A stage may mutate the document in place and return it, or return a
 * different document which the next stage receives.
 */
public interface DocumentTransformer {

    String name();

    UnifiedDocument transform(UnifiedDocument document, TransformationContext context);
}
