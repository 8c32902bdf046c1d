package dev.uimigrator.pipeline;

import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TransformationEngine;
import dev.uimigrator.model.UnifiedDocument;
import java.util.Objects;

/**
 * Pipeline stage running the rule engine over the whole document.
 */
public class RuleBasedTransformer implements DocumentTransformer {

    private final TransformationEngine engine;

    public RuleBasedTransformer(TransformationEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    @Override
    public String name() {
        return "RuleBasedTransformer";
    }

    @Override
    public UnifiedDocument transform(UnifiedDocument document, TransformationContext context) {
        engine.transform(document, context);
        return document;
    }
}
