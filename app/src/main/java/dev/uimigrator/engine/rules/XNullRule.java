package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.MarkupExtensionRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

public class XNullRule extends MarkupExtensionRule {

    @Override
    public String name() {
        return "ValidateXNull";
    }

    @Override
    public int priority() {
        return 150;
    }

    @Override
    public boolean canHandleExtension(MarkupExtension extension) {
        return extension.isNamed("Null");
    }

    @Override
    public Optional<MarkupExtension> transformExtension(MarkupExtension extension, TransformationContext context) {
        context.recordTransformation(name(), NodeKind.MARKUP_EXTENSION, "x:Null kept");
        return Optional.of(extension);
    }
}
