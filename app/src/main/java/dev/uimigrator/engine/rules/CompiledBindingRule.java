package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.MarkupExtensionRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * With {@link dev.uimigrator.engine.TransformationOptions#compiledBindings()} on, bindings become
 * compiled bindings. Runs after the other binding rules so it sees their final arguments. The views
 * still need an {@code x:DataType} before they compile.
 */
public class CompiledBindingRule extends MarkupExtensionRule {

    @Override
    public String name() {
        return "UseCompiledBinding";
    }

    @Override
    public int priority() {
        return 50;
    }

    @Override
    public boolean canHandleExtension(MarkupExtension extension) {
        return extension.isNamed("Binding");
    }

    @Override
    public Optional<MarkupExtension> transformExtension(MarkupExtension extension, TransformationContext context) {
        if (context.options().compiledBindings()) {
            extension.setName("CompiledBinding");
            context.recordTransformation(name(), NodeKind.MARKUP_EXTENSION, "Binding -> CompiledBinding");
        }
        return Optional.of(extension);
    }
}
