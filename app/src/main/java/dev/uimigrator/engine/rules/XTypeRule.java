package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.MarkupExtensionRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.ExtensionArgument;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

public class XTypeRule extends MarkupExtensionRule {

    @Override
    public String name() {
        return "ValidateXType";
    }

    @Override
    public int priority() {
        return 150;
    }

    @Override
    public boolean canHandleExtension(MarkupExtension extension) {
        return extension.isNamed("Type");
    }

    @Override
    public Optional<MarkupExtension> transformExtension(MarkupExtension extension, TransformationContext context) {
        Optional<String> typeName = extension.firstPositional().flatMap(ExtensionArgument::text)
                .or(() -> extension.namedText("TypeName"))
                .filter(value -> !value.isBlank());
        if (typeName.isEmpty()) {
            context.warn(extension, DiagnosticCodes.XTYPE_NO_TYPE, "x:Type needs a type name, for example {x:Type Button}");
        } else {
            context.recordTransformation(name(), NodeKind.MARKUP_EXTENSION, "x:Type " + typeName.get() + " kept");
        }
        return Optional.of(extension);
    }
}
