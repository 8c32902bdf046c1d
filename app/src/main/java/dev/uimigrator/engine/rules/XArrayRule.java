package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.MarkupExtensionRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.ExtensionArgument;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

public class XArrayRule extends MarkupExtensionRule {

    @Override
    public String name() {
        return "FlagXArray";
    }

    @Override
    public int priority() {
        return 200;
    }

    @Override
    public boolean canHandleExtension(MarkupExtension extension) {
        return extension.isNamed("Array");
    }

    @Override
    public Optional<MarkupExtension> transformExtension(MarkupExtension extension, TransformationContext context) {
        String itemType = extension.namedArgument("Type").map(XArrayRule::describe).orElse("object");
        context.warn(extension, DiagnosticCodes.XARRAY_NOT_SUPPORTED, "x:Array of " + itemType
                + " is not supported; expose the items as a collection property and bind ItemsSource to it");
        context.recordTransformation(name(), NodeKind.MARKUP_EXTENSION, "x:Array Type=" + itemType);
        return Optional.of(extension);
    }

    private static String describe(ExtensionArgument argument) {
        return argument.text()
                .or(() -> argument.extension().flatMap(nested -> nested.firstPositional().flatMap(ExtensionArgument::text)))
                .orElse(argument.render());
    }
}
