package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.MarkupExtensionRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.ExtensionArgument;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * {@code x:Static} carries over unchanged; only a missing member is reported.
 */
public class XStaticRule extends MarkupExtensionRule {

    @Override
    public String name() {
        return "ValidateXStatic";
    }

    @Override
    public int priority() {
        return 150;
    }

    @Override
    public boolean canHandleExtension(MarkupExtension extension) {
        return extension.isNamed("Static");
    }

    @Override
    public Optional<MarkupExtension> transformExtension(MarkupExtension extension, TransformationContext context) {
        Optional<String> member = extension.firstPositional().flatMap(ExtensionArgument::text)
                .or(() -> extension.namedText("Member"))
                .filter(value -> !value.isBlank());
        if (member.isEmpty()) {
            context.warn(extension, DiagnosticCodes.XSTATIC_NO_MEMBER,
                    "x:Static needs a member, for example {x:Static local:Constants.Title}");
        } else {
            context.recordTransformation(name(), NodeKind.MARKUP_EXTENSION, "x:Static " + member.get() + " kept");
        }
        return Optional.of(extension);
    }
}
