package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.MarkupExtensionRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupExtension;
import java.util.List;
import java.util.Optional;

/**
 * Binding parameters the target dialect does not know. Source-update timing and async fetching are
 * dropped; the validation flags fold into {@code EnableDataValidation}.
 */
public class BindingRule extends MarkupExtensionRule {

    static final List<String> DROPPED = List.of("UpdateSourceTrigger", "IsAsync", "NotifyOnValidationError");
    private static final List<String> VALIDATION_FLAGS = List.of("ValidatesOnDataErrors", "ValidatesOnExceptions", "ValidatesOnNotifyDataErrors");

    @Override
    public String name() {
        return "TransformBinding";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public boolean canHandleExtension(MarkupExtension extension) {
        if (!extension.isNamed("Binding")) {
            return false;
        }
        return DROPPED.stream().anyMatch(extension::hasNamedArgument)
                || VALIDATION_FLAGS.stream().anyMatch(extension::hasNamedArgument);
    }

    @Override
    public Optional<MarkupExtension> transformExtension(MarkupExtension extension, TransformationContext context) {
        for (String parameter : DROPPED) {
            extension.removeNamedArgument(parameter).ifPresent(ignored ->
                    context.recordTransformation(name(), "Binding", "removed " + parameter));
        }
        boolean validates = false;
        for (String flag : VALIDATION_FLAGS) {
            Optional<String> value = extension.namedText(flag);
            if (extension.removeNamedArgument(flag).isPresent()) {
                validates |= value.map("True"::equalsIgnoreCase).orElse(false);
                context.recordTransformation(name(), "Binding", "removed " + flag);
            }
        }
        if (validates && !extension.hasNamedArgument("EnableDataValidation")) {
            extension.setNamedArgument("EnableDataValidation", "True");
            context.recordTransformation(name(), "Binding", "EnableDataValidation=True");
        }
        return Optional.of(extension);
    }
}
