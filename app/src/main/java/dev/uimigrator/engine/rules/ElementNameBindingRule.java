package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.MarkupExtensionRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupExtension;
import java.util.Optional;

/**
 * {@code ElementName=Foo, Path=Bar} becomes the {@code #Foo.Bar} shorthand when the option is on.
 */
public class ElementNameBindingRule extends MarkupExtensionRule {

    @Override
    public String name() {
        return "TransformElementNameBinding";
    }

    @Override
    public int priority() {
        return 85;
    }

    @Override
    public boolean canHandleExtension(MarkupExtension extension) {
        return extension.isNamed("Binding") && extension.namedText("ElementName").filter(value -> !value.isBlank()).isPresent();
    }

    @Override
    public Optional<MarkupExtension> transformExtension(MarkupExtension binding, TransformationContext context) {
        if (!context.options().elementNameShorthand()) {
            return Optional.of(binding);
        }
        String elementName = binding.namedText("ElementName").orElseThrow().trim();
        String rewritten = binding.pathArgument()
                .filter(path -> !path.isBlank() && !path.equals("."))
                .map(path -> "#" + elementName + "." + path)
                .orElse("#" + elementName);
        binding.removeNamedArgument("ElementName");
        binding.removeNamedArgument("Path");
        binding.setOnlyPositional(rewritten);
        context.recordTransformation(name(), "Binding", "ElementName " + elementName + " -> " + rewritten);
        return Optional.of(binding);
    }
}
