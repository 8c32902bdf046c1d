package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.MarkupExtensionRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.ExtensionArgument;
import dev.uimigrator.model.MarkupExtension;
import java.util.Optional;

/**
 * Rewrites {@code RelativeSource} bindings into path syntax:
 * {@code FindAncestor} becomes {@code $parent[Type]} (or {@code $parent[Type;index]} past the first
 * ancestor), {@code Self} becomes {@code $self}. {@code TemplatedParent} maps to {@code $parent} with
 * a warning, since templates usually want {@code TemplateBinding}.
 */
public class RelativeSourceBindingRule extends MarkupExtensionRule {

    @Override
    public String name() {
        return "TransformRelativeSourceBinding";
    }

    @Override
    public int priority() {
        return 90;
    }

    @Override
    public boolean canHandleExtension(MarkupExtension extension) {
        return extension.isNamed("Binding") && extension.hasNamedArgument("RelativeSource");
    }

    @Override
    public Optional<MarkupExtension> transformExtension(MarkupExtension binding, TransformationContext context) {
        Optional<MarkupExtension> relativeSource = binding.namedArgument("RelativeSource").flatMap(ExtensionArgument::extension);
        if (relativeSource.isEmpty() || !relativeSource.get().isNamed("RelativeSource")) {
            context.warn(binding, DiagnosticCodes.BINDING_RELATIVE_SOURCE_UNSUPPORTED,
                    "RelativeSource is not a {RelativeSource} expression: " + binding.toMarkup());
            return Optional.of(binding);
        }
        MarkupExtension source = relativeSource.get();
        String mode = source.namedText("Mode").or(() -> source.firstPositional().flatMap(ExtensionArgument::text)).orElse("");

        String prefix;
        switch (mode) {
            case "FindAncestor":
                Optional<String> ancestor = ancestorSelector(source);
                if (ancestor.isEmpty()) {
                    context.warn(binding, DiagnosticCodes.BINDING_RELATIVE_SOURCE_UNSUPPORTED,
                            "FindAncestor without AncestorType cannot be converted");
                    return Optional.of(binding);
                }
                prefix = ancestor.get();
                break;
            case "Self":
                prefix = "$self";
                break;
            case "TemplatedParent":
                prefix = "$parent";
                context.warn(binding, DiagnosticCodes.BINDING_TEMPLATED_PARENT,
                        "TemplatedParent binding converted to $parent; inside a ControlTemplate prefer TemplateBinding");
                break;
            default:
                context.warn(binding, DiagnosticCodes.BINDING_RELATIVE_SOURCE_UNSUPPORTED,
                        "RelativeSource mode '" + mode + "' has no path equivalent");
                return Optional.of(binding);
        }

        Optional<String> path = binding.pathArgument().filter(value -> !value.isBlank() && !value.equals("."));
        String rewritten = path.isPresent() ? prefix + "." + path.get() : prefix;
        binding.removeNamedArgument("RelativeSource");
        binding.removeNamedArgument("Path");
        binding.setOnlyPositional(rewritten);
        context.recordTransformation(name(), "Binding", "RelativeSource " + mode + " -> " + rewritten);
        return Optional.of(binding);
    }

    private static Optional<String> ancestorSelector(MarkupExtension source) {
        Optional<ExtensionArgument> typeArgument = source.namedArgument("AncestorType");
        if (typeArgument.isEmpty()) {
            return Optional.empty();
        }
        Optional<String> typeName = typeArgument.get().text();
        if (typeName.isEmpty()) {
            typeName = typeArgument.get().extension()
                    .filter(extension -> extension.isNamed("Type"))
                    .flatMap(extension -> extension.firstPositional().flatMap(ExtensionArgument::text));
        }
        if (typeName.isEmpty() || typeName.get().isBlank()) {
            return Optional.empty();
        }
        int level = source.namedText("AncestorLevel").map(RelativeSourceBindingRule::parseLevel).orElse(1);
        return Optional.of(level > 1
                ? "$parent[" + typeName.get().trim() + ";" + (level - 1) + "]"
                : "$parent[" + typeName.get().trim() + "]");
    }

    private static int parseLevel(String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            return 1;
        }
    }
}
