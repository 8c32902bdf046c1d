package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.PropertyRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Thickness and corner radius lists are written comma-separated: {@code "4 8"} and {@code "4, 8"}
 * both become {@code "4,8"}.
 */
public class ThicknessValueRule extends PropertyRule {

    private static final Set<String> PROPERTIES = Set.of("Margin", "Padding", "BorderThickness", "CornerRadius");
    private static final Pattern SEPARATORS = Pattern.compile("[\\s,]+");

    @Override
    public String name() {
        return "NormalizeThickness";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean canHandleProperty(MarkupProperty property) {
        return PROPERTIES.contains(property.localName()) && property.literal().map(value -> !normalize(value).equals(value)).orElse(false);
    }

    @Override
    public Optional<MarkupProperty> transformProperty(MarkupProperty property, TransformationContext context) {
        String original = property.literal().orElseThrow();
        String normalized = normalize(original);
        property.setLiteral(normalized);
        context.recordTransformation(name(), NodeKind.PROPERTY, property.name() + " '" + original + "' -> '" + normalized + "'");
        return Optional.of(property);
    }

    static String normalize(String value) {
        return Arrays.stream(SEPARATORS.split(value.trim()))
                .filter(part -> !part.isEmpty())
                .collect(Collectors.joining(","));
    }
}
