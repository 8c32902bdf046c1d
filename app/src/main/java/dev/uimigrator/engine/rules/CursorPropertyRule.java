package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.PropertyRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Standard cursor names that differ between the dialects. The diagonal resize cursors only have
 * corner approximations.
 */
public class CursorPropertyRule extends PropertyRule {

    private static final Map<String, String> CURSORS = Map.of(
            "SizeNS", "SizeNorthSouth",
            "SizeWE", "SizeWestEast",
            "SizeNESW", "TopLeftCorner",
            "SizeNWSE", "TopRightCorner");
    private static final Set<String> APPROXIMATED = Set.of("SizeNESW", "SizeNWSE");

    @Override
    public String name() {
        return "ConvertCursor";
    }

    @Override
    public int priority() {
        return 30;
    }

    @Override
    public boolean canHandleProperty(MarkupProperty property) {
        return property.name().equals("Cursor") && property.literal().map(CURSORS::containsKey).orElse(false);
    }

    @Override
    public Optional<MarkupProperty> transformProperty(MarkupProperty property, TransformationContext context) {
        String original = property.literal().orElseThrow();
        String converted = CURSORS.get(original);
        property.setLiteral(converted);
        if (APPROXIMATED.contains(original)) {
            context.info(property, DiagnosticCodes.CURSOR_APPROXIMATED, "Cursor " + original + " approximated as " + converted);
        }
        context.recordTransformation(name(), NodeKind.PROPERTY, original + " -> " + converted);
        return Optional.of(property);
    }
}
