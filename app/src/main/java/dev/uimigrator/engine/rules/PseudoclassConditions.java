package dev.uimigrator.engine.rules;

import dev.uimigrator.model.MarkupElement;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Maps property triggers to selector pseudoclasses. Only property conditions with a known
 * property/value pair are recognized; data triggers need bindings and never are.
 */
public final class PseudoclassConditions {

    private static final Map<String, String> PSEUDOCLASSES = Map.ofEntries(
            Map.entry(key("IsMouseOver", "True"), ":pointerover"),
            Map.entry(key("IsPressed", "True"), ":pressed"),
            Map.entry(key("IsFocused", "True"), ":focus"),
            Map.entry(key("IsEnabled", "False"), ":disabled"),
            Map.entry(key("IsSelected", "True"), ":selected"),
            Map.entry(key("IsChecked", "True"), ":checked"),
            Map.entry(key("IsChecked", "False"), ":unchecked"),
            Map.entry(key("IsReadOnly", "True"), ":readonly"),
            Map.entry(key("IsKeyboardFocused", "True"), ":focus"),
            Map.entry(key("IsKeyboardFocusWithin", "True"), ":focus-within"),
            Map.entry(key("IsMouseDirectlyOver", "True"), ":pointerover"),
            Map.entry(key("IsDragging", "True"), ":dragging"));

    private PseudoclassConditions() {
    }

    public static boolean isConditionalBlock(MarkupElement element) {
        return element.isType("Trigger") || element.isType("MultiTrigger")
                || element.isType("DataTrigger") || element.isType("MultiDataTrigger");
    }

    /**
     * Pseudoclass for one property/value pair. {@code Button.IsPressed} is read as {@code IsPressed}.
     */
    public static Optional<String> pseudoclass(String property, String value) {
        if (property == null || value == null) {
            return Optional.empty();
        }
        String trimmed = property.trim();
        int dot = trimmed.lastIndexOf('.');
        String local = dot >= 0 ? trimmed.substring(dot + 1) : trimmed;
        return Optional.ofNullable(PSEUDOCLASSES.get(key(local, value.trim())));
    }

    /**
     * Selector suffix for a whole conditional block, or empty when any of its conditions is not
     * recognized.
     */
    public static Optional<String> selectorSuffix(MarkupElement block) {
        if (block.isType("Trigger")) {
            return pseudoclass(block.literal("Property").orElse(null), block.literal("Value").orElse(null));
        }
        if (block.isType("MultiTrigger")) {
            List<MarkupElement> conditions = conditionsOf(block);
            if (conditions.isEmpty()) {
                return Optional.empty();
            }
            Set<String> suffixes = new LinkedHashSet<>();
            for (MarkupElement condition : conditions) {
                Optional<String> pseudoclass = pseudoclass(condition.literal("Property").orElse(null),
                        condition.literal("Value").orElse(null));
                if (pseudoclass.isEmpty()) {
                    return Optional.empty();
                }
                suffixes.add(pseudoclass.get());
            }
            return Optional.of(String.join("", suffixes));
        }
        return Optional.empty();
    }

    private static List<MarkupElement> conditionsOf(MarkupElement block) {
        List<MarkupElement> conditions = new ArrayList<>(block.children("Condition"));
        for (MarkupElement item : block.propertyContent("Conditions")) {
            if (item.isType("Condition")) {
                conditions.add(item);
            }
        }
        return conditions;
    }

    private static String key(String property, String value) {
        return property + "=" + value.toLowerCase(Locale.ROOT);
    }
}
