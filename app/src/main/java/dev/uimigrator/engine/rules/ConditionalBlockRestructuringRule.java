package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.PostProcessingPhase;
import dev.uimigrator.engine.PostProcessingRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.NodeKind;
import dev.uimigrator.model.PropertyValue;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lifts property triggers out of a style. Each recognized trigger becomes a sibling style whose
 * selector is the container's selector plus the trigger's pseudoclasses, holding copies of the
 * trigger's setters:
 *
 * <pre>
 * &lt;Style TargetType="Button"&gt;                &lt;Style Selector="Button"&gt;...&lt;/Style&gt;
 *   &lt;Style.Triggers&gt;                    =&gt;   &lt;Style Selector="Button:pointerover"&gt;
 *     &lt;Trigger Property="IsMouseOver"            &lt;Setter .../&gt;
 *              Value="True"&gt;&lt;Setter .../&gt;     &lt;/Style&gt;
 * </pre>
 *
 * <p>Inside a {@code ControlTheme} the new styles are nested in the theme with a {@code ^} selector
 * instead. Keyed styles are left alone: a sibling selector style would apply to every matching control.
 *
 * <p>The original triggers stay in place and are only recorded in the conversion ledger; the
 * cleanup pass removes them once every style has been restructured.
 */
public class ConditionalBlockRestructuringRule extends PostProcessingRule {

    @Override
    public String name() {
        return "RestructureConditionalBlocks";
    }

    @Override
    public int priority() {
        return 50;
    }

    @Override
    public PostProcessingPhase phase() {
        return PostProcessingPhase.RESTRUCTURE;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return (element.isType("Style") || element.isType("ControlTheme")) && !findBlocks(element).isEmpty();
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement container, TransformationContext context) {
        boolean theme = container.isType("ControlTheme");
        if (!theme && container.key().isPresent()) {
            context.warn(container, DiagnosticCodes.STYLE_KEYED_TRIGGERS, "Triggers of keyed style '" + container.key().get()
                    + "' were not converted; move them into a ControlTheme by hand");
            return Optional.of(container);
        }
        Optional<String> base = theme ? Optional.of("^") : Selectors.baseOf(container);
        if (base.isEmpty()) {
            context.warn(container, DiagnosticCodes.STYLE_NO_TARGET_TYPE,
                    "Style has neither Selector nor TargetType; its triggers were not converted");
            return Optional.of(container);
        }
        Optional<MarkupElement> parent = container.parent();
        if (!theme && parent.isEmpty()) {
            context.warn(container, DiagnosticCodes.RESTRUCTURE_NO_PARENT,
                    "Style has no parent to receive converted triggers; its triggers were not converted");
            return Optional.of(container);
        }

        List<MarkupElement> styles = new ArrayList<>();
        List<Block> converted = new ArrayList<>();
        for (Block block : findBlocks(container)) {
            Optional<String> suffix = PseudoclassConditions.selectorSuffix(block.element());
            if (suffix.isEmpty()) {
                context.warn(block.element(), DiagnosticCodes.UNSUPPORTED_CONDITION,
                        "unsupported condition: " + describe(block.element()) + " was left in place");
                continue;
            }
            styles.add(selectorStyle(container, base.get() + suffix.get(), block.element()));
            converted.add(block);
        }
        if (styles.isEmpty()) {
            return Optional.of(container);
        }
        if (theme) {
            styles.forEach(container::addChild);
        } else if (!placeAfter(container, parent.get(), styles)) {
            context.warn(container, DiagnosticCodes.RESTRUCTURE_NO_PARENT,
                    "Parent " + parent.get().typeName() + " does not hold this style; its triggers were not converted");
            return Optional.of(container);
        }
        for (Block block : converted) {
            context.conversions().markConverted(block.element());
            if (block.wrapper() != null) {
                context.conversions().markWrapper(block.wrapper());
            }
        }
        for (MarkupElement style : styles) {
            context.recordTransformation(name(), NodeKind.ELEMENT, "Style Selector=" + style.literal("Selector").orElse(""));
        }
        return Optional.of(container);
    }

    private static MarkupElement selectorStyle(MarkupElement container, String selector, MarkupElement block) {
        MarkupElement style = new MarkupElement("Style", container.namespace().orElse(null));
        style.setLocation(block.location().orElse(null));
        style.setProperty("Selector", selector);
        for (MarkupElement setter : settersOf(block)) {
            style.addChild(setter.deepCopy());
        }
        return style;
    }

    // A style held directly as a property value is moved into a <Owner.Property> collection first.
    private static boolean placeAfter(MarkupElement style, MarkupElement parent, List<MarkupElement> siblings) {
        int index = parent.indexOfChild(style);
        if (index >= 0) {
            for (int i = 0; i < siblings.size(); i++) {
                parent.insertChild(index + 1 + i, siblings.get(i));
            }
            return true;
        }
        Optional<MarkupProperty> holder = parent.propertyHolding(style);
        if (holder.isEmpty()) {
            return false;
        }
        String collectionName = holder.get().isAttached() ? holder.get().name() : parent.typeName() + "." + holder.get().name();
        MarkupElement collection = new MarkupElement(collectionName, parent.namespace().orElse(null));
        holder.get().setValue(PropertyValue.element(collection));
        collection.addChild(style);
        siblings.forEach(collection::addChild);
        return true;
    }

    static List<Block> findBlocks(MarkupElement container) {
        List<Block> blocks = new ArrayList<>();
        for (MarkupElement child : container.children()) {
            if (PseudoclassConditions.isConditionalBlock(child)) {
                blocks.add(new Block(child, null));
            }
        }
        for (MarkupProperty property : container.properties()) {
            if (!property.localName().equals("Triggers") || property.elementValue().isEmpty()) {
                continue;
            }
            MarkupElement value = property.elementValue().get();
            if (value.isPropertyElement()) {
                for (MarkupElement nested : value.children()) {
                    if (PseudoclassConditions.isConditionalBlock(nested)) {
                        blocks.add(new Block(nested, value));
                    }
                }
            } else if (PseudoclassConditions.isConditionalBlock(value)) {
                blocks.add(new Block(value, null));
            }
        }
        return blocks;
    }

    private static List<MarkupElement> settersOf(MarkupElement block) {
        List<MarkupElement> setters = new ArrayList<>(block.children("Setter"));
        for (MarkupElement item : block.propertyContent("Setters")) {
            if (item.isType("Setter")) {
                setters.add(item);
            }
        }
        return setters;
    }

    private static String describe(MarkupElement block) {
        if (block.isType("Trigger") || block.isType("DataTrigger")) {
            String subject = block.literal("Property")
                    .or(() -> block.property("Binding").flatMap(MarkupProperty::markupExtension).map(MarkupExtension::toMarkup))
                    .orElse("?");
            return block.typeName() + " " + subject + "=" + block.literal("Value").orElse("?");
        }
        return block.typeName();
    }

    record Block(MarkupElement element, MarkupElement wrapper) {
    }
}
