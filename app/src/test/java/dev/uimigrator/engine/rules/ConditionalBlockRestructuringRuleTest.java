package dev.uimigrator.engine.rules;

import static org.assertj.core.api.Assertions.assertThat;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.DiagnosticCollector;
import dev.uimigrator.engine.RuleRegistry;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TransformationEngine;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.UnifiedDocument;
import org.junit.jupiter.api.Test;

class ConditionalBlockRestructuringRuleTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final TransformationContext context = new TransformationContext("styles.xaml", diagnostics);
    private final TransformationEngine engine = new TransformationEngine(new RuleRegistry()
            .register(new ControlThemeRule())
            .register(new StyleSelectorRule())
            .register(new ConditionalBlockRestructuringRule())
            .register(new ConvertedBlockCleanupRule()));

    private final MarkupElement window = new MarkupElement("Window");
    private final MarkupElement resources = collection(window, "Resources");

    @Test
    void eachRecognizedTriggerBecomesOneSiblingStyle() {
        MarkupElement style = resources.addChild(style("Button"));
        MarkupElement triggers = collection(style, "Triggers");
        triggers.addChild(trigger("IsMouseOver", "True", "Background", "Red"));
        triggers.addChild(trigger("IsPressed", "True", "Background", "DarkRed"));
        triggers.addChild(trigger("IsEnabled", "False", "Opacity", "0.5"));

        transform();

        assertThat(resources.children()).extracting(element -> element.literal("Selector").orElse(""))
                .containsExactly("Button", "Button:pointerover", "Button:pressed", "Button:disabled");
        MarkupElement hover = resources.children().get(1);
        assertThat(hover.children()).singleElement()
                .satisfies(setter -> assertThat(setter.literal("Value")).contains("Red"));
        assertThat(hover.parent()).containsSame(resources);
        assertThat(style.hasProperty("Triggers")).isFalse();
        assertThat(context.conversions().size()).isEqualTo(3);
        assertThat(diagnostics.byCode(DiagnosticCodes.UNSUPPORTED_CONDITION)).isEmpty();
    }

    @Test
    void unrelatedResourcesAndSettersKeepTheirPlace() {
        MarkupElement keyedButton = resources.addChild(new MarkupElement("Button"));
        keyedButton.setKey("Sample");
        MarkupElement style = resources.addChild(style("Button"));
        MarkupElement plainSetter = style.addChild(setter("Foreground", "White"));
        collection(style, "Triggers").addChild(trigger("IsMouseOver", "True", "Background", "Red"));
        MarkupElement brush = resources.addChild(new MarkupElement("SolidColorBrush"));
        brush.setKey("Accent");

        transform();

        assertThat(resources.children()).hasSize(4);
        assertThat(resources.children().get(0)).isSameAs(keyedButton);
        assertThat(resources.children().get(1)).isSameAs(style);
        assertThat(resources.children().get(2).literal("Selector")).contains("Button:pointerover");
        assertThat(resources.children().get(3)).isSameAs(brush);
        assertThat(keyedButton.parent()).containsSame(resources);
        assertThat(keyedButton.properties()).isEmpty();
        assertThat(style.children()).containsExactly(plainSetter);
        assertThat(plainSetter.parent()).containsSame(style);
        assertThat(plainSetter.literal("Property")).contains("Foreground");
        assertThat(plainSetter.literal("Value")).contains("White");
    }

    @Test
    void unrecognizedBlockStaysInPlaceWithWarning() {
        MarkupElement style = resources.addChild(style("Button"));
        MarkupElement triggers = collection(style, "Triggers");
        triggers.addChild(trigger("IsMouseOver", "True", "Background", "Red"));
        MarkupElement dataTrigger = triggers.addChild(new MarkupElement("DataTrigger"));
        dataTrigger.setProperty("Value", "True");

        transform();

        assertThat(resources.children()).hasSize(2);
        assertThat(resources.children().get(1).literal("Selector")).contains("Button:pointerover");
        assertThat(triggers.children()).containsExactly(dataTrigger);
        assertThat(style.property("Triggers").flatMap(MarkupProperty::elementValue)).containsSame(triggers);
        assertThat(diagnostics.byCode(DiagnosticCodes.UNSUPPORTED_CONDITION)).singleElement()
                .satisfies(diagnostic -> assertThat(diagnostic.message()).startsWith("unsupported condition"));
        assertThat(dataTrigger.diagnostics()).hasSize(1);
    }

    @Test
    void singleTriggerHeldDirectlyByTheProperty() {
        MarkupElement style = resources.addChild(style("TextBox"));
        style.addProperty(MarkupProperty.element("Triggers", trigger("IsReadOnly", "True", "Background", "Gray")));

        transform();

        assertThat(resources.children()).extracting(element -> element.literal("Selector").orElse(""))
                .containsExactly("TextBox", "TextBox:readonly");
        assertThat(style.hasProperty("Triggers")).isFalse();
    }

    @Test
    void multiTriggerCombinesPseudoclasses() {
        MarkupElement style = resources.addChild(style("CheckBox"));
        MarkupElement multi = new MarkupElement("MultiTrigger");
        MarkupElement conditions = collection(multi, "Conditions");
        conditions.addChild(condition("IsChecked", "True"));
        conditions.addChild(condition("IsMouseOver", "True"));
        multi.addChild(setter("Foreground", "Blue"));
        style.addChild(multi);

        transform();

        assertThat(resources.children()).extracting(element -> element.literal("Selector").orElse(""))
                .containsExactly("CheckBox", "CheckBox:checked:pointerover");
        assertThat(style.children()).isEmpty();
    }

    @Test
    void styleWithoutParentIsLeftAlone() {
        MarkupElement style = style("Button");
        MarkupElement triggers = collection(style, "Triggers");
        triggers.addChild(trigger("IsMouseOver", "True", "Background", "Red"));

        engine.transform(new UnifiedDocument("styles.xaml", style), context);

        assertThat(triggers.children()).hasSize(1);
        assertThat(context.conversions().size()).isZero();
        assertThat(diagnostics.byCode(DiagnosticCodes.RESTRUCTURE_NO_PARENT)).hasSize(1);
    }

    @Test
    void styleHeldAsSinglePropertyValueIsWrappedInCollection() {
        MarkupElement page = new MarkupElement("UserControl");
        MarkupElement style = style("Button");
        style.addChild(trigger("IsFocused", "True", "BorderBrush", "Blue"));
        page.addProperty(MarkupProperty.element("Resources", style));

        engine.transform(new UnifiedDocument("styles.xaml", page), context);

        MarkupElement collection = page.property("Resources").flatMap(MarkupProperty::elementValue).orElseThrow();
        assertThat(collection.typeName()).isEqualTo("UserControl.Resources");
        assertThat(collection.children()).extracting(element -> element.literal("Selector").orElse(""))
                .containsExactly("Button", "Button:focus");
        assertThat(style.parent()).containsSame(collection);
    }

    @Test
    void keyedStyleTriggersAreNotTurnedIntoGlobalSelectors() {
        MarkupElement style = resources.addChild(new MarkupElement("Style"));
        style.setKey("Accent");
        MarkupElement triggers = collection(style, "Triggers");
        triggers.addChild(trigger("IsMouseOver", "True", "Background", "Red"));

        transform();

        assertThat(resources.children()).containsExactly(style);
        assertThat(triggers.children()).hasSize(1);
        assertThat(context.conversions().size()).isZero();
        assertThat(diagnostics.byCode(DiagnosticCodes.STYLE_KEYED_TRIGGERS)).hasSize(1);
    }

    @Test
    void controlThemeTriggersBecomeNestedStyles() {
        MarkupElement style = resources.addChild(style("Button"));
        style.setKey("Primary");
        style.addChild(setter("Background", "Navy"));
        collection(style, "Triggers").addChild(trigger("IsPressed", "True", "Background", "Black"));

        transform();

        assertThat(resources.children()).containsExactly(style);
        assertThat(style.typeName()).isEqualTo("ControlTheme");
        assertThat(style.literal("TargetType")).contains("Button");
        assertThat(style.children()).extracting(MarkupElement::typeName).containsExactly("Setter", "Style");
        MarkupElement nested = style.children().get(1);
        assertThat(nested.literal("Selector")).contains("^:pressed");
        assertThat(nested.children()).singleElement()
                .satisfies(setter -> assertThat(setter.literal("Value")).contains("Black"));
        assertThat(style.hasProperty("Triggers")).isFalse();
    }

    private void transform() {
        engine.transform(new UnifiedDocument("styles.xaml", window), context);
    }

    private static MarkupElement collection(MarkupElement owner, String property) {
        MarkupElement collection = new MarkupElement(owner.typeName() + "." + property);
        owner.addProperty(MarkupProperty.element(property, collection));
        return collection;
    }

    private static MarkupElement style(String targetType) {
        MarkupElement style = new MarkupElement("Style");
        style.setProperty("TargetType", targetType);
        return style;
    }

    private static MarkupElement trigger(String property, String value, String setterProperty, String setterValue) {
        MarkupElement trigger = new MarkupElement("Trigger");
        trigger.setProperty("Property", property);
        trigger.setProperty("Value", value);
        trigger.addChild(setter(setterProperty, setterValue));
        return trigger;
    }

    private static MarkupElement condition(String property, String value) {
        MarkupElement condition = new MarkupElement("Condition");
        condition.setProperty("Property", property);
        condition.setProperty("Value", value);
        return condition;
    }

    private static MarkupElement setter(String property, String value) {
        MarkupElement setter = new MarkupElement("Setter");
        setter.setProperty("Property", property);
        setter.setProperty("Value", value);
        return setter;
    }
}
