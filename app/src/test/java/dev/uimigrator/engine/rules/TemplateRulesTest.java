package dev.uimigrator.engine.rules;

import static org.assertj.core.api.Assertions.assertThat;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.DiagnosticCollector;
import dev.uimigrator.engine.RuleRegistry;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TransformationEngine;
import dev.uimigrator.engine.TransformationOptions;
import dev.uimigrator.engine.TransformationRule;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.xml.MarkupExtensionParser;
import org.junit.jupiter.api.Test;

class TemplateRulesTest {

    private final MarkupExtensionParser parser = new MarkupExtensionParser();
    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private TransformationContext context = new TransformationContext("templates.xaml", diagnostics);

    @Test
    void keyedStyleBecomesControlTheme() {
        MarkupElement window = new MarkupElement("Window");
        MarkupElement resources = collection(window, "Resources");
        MarkupElement style = resources.addChild(new MarkupElement("Style"));
        style.setKey("Primary");
        style.addProperty(MarkupProperty.extension("TargetType", parser.parse("{x:Type Button}")));
        MarkupElement setters = collection(style, "Setters");
        setters.addChild(new MarkupElement("Setter"));

        run(window, new ControlThemeRule(), new StyleSelectorRule());

        assertThat(style.typeName()).isEqualTo("ControlTheme");
        assertThat(style.key()).contains("Primary");
        assertThat(style.literal("TargetType")).contains("Button");
        assertThat(style.hasProperty("Selector")).isFalse();
        assertThat(setters.typeName()).isEqualTo("ControlTheme.Setters");
        assertThat(context.statistics().countsByRule()).containsEntry("ConvertStyleToControlTheme", 1);
    }

    @Test
    void templatedStyleIsKeyedByItsType() {
        MarkupElement style = new MarkupElement("Style");
        style.setProperty("TargetType", "ToggleButton");
        MarkupElement setter = style.addChild(new MarkupElement("Setter"));
        setter.setProperty("Property", "Template");
        setter.addProperty(MarkupProperty.element("Value", new MarkupElement("ControlTemplate")));

        run(style, new ControlThemeRule(), new StyleSelectorRule());

        assertThat(style.typeName()).isEqualTo("ControlTheme");
        assertThat(style.key()).contains("{x:Type ToggleButton}");
    }

    @Test
    void plainStyleIsLeftToSelectors() {
        MarkupElement style = new MarkupElement("Style");
        style.setProperty("TargetType", "Button");
        MarkupElement setter = style.addChild(new MarkupElement("Setter"));
        setter.setProperty("Property", "Background");
        setter.setProperty("Value", "Red");

        run(style, new ControlThemeRule(), new StyleSelectorRule());

        assertThat(style.typeName()).isEqualTo("Style");
        assertThat(style.literal("Selector")).contains("Button");
    }

    @Test
    void keyedStyleWithoutTargetTypeStaysAStyle() {
        MarkupElement style = new MarkupElement("Style");
        style.setKey("Loose");

        run(style, new ControlThemeRule());

        assertThat(style.typeName()).isEqualTo("Style");
        assertThat(diagnostics.byCode(DiagnosticCodes.STYLE_KEYED)).hasSize(1);
    }

    @Test
    void styleReferenceToConvertedThemeBecomesThemeReference() {
        MarkupElement window = new MarkupElement("Window");
        MarkupElement resources = collection(window, "Resources");
        MarkupElement style = resources.addChild(new MarkupElement("Style"));
        style.setKey("Primary");
        style.setProperty("TargetType", "Button");
        MarkupElement button = window.addChild(new MarkupElement("Button"));
        MarkupProperty reference = button.addProperty(MarkupProperty.extension("Style", parser.parse("{StaticResource Primary}")));
        MarkupElement label = window.addChild(new MarkupElement("Label"));
        label.addProperty(MarkupProperty.extension("Style", parser.parse("{StaticResource FromDictionary}")));

        run(window, new ControlThemeRule(), new ThemeReferenceRule());

        assertThat(reference.name()).isEqualTo("Theme");
        assertThat(reference.markupExtension().map(MarkupExtension::toMarkup)).contains("{StaticResource Primary}");
        assertThat(label.hasProperty("Style")).isTrue();
        assertThat(diagnostics.byCode(DiagnosticCodes.THEME_REFERENCE_EXTERNAL)).singleElement()
                .satisfies(diagnostic -> assertThat(diagnostic.message()).contains("FromDictionary"));
    }

    @Test
    void contentPresentersGetTemplateBindings() {
        MarkupElement template = new MarkupElement("ControlTemplate");
        template.addProperty(MarkupProperty.extension("TargetType", parser.parse("{x:Type Expander}")));
        MarkupElement border = template.addChild(new MarkupElement("Border"));
        MarkupElement body = border.addChild(new MarkupElement("ContentPresenter"));
        MarkupElement header = border.addChild(new MarkupElement("ContentPresenter"));
        header.setProperty("ContentSource", "Header");
        MarkupElement fixed = border.addChild(new MarkupElement("ContentPresenter"));
        fixed.setProperty("Content", "Static");

        run(template, new ControlTemplateRule());

        assertThat(template.literal("TargetType")).contains("Expander");
        assertThat(body.property("Content").flatMap(MarkupProperty::markupExtension).map(MarkupExtension::toMarkup))
                .contains("{TemplateBinding Content}");
        assertThat(header.property("Content").flatMap(MarkupProperty::markupExtension).map(MarkupExtension::toMarkup))
                .contains("{TemplateBinding Header}");
        assertThat(header.hasProperty("ContentSource")).isFalse();
        assertThat(fixed.literal("Content")).contains("Static");
    }

    @Test
    void controlTemplateProblemsAreFlagged() {
        MarkupElement template = new MarkupElement("ControlTemplate");
        template.addProperty(MarkupProperty.element("Triggers", new MarkupElement("Trigger")));

        run(template, new ControlTemplateRule());

        assertThat(diagnostics.byCode(DiagnosticCodes.CONTROL_TEMPLATE_NO_TARGET_TYPE)).hasSize(1);
        assertThat(diagnostics.byCode(DiagnosticCodes.CONTROL_TEMPLATE_TRIGGERS)).hasSize(1);
    }

    @Test
    void hierarchicalTemplateBecomesTreeDataTemplate() {
        MarkupElement template = new MarkupElement("HierarchicalDataTemplate");
        template.addProperty(MarkupProperty.extension("DataType", parser.parse("{x:Type local:Folder}")));
        template.addProperty(MarkupProperty.extension("ItemsSource", parser.parse("{Binding Children}")));
        MarkupElement itemTemplate = new MarkupElement("HierarchicalDataTemplate.ItemTemplate");
        template.addProperty(MarkupProperty.element("ItemTemplate", itemTemplate));

        run(template, new DataTemplateRule());

        assertThat(template.typeName()).isEqualTo("TreeDataTemplate");
        assertThat(template.literal("DataType")).contains("local:Folder");
        assertThat(itemTemplate.typeName()).isEqualTo("TreeDataTemplate.ItemTemplate");
        assertThat(diagnostics.byCode(DiagnosticCodes.HIERARCHICAL_DATA_TEMPLATE)).hasSize(1);
    }

    @Test
    void dataTemplateTriggersAreFlagged() {
        MarkupElement template = new MarkupElement("DataTemplate");
        template.setProperty("DataType", "Person");
        template.addProperty(MarkupProperty.element("Triggers", new MarkupElement("DataTrigger")));

        run(template, new DataTemplateRule());

        assertThat(template.typeName()).isEqualTo("DataTemplate");
        assertThat(template.literal("DataType")).contains("Person");
        assertThat(diagnostics.byCode(DiagnosticCodes.DATA_TEMPLATE_TRIGGERS)).hasSize(1);
    }

    @Test
    void multiBindingDropsUnsupportedParameters() {
        MarkupElement multi = new MarkupElement("MultiBinding");
        multi.setProperty("StringFormat", "{}{0} {1}");
        multi.setProperty("UpdateSourceTrigger", "PropertyChanged");
        multi.addProperty(MarkupProperty.extension("Converter", parser.parse("{StaticResource FullName}")));
        MarkupElement first = multi.addChild(binding("First"));
        first.setProperty("IsAsync", "True");
        MarkupElement last = multi.addChild(binding("Last"));

        run(multi, new MultiBindingRule());

        assertThat(multi.hasProperty("UpdateSourceTrigger")).isFalse();
        assertThat(multi.literal("StringFormat")).contains("{}{0} {1}");
        assertThat(first.hasProperty("IsAsync")).isFalse();
        assertThat(first.typeName()).isEqualTo("Binding");
        assertThat(last.literal("Path")).contains("Last");
        assertThat(diagnostics.byCode(DiagnosticCodes.MULTIBINDING_CONVERTER)).singleElement()
                .satisfies(diagnostic -> assertThat(diagnostic.message()).contains("IMultiValueConverter"));
    }

    @Test
    void multiBindingChildrenBecomeCompiledWhenEnabled() {
        context = new TransformationContext("templates.xaml", new TransformationOptions(true, true, true),
                MappingSource.empty(), diagnostics);
        MarkupElement multi = new MarkupElement("MultiBinding");
        MarkupElement bindings = collection(multi, "Bindings");
        MarkupElement first = bindings.addChild(binding("First"));
        MarkupElement last = bindings.addChild(binding("Last"));

        run(multi, new MultiBindingRule());

        assertThat(first.typeName()).isEqualTo("CompiledBinding");
        assertThat(last.typeName()).isEqualTo("CompiledBinding");
        assertThat(diagnostics.byCode(DiagnosticCodes.MULTIBINDING_CONVERTER)).isEmpty();
    }

    private void run(MarkupElement root, TransformationRule... rules) {
        RuleRegistry registry = new RuleRegistry();
        for (TransformationRule rule : rules) {
            registry.register(rule);
        }
        new TransformationEngine(registry).transform(new UnifiedDocument("templates.xaml", root), context);
    }

    private static MarkupElement collection(MarkupElement owner, String property) {
        MarkupElement collection = new MarkupElement(owner.typeName() + "." + property);
        owner.addProperty(MarkupProperty.element(property, collection));
        return collection;
    }

    private static MarkupElement binding(String path) {
        MarkupElement binding = new MarkupElement("Binding");
        binding.setProperty("Path", path);
        return binding;
    }
}
