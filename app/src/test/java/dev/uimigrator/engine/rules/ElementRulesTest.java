package dev.uimigrator.engine.rules;

import static org.assertj.core.api.Assertions.assertThat;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.DiagnosticCollector;
import dev.uimigrator.engine.RuleRegistry;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TransformationEngine;
import dev.uimigrator.engine.TransformationRule;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.model.XamlNamespaces;
import dev.uimigrator.xml.MarkupExtensionParser;
import org.junit.jupiter.api.Test;

class ElementRulesTest {

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final TransformationContext context = new TransformationContext("elements.xaml", diagnostics);

    @Test
    void pageBecomesUserControlWithoutNavigationProperties() {
        MarkupElement page = new MarkupElement("Page", XamlNamespaces.WPF_PRESENTATION);
        page.setProperty("KeepAlive", "True");
        page.setProperty("Title", "Settings");

        run(page, new PageRule());

        assertThat(page.typeName()).isEqualTo("UserControl");
        assertThat(page.namespace()).contains(XamlNamespaces.AVALONIA);
        assertThat(page.properties()).extracting(MarkupProperty::name).containsExactly("Title");
        assertThat(diagnostics.byCode(DiagnosticCodes.PAGE_NAVIGATION_REMOVED)).hasSize(1);
    }

    @Test
    void propertyElementsFollowTheRenamedOwner() {
        MarkupElement page = new MarkupElement("Page");
        MarkupElement resources = new MarkupElement("Page.Resources");
        resources.addChild(new MarkupElement("SolidColorBrush"));
        resources.addChild(new MarkupElement("Style"));
        page.addProperty(MarkupProperty.element("Resources", resources));
        page.addChild(new MarkupElement("PageHeader"));

        run(page, new PageRule());

        assertThat(resources.typeName()).isEqualTo("UserControl.Resources");
        assertThat(page.children()).extracting(MarkupElement::typeName).containsExactly("PageHeader");
    }

    @Test
    void listViewLosesItsView() {
        MarkupElement listView = new MarkupElement("ListView");
        listView.addProperty(MarkupProperty.element("View", new MarkupElement("GridView")));
        listView.addChild(new MarkupElement("ListViewItem"));

        run(listView, new ListViewRule(), new TypeRenameRule("ListViewItem", "ListBoxItem"));

        assertThat(listView.typeName()).isEqualTo("ListBox");
        assertThat(listView.children()).extracting(MarkupElement::typeName).containsExactly("ListBoxItem");
        assertThat(listView.hasProperty("View")).isFalse();
        assertThat(diagnostics.byCode(DiagnosticCodes.LISTVIEW_VIEW_REMOVED)).hasSize(1);
    }

    @Test
    void userTypesKeepTheirName() {
        MarkupElement custom = new MarkupElement("Page", "clr-namespace:MyApp.Views");

        run(custom, new PageRule());

        assertThat(custom.typeName()).isEqualTo("Page");
    }

    @Test
    void unkeyedStyleTargetTypeBecomesSelector() {
        MarkupElement resources = new MarkupElement("UserControl.Resources");
        MarkupElement plain = resources.addChild(new MarkupElement("Style"));
        plain.setProperty("TargetType", "local:FancyButton");
        MarkupElement typed = resources.addChild(new MarkupElement("Style"));
        typed.addProperty(MarkupProperty.extension("TargetType", new MarkupExtensionParser().parse("{x:Type TextBox}")));
        MarkupElement keyed = resources.addChild(new MarkupElement("Style"));
        keyed.setKey("Accent");
        keyed.setProperty("TargetType", "Button");

        run(resources, new StyleSelectorRule());

        assertThat(plain.literal("Selector")).contains("local|FancyButton");
        assertThat(typed.literal("Selector")).contains("TextBox");
        assertThat(keyed.hasProperty("TargetType")).isTrue();
        assertThat(keyed.hasProperty("Selector")).isFalse();
    }

    @Test
    void eventTriggersAreFlagged() {
        MarkupElement button = new MarkupElement("Button");
        button.addProperty(MarkupProperty.element("Triggers", new MarkupElement("EventTrigger")));

        run(button, new EventTriggerRule());

        assertThat(diagnostics.byCode(DiagnosticCodes.EVENT_TRIGGER_UNSUPPORTED)).hasSize(1);
    }

    @Test
    void defaultRulesCoverTheBuiltInSet() {
        RuleRegistry registry = DefaultRules.create();

        assertThat(registry.rules()).extracting(TransformationRule::name)
                .contains("RenamePageToUserControl", "RenameListViewToListBox", "ConvertStyleTargetType",
                        "VisibilityToIsVisible", "TransformBinding", "RestructureConditionalBlocks", "RemoveConvertedBlocks",
                        "ConvertStyleToControlTheme", "ConvertStyleReferenceToTheme", "TransformControlTemplate",
                        "TransformDataTemplate", "TransformMultiBinding", "UseCompiledBinding", "NormalizeThickness");
    }

    private void run(MarkupElement root, TransformationRule... rules) {
        RuleRegistry registry = new RuleRegistry();
        for (TransformationRule rule : rules) {
            registry.register(rule);
        }
        new TransformationEngine(registry).transform(new UnifiedDocument("elements.xaml", root), context);
    }
}
