package dev.uimigrator.engine.rules;

import static org.assertj.core.api.Assertions.assertThat;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.DiagnosticCollector;
import dev.uimigrator.engine.RuleRegistry;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TransformationEngine;
import dev.uimigrator.engine.TransformationOptions;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupExtension;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.xml.MarkupExtensionParser;
import org.junit.jupiter.api.Test;

class MarkupExtensionRulesTest {

    private final MarkupExtensionParser parser = new MarkupExtensionParser();
    private final DiagnosticCollector diagnostics = new DiagnosticCollector();

    @Test
    void elementNameBindingUsesShorthand() {
        assertThat(transform("{Binding ElementName=searchBox, Path=Text}")).isEqualTo("{Binding #searchBox.Text}");
        assertThat(transform("{Binding ElementName=searchBox}")).isEqualTo("{Binding #searchBox}");
    }

    @Test
    void elementNameBindingKeptWhenShorthandDisabled() {
        TransformationContext context = new TransformationContext("bindings.xaml", new TransformationOptions(false, true),
                MappingSource.empty(), diagnostics);

        assertThat(transform("{Binding ElementName=searchBox, Path=Text}", context))
                .isEqualTo("{Binding ElementName=searchBox, Path=Text}");
    }

    @Test
    void findAncestorBecomesParentSelector() {
        assertThat(transform("{Binding DataContext.Title, RelativeSource={RelativeSource FindAncestor, AncestorType={x:Type Window}}}"))
                .isEqualTo("{Binding $parent[Window].DataContext.Title}");
        assertThat(transform("{Binding Path=Tag, RelativeSource={RelativeSource Mode=FindAncestor, AncestorType=ListBox, AncestorLevel=2}}"))
                .isEqualTo("{Binding $parent[ListBox;1].Tag}");
    }

    @Test
    void selfAndTemplatedParentModes() {
        assertThat(transform("{Binding ActualWidth, RelativeSource={RelativeSource Self}}"))
                .isEqualTo("{Binding $self.ActualWidth}");
        assertThat(transform("{Binding Foreground, RelativeSource={RelativeSource TemplatedParent}}"))
                .isEqualTo("{Binding $parent.Foreground}");
        assertThat(diagnostics.byCode(DiagnosticCodes.BINDING_TEMPLATED_PARENT)).hasSize(1);
    }

    @Test
    void unknownRelativeSourceModeIsReported() {
        String original = "{Binding RelativeSource={RelativeSource PreviousData}}";

        assertThat(transform(original)).isEqualTo(original);
        assertThat(diagnostics.byCode(DiagnosticCodes.BINDING_RELATIVE_SOURCE_UNSUPPORTED)).hasSize(1);
    }

    @Test
    void unsupportedBindingParametersAreDropped() {
        assertThat(transform("{Binding Name, UpdateSourceTrigger=PropertyChanged, ValidatesOnDataErrors=True}"))
                .isEqualTo("{Binding Name, EnableDataValidation=True}");
        assertThat(transform("{Binding Name, IsAsync=True, ValidatesOnExceptions=False}"))
                .isEqualTo("{Binding Name}");
    }

    @Test
    void nestedBindingsAreVisited() {
        assertThat(transform("{MultiBinding Converter={StaticResource Join}, FallbackValue={Binding ElementName=box}}"))
                .isEqualTo("{MultiBinding Converter={StaticResource Join}, FallbackValue={Binding #box}}");
    }

    @Test
    void markupLanguageExtensionsAreValidated() {
        transform("{x:Array Type=sys:String}");
        transform("{x:Static}");
        transform("{x:Type}");
        transform("{x:Static SystemColors.ControlBrush}");

        assertThat(diagnostics.byCode(DiagnosticCodes.XARRAY_NOT_SUPPORTED)).hasSize(1);
        assertThat(diagnostics.byCode(DiagnosticCodes.XSTATIC_NO_MEMBER)).hasSize(1);
        assertThat(diagnostics.byCode(DiagnosticCodes.XTYPE_NO_TYPE)).hasSize(1);
    }

    @Test
    void compiledBindingsAreOptIn() {
        TransformationContext compiled = new TransformationContext("bindings.xaml", new TransformationOptions(true, true, true),
                MappingSource.empty(), diagnostics);

        assertThat(transform("{Binding Name, UpdateSourceTrigger=PropertyChanged}", compiled)).isEqualTo("{CompiledBinding Name}");
        assertThat(transform("{Binding Name}")).isEqualTo("{Binding Name}");
    }

    private String transform(String markup) {
        return transform(markup, new TransformationContext("bindings.xaml", diagnostics));
    }

    private String transform(String markup, TransformationContext context) {
        MarkupElement element = new MarkupElement("TextBlock");
        MarkupProperty property = element.addProperty(MarkupProperty.extension("Text", parser.parse(markup)));
        RuleRegistry registry = new RuleRegistry()
                .register(new XArrayRule())
                .register(new XStaticRule())
                .register(new XTypeRule())
                .register(new XNullRule())
                .register(new BindingRule())
                .register(new RelativeSourceBindingRule())
                .register(new ElementNameBindingRule())
                .register(new CompiledBindingRule());
        new TransformationEngine(registry).transform(new UnifiedDocument("bindings.xaml", element), context);
        return property.markupExtension().map(MarkupExtension::toMarkup).orElseThrow();
    }
}
