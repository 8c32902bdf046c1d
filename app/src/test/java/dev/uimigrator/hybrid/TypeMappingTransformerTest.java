package dev.uimigrator.hybrid;

import static org.assertj.core.api.Assertions.assertThat;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.DiagnosticCollector;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TransformationOptions;
import dev.uimigrator.mapping.InMemoryMappingSource;
import dev.uimigrator.mapping.MappingDatabase;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.mapping.TypeMapping;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.NamespaceTypeResolver;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.model.XamlNamespaces;
import dev.uimigrator.xml.XamlDocumentReader;
import java.util.List;
import org.junit.jupiter.api.Test;

class TypeMappingTransformerTest {

    private static final String MARKUP = "<Window xmlns=\"" + XamlNamespaces.WPF_PRESENTATION + "\""
            + " xmlns:tk=\"clr-namespace:Extended.Toolkit\">"
            + "<StackPanel><Calendar/><tk:Calendar/><GroupBox/></StackPanel></Window>";

    private final MappingSource mappings = new InMemoryMappingSource(new MappingDatabase("1", List.of(
            new TypeMapping("System.Windows.Controls.Calendar", "Avalonia.Controls.Calendar", XamlNamespaces.AVALONIA),
            new TypeMapping("Extended.Toolkit.Calendar", "Avalonia.Controls.CalendarDatePicker", XamlNamespaces.AVALONIA),
            new TypeMapping("System.Windows.Controls.GroupBox", "Avalonia.Controls.HeaderedContentControl",
                    XamlNamespaces.AVALONIA, true, "Restyle the header")), List.of(), List.of()));

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final TransformationContext context = new TransformationContext("types.xaml",
            new TransformationOptions(true, true), mappings, diagnostics);

    @Test
    void resolvedTypesPickTheMatchingMapping() {
        UnifiedDocument document = read();
        document.attachTypedLayer(NamespaceTypeResolver.wpfDefaults());

        new TypeMappingTransformer(TransformationStrategy.HYBRID, mappings).transform(document, context);

        List<MarkupElement> panelChildren = panel(document).children();
        assertThat(panelChildren).extracting(MarkupElement::typeName)
                .containsExactly("Calendar", "CalendarDatePicker", "HeaderedContentControl");
        assertThat(panelChildren).allSatisfy(element -> assertThat(element.namespace()).contains(XamlNamespaces.AVALONIA));
        assertThat(diagnostics.byCode(DiagnosticCodes.TYPED_VIEW_UNAVAILABLE)).isEmpty();
    }

    @Test
    void ambiguousNamesFallBackToFirstMappingWithoutTypedView() {
        UnifiedDocument document = read();

        new TypeMappingTransformer(TransformationStrategy.HYBRID, mappings).transform(document, context);

        assertThat(panel(document).children()).extracting(MarkupElement::typeName)
                .containsExactly("Calendar", "Calendar", "HeaderedContentControl");
        assertThat(diagnostics.byCode(DiagnosticCodes.TYPED_VIEW_UNAVAILABLE)).hasSize(2);
    }

    @Test
    void structuralAnchorFollowsTheRename() {
        UnifiedDocument document = read();

        new TypeMappingTransformer(TransformationStrategy.STRUCTURAL_ONLY, mappings).transform(document, context);

        MarkupElement groupBox = panel(document).children().get(2);
        assertThat(groupBox.structuralAnchor()).hasValueSatisfying(anchor ->
                assertThat(anchor.getLocalName()).isEqualTo("HeaderedContentControl"));
    }

    @Test
    void manualReviewMappingsAreFlagged() {
        UnifiedDocument document = read();

        new TypeMappingTransformer(TransformationStrategy.STRUCTURAL_ONLY, mappings).transform(document, context);

        assertThat(diagnostics.byCode(DiagnosticCodes.TYPE_MANUAL_REVIEW)).singleElement()
                .satisfies(diagnostic -> assertThat(diagnostic.message()).contains("Restyle the header"));
        assertThat(context.statistics().countsByRule()).containsEntry("TypeMappingTransformer", 3);
    }

    private static UnifiedDocument read() {
        return new XamlDocumentReader().read(MARKUP, "types.xaml");
    }

    private static MarkupElement panel(UnifiedDocument document) {
        return document.root().orElseThrow().children().get(0);
    }
}
