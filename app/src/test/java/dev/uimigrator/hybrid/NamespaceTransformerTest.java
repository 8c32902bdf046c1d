package dev.uimigrator.hybrid;

import static org.assertj.core.api.Assertions.assertThat;

import dev.uimigrator.diagnostics.DiagnosticCollector;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TransformationOptions;
import dev.uimigrator.mapping.InMemoryMappingSource;
import dev.uimigrator.mapping.MappingDatabase;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.mapping.NamespaceMapping;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.model.XamlNamespaces;
import dev.uimigrator.xml.XamlDocumentReader;
import java.util.List;
import org.junit.jupiter.api.Test;

class NamespaceTransformerTest {

    private final MappingSource mappings = new InMemoryMappingSource(new MappingDatabase("1", List.of(), List.of(),
            List.of(new NamespaceMapping(XamlNamespaces.WPF_PRESENTATION, XamlNamespaces.AVALONIA, "presentation"))));

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final TransformationContext context = new TransformationContext("ns.xaml",
            new TransformationOptions(true, true), mappings, diagnostics);

    @Test
    void remapsPrefixTableElementsAndDom() {
        UnifiedDocument document = new XamlDocumentReader().read("<Window xmlns=\"" + XamlNamespaces.WPF_PRESENTATION + "\""
                + " xmlns:local=\"clr-namespace:MyApp\"><local:Gauge/><Button/></Window>", "ns.xaml");

        new NamespaceTransformer(TransformationStrategy.HYBRID, mappings).transform(document, context);

        assertThat(document.namespaces()).containsEntry("", XamlNamespaces.AVALONIA)
                .containsEntry("local", "clr-namespace:MyApp");
        MarkupElement root = document.root().orElseThrow();
        assertThat(root.namespace()).contains(XamlNamespaces.AVALONIA);
        assertThat(root.children()).extracting(element -> element.namespace().orElseThrow())
                .containsExactly("clr-namespace:MyApp", XamlNamespaces.AVALONIA);
        assertThat(root.structuralAnchor()).hasValueSatisfying(anchor ->
                assertThat(anchor.getNamespaceURI()).isEqualTo(XamlNamespaces.AVALONIA));
        assertThat(context.statistics().countsByRule()).containsEntry("NamespaceTransformer", 3);
    }

    @Test
    void unmappedNamespacesAreLeftAlone() {
        UnifiedDocument document = new UnifiedDocument("ns.xaml", new MarkupElement("Gauge", "clr-namespace:MyApp"));

        new NamespaceTransformer(TransformationStrategy.HYBRID, mappings).transform(document, context);

        assertThat(document.root().orElseThrow().namespace()).contains("clr-namespace:MyApp");
        assertThat(context.statistics().total()).isZero();
    }
}
