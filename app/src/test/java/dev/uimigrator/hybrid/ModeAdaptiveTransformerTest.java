package dev.uimigrator.hybrid;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.DiagnosticCollector;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TypeResolutionException;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.NamespaceTypeResolver;
import dev.uimigrator.model.ResolvedType;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.model.XamlNamespaces;
import dev.uimigrator.xml.XamlDocumentReader;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class ModeAdaptiveTransformerTest {

    private static final String MARKUP = "<Window xmlns=\"" + XamlNamespaces.WPF_PRESENTATION + "\">"
            + "<StackPanel><Button/><Label/></StackPanel></Window>";

    private final DiagnosticCollector diagnostics = new DiagnosticCollector();
    private final TransformationContext context = new TransformationContext("adaptive.xaml", diagnostics);

    @Test
    void hybridWithoutLayersWarnsAndUsesStructuralPath() {
        MarkupElement root = new MarkupElement("Window");
        root.addChild(new MarkupElement("Button"));
        RecordingTransformer transformer = new RecordingTransformer(TransformationStrategy.HYBRID);

        transformer.transform(new UnifiedDocument("adaptive.xaml", root), context);

        assertThat(diagnostics.byCode(DiagnosticCodes.MISSING_STRUCTURAL_LAYER)).hasSize(1);
        assertThat(diagnostics.byCode(DiagnosticCodes.MISSING_TYPED_LAYER)).hasSize(1);
        assertThat(transformer.calls).containsExactly("structural:Button");
    }

    @Test
    void hybridTakesTypedPathOnlyWhereRequiredAndResolved() {
        UnifiedDocument document = new XamlDocumentReader().read(MARKUP, "adaptive.xaml");
        document.attachTypedLayer(NamespaceTypeResolver.wpfDefaults());
        RecordingTransformer transformer = new RecordingTransformer(TransformationStrategy.HYBRID);
        transformer.typedFor.add("Button");

        transformer.transform(document, context);

        assertThat(transformer.calls).containsExactly("typed:Button=System.Windows.Controls.Button", "structural:Label");
        assertThat(diagnostics.warningCount()).isZero();
    }

    @Test
    void hybridFallsBackWhenTypedViewIsUnavailable() {
        UnifiedDocument document = new XamlDocumentReader().read(MARKUP, "adaptive.xaml");
        RecordingTransformer transformer = new RecordingTransformer(TransformationStrategy.HYBRID);
        transformer.typedFor.add("Button");

        transformer.transform(document, context);

        assertThat(transformer.calls).containsExactly("structural:Button", "structural:Label");
        assertThat(diagnostics.byCode(DiagnosticCodes.TYPED_VIEW_UNAVAILABLE)).hasSize(1);
        assertThat(diagnostics.byCode(DiagnosticCodes.MISSING_TYPED_LAYER)).hasSize(1);
    }

    @Test
    void typedOnlyRequiresTheTypedLayer() {
        UnifiedDocument document = new XamlDocumentReader().read(MARKUP, "adaptive.xaml");
        RecordingTransformer transformer = new RecordingTransformer(TransformationStrategy.TYPED_ONLY);

        assertThatThrownBy(() -> transformer.transform(document, context))
                .isInstanceOf(MissingLayerException.class)
                .hasMessageContaining("typed layer");
        assertThat(transformer.calls).isEmpty();
    }

    @Test
    void typedOnlyRequiresResolvedTypes() {
        UnifiedDocument document = new XamlDocumentReader().read(MARKUP, "adaptive.xaml");
        document.attachTypedLayer(new NamespaceTypeResolver());
        RecordingTransformer transformer = new RecordingTransformer(TransformationStrategy.TYPED_ONLY);

        assertThatThrownBy(() -> transformer.transform(document, context))
                .isInstanceOf(MissingLayerException.class)
                .hasMessageContaining("no resolved type");
    }

    @Test
    void structuralOnlyRequiresTheStructuralLayer() {
        RecordingTransformer transformer = new RecordingTransformer(TransformationStrategy.STRUCTURAL_ONLY);

        assertThatThrownBy(() -> transformer.transform(new UnifiedDocument("adaptive.xaml", new MarkupElement("Button")), context))
                .isInstanceOf(MissingLayerException.class)
                .hasMessageContaining("structural layer");
    }

    @Test
    void typeResolutionFailureSkipsOnlyThatElement() {
        UnifiedDocument document = new XamlDocumentReader().read(MARKUP, "adaptive.xaml");
        RecordingTransformer transformer = new RecordingTransformer(TransformationStrategy.STRUCTURAL_ONLY);
        transformer.failFor.add("Button");

        transformer.transform(document, context);

        assertThat(transformer.calls).containsExactly("structural:Label");
        assertThat(diagnostics.byCode(DiagnosticCodes.TYPE_RESOLUTION_FAILED)).hasSize(1);
        assertThat(diagnostics.byCode(DiagnosticCodes.TRANSFORMER_COMPLETE)).singleElement()
                .satisfies(diagnostic -> assertThat(diagnostic.message()).contains("transformed 1 element(s)"));
    }

    @Test
    void validationFlagsElementsLeftWithoutTypeName() {
        UnifiedDocument document = new XamlDocumentReader().read(MARKUP, "adaptive.xaml");
        RecordingTransformer transformer = new RecordingTransformer(TransformationStrategy.HYBRID);
        transformer.blankFor.add("Label");

        transformer.transform(document, context);

        assertThat(diagnostics.byCode(DiagnosticCodes.VALIDATION_MISSING_TYPE)).hasSize(1);
        assertThat(diagnostics.byCode(DiagnosticCodes.VALIDATION_ISSUES)).hasSize(1);
    }

    private static final class RecordingTransformer extends ModeAdaptiveTransformer {

        private final List<String> calls = new ArrayList<>();
        private final List<String> typedFor = new ArrayList<>();
        private final List<String> failFor = new ArrayList<>();
        private final List<String> blankFor = new ArrayList<>();

        RecordingTransformer(TransformationStrategy strategy) {
            super(strategy);
        }

        @Override
        public String name() {
            return "Recording";
        }

        @Override
        protected boolean canTransform(MarkupElement element) {
            return element.isType("Button") || element.isType("Label");
        }

        @Override
        protected boolean requiresTypedView(MarkupElement element) {
            return typedFor.contains(element.typeName());
        }

        @Override
        protected void transformStructural(MarkupElement element, UnifiedDocument document, TransformationContext context) {
            if (failFor.contains(element.typeName())) {
                throw new TypeResolutionException("cannot resolve " + element.typeName());
            }
            calls.add("structural:" + element.typeName());
            if (blankFor.contains(element.typeName())) {
                element.setTypeName("");
            }
        }

        @Override
        protected void transformTyped(MarkupElement element, ResolvedType type, UnifiedDocument document,
                                      TransformationContext context) {
            calls.add("typed:" + element.typeName() + "=" + type.qualifiedName());
        }
    }
}
