package dev.uimigrator.hybrid;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.engine.TypeResolutionException;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.ResolvedType;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.pipeline.DocumentTransformer;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for stages that can work from the structural layer, the typed layer, or both.
 *
 * <ul>
 *   <li>{@link TransformationStrategy#STRUCTURAL_ONLY}: needs the structural layer and uses only
 *   {@link #transformStructural}.</li>
 *   <li>{@link TransformationStrategy#TYPED_ONLY}: needs the typed layer and a resolved type on every
 *   element it transforms; uses only {@link #transformTyped}.</li>
 *   <li>{@link TransformationStrategy#HYBRID}: structural by default. Elements for which
 *   {@link #requiresTypedView} holds take the typed path when their type is resolved, otherwise the
 *   structural one with a warning. Missing layers are warnings.</li>
 * </ul>
 *
 * A {@link TypeResolutionException} from either hook leaves that element unchanged and is reported as
 * a warning.
 */
public abstract class ModeAdaptiveTransformer implements DocumentTransformer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ModeAdaptiveTransformer.class);

    private final TransformationStrategy strategy;

    protected ModeAdaptiveTransformer(TransformationStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "strategy");
    }

    public TransformationStrategy strategy() {
        return strategy;
    }

    @Override
    public final UnifiedDocument transform(UnifiedDocument document, TransformationContext context) {
        context.report(Severity.INFO, DiagnosticCodes.TRANSFORMER_START, name() + " started with strategy " + strategy);
        validateLayers(document, context);
        beforeTransform(document, context);

        int transformed = 0;
        for (MarkupElement element : document.elements()) {
            if (!canTransform(element)) {
                continue;
            }
            try {
                transformElement(element, document, context);
                transformed++;
            } catch (TypeResolutionException ex) {
                context.warn(element, DiagnosticCodes.TYPE_RESOLUTION_FAILED, name() + ": " + ex.getMessage());
            }
        }

        if (strategy != TransformationStrategy.STRUCTURAL_ONLY) {
            validateResult(document, context);
        }
        context.report(Severity.INFO, DiagnosticCodes.TRANSFORMER_COMPLETE, name() + " transformed " + transformed + " element(s)");
        LOGGER.debug("{} transformed {} element(s) in {}", name(), transformed, document.sourceId());
        return document;
    }

    private void validateLayers(UnifiedDocument document, TransformationContext context) {
        boolean structural = document.structuralLayer().isPresent();
        boolean typed = document.typedLayer().isPresent();
        switch (strategy) {
            case STRUCTURAL_ONLY:
                if (!structural) {
                    throw new MissingLayerException(name() + " requires the structural layer of " + document.sourceId());
                }
                break;
            case TYPED_ONLY:
                if (!typed) {
                    throw new MissingLayerException(name() + " requires the typed layer of " + document.sourceId());
                }
                break;
            default:
                if (!structural) {
                    context.report(Severity.WARNING, DiagnosticCodes.MISSING_STRUCTURAL_LAYER,
                            name() + ": document has no structural layer; continuing on the element tree only");
                }
                if (!typed) {
                    context.report(Severity.WARNING, DiagnosticCodes.MISSING_TYPED_LAYER,
                            name() + ": document has no typed layer; typed rewrites are skipped");
                }
        }
    }

    private void transformElement(MarkupElement element, UnifiedDocument document, TransformationContext context) {
        Optional<ResolvedType> type = document.typedLayer().isPresent() ? element.resolvedType() : Optional.empty();
        switch (strategy) {
            case STRUCTURAL_ONLY:
                transformStructural(element, document, context);
                break;
            case TYPED_ONLY:
                if (type.isEmpty()) {
                    throw new MissingLayerException(name() + ": no resolved type for " + element
                            + element.location().map(location -> " at " + location).orElse(""));
                }
                transformTyped(element, type.get(), document, context);
                break;
            default:
                if (!requiresTypedView(element)) {
                    transformStructural(element, document, context);
                } else if (type.isPresent()) {
                    transformTyped(element, type.get(), document, context);
                } else {
                    context.warn(element, DiagnosticCodes.TYPED_VIEW_UNAVAILABLE,
                            name() + ": typed view unavailable for " + element + "; using structural rewrite");
                    transformStructural(element, document, context);
                }
        }
    }

    private void validateResult(UnifiedDocument document, TransformationContext context) {
        int issues = 0;
        for (MarkupElement element : document.elements()) {
            if (!element.hasTypeName()) {
                context.warn(element, DiagnosticCodes.VALIDATION_MISSING_TYPE, name() + " left an element without a type name");
                issues++;
            }
            if (strategy == TransformationStrategy.TYPED_ONLY && element.structuralAnchor().isEmpty()) {
                context.warn(element, DiagnosticCodes.VALIDATION_MISSING_STRUCTURAL_ANCHOR,
                        name() + " left " + element + " without a structural anchor");
                issues++;
            }
        }
        if (issues > 0) {
            context.report(Severity.WARNING, DiagnosticCodes.VALIDATION_ISSUES, name() + " validation found " + issues + " issue(s)");
        }
    }

    /**
     * Called once per run after layer validation.
     */
    protected void beforeTransform(UnifiedDocument document, TransformationContext context) {
    }

    protected abstract boolean canTransform(MarkupElement element);

    protected boolean requiresTypedView(MarkupElement element) {
        return false;
    }

    protected abstract void transformStructural(MarkupElement element, UnifiedDocument document, TransformationContext context);

    protected void transformTyped(MarkupElement element, ResolvedType type, UnifiedDocument document, TransformationContext context) {
        throw new UnsupportedOperationException(name() + " has no typed rewrite");
    }
}
