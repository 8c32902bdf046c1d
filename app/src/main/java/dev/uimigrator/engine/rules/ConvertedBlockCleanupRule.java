package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.PostProcessingPhase;
import dev.uimigrator.engine.PostProcessingRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * Removes the triggers recorded as converted, then any {@code *.Triggers} collection they left empty.
 * A trigger held directly by a {@code Triggers} property takes the property with it.
 */
public class ConvertedBlockCleanupRule extends PostProcessingRule {

    @Override
    public String name() {
        return "RemoveConvertedBlocks";
    }

    @Override
    public int priority() {
        return 1;
    }

    @Override
    public PostProcessingPhase phase() {
        return PostProcessingPhase.CLEANUP;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return PseudoclassConditions.isConditionalBlock(element)
                || element.propertyElementName().filter("Triggers"::equals).isPresent();
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement element, TransformationContext context) {
        if (context.conversions().isConverted(element)) {
            context.recordTransformation(name(), NodeKind.ELEMENT, "removed converted " + element.typeName());
            return Optional.empty();
        }
        if (context.conversions().isWrapper(element) && element.children().isEmpty() && element.properties().isEmpty()) {
            context.recordTransformation(name(), NodeKind.ELEMENT, "removed empty " + element.typeName());
            return Optional.empty();
        }
        return Optional.of(element);
    }
}
