package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.ElementRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.NodeKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Multi-bindings are written as elements with nested {@code Binding} elements. The same parameters
 * as for {@link BindingRule} are dropped from all of them; converters need a manual check since the
 * converter interface differs.
 */
public class MultiBindingRule extends ElementRule {

    @Override
    public String name() {
        return "TransformMultiBinding";
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return element.isType("MultiBinding");
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement multiBinding, TransformationContext context) {
        List<MarkupElement> bindings = new ArrayList<>(multiBinding.children("Binding"));
        multiBinding.propertyContent("Bindings").stream().filter(item -> item.isType("Binding")).forEach(bindings::add);

        dropParameters(multiBinding, context);
        for (MarkupElement binding : bindings) {
            dropParameters(binding, context);
            if (context.options().compiledBindings()) {
                binding.setTypeName("CompiledBinding");
                context.recordTransformation(name(), NodeKind.ELEMENT, "Binding -> CompiledBinding");
            }
        }
        multiBinding.property("Converter").ifPresent(converter ->
                context.warn(multiBinding, DiagnosticCodes.MULTIBINDING_CONVERTER,
                        "MultiBinding " + converter + " must implement the target dialect's IMultiValueConverter"));
        multiBinding.literal("StringFormat").ifPresent(format ->
                context.recordTransformation(name(), NodeKind.ELEMENT, "StringFormat kept: " + format));
        return Optional.of(multiBinding);
    }

    private void dropParameters(MarkupElement binding, TransformationContext context) {
        for (String parameter : BindingRule.DROPPED) {
            binding.removeProperty(parameter).ifPresent(ignored ->
                    context.recordTransformation(name(), NodeKind.ELEMENT, binding.typeName() + ": removed " + parameter));
        }
    }
}
