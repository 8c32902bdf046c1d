package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.ElementRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.NodeKind;
import java.util.Optional;

/**
 * Data templates: {@code DataType} becomes a plain type name and hierarchical templates become tree
 * data templates.
 */
public class DataTemplateRule extends ElementRule {

    @Override
    public String name() {
        return "TransformDataTemplate";
    }

    @Override
    public int priority() {
        return 70;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return element.isType("DataTemplate") || element.isType("HierarchicalDataTemplate");
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement template, TransformationContext context) {
        Selectors.simplifyTypeReference(template, "DataType").ifPresent(type ->
                context.recordTransformation(name(), NodeKind.PROPERTY, "DataType={x:Type " + type + "} -> " + type));
        if (template.isType("HierarchicalDataTemplate")) {
            template.setTypeName("TreeDataTemplate");
            template.renamePropertyElements("HierarchicalDataTemplate", "TreeDataTemplate");
            context.recordTransformation(name(), NodeKind.ELEMENT, "HierarchicalDataTemplate -> TreeDataTemplate");
            if (template.hasProperty("ItemTemplate") || template.hasProperty("ItemContainerStyle")) {
                context.warn(template, DiagnosticCodes.HIERARCHICAL_DATA_TEMPLATE,
                        "TreeDataTemplate has no ItemTemplate or ItemContainerStyle; move them to the tree view");
            }
        }
        if (!template.propertyContent("Triggers").isEmpty()) {
            context.warn(template, DiagnosticCodes.DATA_TEMPLATE_TRIGGERS,
                    "DataTemplate.Triggers were left in place; use styles or bindings on the template content");
        }
        return Optional.of(template);
    }
}
