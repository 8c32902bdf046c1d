package dev.uimigrator.engine.rules;

import dev.uimigrator.engine.RuleRegistry;

/**
 * The built-in rule set used by the migration pipeline.
 */
public final class DefaultRules {

    private DefaultRules() {
    }

    public static RuleRegistry create() {
        RuleRegistry registry = new RuleRegistry();

        registry.register(new TypeRenameRule("Window", "Window"));
        registry.register(new TypeRenameRule("UserControl", "UserControl"));
        registry.register(new PageRule());
        registry.register(new ListViewRule());
        registry.register(new TypeRenameRule("ListViewItem", "ListBoxItem"));
        registry.register(new WindowRule());
        registry.register(new ControlThemeRule());
        registry.register(new StyleSelectorRule());
        registry.register(new ControlTemplateRule());
        registry.register(new DataTemplateRule());
        registry.register(new MultiBindingRule());
        registry.register(new EventTriggerRule());

        registry.register(new VisibilityPropertyRule());
        registry.register(new PropertyRenameRule("ToolTipService.ToolTip", "ToolTip.Tip"));
        registry.register(new PropertyRenameRule("ToolTipService.Placement", "ToolTip.Placement"));
        registry.register(new CursorPropertyRule());
        registry.register(new MappedPropertyRule());
        registry.register(new ThicknessValueRule());

        registry.register(new XArrayRule());
        registry.register(new XStaticRule());
        registry.register(new XTypeRule());
        registry.register(new XNullRule());
        registry.register(new BindingRule());
        registry.register(new RelativeSourceBindingRule());
        registry.register(new ElementNameBindingRule());
        registry.register(new CompiledBindingRule());

        registry.register(new ConditionalBlockRestructuringRule());
        registry.register(new ThemeReferenceRule());
        registry.register(new ConvertedBlockCleanupRule());
        return registry;
    }
}
