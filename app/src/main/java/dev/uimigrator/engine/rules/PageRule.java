package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import java.util.ArrayList;
import java.util.List;

/**
 * Pages become user controls. Navigation-host properties have no counterpart and are dropped.
 */
public class PageRule extends TypeRenameRule {

    private static final List<String> NAVIGATION_PROPERTIES = List.of("KeepAlive", "NavigationUIVisibility", "ShowsNavigationUI");

    public PageRule() {
        super("Page", "UserControl");
    }

    @Override
    protected void afterRename(MarkupElement element, TransformationContext context) {
        List<String> removed = new ArrayList<>();
        for (String property : NAVIGATION_PROPERTIES) {
            element.removeProperty(property).ifPresent(ignored -> removed.add(property));
        }
        if (!removed.isEmpty()) {
            context.warn(element, DiagnosticCodes.PAGE_NAVIGATION_REMOVED,
                    "Removed page navigation properties " + String.join(", ", removed));
        }
    }
}
