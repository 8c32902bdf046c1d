package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;

/**
 * List views become list boxes. The {@code View} (usually a GridView) has no list box equivalent.
 */
public class ListViewRule extends TypeRenameRule {

    public ListViewRule() {
        super("ListView", "ListBox");
    }

    @Override
    protected void afterRename(MarkupElement element, TransformationContext context) {
        if (element.removeProperty("View").isPresent()) {
            context.warn(element, DiagnosticCodes.LISTVIEW_VIEW_REMOVED,
                    "ListView.View was removed; rebuild the columns with an ItemTemplate or a DataGrid");
        }
    }
}
