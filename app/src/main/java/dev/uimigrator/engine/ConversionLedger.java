package dev.uimigrator.engine;

import dev.uimigrator.model.MarkupElement;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Remembers which conditional blocks the restructuring pass converted, so the cleanup pass removes
 * exactly those. Wrappers that held converted blocks are tracked too, so they can be dropped once empty.
 */
public final class ConversionLedger {

    private final Set<MarkupElement> converted = Collections.newSetFromMap(new IdentityHashMap<>());
    private final Set<MarkupElement> wrappers = Collections.newSetFromMap(new IdentityHashMap<>());
    private final List<MarkupElement> order = new ArrayList<>();

    ConversionLedger() {
    }

    public void markConverted(MarkupElement block) {
        if (converted.add(block)) {
            order.add(block);
        }
    }

    public void markWrapper(MarkupElement wrapper) {
        wrappers.add(wrapper);
    }

    public boolean isConverted(MarkupElement element) {
        return converted.contains(element);
    }

    public boolean isWrapper(MarkupElement element) {
        return wrappers.contains(element);
    }

    public List<MarkupElement> converted() {
        return Collections.unmodifiableList(order);
    }

    public int size() {
        return converted.size();
    }
}
