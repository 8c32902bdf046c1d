package dev.uimigrator.model;

import dev.uimigrator.diagnostics.Diagnostic;
import dev.uimigrator.diagnostics.SourceLocation;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Common state of every node: its kind, source location and the diagnostics attached to it.
 */
public abstract class MarkupNode {

    private final List<Diagnostic> diagnostics = new ArrayList<>();
    private SourceLocation location;

    protected MarkupNode() {
    }

    public abstract NodeKind kind();

    public Optional<SourceLocation> location() {
        return Optional.ofNullable(location);
    }

    public void setLocation(SourceLocation location) {
        this.location = location;
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Attaches a diagnostic to this node. Transformation code should go through the transformation
     * context, which also forwards the diagnostic to the document's sink.
     */
    public void addDiagnostic(Diagnostic diagnostic) {
        diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic"));
    }

    protected void copyNodeStateFrom(MarkupNode source) {
        location = source.location;
        diagnostics.addAll(source.diagnostics);
    }
}
