package dev.uimigrator.pipeline;

import dev.uimigrator.model.UnifiedDocument;
import java.util.List;
import java.util.Optional;

/**
 * Raised when a stage fails. Stages that completed before it are not rolled back. {@link #lastDocument()}
 * is a snapshot taken just before the failing stage ran, so it holds the output of the completed
 * stages and none of the failing stage's partial edits.
 */
public class PipelineException extends RuntimeException {

    private final String stageName;
    private final List<String> completedStages;
    private final transient UnifiedDocument lastDocument;

    public PipelineException(String stageName, List<String> completedStages, UnifiedDocument lastDocument, Throwable cause) {
        super("Transformation pipeline aborted at stage " + stageName + ": "
                + (cause == null ? "unknown failure" : cause.getMessage()), cause);
        this.stageName = stageName;
        this.completedStages = List.copyOf(completedStages);
        this.lastDocument = lastDocument;
    }

    public String stageName() {
        return stageName;
    }

    public List<String> completedStages() {
        return completedStages;
    }

    public Optional<UnifiedDocument> lastDocument() {
        return Optional.ofNullable(lastDocument);
    }
}
