package dev.uimigrator.pipeline;

import dev.uimigrator.model.UnifiedDocument;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

public record PipelineResult(UnifiedDocument document,
                             List<String> completedStages,
                             List<IntegrityReport> integrityReports,
                             Duration elapsed) {

    public PipelineResult {
        Objects.requireNonNull(document, "document");
        completedStages = List.copyOf(completedStages);
        integrityReports = List.copyOf(integrityReports);
        Objects.requireNonNull(elapsed, "elapsed");
    }

    public boolean isClean() {
        return integrityReports.stream().allMatch(IntegrityReport::isClean);
    }
}
