package dev.uimigrator.migrate;

import dev.uimigrator.diagnostics.Diagnostic;
import dev.uimigrator.diagnostics.Severity;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of migrating one document.
 */
public record MigrationOutcome(String sourceId,
                               Status status,
                               Optional<String> output,
                               List<String> completedStages,
                               List<Diagnostic> diagnostics,
                               int transformations,
                               Duration elapsed) {

    public enum Status {
        MIGRATED,
        DRY_RUN,
        FAILED
    }

    public MigrationOutcome {
        Objects.requireNonNull(sourceId, "sourceId");
        Objects.requireNonNull(status, "status");
        output = output == null ? Optional.empty() : output;
        completedStages = List.copyOf(Objects.requireNonNull(completedStages, "completedStages"));
        diagnostics = List.copyOf(Objects.requireNonNull(diagnostics, "diagnostics"));
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    public boolean failed() {
        return status == Status.FAILED;
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(diagnostic -> diagnostic.severity() == severity).count();
    }

    public boolean hasErrors() {
        return count(Severity.ERROR) > 0;
    }
}
