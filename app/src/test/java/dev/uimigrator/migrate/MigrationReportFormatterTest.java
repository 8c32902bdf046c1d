package dev.uimigrator.migrate;

import static org.assertj.core.api.Assertions.assertThat;

import dev.uimigrator.diagnostics.Diagnostic;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.diagnostics.SourceLocation;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class MigrationReportFormatterTest {

    private final MigrationOutcome migrated = new MigrationOutcome("Main.xaml", MigrationOutcome.Status.MIGRATED, Optional.of("<Window />"),
            List.of("RuleBasedTransformer"),
            List.of(Diagnostic.of("STYLE_KEYED", Severity.INFO, "keyed style", SourceLocation.of("Main.xaml", 3, 5)),
                    Diagnostic.of("VISIBILITY_HIDDEN", Severity.WARNING, "hidden", SourceLocation.of("Main.xaml", 9, 7)),
                    Diagnostic.of("TYPE_MANUAL_REVIEW", Severity.WARNING, "review", SourceLocation.of("Main.xaml", 4, 2))),
            4, Duration.ofMillis(12));

    private final MigrationOutcome failed = new MigrationOutcome("Broken.xaml", MigrationOutcome.Status.FAILED, Optional.empty(),
            List.of(), List.of(Diagnostic.of("PARSE_FAILED", Severity.ERROR, "unexpected end", SourceLocation.of("Broken.xaml", 1, 9))),
            0, Duration.ZERO);

    @Test
    void listsWarningsAndErrorsPerDocument() {
        String report = new MigrationReportFormatter(false).format(List.of(migrated, failed));

        assertThat(report.split(System.lineSeparator())).containsExactly(
                "migrated Main.xaml (4 transformation(s))",
                "  Main.xaml:4:2: warning TYPE_MANUAL_REVIEW: review",
                "  Main.xaml:9:7: warning VISIBILITY_HIDDEN: hidden",
                "failed Broken.xaml (0 transformation(s))",
                "  Broken.xaml:1:9: error PARSE_FAILED: unexpected end",
                "2 document(s), 1 failed, 1 error(s), 2 warning(s)");
    }

    @Test
    void includesInfoWhenRequested() {
        String report = new MigrationReportFormatter(true).format(List.of(migrated));

        assertThat(report).contains("  Main.xaml:3:5: info STYLE_KEYED: keyed style");
    }

    @Test
    void dryRunStatusIsHyphenated() {
        MigrationOutcome dryRun = new MigrationOutcome("Main.xaml", MigrationOutcome.Status.DRY_RUN, Optional.of(""), List.of(),
                List.of(), 0, Duration.ZERO);

        assertThat(new MigrationReportFormatter(false).format(List.of(dryRun)))
                .startsWith("dry-run Main.xaml (0 transformation(s))");
    }
}
