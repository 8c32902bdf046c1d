package dev.uimigrator.migrate;

import dev.uimigrator.diagnostics.Diagnostic;
import dev.uimigrator.diagnostics.Severity;
import dev.uimigrator.diagnostics.SourceLocation;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Renders a plain-text report: one block per document with its diagnostics, most severe first,
 * then a summary line. INFO diagnostics are listed only when requested.
 */
public class MigrationReportFormatter {

    private static final Comparator<Diagnostic> MOST_SEVERE_FIRST = Comparator
            .comparing(Diagnostic::severity, Comparator.reverseOrder())
            .thenComparing(diagnostic -> diagnostic.location().map(SourceLocation::line).orElse(0));

    private final boolean includeInfo;

    public MigrationReportFormatter(boolean includeInfo) {
        this.includeInfo = includeInfo;
    }

    public String format(List<MigrationOutcome> outcomes) {
        StringBuilder report = new StringBuilder();
        int failed = 0;
        long errors = 0;
        long warnings = 0;
        for (MigrationOutcome outcome : outcomes) {
            report.append(outcome.status().name().toLowerCase(Locale.ROOT).replace('_', '-'))
                    .append(' ')
                    .append(outcome.sourceId())
                    .append(" (")
                    .append(outcome.transformations())
                    .append(" transformation(s))")
                    .append(System.lineSeparator());
            outcome.diagnostics().stream()
                    .filter(diagnostic -> includeInfo || diagnostic.severity() != Severity.INFO)
                    .sorted(MOST_SEVERE_FIRST)
                    .forEach(diagnostic -> report.append("  ").append(diagnostic.format()).append(System.lineSeparator()));
            failed += outcome.failed() ? 1 : 0;
            errors += outcome.count(Severity.ERROR);
            warnings += outcome.count(Severity.WARNING);
        }
        report.append(String.format(Locale.ROOT, "%d document(s), %d failed, %d error(s), %d warning(s)%n",
                outcomes.size(), failed, errors, warnings));
        return report.toString();
    }
}
