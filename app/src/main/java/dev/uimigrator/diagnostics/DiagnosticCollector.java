package dev.uimigrator.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * In-memory sink keeping every diagnostic of one document run in arrival order.
 */
public class DiagnosticCollector implements DiagnosticSink {

    private static final Comparator<Diagnostic> BY_SEVERITY_THEN_POSITION = Comparator
            .comparing(Diagnostic::severity, Comparator.reverseOrder())
            .thenComparing(diagnostic -> diagnostic.location().map(SourceLocation::line).orElse(0))
            .thenComparing(diagnostic -> diagnostic.location().map(SourceLocation::column).orElse(0));

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public void report(Diagnostic diagnostic) {
        diagnostics.add(Objects.requireNonNull(diagnostic, "diagnostic"));
    }

    public List<Diagnostic> diagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<Diagnostic> bySeverity(Severity severity) {
        return diagnostics.stream()
                .filter(diagnostic -> diagnostic.severity() == severity)
                .collect(Collectors.toUnmodifiableList());
    }

    public List<Diagnostic> byCode(String code) {
        return diagnostics.stream()
                .filter(diagnostic -> diagnostic.code().equals(code))
                .collect(Collectors.toUnmodifiableList());
    }

    public Map<String, List<Diagnostic>> byFile() {
        return diagnostics.stream()
                .collect(Collectors.groupingBy(diagnostic -> diagnostic.file().orElse(""),
                        LinkedHashMap::new, Collectors.toUnmodifiableList()));
    }

    public List<Diagnostic> sorted() {
        return diagnostics.stream()
                .sorted(BY_SEVERITY_THEN_POSITION)
                .collect(Collectors.toUnmodifiableList());
    }

    public long count(Severity severity) {
        return diagnostics.stream().filter(diagnostic -> diagnostic.severity() == severity).count();
    }

    public long errorCount() {
        return count(Severity.ERROR);
    }

    public long warningCount() {
        return count(Severity.WARNING);
    }

    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public boolean isEmpty() {
        return diagnostics.isEmpty();
    }
}
