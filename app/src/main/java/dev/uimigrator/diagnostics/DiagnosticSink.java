package dev.uimigrator.diagnostics;

/**
 * Receives diagnostics as they are produced.
 */
@FunctionalInterface
public interface DiagnosticSink {

    void report(Diagnostic diagnostic);

    default Diagnostic info(String code, String message, SourceLocation location) {
        return emit(code, Severity.INFO, message, location);
    }

    default Diagnostic warning(String code, String message, SourceLocation location) {
        return emit(code, Severity.WARNING, message, location);
    }

    default Diagnostic error(String code, String message, SourceLocation location) {
        return emit(code, Severity.ERROR, message, location);
    }

    private Diagnostic emit(String code, Severity severity, String message, SourceLocation location) {
        Diagnostic diagnostic = Diagnostic.of(code, severity, message, location);
        report(diagnostic);
        return diagnostic;
    }
}
