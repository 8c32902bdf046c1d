package dev.uimigrator.pipeline;

import java.util.Objects;

/**
 * Findings of one integrity check, taken after the named stage.
 */
public record IntegrityReport(String stageName, int cycleErrors, int parentMismatches, boolean rootMissing) {

    public IntegrityReport {
        Objects.requireNonNull(stageName, "stageName");
        if (cycleErrors < 0 || parentMismatches < 0) {
            throw new IllegalArgumentException("Issue counts must not be negative");
        }
    }

    public boolean isClean() {
        return cycleErrors == 0 && parentMismatches == 0 && !rootMissing;
    }

    public int issueCount() {
        return cycleErrors + parentMismatches + (rootMissing ? 1 : 0);
    }
}
