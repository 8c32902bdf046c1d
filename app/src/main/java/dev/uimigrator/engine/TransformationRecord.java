package dev.uimigrator.engine;

import java.time.Instant;
import java.util.Objects;

/**
 * One successful rule application.
 */
public record TransformationRecord(String ruleName, String nodeKind, String detail, Instant timestamp) {

    public TransformationRecord {
        Objects.requireNonNull(ruleName, "ruleName");
        Objects.requireNonNull(nodeKind, "nodeKind");
        detail = detail == null ? "" : detail;
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
