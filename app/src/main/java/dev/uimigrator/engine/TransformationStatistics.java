package dev.uimigrator.engine;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Counts of rule applications grouped by rule name and node-kind label. Records are added only through
 * {@link TransformationContext}.
 */
public final class TransformationStatistics {

    private final List<TransformationRecord> records = new ArrayList<>();

    TransformationStatistics() {
    }

    void record(String ruleName, String nodeKind, String detail) {
        records.add(new TransformationRecord(ruleName, nodeKind, detail, Instant.now()));
    }

    public int total() {
        return records.size();
    }

    public List<TransformationRecord> records() {
        return Collections.unmodifiableList(records);
    }

    public List<TransformationRecord> recordsFor(String ruleName) {
        return records.stream()
                .filter(record -> record.ruleName().equals(ruleName))
                .collect(Collectors.toUnmodifiableList());
    }

    public Map<String, Integer> countsByRule() {
        return count(TransformationRecord::ruleName);
    }

    public Map<String, Integer> countsByNodeKind() {
        return count(TransformationRecord::nodeKind);
    }

    private Map<String, Integer> count(java.util.function.Function<TransformationRecord, String> classifier) {
        Map<String, Integer> counts = new TreeMap<>();
        for (TransformationRecord record : records) {
            counts.merge(classifier.apply(record), 1, Integer::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
