package dev.uimigrator.mapping;

import java.util.Map;
import java.util.Optional;

/**
 * Maps a property, optionally scoped to an owner type, to its target name and value spellings.
 * A blank target name marks a property that has no equivalent and is dropped.
 */
public record PropertyMapping(
        String sourceName,
        String targetName,
        String ownerType,
        Map<String, String> valueConversions,
        boolean requiresManualReview,
        String notes
) {

    public PropertyMapping {
        if (sourceName == null || sourceName.isBlank()) {
            throw new IllegalArgumentException("sourceName must not be blank");
        }
        sourceName = sourceName.trim();
        targetName = targetName == null ? "" : targetName.trim();
        ownerType = ownerType == null || ownerType.isBlank() ? null : ownerType.trim();
        valueConversions = valueConversions == null ? Map.of() : Map.copyOf(valueConversions);
        notes = notes == null ? "" : notes;
    }

    public PropertyMapping(String sourceName, String targetName) {
        this(sourceName, targetName, null, Map.of(), false, "");
    }

    public Optional<String> owner() {
        return Optional.ofNullable(ownerType);
    }

    public boolean isRemoval() {
        return targetName.isEmpty();
    }

    public boolean isRename() {
        return !isRemoval() && !targetName.equals(sourceName);
    }

    public Optional<String> convertValue(String value) {
        return Optional.ofNullable(valueConversions.get(value));
    }
}
