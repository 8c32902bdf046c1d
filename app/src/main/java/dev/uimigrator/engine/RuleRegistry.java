package dev.uimigrator.engine;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds registered rules in priority order and splits them by node kind once, at registration time.
 */
public final class RuleRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(RuleRegistry.class);
    private static final Comparator<TransformationRule> BY_PRIORITY_DESCENDING =
            Comparator.comparingInt(TransformationRule::priority).reversed();

    private final List<TransformationRule> rules = new ArrayList<>();
    private List<ElementRule> elementRules = List.of();
    private List<PropertyRule> propertyRules = List.of();
    private List<MarkupExtensionRule> extensionRules = List.of();
    private List<PostProcessingRule> restructuringRules = List.of();
    private List<PostProcessingRule> cleanupRules = List.of();

    public RuleRegistry register(TransformationRule rule) {
        Objects.requireNonNull(rule, "rule");
        if (!(rule instanceof ElementRule) && !(rule instanceof PropertyRule) && !(rule instanceof MarkupExtensionRule)) {
            throw new IllegalArgumentException("Rule " + rule.name()
                    + " must extend ElementRule, PropertyRule or MarkupExtensionRule");
        }
        for (TransformationRule existing : rules) {
            if (existing.name().equals(rule.name())) {
                LOGGER.warn("Rule name {} is registered more than once", rule.name());
            }
        }
        warnOnChainedRename(rule);
        rules.add(rule);
        reindex();
        return this;
    }

    public RuleRegistry registerAll(Collection<? extends TransformationRule> additions) {
        additions.forEach(this::register);
        return this;
    }

    /**
     * All rules, highest priority first. Equal priorities keep registration order.
     */
    public List<TransformationRule> rules() {
        return sortByPriority(rules);
    }

    public List<ElementRule> elementRules() {
        return elementRules;
    }

    public List<PropertyRule> propertyRules() {
        return propertyRules;
    }

    public List<MarkupExtensionRule> extensionRules() {
        return extensionRules;
    }

    public List<PostProcessingRule> postProcessingRules(PostProcessingPhase phase) {
        return phase == PostProcessingPhase.RESTRUCTURE ? restructuringRules : cleanupRules;
    }

    public int size() {
        return rules.size();
    }

    /**
     * Stable sort by descending priority. Sorting an already sorted list returns it unchanged.
     */
    public static <T extends TransformationRule> List<T> sortByPriority(List<T> input) {
        List<T> sorted = new ArrayList<>(input);
        sorted.sort(BY_PRIORITY_DESCENDING);
        return List.copyOf(sorted);
    }

    private void reindex() {
        List<TransformationRule> sorted = sortByPriority(rules);
        List<ElementRule> elements = new ArrayList<>();
        List<PropertyRule> properties = new ArrayList<>();
        List<MarkupExtensionRule> extensions = new ArrayList<>();
        List<PostProcessingRule> postProcessing = new ArrayList<>();
        for (TransformationRule rule : sorted) {
            if (rule instanceof PostProcessingRule postRule) {
                postProcessing.add(postRule);
            } else if (rule instanceof ElementRule elementRule) {
                elements.add(elementRule);
            } else if (rule instanceof PropertyRule propertyRule) {
                properties.add(propertyRule);
            } else if (rule instanceof MarkupExtensionRule extensionRule) {
                extensions.add(extensionRule);
            }
        }
        elementRules = List.copyOf(elements);
        propertyRules = List.copyOf(properties);
        extensionRules = List.copyOf(extensions);
        restructuringRules = postProcessing.stream()
                .filter(rule -> rule.phase() == PostProcessingPhase.RESTRUCTURE)
                .collect(Collectors.toUnmodifiableList());
        cleanupRules = postProcessing.stream()
                .filter(rule -> rule.phase() == PostProcessingPhase.CLEANUP)
                .collect(Collectors.toUnmodifiableList());
    }

    // Every matching rule applies on one visit, so a rename whose target is another rename's source
    // rewrites the same property twice.
    private void warnOnChainedRename(TransformationRule rule) {
        if (!(rule instanceof RenamingRule renaming)) {
            return;
        }
        for (TransformationRule existing : rules) {
            if (existing instanceof RenamingRule other) {
                if (other.targetName().equals(renaming.sourceName()) || renaming.targetName().equals(other.sourceName())) {
                    LOGGER.warn("Rename rules {} and {} chain into each other; both apply to the same property in one visit",
                            existing.name(), rule.name());
                }
            }
        }
    }
}
