package dev.uimigrator.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.uimigrator.engine.rules.ConditionalBlockRestructuringRule;
import dev.uimigrator.engine.rules.ConvertedBlockCleanupRule;
import dev.uimigrator.engine.rules.PropertyRenameRule;
import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupNode;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class RuleRegistryTest {

    @Test
    void sortsByDescendingPriorityKeepingRegistrationOrderForTies() {
        NamedRule first = new NamedRule("first", 10);
        NamedRule second = new NamedRule("second", 50);
        NamedRule third = new NamedRule("third", 10);
        NamedRule fourth = new NamedRule("fourth", 50);

        List<NamedRule> sorted = RuleRegistry.sortByPriority(List.of(first, second, third, fourth));

        assertThat(sorted).containsExactly(second, fourth, first, third);
        assertThat(RuleRegistry.sortByPriority(sorted)).containsExactlyElementsOf(sorted);
    }

    @Test
    void splitsRulesByKindAndPhase() {
        RuleRegistry registry = new RuleRegistry()
                .register(new NamedRule("element", 5))
                .register(new PropertyRenameRule("Foo", "Bar"))
                .register(new ConditionalBlockRestructuringRule())
                .register(new ConvertedBlockCleanupRule());

        assertThat(registry.size()).isEqualTo(4);
        assertThat(registry.elementRules()).extracting(TransformationRule::name).containsExactly("element");
        assertThat(registry.propertyRules()).extracting(TransformationRule::name).containsExactly("RenameFoo");
        assertThat(registry.extensionRules()).isEmpty();
        assertThat(registry.postProcessingRules(PostProcessingPhase.RESTRUCTURE))
                .extracting(TransformationRule::name).containsExactly("RestructureConditionalBlocks");
        assertThat(registry.postProcessingRules(PostProcessingPhase.CLEANUP))
                .extracting(TransformationRule::name).containsExactly("RemoveConvertedBlocks");
    }

    @Test
    void rejectsRulesOutsideTheKnownHierarchy() {
        TransformationRule bare = new TransformationRule() {
            @Override
            public String name() {
                return "bare";
            }

            @Override
            public boolean canHandle(MarkupNode node) {
                return true;
            }

            @Override
            public Optional<MarkupNode> apply(MarkupNode node, TransformationContext context) {
                return Optional.of(node);
            }
        };

        assertThatThrownBy(() -> new RuleRegistry().register(bare))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bare");
    }

    static final class NamedRule extends ElementRule {

        private final String name;
        private final int priority;

        NamedRule(String name, int priority) {
            this.name = name;
            this.priority = priority;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        public int priority() {
            return priority;
        }

        @Override
        public boolean canHandleElement(MarkupElement element) {
            return false;
        }

        @Override
        public Optional<MarkupElement> transformElement(MarkupElement element, TransformationContext context) {
            return Optional.of(element);
        }
    }
}
