package dev.uimigrator.migrate;

import dev.uimigrator.engine.RuleRegistry;
import dev.uimigrator.engine.TransformationEngine;
import dev.uimigrator.engine.rules.DefaultRules;
import dev.uimigrator.hybrid.NamespaceTransformer;
import dev.uimigrator.hybrid.TransformationStrategy;
import dev.uimigrator.hybrid.TypeMappingTransformer;
import dev.uimigrator.mapping.MappingSource;
import dev.uimigrator.pipeline.RuleBasedTransformer;
import dev.uimigrator.pipeline.TransformationPipeline;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Assembles the standard stage order: namespaces, then types, then the rule engine.
 */
public class MigrationPipelineFactory {

    private final Supplier<RuleRegistry> rules;

    public MigrationPipelineFactory() {
        this(DefaultRules::create);
    }

    public MigrationPipelineFactory(Supplier<RuleRegistry> rules) {
        this.rules = Objects.requireNonNull(rules, "rules");
    }

    public TransformationPipeline create(TransformationStrategy strategy, MappingSource mappings) {
        Objects.requireNonNull(strategy, "strategy");
        Objects.requireNonNull(mappings, "mappings");
        // Namespace remapping has no typed path of its own.
        TransformationStrategy namespaceStrategy = strategy == TransformationStrategy.STRUCTURAL_ONLY
                ? TransformationStrategy.STRUCTURAL_ONLY
                : TransformationStrategy.HYBRID;
        return TransformationPipeline.builder()
                .add(new NamespaceTransformer(namespaceStrategy, mappings))
                .add(new TypeMappingTransformer(strategy, mappings))
                .add(new RuleBasedTransformer(new TransformationEngine(rules.get())))
                .build();
    }
}
