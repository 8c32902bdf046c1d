package dev.uimigrator.cli;

import dev.uimigrator.hybrid.TransformationStrategy;
import picocli.CommandLine;

public class StrategyConverter implements CommandLine.ITypeConverter<TransformationStrategy> {

    @Override
    public TransformationStrategy convert(String value) {
        return TransformationStrategy.from(value);
    }
}
