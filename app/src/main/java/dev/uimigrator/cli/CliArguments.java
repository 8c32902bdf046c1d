package dev.uimigrator.cli;

import dev.uimigrator.config.LogFormat;
import dev.uimigrator.hybrid.TransformationStrategy;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine;

@CommandLine.Command(name = "ui-migrator", mixinStandardHelpOptions = true,
        description = "Migrates WPF XAML documents to Avalonia markup")
public class CliArguments {

    @CommandLine.Parameters(arity = "1..*", paramLabel = "INPUT", description = "XAML files or directories to migrate")
    private List<Path> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--output"}, description = "Directory for migrated files (default: next to each input)", paramLabel = "DIR")
    private Path outputDirectory;

    @CommandLine.Option(names = "--strategy", converter = StrategyConverter.class,
            description = "Transformation strategy: structural, typed or hybrid")
    private TransformationStrategy strategy;

    @CommandLine.Option(names = "--mappings", description = "JSON mapping file replacing the bundled mappings", paramLabel = "FILE")
    private Path mappingsFile;

    @CommandLine.Option(names = "--dry-run", description = "Transform and report without writing files")
    private boolean dryRun;

    @CommandLine.Option(names = "--fail-on-error", description = "Exit with status 1 when any error diagnostic is reported")
    private boolean failOnError;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log rule applications and stage details")
    private boolean verbose;

    @CommandLine.Option(names = "--no-element-name-shorthand", description = "Keep ElementName bindings instead of #name shorthand")
    private boolean noElementNameShorthand;

    @CommandLine.Option(names = "--compiled-bindings", description = "Rewrite Binding to CompiledBinding (needs x:DataType on the views)")
    private boolean compiledBindings;

    public List<Path> inputs() {
        return inputs;
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    public TransformationStrategy strategy() {
        return strategy;
    }

    public Path mappingsFile() {
        return mappingsFile;
    }

    public boolean dryRun() {
        return dryRun;
    }

    public boolean failOnError() {
        return failOnError;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }

    public boolean noElementNameShorthand() {
        return noElementNameShorthand;
    }

    public boolean compiledBindings() {
        return compiledBindings;
    }
}
