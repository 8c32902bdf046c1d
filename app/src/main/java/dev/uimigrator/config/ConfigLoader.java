package dev.uimigrator.config;

import dev.uimigrator.cli.CliArguments;
import dev.uimigrator.hybrid.TransformationStrategy;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Builds a {@link MigratorConfig} by combining CLI arguments with environment variables and defaults.
 * CLI values win over the environment.
 */
public class ConfigLoader {

    static final String ENV_STRATEGY = "MIGRATOR_STRATEGY";
    static final String ENV_MAPPINGS = "MIGRATOR_MAPPINGS";
    static final String ENV_FILE_EXTENSIONS = "MIGRATOR_FILE_EXTENSIONS";
    static final String ENV_OUTPUT_SUFFIX = "MIGRATOR_OUTPUT_SUFFIX";
    static final String ENV_AVALONIA_BINDINGS = "MIGRATOR_AVALONIA_BINDINGS";
    static final String ENV_COMPILED_BINDINGS = "MIGRATOR_COMPILED_BINDINGS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private static final Set<String> DEFAULT_FILE_EXTENSIONS = Set.of("xaml");
    private static final String DEFAULT_OUTPUT_SUFFIX = ".axaml";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public MigratorConfig load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        TransformationStrategy strategy = resolveStrategy(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        Optional<Path> mappingsFile = Optional.ofNullable(arguments.mappingsFile())
                .or(() -> environmentReader.get(ENV_MAPPINGS)
                        .filter(ConfigLoader::isNotBlank)
                        .map(String::trim)
                        .map(Path::of));

        Set<String> fileExtensions = environmentReader.get(ENV_FILE_EXTENSIONS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseExtensions)
                .orElse(DEFAULT_FILE_EXTENSIONS);

        String outputSuffix = environmentReader.get(ENV_OUTPUT_SUFFIX)
                .filter(ConfigLoader::isNotBlank)
                .orElse(DEFAULT_OUTPUT_SUFFIX);

        boolean elementNameShorthand = !arguments.noElementNameShorthand()
                && environmentReader.get(ENV_AVALONIA_BINDINGS)
                        .filter(ConfigLoader::isNotBlank)
                        .map(value -> parseBoolean(ENV_AVALONIA_BINDINGS, value))
                        .orElse(true);

        boolean compiledBindings = arguments.compiledBindings()
                || environmentReader.get(ENV_COMPILED_BINDINGS)
                        .filter(ConfigLoader::isNotBlank)
                        .map(value -> parseBoolean(ENV_COMPILED_BINDINGS, value))
                        .orElse(false);

        return new MigratorConfig(arguments.inputs(), Optional.ofNullable(arguments.outputDirectory()), strategy,
                mappingsFile, fileExtensions, outputSuffix, elementNameShorthand, compiledBindings, arguments.dryRun(),
                arguments.failOnError(), logFormat);
    }

    private TransformationStrategy resolveStrategy(CliArguments arguments) {
        TransformationStrategy cliStrategy = arguments.strategy();
        if (cliStrategy != null) {
            return cliStrategy;
        }
        return environmentReader.get(ENV_STRATEGY)
                .filter(ConfigLoader::isNotBlank)
                .map(TransformationStrategy::from)
                .orElse(TransformationStrategy.HYBRID);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static boolean parseBoolean(String variable, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "true":
            case "1":
            case "yes":
                return true;
            case "false":
            case "0":
            case "no":
                return false;
            default:
                throw new IllegalArgumentException(variable + " must be true or false: " + raw);
        }
    }

    private static Set<String> parseExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }
}
