package dev.uimigrator.config;

import dev.uimigrator.hybrid.TransformationStrategy;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 */
public record MigratorConfig(
        List<Path> inputs,
        Optional<Path> outputDirectory,
        TransformationStrategy strategy,
        Optional<Path> mappingsFile,
        Set<String> fileExtensions,
        String outputSuffix,
        boolean elementNameShorthand,
        boolean compiledBindings,
        boolean dryRun,
        boolean failOnError,
        LogFormat logFormat
) {

    public MigratorConfig {
        inputs = List.copyOf(Objects.requireNonNull(inputs, "inputs"));
        if (inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input file or directory must be provided");
        }
        outputDirectory = outputDirectory == null ? Optional.empty() : outputDirectory;
        strategy = Objects.requireNonNull(strategy, "strategy");
        mappingsFile = mappingsFile == null ? Optional.empty() : mappingsFile;
        fileExtensions = normalizeExtensions(fileExtensions);
        outputSuffix = requireNonBlank(outputSuffix, "outputSuffix");
        if (!outputSuffix.startsWith(".")) {
            outputSuffix = "." + outputSuffix;
        }
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    /**
     * True when the file name ends with one of the configured markup extensions.
     */
    public boolean accepts(Path file) {
        Path fileName = file.getFileName();
        if (fileName == null) {
            return false;
        }
        String name = fileName.toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && fileExtensions.contains(name.substring(dot + 1));
    }

    private static Set<String> normalizeExtensions(Set<String> extensions) {
        if (extensions == null || extensions.isEmpty()) {
            throw new IllegalArgumentException("fileExtensions must not be empty");
        }
        return extensions.stream()
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
