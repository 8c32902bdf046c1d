package dev.uimigrator.migrate;

import dev.uimigrator.config.MigratorConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Expands the configured inputs into migration tasks. Directories are walked recursively and
 * filtered by file extension; the walk order is sorted so runs are repeatable.
 */
public class MigrationPlanner {

    private static final Logger LOGGER = LoggerFactory.getLogger(MigrationPlanner.class);

    private final MigratorConfig config;

    public MigrationPlanner(MigratorConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    public List<MigrationTask> plan() {
        List<MigrationTask> tasks = new ArrayList<>();
        for (Path input : config.inputs()) {
            if (Files.isDirectory(input)) {
                for (Path file : markupFilesUnder(input)) {
                    tasks.add(new MigrationTask(file, targetFor(file, Optional.of(input))));
                }
            } else if (Files.isRegularFile(input)) {
                tasks.add(new MigrationTask(input, targetFor(input, Optional.empty())));
            } else {
                throw new IllegalArgumentException("Input does not exist: " + input);
            }
        }
        LOGGER.info("Planned {} document(s) from {} input(s)", tasks.size(), config.inputs().size());
        return tasks;
    }

    private List<Path> markupFilesUnder(Path directory) {
        try (Stream<Path> files = Files.walk(directory)) {
            return files.filter(Files::isRegularFile)
                    .filter(config::accepts)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to list " + directory, ex);
        }
    }

    Path targetFor(Path source, Optional<Path> inputRoot) {
        String fileName = withSuffix(source.getFileName().toString());
        if (config.outputDirectory().isEmpty()) {
            return source.resolveSibling(fileName);
        }
        Path outputDirectory = config.outputDirectory().get();
        Path relativeParent = inputRoot.map(root -> root.relativize(source).getParent()).orElse(null);
        return relativeParent == null ? outputDirectory.resolve(fileName) : outputDirectory.resolve(relativeParent).resolve(fileName);
    }

    private String withSuffix(String fileName) {
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return stem + config.outputSuffix();
    }
}
