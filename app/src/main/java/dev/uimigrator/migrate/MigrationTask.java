package dev.uimigrator.migrate;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One markup file to migrate and where its result goes.
 */
public record MigrationTask(Path source, Path target) {

    public MigrationTask {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(target, "target");
    }
}
