package dev.uimigrator.diagnostics;

import java.util.Objects;

/**
 * Position of a node in its source file. Line and column are 1-based; zero means unknown.
 */
public record SourceLocation(String file, int line, int column) {

    public SourceLocation {
        Objects.requireNonNull(file, "file");
        if (line < 0 || column < 0) {
            throw new IllegalArgumentException("line and column must be zero or greater");
        }
    }

    public static SourceLocation of(String file, int line, int column) {
        return new SourceLocation(file, line, column);
    }

    public static SourceLocation fileOnly(String file) {
        return new SourceLocation(file, 0, 0);
    }

    public boolean hasPosition() {
        return line > 0;
    }

    @Override
    public String toString() {
        if (!hasPosition()) {
            return file;
        }
        return file + ':' + line + ':' + column;
    }
}
