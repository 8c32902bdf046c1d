package dev.uimigrator.mapping;

/**
 * Raised when a mapping file cannot be read or parsed.
 */
public class MappingLoadException extends RuntimeException {

    public MappingLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
