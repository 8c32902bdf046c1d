package dev.uimigrator.engine;

/**
 * Thrown by a rule or transformer that cannot use the typed view for a node, for example because the
 * resolved type no longer matches the rewritten tag. The node is left unmodified and processing
 * continues.
 */
public class TypeResolutionException extends RuntimeException {

    public TypeResolutionException(String message) {
        super(message);
    }

    public TypeResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
