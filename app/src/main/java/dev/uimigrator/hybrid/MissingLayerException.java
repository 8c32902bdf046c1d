package dev.uimigrator.hybrid;

/**
 * A strategy needs a document layer, or a per-element typed view, that is not there.
 */
public class MissingLayerException extends RuntimeException {

    public MissingLayerException(String message) {
        super(message);
    }
}
