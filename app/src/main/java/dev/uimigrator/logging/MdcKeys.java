package dev.uimigrator.logging;

/**
 * MDC keys set while a document moves through the pipeline.
 */
public final class MdcKeys {

    public static final String DOCUMENT = "document";
    public static final String STAGE = "stage";

    private MdcKeys() {
    }
}
