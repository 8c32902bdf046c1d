package dev.uimigrator.engine;

/**
 * The two ordered passes of the restructuring post-processor.
 */
public enum PostProcessingPhase {
    RESTRUCTURE,
    CLEANUP
}
