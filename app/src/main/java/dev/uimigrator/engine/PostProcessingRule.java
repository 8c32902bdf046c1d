package dev.uimigrator.engine;

/**
 * Element rule that runs after dispatch, during one of the post-processing passes, instead of during
 * the pre-order visit.
 */
public abstract class PostProcessingRule extends ElementRule {

    public abstract PostProcessingPhase phase();
}
