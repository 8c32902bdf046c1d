package dev.uimigrator.engine;

/**
 * Implemented by rules that rename a property, so the registry can spot renames that feed into each
 * other.
 */
public interface RenamingRule {

    String sourceName();

    String targetName();
}
