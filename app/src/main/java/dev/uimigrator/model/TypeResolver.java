package dev.uimigrator.model;

import java.util.Optional;

/**
 * The typed view of a document: resolves a tag to its type identity.
 */
@FunctionalInterface
public interface TypeResolver {

    Optional<ResolvedType> resolve(String xmlNamespace, String typeName);
}
