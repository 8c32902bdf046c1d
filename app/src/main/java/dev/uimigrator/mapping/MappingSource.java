package dev.uimigrator.mapping;

import java.util.List;
import java.util.Optional;

/**
 * Read-only lookup of old-to-new name associations consulted by rules and transformers.
 */
public interface MappingSource {

    /**
     * All type mappings whose source simple name matches, in declaration order.
     */
    List<TypeMapping> typesNamed(String simpleName);

    Optional<TypeMapping> findTypeByQualifiedName(String qualifiedName);

    /**
     * Most specific match first: the mapping scoped to {@code ownerType}, then the unscoped one.
     */
    Optional<PropertyMapping> findProperty(String propertyName, String ownerType);

    Optional<NamespaceMapping> findNamespace(String sourceNamespace);

    static MappingSource empty() {
        return new InMemoryMappingSource(MappingDatabase.empty());
    }
}
