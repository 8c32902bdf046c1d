package dev.uimigrator.mapping;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Indexes a {@link MappingDatabase} for case-insensitive lookups.
 */
public class InMemoryMappingSource implements MappingSource {

    private final Map<String, List<TypeMapping>> typesBySimpleName = new LinkedHashMap<>();
    private final Map<String, TypeMapping> typesByQualifiedName = new LinkedHashMap<>();
    private final Map<String, PropertyMapping> properties = new LinkedHashMap<>();
    private final Map<String, NamespaceMapping> namespaces = new LinkedHashMap<>();

    public InMemoryMappingSource(MappingDatabase database) {
        Objects.requireNonNull(database, "database");
        for (TypeMapping type : database.types()) {
            typesBySimpleName.computeIfAbsent(normalize(type.sourceSimpleName()), key -> new ArrayList<>()).add(type);
            typesByQualifiedName.putIfAbsent(normalize(type.sourceType()), type);
        }
        for (PropertyMapping property : database.properties()) {
            properties.putIfAbsent(propertyKey(property.sourceName(), property.ownerType()), property);
        }
        for (NamespaceMapping namespace : database.namespaces()) {
            namespaces.putIfAbsent(namespace.sourceNamespace(), namespace);
        }
    }

    @Override
    public List<TypeMapping> typesNamed(String simpleName) {
        if (simpleName == null) {
            return List.of();
        }
        return List.copyOf(typesBySimpleName.getOrDefault(normalize(simpleName), List.of()));
    }

    @Override
    public Optional<TypeMapping> findTypeByQualifiedName(String qualifiedName) {
        if (qualifiedName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(typesByQualifiedName.get(normalize(qualifiedName)));
    }

    @Override
    public Optional<PropertyMapping> findProperty(String propertyName, String ownerType) {
        if (propertyName == null) {
            return Optional.empty();
        }
        if (ownerType != null && !ownerType.isBlank()) {
            PropertyMapping scoped = properties.get(propertyKey(propertyName, ownerType));
            if (scoped != null) {
                return Optional.of(scoped);
            }
        }
        return Optional.ofNullable(properties.get(propertyKey(propertyName, null)));
    }

    @Override
    public Optional<NamespaceMapping> findNamespace(String sourceNamespace) {
        if (sourceNamespace == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(namespaces.get(sourceNamespace));
    }

    private static String propertyKey(String name, String ownerType) {
        return normalize(name) + '|' + (ownerType == null ? "" : normalize(ownerType));
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
