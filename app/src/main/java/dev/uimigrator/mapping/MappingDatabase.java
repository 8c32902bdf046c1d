package dev.uimigrator.mapping;

import java.util.List;

/**
 * All mapping entries of one mapping file.
 */
public record MappingDatabase(
        String version,
        List<TypeMapping> types,
        List<PropertyMapping> properties,
        List<NamespaceMapping> namespaces
) {

    public MappingDatabase {
        version = version == null ? "" : version;
        types = types == null ? List.of() : List.copyOf(types);
        properties = properties == null ? List.of() : List.copyOf(properties);
        namespaces = namespaces == null ? List.of() : List.copyOf(namespaces);
    }

    public static MappingDatabase empty() {
        return new MappingDatabase("", List.of(), List.of(), List.of());
    }
}
