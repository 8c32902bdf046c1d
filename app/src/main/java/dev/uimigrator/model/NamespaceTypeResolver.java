package dev.uimigrator.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Resolves tags by mapping their XML namespace to a CLR namespace. {@code clr-namespace:} URIs
 * resolve to the namespace they name; other URIs resolve only when registered.
 */
public class NamespaceTypeResolver implements TypeResolver {

    private final Map<String, String> clrNamespaces = new LinkedHashMap<>();

    public NamespaceTypeResolver register(String xmlNamespace, String clrNamespace) {
        clrNamespaces.put(Objects.requireNonNull(xmlNamespace, "xmlNamespace"),
                Objects.requireNonNull(clrNamespace, "clrNamespace"));
        return this;
    }

    public static NamespaceTypeResolver wpfDefaults() {
        return new NamespaceTypeResolver()
                .register(XamlNamespaces.WPF_PRESENTATION, "System.Windows.Controls");
    }

    @Override
    public Optional<ResolvedType> resolve(String xmlNamespace, String typeName) {
        if (xmlNamespace == null || typeName == null || typeName.isBlank() || typeName.indexOf('.') > 0) {
            return Optional.empty();
        }
        if (XamlNamespaces.isClrNamespace(xmlNamespace)) {
            return Optional.of(new ResolvedType(XamlNamespaces.clrNamespaceOf(xmlNamespace) + '.' + typeName));
        }
        return Optional.ofNullable(clrNamespaces.get(xmlNamespace))
                .map(clrNamespace -> new ResolvedType(clrNamespace + '.' + typeName));
    }
}
