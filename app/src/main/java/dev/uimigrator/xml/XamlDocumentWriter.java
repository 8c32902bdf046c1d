package dev.uimigrator.xml;

import dev.uimigrator.model.MarkupElement;
import dev.uimigrator.model.MarkupProperty;
import dev.uimigrator.model.PropertyValue;
import dev.uimigrator.model.UnifiedDocument;
import dev.uimigrator.model.XamlNamespaces;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Serializes the unified tree back to markup. Namespace declarations go on the root element; a
 * namespace used by an element but never declared gets a generated prefix. Element-valued properties
 * are written as {@code <Owner.Property>} elements ahead of the children, named after the owner's
 * current type.
 */
public class XamlDocumentWriter {

    private static final String INDENT = "  ";

    public String write(UnifiedDocument document) {
        StringBuilder out = new StringBuilder("<?xml version=\"1.0\" encoding=\"utf-8\"?>\n");
        if (document.root().isEmpty()) {
            return out.toString();
        }
        MarkupElement root = document.root().get();
        Map<String, String> prefixes = prefixTable(document, root);
        writeElement(root, prefixes, 0, true, out);
        return out.toString();
    }

    public void write(UnifiedDocument document, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, write(document), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write migrated document: " + target, ex);
        }
    }

    // URI to prefix, in declaration order.
    private static Map<String, String> prefixTable(UnifiedDocument document, MarkupElement root) {
        Map<String, String> prefixes = new LinkedHashMap<>();
        document.namespaces().forEach((prefix, uri) -> prefixes.putIfAbsent(uri, prefix));
        boolean needsXaml = false;
        for (MarkupElement element : root.descendantsAndSelf()) {
            element.namespace().ifPresent(uri -> declare(prefixes, uri));
            needsXaml |= element.name().isPresent() || element.key().isPresent();
        }
        if (needsXaml) {
            declare(prefixes, XamlNamespaces.XAML);
        }
        return prefixes;
    }

    private static void declare(Map<String, String> prefixes, String uri) {
        if (prefixes.containsKey(uri)) {
            return;
        }
        boolean xaml = XamlNamespaces.XAML.equals(uri);
        if (!xaml && !prefixes.containsValue("")) {
            prefixes.put(uri, "");
            return;
        }
        String prefix = xaml ? "x" : "ns1";
        int counter = xaml ? 1 : 2;
        while (prefixes.containsValue(prefix)) {
            prefix = (xaml ? "x" : "ns") + counter++;
        }
        prefixes.put(uri, prefix);
    }

    private void writeElement(MarkupElement element, Map<String, String> prefixes, int depth, boolean root, StringBuilder out) {
        String tag = qualify(element, prefixes);
        indent(depth, out);
        out.append('<').append(tag);
        if (root) {
            prefixes.forEach((uri, prefix) -> attribute(prefix.isEmpty() ? "xmlns" : "xmlns:" + prefix, uri, out));
        }
        String xaml = prefixes.getOrDefault(XamlNamespaces.XAML, "x");
        element.name().ifPresent(name -> attribute(xaml + ":Name", name, out));
        element.key().ifPresent(key -> attribute(xaml + ":Key", key, out));
        for (MarkupProperty property : element.properties()) {
            PropertyValue value = property.value();
            if (value instanceof PropertyValue.Literal literal) {
                String text = literal.text().startsWith("{") ? "{}" + literal.text() : literal.text();
                attribute(property.name(), text, out);
            } else if (value instanceof PropertyValue.ExtensionValue extension) {
                attribute(property.name(), extension.extension().toMarkup(), out);
            }
        }

        boolean hasElementProperties = element.properties().stream().anyMatch(p -> p.elementValue().isPresent());
        if (element.children().isEmpty() && element.textContent().isEmpty() && !hasElementProperties) {
            out.append(" />\n");
            return;
        }
        if (element.children().isEmpty() && !hasElementProperties) {
            out.append('>').append(escape(element.textContent().get(), false)).append("</").append(tag).append(">\n");
            return;
        }
        out.append(">\n");
        element.textContent().ifPresent(text -> {
            indent(depth + 1, out);
            out.append(escape(text, false)).append('\n');
        });
        for (MarkupProperty property : element.properties()) {
            if (property.elementValue().isEmpty()) {
                continue;
            }
            writePropertyElement(element, property, prefixes, depth + 1, out);
        }
        for (MarkupElement child : element.children()) {
            writeElement(child, prefixes, depth + 1, false, out);
        }
        indent(depth, out);
        out.append("</").append(tag).append(">\n");
    }

    // <Owner.Property> around the value; a property-element collection contributes only its items.
    private void writePropertyElement(MarkupElement owner, MarkupProperty property, Map<String, String> prefixes, int depth,
                                      StringBuilder out) {
        MarkupElement value = property.elementValue().orElseThrow();
        String wrapper = qualifyName(property.isAttached() ? property.name() : owner.typeName() + "." + property.name(),
                owner.namespace().orElse(null), prefixes);
        indent(depth, out);
        out.append('<').append(wrapper);
        if (!value.isPropertyElement()) {
            out.append(">\n");
            writeElement(value, prefixes, depth + 1, false, out);
            indent(depth, out);
            out.append("</").append(wrapper).append(">\n");
            return;
        }
        if (value.children().isEmpty()) {
            Optional<String> text = value.textContent();
            out.append(text.isEmpty() ? " />\n" : ">" + escape(text.get(), false) + "</" + wrapper + ">\n");
            return;
        }
        out.append(">\n");
        value.textContent().ifPresent(text -> {
            indent(depth + 1, out);
            out.append(escape(text, false)).append('\n');
        });
        for (MarkupElement item : value.children()) {
            writeElement(item, prefixes, depth + 1, false, out);
        }
        indent(depth, out);
        out.append("</").append(wrapper).append(">\n");
    }

    private static String qualify(MarkupElement element, Map<String, String> prefixes) {
        return qualifyName(element.typeName(), element.namespace().orElse(null), prefixes);
    }

    private static String qualifyName(String name, String namespace, Map<String, String> prefixes) {
        if (namespace == null) {
            return name;
        }
        String prefix = prefixes.getOrDefault(namespace, "");
        return prefix.isEmpty() ? name : prefix + ":" + name;
    }

    private static void attribute(String name, String value, StringBuilder out) {
        out.append(' ').append(name).append("=\"").append(escape(value, true)).append('"');
    }

    private static void indent(int depth, StringBuilder out) {
        out.append(INDENT.repeat(depth));
    }

    static String escape(String text, boolean attribute) {
        StringBuilder escaped = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '&' -> escaped.append("&amp;");
                case '<' -> escaped.append("&lt;");
                case '>' -> escaped.append("&gt;");
                case '"' -> escaped.append(attribute ? "&quot;" : "\"");
                default -> escaped.append(ch);
            }
        }
        return escaped.toString();
    }
}
