package dev.uimigrator.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * An inline expression such as {@code {Binding Path=Name, Mode=TwoWay}}: a name, ordered positional
 * arguments and named parameters in declaration order.
 */
public final class MarkupExtension extends MarkupNode {

    private String name;
    private final List<ExtensionArgument> positional = new ArrayList<>();
    private final Map<String, ExtensionArgument> named = new LinkedHashMap<>();

    public MarkupExtension(String name) {
        setName(name);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.MARKUP_EXTENSION;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Markup extension name must not be blank");
        }
        this.name = name.trim();
    }

    /**
     * Returns true when the name matches either the bare or the {@code x:}-prefixed form.
     */
    public boolean isNamed(String candidate) {
        return name.equals(candidate) || name.equals("x:" + candidate);
    }

    public List<ExtensionArgument> positionalArguments() {
        return Collections.unmodifiableList(positional);
    }

    public Optional<ExtensionArgument> firstPositional() {
        return positional.isEmpty() ? Optional.empty() : Optional.of(positional.get(0));
    }

    public MarkupExtension addPositional(ExtensionArgument argument) {
        positional.add(Objects.requireNonNull(argument, "argument"));
        return this;
    }

    public MarkupExtension addPositional(String text) {
        return addPositional(ExtensionArgument.text(text));
    }

    public void setPositional(int index, ExtensionArgument argument) {
        positional.set(index, Objects.requireNonNull(argument, "argument"));
    }

    public void setOnlyPositional(String text) {
        positional.clear();
        positional.add(ExtensionArgument.text(text));
    }

    public void removePositional(int index) {
        positional.remove(index);
    }

    public Map<String, ExtensionArgument> namedArguments() {
        return Collections.unmodifiableMap(named);
    }

    public Optional<ExtensionArgument> namedArgument(String key) {
        return Optional.ofNullable(named.get(key));
    }

    public Optional<String> namedText(String key) {
        return namedArgument(key).flatMap(ExtensionArgument::text);
    }

    public boolean hasNamedArgument(String key) {
        return named.containsKey(key);
    }

    public MarkupExtension setNamedArgument(String key, ExtensionArgument argument) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Argument name must not be blank");
        }
        named.put(key, Objects.requireNonNull(argument, "argument"));
        return this;
    }

    public MarkupExtension setNamedArgument(String key, String text) {
        return setNamedArgument(key, ExtensionArgument.text(text));
    }

    public Optional<ExtensionArgument> removeNamedArgument(String key) {
        return Optional.ofNullable(named.remove(key));
    }

    /**
     * Binding path taken from {@code Path=} or, failing that, the first positional argument.
     */
    public Optional<String> pathArgument() {
        Optional<String> path = namedText("Path");
        if (path.isPresent()) {
            return path;
        }
        return firstPositional().flatMap(ExtensionArgument::text);
    }

    public MarkupExtension deepCopy() {
        MarkupExtension copy = new MarkupExtension(name);
        copy.setLocation(location().orElse(null));
        positional.forEach(argument -> copy.positional.add(argument.deepCopy()));
        named.forEach((key, argument) -> copy.named.put(key, argument.deepCopy()));
        return copy;
    }

    public String toMarkup() {
        StringJoiner arguments = new StringJoiner(", ");
        positional.forEach(argument -> arguments.add(argument.render()));
        named.forEach((key, argument) -> arguments.add(key + '=' + argument.render()));
        String rendered = arguments.toString();
        return rendered.isEmpty() ? '{' + name + '}' : '{' + name + ' ' + rendered + '}';
    }

    @Override
    public String toString() {
        return toMarkup();
    }
}
