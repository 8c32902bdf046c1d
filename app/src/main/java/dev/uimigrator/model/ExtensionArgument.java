package dev.uimigrator.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A positional or named argument of a markup extension: plain text or a nested extension.
 */
public interface ExtensionArgument {

    String render();

    ExtensionArgument deepCopy();

    default Optional<String> text() {
        return Optional.empty();
    }

    default Optional<MarkupExtension> extension() {
        return Optional.empty();
    }

    static ExtensionArgument text(String value) {
        return new Text(value);
    }

    static ExtensionArgument nested(MarkupExtension extension) {
        return new Nested(extension);
    }

    record Text(String value) implements ExtensionArgument {

        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            if (needsQuoting(value)) {
                return '\'' + value.replace("'", "\\'") + '\'';
            }
            return value;
        }

        @Override
        public ExtensionArgument deepCopy() {
            return this;
        }

        @Override
        public Optional<String> text() {
            return Optional.of(value);
        }

        private static boolean needsQuoting(String value) {
            if (value.isEmpty() || !value.equals(value.trim())) {
                return true;
            }
            for (int i = 0; i < value.length(); i++) {
                char ch = value.charAt(i);
                if (ch == ',' || ch == '{' || ch == '}' || ch == '=' || ch == '\'' || ch == '"') {
                    return true;
                }
            }
            return false;
        }
    }

    record Nested(MarkupExtension value) implements ExtensionArgument {

        public Nested {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String render() {
            return value.toMarkup();
        }

        @Override
        public ExtensionArgument deepCopy() {
            return new Nested(value.deepCopy());
        }

        @Override
        public Optional<MarkupExtension> extension() {
            return Optional.of(value);
        }
    }
}
