package dev.uimigrator.xml;

import dev.uimigrator.model.ExtensionArgument;
import dev.uimigrator.model.MarkupExtension;

/**
 * Recursive-descent parser for attribute values such as
 * {@code {Binding Path=Name, RelativeSource={RelativeSource AncestorType={x:Type Grid}}}}.
 *
 * <p>Arguments are plain text, quoted text ({@code '...'} or {@code "..."}, backslash escapes) or nested
 * extensions. A value starting with {@code {}} is literal text, braces included.
 */
public class MarkupExtensionParser {

    /**
     * True when the attribute value is a markup extension rather than literal text.
     */
    public static boolean isMarkupExtension(String value) {
        if (value == null) {
            return false;
        }
        String trimmed = value.trim();
        return trimmed.startsWith("{") && !trimmed.startsWith("{}");
    }

    public MarkupExtension parse(String text) {
        if (text == null) {
            throw new MarkupParseException("Markup extension text is null");
        }
        Cursor cursor = new Cursor(text);
        cursor.skipWhitespace();
        MarkupExtension extension = parseExtension(cursor);
        cursor.skipWhitespace();
        if (!cursor.atEnd()) {
            throw cursor.error("Unexpected trailing text");
        }
        return extension;
    }

    private MarkupExtension parseExtension(Cursor cursor) {
        cursor.expect('{');
        cursor.skipWhitespace();
        int start = cursor.position;
        while (!cursor.atEnd() && !Character.isWhitespace(cursor.peek()) && cursor.peek() != '}' && cursor.peek() != ',') {
            cursor.position++;
        }
        String name = cursor.text.substring(start, cursor.position);
        if (name.isEmpty()) {
            throw cursor.error("Markup extension name is missing");
        }
        MarkupExtension extension = new MarkupExtension(name);
        cursor.skipWhitespace();
        if (cursor.peekIs('}')) {
            cursor.position++;
            return extension;
        }
        while (true) {
            parseArgument(cursor, extension);
            cursor.skipWhitespace();
            if (cursor.peekIs(',')) {
                cursor.position++;
                continue;
            }
            if (cursor.peekIs('}')) {
                cursor.position++;
                return extension;
            }
            throw cursor.error("Expected ',' or '}'");
        }
    }

    private void parseArgument(Cursor cursor, MarkupExtension extension) {
        cursor.skipWhitespace();
        if (cursor.peekIs('{') && !cursor.startsWith("{}")) {
            extension.addPositional(ExtensionArgument.nested(parseExtension(cursor)));
            return;
        }
        if (cursor.peekIs('\'') || cursor.peekIs('"')) {
            extension.addPositional(ExtensionArgument.text(readQuoted(cursor)));
            return;
        }
        int mark = cursor.position;
        String token = readBare(cursor, true);
        if (cursor.peekIs('=')) {
            cursor.position++;
            String key = token.trim();
            if (key.isEmpty()) {
                throw cursor.error("Argument name is missing");
            }
            extension.setNamedArgument(key, parseValue(cursor));
            return;
        }
        cursor.position = mark;
        extension.addPositional(ExtensionArgument.text(readBare(cursor, false).trim()));
    }

    private ExtensionArgument parseValue(Cursor cursor) {
        cursor.skipWhitespace();
        if (cursor.startsWith("{}")) {
            cursor.position += 2;
            return ExtensionArgument.text(readBare(cursor, false).trim());
        }
        if (cursor.peekIs('{')) {
            return ExtensionArgument.nested(parseExtension(cursor));
        }
        if (cursor.peekIs('\'') || cursor.peekIs('"')) {
            return ExtensionArgument.text(readQuoted(cursor));
        }
        return ExtensionArgument.text(readBare(cursor, false).trim());
    }

    // Reads up to a top-level ',' or '}' (and '=' when reading a possible key). Braces opened inside
    // the value, as in a format string, are balanced.
    private String readBare(Cursor cursor, boolean stopAtEquals) {
        StringBuilder value = new StringBuilder();
        int depth = 0;
        while (!cursor.atEnd()) {
            char ch = cursor.peek();
            if (ch == '\\' && cursor.position + 1 < cursor.text.length()) {
                value.append(cursor.text.charAt(cursor.position + 1));
                cursor.position += 2;
                continue;
            }
            if (depth == 0 && (ch == ',' || ch == '}' || (stopAtEquals && ch == '='))) {
                break;
            }
            if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
            }
            value.append(ch);
            cursor.position++;
        }
        return value.toString();
    }

    private String readQuoted(Cursor cursor) {
        char quote = cursor.peek();
        cursor.position++;
        StringBuilder value = new StringBuilder();
        while (!cursor.atEnd()) {
            char ch = cursor.peek();
            if (ch == '\\' && cursor.position + 1 < cursor.text.length()) {
                value.append(cursor.text.charAt(cursor.position + 1));
                cursor.position += 2;
                continue;
            }
            cursor.position++;
            if (ch == quote) {
                return value.toString();
            }
            value.append(ch);
        }
        throw cursor.error("Unterminated quoted value");
    }

    private static final class Cursor {

        private final String text;
        private int position;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return position >= text.length();
        }

        char peek() {
            return text.charAt(position);
        }

        boolean peekIs(char expected) {
            return !atEnd() && text.charAt(position) == expected;
        }

        boolean startsWith(String prefix) {
            return text.startsWith(prefix, position);
        }

        void expect(char expected) {
            if (!peekIs(expected)) {
                throw error("Expected '" + expected + "'");
            }
            position++;
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(peek())) {
                position++;
            }
        }

        MarkupParseException error(String message) {
            return new MarkupParseException(message + " at offset " + position + " in " + text);
        }
    }
}
