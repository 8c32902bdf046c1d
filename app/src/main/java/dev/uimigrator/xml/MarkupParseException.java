package dev.uimigrator.xml;

/**
 * Markup that cannot be read: malformed XML or an unbalanced markup extension.
 */
public class MarkupParseException extends RuntimeException {

    private final int line;
    private final int column;

    public MarkupParseException(String message) {
        this(message, -1, -1, null);
    }

    public MarkupParseException(String message, int line, int column, Throwable cause) {
        super(message, cause);
        this.line = line;
        this.column = column;
    }

    /**
     * One-based line, or -1 when unknown.
     */
    public int line() {
        return line;
    }

    public int column() {
        return column;
    }
}
