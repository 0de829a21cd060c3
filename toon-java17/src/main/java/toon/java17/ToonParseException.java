package toon.java17;

import java.util.Objects;
import java.util.Optional;

/// Thrown when TOON text cannot be parsed.
///
/// Carries the 1-based line and column where the problem was detected, the
/// offending source line with a caret under the column, and an optional hint
/// on how to fix the input.
public class ToonParseException extends ToonException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String detail;
    private final int line;
    private final int column;
    private final String context;
    private final String suggestion;

    /// Creates a syntax error.
    ///
    /// @param detail what went wrong
    /// @param line 1-based line number
    /// @param column 1-based column number
    /// @param context the source snippet, may be empty
    /// @param suggestion optional fix hint, may be `null`
    public ToonParseException(String detail, int line, int column, String context, String suggestion) {
        this(formatMessage(detail, line, column, context, suggestion), detail, line, column, context, suggestion);
    }

    /// Used by subclasses that render their own message.
    protected ToonParseException(String message, String detail, int line, int column,
                                 String context, String suggestion) {
        super(message);
        this.detail = Objects.requireNonNull(detail, "detail must not be null");
        this.line = line;
        this.column = column;
        this.context = context == null ? "" : context;
        this.suggestion = suggestion;
    }

    private static String formatMessage(String detail, int line, int column, String context, String suggestion) {
        final var sb = new StringBuilder();
        sb.append("Syntax error at line ").append(line).append(", column ").append(column).append(":\n");
        if (context != null && !context.isEmpty()) {
            sb.append(context).append('\n');
        }
        sb.append(detail);
        if (suggestion != null) {
            sb.append("\nHelp: ").append(suggestion);
        }
        return sb.toString();
    }

    /// Returns the bare problem description without position or context.
    public String detail() {
        return detail;
    }

    /// Returns the 1-based line of the error.
    public int line() {
        return line;
    }

    /// Returns the 1-based column of the error.
    public int column() {
        return column;
    }

    /// Returns the source snippet around the error.
    public String context() {
        return context;
    }

    /// Returns the fix hint, if one is known.
    public Optional<String> suggestion() {
        return Optional.ofNullable(suggestion);
    }
}
