package toon.java17;

import java.util.Objects;
import java.util.OptionalInt;

/// Thrown when a value of one kind is used where another kind is required,
/// for example calling {@link ToonValue#string()} on a number.
public final class ToonTypeException extends ToonException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;
    private final int line;
    private final int column;

    public ToonTypeException(String expected, String found) {
        this(expected, found, -1, -1);
    }

    public ToonTypeException(String expected, String found, int line, int column) {
        super(formatMessage(expected, found, line, column));
        this.expected = Objects.requireNonNull(expected, "expected must not be null");
        this.found = Objects.requireNonNull(found, "found must not be null");
        this.line = line;
        this.column = column;
    }

    private static String formatMessage(String expected, String found, int line, int column) {
        if (line < 1) {
            return "Type mismatch: expected " + expected + ", found " + found;
        }
        return "Type mismatch at line " + line + ", column " + column
                + ": expected " + expected + ", found " + found;
    }

    public String expected() {
        return expected;
    }

    public String found() {
        return found;
    }

    /// Returns the 1-based line, when the mismatch is tied to a source position.
    public OptionalInt line() {
        return line < 1 ? OptionalInt.empty() : OptionalInt.of(line);
    }

    /// Returns the 1-based column, when the mismatch is tied to a source position.
    public OptionalInt column() {
        return column < 1 ? OptionalInt.empty() : OptionalInt.of(column);
    }
}
