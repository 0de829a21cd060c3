package toon.java17;

/// Thrown when a line is indented where a sibling field was expected.
public final class ToonIndentationException extends ToonParseException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private static final String HELP = "Fields of one object must start at the same column";

    private final int expected;
    private final int found;

    public ToonIndentationException(int expected, int found, int line, int column, String context) {
        super(formatMessage(expected, found, line, column, context),
                "Expected " + expected + " spaces, found " + found + " spaces",
                line, column, context, HELP);
        this.expected = expected;
        this.found = found;
    }

    private static String formatMessage(int expected, int found, int line, int column, String context) {
        return "Indentation error at line " + line + ", column " + column + ":\n"
                + context + "\n"
                + "Expected " + expected + " spaces, found " + found + " spaces\n"
                + "Help: " + HELP;
    }

    /// Returns the indentation, in spaces, the parser expected.
    public int expected() {
        return expected;
    }

    /// Returns the indentation, in spaces, actually found.
    public int found() {
        return found;
    }
}
