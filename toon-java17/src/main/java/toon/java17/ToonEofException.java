package toon.java17;

/// Thrown when the input ends while a value is still incomplete.
public final class ToonEofException extends ToonParseException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String expected;

    public ToonEofException(String expected, int line, int column, String context) {
        super("Unexpected end of input at line " + line + ", column " + column + "\n"
                        + context + "\nExpected: " + expected,
                "Unexpected end of input, expected " + expected, line, column, context, null);
        this.expected = expected;
    }

    /// Returns a description of what the parser was waiting for.
    public String expected() {
        return expected;
    }
}
