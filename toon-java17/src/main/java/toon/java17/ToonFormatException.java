package toon.java17;

/// Thrown when input is well formed token by token but breaks a structural
/// rule of the format, such as an array holding more or fewer values than its
/// header declares.
public final class ToonFormatException extends ToonParseException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    public ToonFormatException(String detail, int line, int column, String context) {
        super("Invalid TOON format at line " + line + ", column " + column + ": " + detail
                        + (context == null || context.isEmpty() ? "" : "\n" + context),
                detail, line, column, context, null);
    }
}
