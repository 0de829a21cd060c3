package toon.java17;

/// Thrown when a host object has no TOON representation.
public final class ToonUnsupportedTypeException extends ToonException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String type;

    public ToonUnsupportedTypeException(String type) {
        super("Unsupported type: " + type);
        this.type = type;
    }

    /// Returns a description of the rejected type.
    public String type() {
        return type;
    }
}
