package toon.java17;

/// The TOON `null` literal.
public record ToonNull() implements ToonValue {

    private static final ToonNull INSTANCE = new ToonNull();

    /// {@return the shared `null` value}
    public static ToonNull of() {
        return INSTANCE;
    }

    @Override
    public String typeName() {
        return "null";
    }

    @Override
    public String toString() {
        return "null";
    }
}
