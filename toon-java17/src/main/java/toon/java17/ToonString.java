package toon.java17;

import java.util.Objects;
import java.util.Optional;

/// A TOON string. Whether it is written bare or quoted is decided at write time
/// by {@link ToonQuoting}.
public record ToonString(String value) implements ToonValue {

    public ToonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static ToonString of(String value) {
        return new ToonString(value);
    }

    @Override
    public Optional<String> asString() {
        return Optional.of(value);
    }

    @Override
    public String typeName() {
        return "string";
    }

    @Override
    public String toString() {
        return Toon.serialize(this);
    }
}
