package toon.java17;

import java.util.Optional;

/// The TOON `true` and `false` literals.
public record ToonBoolean(boolean value) implements ToonValue {

    public static final ToonBoolean TRUE = new ToonBoolean(true);
    public static final ToonBoolean FALSE = new ToonBoolean(false);

    public static ToonBoolean of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public Optional<Boolean> asBool() {
        return Optional.of(value);
    }

    @Override
    public String typeName() {
        return "bool";
    }

    @Override
    public String toString() {
        return Boolean.toString(value);
    }
}
