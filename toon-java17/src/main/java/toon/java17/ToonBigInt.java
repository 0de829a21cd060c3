package toon.java17;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/// An arbitrary-precision integer, written as its decimal digits followed by
/// `n`, for example `123456789012345678901234567890n`.
public record ToonBigInt(BigInteger value) implements ToonValue {

    public ToonBigInt {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static ToonBigInt of(BigInteger value) {
        return new ToonBigInt(value);
    }

    @Override
    public Optional<BigInteger> asBigInt() {
        return Optional.of(value);
    }

    @Override
    public String typeName() {
        return "bigint";
    }

    @Override
    public String toString() {
        return value + "n";
    }
}
