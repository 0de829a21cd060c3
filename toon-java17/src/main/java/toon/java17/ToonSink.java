package toon.java17;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/// Receives a parsed value and turns it into something else.
///
/// Pass a sink to {@link Toon#parse(String, ToonSink)} or
/// {@link ToonValue#accept(ToonSink)}. Exactly one `visit` method is called
/// for the value. Override the ones the target type understands; the others
/// reject the value with a {@link ToonTypeException} naming
/// {@link #expecting()}.
///
/// Tables arrive through {@link #visitArray(List)} as lists of objects, and
/// special numbers through {@link #visitDouble(double)} as infinities and NaN.
///
/// @param <T> the produced type
public interface ToonSink<T> {

    /// {@return what this sink accepts, for error messages}
    default String expecting() {
        return "a TOON value";
    }

    default T visitNull() {
        throw mismatch("null");
    }

    default T visitBool(boolean value) {
        throw mismatch("bool");
    }

    default T visitLong(long value) {
        throw mismatch("integer");
    }

    default T visitDouble(double value) {
        throw mismatch("number");
    }

    default T visitString(String value) {
        throw mismatch("string");
    }

    default T visitDate(Instant value) {
        throw mismatch("date");
    }

    default T visitBigInt(BigInteger value) {
        throw mismatch("bigint");
    }

    default T visitArray(List<ToonValue> elements) {
        throw mismatch("array");
    }

    default T visitObject(Map<String, ToonValue> members) {
        throw mismatch("object");
    }

    private ToonTypeException mismatch(String found) {
        return new ToonTypeException(expecting(), found);
    }
}
