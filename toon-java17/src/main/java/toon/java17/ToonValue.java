package toon.java17;

import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/// The interface that represents a TOON value.
///
/// Instances of `ToonValue` are immutable and thread safe.
///
/// A `ToonValue` is produced by {@link Toon#parse(String)}, by the factories
/// on each variant, or by {@link Toon#fromUntyped(Object)}. The `is*` and `as*`
/// methods inspect a value without failing. The accessors named after a kind
/// (`bool()`, `string()`, `members()` ...) assert the kind and throw
/// {@link ToonTypeException} on a mismatch.
public sealed interface ToonValue
        permits ToonNull, ToonBoolean, ToonNumber, ToonString, ToonArray, ToonObject,
        ToonTable, ToonDate, ToonBigInt {

    /// {@return the TOON text of this value written with default options}
    String toString();

    /// {@return a short lowercase name of this kind of value, used in diagnostics}
    String typeName();

    default boolean isNull() {
        return this instanceof ToonNull;
    }

    default boolean isBool() {
        return this instanceof ToonBoolean;
    }

    default boolean isNumber() {
        return this instanceof ToonNumber;
    }

    default boolean isString() {
        return this instanceof ToonString;
    }

    default boolean isArray() {
        return this instanceof ToonArray;
    }

    default boolean isObject() {
        return this instanceof ToonObject;
    }

    default boolean isTable() {
        return this instanceof ToonTable;
    }

    default boolean isDate() {
        return this instanceof ToonDate;
    }

    default boolean isBigInt() {
        return this instanceof ToonBigInt;
    }

    /// {@return `true` for values written as a single token: null, booleans,
    /// numbers, strings, dates and big integers}
    default boolean isPrimitive() {
        return !(this instanceof ToonArray || this instanceof ToonObject || this instanceof ToonTable);
    }

    default Optional<Boolean> asBool() {
        return Optional.empty();
    }

    default Optional<String> asString() {
        return Optional.empty();
    }

    /// {@return the value as a `long` when it is an integer, or a float holding
    /// a whole number within `long` range; empty otherwise}
    default OptionalLong asLong() {
        return OptionalLong.empty();
    }

    /// {@return the value as a `double`; present for every number, with the
    /// special numbers mapped to the IEEE infinities and NaN}
    default OptionalDouble asDouble() {
        return OptionalDouble.empty();
    }

    default Optional<List<ToonValue>> asArray() {
        return Optional.empty();
    }

    default Optional<Map<String, ToonValue>> asObject() {
        return Optional.empty();
    }

    default Optional<Instant> asDate() {
        return Optional.empty();
    }

    default Optional<BigInteger> asBigInt() {
        return Optional.empty();
    }

    /// {@return the `boolean` value represented by a `ToonBoolean`}
    default boolean bool() {
        return asBool().orElseThrow(() -> new ToonTypeException("bool", typeName()));
    }

    /// {@return the `String` value represented by a `ToonString`}
    default String string() {
        return asString().orElseThrow(() -> new ToonTypeException("string", typeName()));
    }

    /// {@return this value as a `long`}
    ///
    /// @throws ToonTypeException if this is not a number or has no exact `long` value
    default long toLong() {
        final OptionalLong result = asLong();
        if (result.isEmpty()) {
            throw new ToonTypeException("integer", isNumber() ? "number " + this : typeName());
        }
        return result.getAsLong();
    }

    /// {@return this value as a `double`}
    default double toDouble() {
        final OptionalDouble result = asDouble();
        if (result.isEmpty()) {
            throw new ToonTypeException("number", typeName());
        }
        return result.getAsDouble();
    }

    /// {@return the elements of a `ToonArray`, or the rows of a `ToonTable` as objects}
    default List<ToonValue> elements() {
        return asArray().orElseThrow(() -> new ToonTypeException("array", typeName()));
    }

    /// {@return the members of a `ToonObject`}
    default Map<String, ToonValue> members() {
        return asObject().orElseThrow(() -> new ToonTypeException("object", typeName()));
    }

    /// {@return the value associated with the given member name of a `ToonObject`}
    ///
    /// @param name the member name
    /// @throws ToonTypeException if this is not an object
    /// @throws ToonException if there is no member with that name
    default ToonValue get(String name) {
        Objects.requireNonNull(name, "name must not be null");
        final ToonValue value = members().get(name);
        if (value == null) {
            throw new ToonException("Object member \"%s\" does not exist.".formatted(name));
        }
        return value;
    }

    /// {@return the value at the given index of a `ToonArray`}
    ///
    /// @throws ToonTypeException if this is not an array
    /// @throws ToonException if the index is outside the bounds
    default ToonValue element(int index) {
        final List<ToonValue> elements = elements();
        if (index < 0 || index >= elements.size()) {
            throw new ToonException("Array index %d out of bounds for length %d."
                    .formatted(index, elements.size()));
        }
        return elements.get(index);
    }

    /// Hands this value to a sink. Tables arrive as arrays of objects.
    ///
    /// @param sink the receiving sink
    /// @param <T> the sink's result type
    /// @return whatever the sink produced
    default <T> T accept(ToonSink<T> sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        if (this instanceof ToonNull) {
            return sink.visitNull();
        } else if (this instanceof ToonBoolean b) {
            return sink.visitBool(b.value());
        } else if (this instanceof ToonNumber.OfLong n) {
            return sink.visitLong(n.value());
        } else if (this instanceof ToonNumber n) {
            return sink.visitDouble(n.toDouble());
        } else if (this instanceof ToonString s) {
            return sink.visitString(s.value());
        } else if (this instanceof ToonDate d) {
            return sink.visitDate(d.value());
        } else if (this instanceof ToonBigInt b) {
            return sink.visitBigInt(b.value());
        } else if (this instanceof ToonObject o) {
            return sink.visitObject(o.members());
        } else if (this instanceof ToonTable t) {
            return sink.visitArray(t.toArray().elements());
        } else {
            return sink.visitArray(((ToonArray) this).elements());
        }
    }
}
