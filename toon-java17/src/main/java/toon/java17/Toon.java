package toon.java17;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// This class provides static methods for reading and writing TOON text and
/// for converting between {@link ToonValue} and plain Java objects.
///
/// TOON (Token-Oriented Object Notation) carries the JSON data model in an
/// indentation-based layout that states array lengths and writes uniform
/// arrays of objects as tables:
///
/// ```
/// users: [2]{active,id,name}:
///   true,1,Alice
///   true,2,Bob
/// tags: [3]: a,b,c
/// ```
///
/// Parsing is strict and reports the line and column of the first problem.
/// Writing is deterministic: the layout of every array is chosen by
/// {@link ToonFormat#select(List)} and strings are quoted only where
/// {@link ToonQuoting#needsQuotes(String, Delimiter)} requires it. For every
/// value `v` without special numbers, `parse(serialize(v, options))` equals `v`.
public final class Toon {

    private static final Logger LOG = Logger.getLogger(Toon.class.getName());

    private Toon() {
    }

    /// Parses TOON text.
    ///
    /// @param input the text; an empty document is an empty object
    /// @return the value, with tabular arrays given as arrays of objects
    /// @throws ToonParseException if the text is not valid TOON
    public static ToonValue parse(String input) {
        Objects.requireNonNull(input, "input must not be null");
        return normalize(ToonParser.parse(input));
    }

    /// Parses TOON text and hands the value to `sink`.
    ///
    /// @throws ToonParseException if the text is not valid TOON
    /// @throws ToonTypeException if the sink does not accept the value
    public static <T> T parse(String input, ToonSink<T> sink) {
        Objects.requireNonNull(sink, "sink must not be null");
        return parse(input).accept(sink);
    }

    /// Writes `value` with {@link ToonOptions#defaults()}.
    public static String serialize(ToonValue value) {
        return serialize(value, ToonOptions.defaults());
    }

    /// Writes `value` as TOON text.
    ///
    /// Special numbers (infinities and NaN) have no literal and are written
    /// as `null`.
    public static String serialize(ToonValue value, ToonOptions options) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(options, "options must not be null");
        return ToonWriter.write(value, options);
    }

    /// Writes the value `source` emits.
    ///
    /// @throws ToonException if the emitted events do not form one value
    public static String serialize(ToonSource source, ToonOptions options) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(options, "options must not be null");
        final var builder = new ToonValueBuilder();
        source.emitTo(builder);
        return serialize(builder.build(), options);
    }

    /// {@return a `ToonValue` for a plain Java object}
    ///
    /// Maps with `String` keys become objects, lists become arrays. `String`,
    /// `Character`, `Boolean`, the integral boxes, `Float`, `Double`,
    /// `BigDecimal`, `BigInteger`, `Instant` and `java.util.Date` map to the
    /// matching scalar, `null` to {@link ToonNull}. A `ToonValue` is returned
    /// as is.
    ///
    /// @throws ToonUnsupportedTypeException for any other type or a non-`String` key
    public static ToonValue fromUntyped(Object src) {
        if (src == null) {
            return ToonNull.of();
        }
        if (src instanceof ToonValue value) {
            return value;
        }
        if (src instanceof Map<?, ?> map) {
            final var members = new LinkedHashMap<String, ToonValue>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new ToonUnsupportedTypeException("map key " + describe(entry.getKey())
                            + ", keys must be strings");
                }
                members.put(key, fromUntyped(entry.getValue()));
            }
            return new ToonObject(members);
        }
        if (src instanceof List<?> list) {
            final var elements = new ArrayList<ToonValue>(list.size());
            for (Object o : list) {
                elements.add(fromUntyped(o));
            }
            return new ToonArray(elements);
        }
        if (src instanceof String s) {
            return ToonString.of(s);
        }
        if (src instanceof Character c) {
            return ToonString.of(c.toString());
        }
        if (src instanceof Boolean b) {
            return ToonBoolean.of(b);
        }
        if (src instanceof Long || src instanceof Integer || src instanceof Short || src instanceof Byte) {
            return ToonNumber.of(((Number) src).longValue());
        }
        if (src instanceof Double || src instanceof Float) {
            return ToonNumber.of(((Number) src).doubleValue());
        }
        if (src instanceof BigInteger big) {
            return ToonBigInt.of(big);
        }
        if (src instanceof BigDecimal decimal) {
            return ToonNumber.of(decimal.doubleValue());
        }
        if (src instanceof Instant instant) {
            return ToonDate.of(instant);
        }
        if (src instanceof Date date) {
            return ToonDate.of(date.toInstant());
        }
        throw new ToonUnsupportedTypeException(describe(src));
    }

    /// {@return a plain Java object for a `ToonValue`}
    ///
    /// Objects become insertion-ordered `Map`s, arrays and tables become
    /// `List`s, integers `Long`, other numbers `Double`, dates `Instant`, big
    /// integers `BigInteger` and `null` stays `null`.
    public static Object toUntyped(ToonValue src) {
        Objects.requireNonNull(src, "src must not be null");
        if (src instanceof ToonObject object) {
            final var map = new LinkedHashMap<String, Object>();
            object.members().forEach((k, v) -> map.put(k, toUntyped(v)));
            return map;
        }
        if (src instanceof ToonArray || src instanceof ToonTable) {
            final var list = new ArrayList<Object>();
            for (ToonValue element : src.elements()) {
                list.add(toUntyped(element));
            }
            return list;
        }
        if (src instanceof ToonNull) {
            return null;
        }
        if (src instanceof ToonBoolean b) {
            return b.value();
        }
        if (src instanceof ToonNumber.OfLong n) {
            return n.value();
        }
        if (src instanceof ToonNumber n) {
            return n.toDouble();
        }
        if (src instanceof ToonString s) {
            return s.value();
        }
        if (src instanceof ToonDate d) {
            return d.value();
        }
        return ((ToonBigInt) src).value();
    }

    /// Replaces every table in the tree by its array of objects.
    static ToonValue normalize(ToonValue value) {
        if (value instanceof ToonTable table) {
            LOG.finer(() -> "normalizing table of " + table.rows().size() + " rows");
            return table.toArray();
        }
        if (value instanceof ToonArray array) {
            final var elements = new ArrayList<ToonValue>(array.size());
            for (ToonValue element : array.elements()) {
                elements.add(normalize(element));
            }
            return new ToonArray(elements);
        }
        if (value instanceof ToonObject object) {
            final var members = new LinkedHashMap<String, ToonValue>();
            object.members().forEach((k, v) -> members.put(k, normalize(v)));
            return new ToonObject(members);
        }
        return value;
    }

    private static String describe(Object o) {
        return o == null ? "null" : o.getClass().getName();
    }
}
