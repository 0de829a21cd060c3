package toon.java17;

import java.math.BigDecimal;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/// A TOON number: an exact 64-bit integer, a double, or one of the special
/// values infinity, negative infinity and NaN.
///
/// Two numbers are equal when their {@linkplain #canonical() canonical text}
/// is equal, so `ToonNumber.of(2)` equals `ToonNumber.of(2.0)` and negative
/// zero equals zero. This is the equality a value has after being written and
/// read back.
///
/// Special numbers have no TOON literal and are written as `null`.
public sealed interface ToonNumber extends ToonValue
        permits ToonNumber.OfLong, ToonNumber.OfDouble, ToonNumber.Special {

    static ToonNumber of(long value) {
        return new OfLong(value);
    }

    /// {@return a number for the given double; non-finite input maps to a
    /// {@link Special} constant}
    static ToonNumber of(double value) {
        if (Double.isNaN(value)) {
            return Special.NAN;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? Special.INFINITY : Special.NEGATIVE_INFINITY;
        }
        return new OfDouble(value);
    }

    /// {@return the plain decimal text of this number, never in scientific
    /// notation, without trailing fractional zeros}
    String canonical();

    @Override
    default String typeName() {
        return "number";
    }

    /// An exact 64-bit integer.
    record OfLong(long value) implements ToonNumber {

        @Override
        public String canonical() {
            return Long.toString(value);
        }

        @Override
        public OptionalLong asLong() {
            return OptionalLong.of(value);
        }

        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ToonNumber other && canonical().equals(other.canonical());
        }

        @Override
        public int hashCode() {
            return canonical().hashCode();
        }

        @Override
        public String toString() {
            return canonical();
        }
    }

    /// A finite double.
    record OfDouble(double value) implements ToonNumber {

        // 2^63 as a double; the first whole double outside long range
        private static final double LONG_LIMIT = 9.223372036854775808E18;

        public OfDouble {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException("Non-finite double " + value + " must use ToonNumber.Special");
            }
        }

        @Override
        public String canonical() {
            if (value == 0.0d) {
                return "0";
            }
            return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
        }

        @Override
        public OptionalLong asLong() {
            if (value == Math.rint(value) && value >= -LONG_LIMIT && value < LONG_LIMIT) {
                return OptionalLong.of((long) value);
            }
            return OptionalLong.empty();
        }

        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(value);
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof ToonNumber other && canonical().equals(other.canonical());
        }

        @Override
        public int hashCode() {
            return canonical().hashCode();
        }

        @Override
        public String toString() {
            return canonical();
        }
    }

    /// The non-finite doubles.
    enum Special implements ToonNumber {
        INFINITY("Infinity", Double.POSITIVE_INFINITY),
        NEGATIVE_INFINITY("-Infinity", Double.NEGATIVE_INFINITY),
        NAN("NaN", Double.NaN);

        private final String canonical;
        private final double value;

        Special(String canonical, double value) {
            this.canonical = canonical;
            this.value = value;
        }

        @Override
        public String canonical() {
            return canonical;
        }

        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(value);
        }

        @Override
        public String toString() {
            return canonical;
        }
    }
}
