package toon.java17;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for the value model: predicates, narrowing and equality.
class ToonValueTest extends ToonTestBase {

    @Test
    void testPredicates() {
        LOG.info(() -> "TEST: testPredicates");
        assertThat(ToonNull.of().isNull()).isTrue();
        assertThat(ToonBoolean.TRUE.isBool()).isTrue();
        assertThat(ToonNumber.of(1).isNumber()).isTrue();
        assertThat(ToonString.of("x").isString()).isTrue();
        assertThat(ToonArray.empty().isArray()).isTrue();
        assertThat(ToonObject.empty().isObject()).isTrue();
        assertThat(ToonDate.of(Instant.EPOCH).isDate()).isTrue();
        assertThat(ToonBigInt.of(BigInteger.TEN).isBigInt()).isTrue();
        assertThat(new ToonTable(List.of("a"), List.of()).isTable()).isTrue();
        assertThat(ToonString.of("x").isPrimitive()).isTrue();
        assertThat(ToonDate.of(Instant.EPOCH).isPrimitive()).isTrue();
        assertThat(ToonArray.empty().isPrimitive()).isFalse();
        assertThat(ToonObject.empty().isPrimitive()).isFalse();
    }

    @Test
    void testAsLongAcceptsWholeNumbersOnly() {
        LOG.info(() -> "TEST: testAsLongAcceptsWholeNumbersOnly");
        assertThat(ToonNumber.of(42).asLong()).hasValue(42L);
        assertThat(ToonNumber.of(42.0).asLong()).hasValue(42L);
        assertThat(ToonNumber.of(-3.0).asLong()).hasValue(-3L);
        assertThat(ToonNumber.of(42.5).asLong()).isEmpty();
        assertThat(ToonNumber.of(1.0E19).asLong()).isEmpty();
        assertThat(ToonNumber.of(Double.NaN).asLong()).isEmpty();
        assertThat(ToonNumber.of(Double.POSITIVE_INFINITY).asLong()).isEmpty();
        assertThat(ToonString.of("42").asLong()).isEmpty();
    }

    @Test
    void testAsDoubleCoversEveryNumber() {
        LOG.info(() -> "TEST: testAsDoubleCoversEveryNumber");
        assertThat(ToonNumber.of(7).asDouble()).hasValue(7.0);
        assertThat(ToonNumber.of(2.5).asDouble()).hasValue(2.5);
        assertThat(ToonNumber.Special.INFINITY.asDouble()).hasValue(Double.POSITIVE_INFINITY);
        assertThat(ToonNumber.Special.NEGATIVE_INFINITY.asDouble()).hasValue(Double.NEGATIVE_INFINITY);
        assertThat(ToonNumber.Special.NAN.toDouble()).isNaN();
        assertThat(ToonBoolean.TRUE.asDouble()).isEmpty();
    }

    @Test
    void testNumberEqualityFollowsCanonicalText() {
        LOG.info(() -> "TEST: testNumberEqualityFollowsCanonicalText");
        assertThat(ToonNumber.of(2)).isEqualTo(ToonNumber.of(2.0));
        assertThat(ToonNumber.of(2.0)).isEqualTo(ToonNumber.of(2));
        assertThat(ToonNumber.of(-0.0)).isEqualTo(ToonNumber.of(0));
        assertThat(ToonNumber.of(2).hashCode()).isEqualTo(ToonNumber.of(2.0).hashCode());
        assertThat(ToonNumber.of(0.1)).isNotEqualTo(ToonNumber.of(0.10000000000000002));
        assertThat(ToonNumber.of(Double.NaN)).isSameAs(ToonNumber.Special.NAN);
        assertThat(ToonNumber.of(1.0E-7).canonical()).isEqualTo("0.0000001");
    }

    @Test
    void testNarrowingOfOtherKinds() {
        LOG.info(() -> "TEST: testNarrowingOfOtherKinds");
        assertThat(ToonBoolean.of(false).asBool()).contains(false);
        assertThat(ToonString.of("s").asString()).contains("s");
        assertThat(ToonNumber.of(1).asString()).isEmpty();
        assertThat(ToonDate.of(Instant.EPOCH).asDate()).contains(Instant.EPOCH);
        assertThat(ToonBigInt.of(BigInteger.ONE).asBigInt()).contains(BigInteger.ONE);
        assertThat(ToonArray.of(ToonNull.of()).asArray()).hasValueSatisfying(l -> assertThat(l).hasSize(1));
        assertThat(ToonArray.empty().asObject()).isEmpty();
    }

    @Test
    void testAssertingAccessorsThrowTypeMismatch() {
        LOG.info(() -> "TEST: testAssertingAccessorsThrowTypeMismatch");
        assertThatThrownBy(() -> ToonNumber.of(1).string())
                .isInstanceOf(ToonTypeException.class)
                .hasMessage("Type mismatch: expected string, found number");
        assertThatThrownBy(() -> ToonString.of("x").members())
                .isInstanceOf(ToonTypeException.class)
                .satisfies(e -> {
                    final var ex = (ToonTypeException) e;
                    assertThat(ex.expected()).isEqualTo("object");
                    assertThat(ex.found()).isEqualTo("string");
                    assertThat(ex.line()).isEmpty();
                });
        assertThatThrownBy(() -> ToonNumber.of(1.5).toLong())
                .isInstanceOf(ToonTypeException.class)
                .hasMessageContaining("found number 1.5");
        assertThatThrownBy(() -> ToonObject.empty().get("missing"))
                .isInstanceOf(ToonException.class)
                .hasMessageContaining("\"missing\" does not exist");
        assertThatThrownBy(() -> ToonArray.empty().element(0))
                .isInstanceOf(ToonException.class)
                .hasMessageContaining("out of bounds");
    }

    @Test
    void testObjectKeepsOrderButComparesAsMap() {
        LOG.info(() -> "TEST: testObjectKeepsOrderButComparesAsMap");
        final var ab = ToonObject.builder().put("a", 1).put("b", "x").build();
        final var ba = ToonObject.builder().put("b", "x").put("a", 1).build();
        assertThat(ab.members().keySet()).containsExactly("a", "b");
        assertThat(ba.members().keySet()).containsExactly("b", "a");
        assertThat(ab).isEqualTo(ba);
        assertThat(ab.hashCode()).isEqualTo(ba.hashCode());
    }

    @Test
    void testBuilderReplacesInPlace() {
        LOG.info(() -> "TEST: testBuilderReplacesInPlace");
        final var object = ToonObject.builder().put("a", 1).put("b", 2).put("a", true).build();
        assertThat(object.members().keySet()).containsExactly("a", "b");
        assertThat(object.get("a")).isEqualTo(ToonBoolean.TRUE);
    }

    @Test
    void testObjectIsImmutableCopy() {
        LOG.info(() -> "TEST: testObjectIsImmutableCopy");
        final var source = new LinkedHashMap<String, ToonValue>();
        source.put("a", ToonNumber.of(1));
        final var object = new ToonObject(source);
        source.put("b", ToonNumber.of(2));
        assertThat(object.size()).isEqualTo(1);
        assertThatThrownBy(() -> object.members().put("c", ToonNull.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testTableValidatesRows() {
        LOG.info(() -> "TEST: testTableValidatesRows");
        assertThatThrownBy(() -> new ToonTable(List.of("a", "b"), List.of(List.of(ToonNumber.of(1)))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has 1 values but the table has 2 fields");
        assertThatThrownBy(() -> new ToonTable(List.of("a", "a"), List.of()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ToonTable(List.of("a"), List.of(List.of(ToonArray.empty()))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testTableToArray() {
        LOG.info(() -> "TEST: testTableToArray");
        final var table = new ToonTable(List.of("id", "name"), List.of(
                List.of(ToonNumber.of(1), ToonString.of("Alice")),
                List.of(ToonNumber.of(2), ToonString.of("Bob"))));
        assertThat(table.toArray()).isEqualTo(json("[{\"id\":1,\"name\":\"Alice\"},{\"id\":2,\"name\":\"Bob\"}]"));
        assertThat(table.elements()).hasSize(2);
        assertThat(table.toArray().element(1).members().keySet()).containsExactly("id", "name");
    }

    @Test
    void testToStringIsToonText() {
        LOG.info(() -> "TEST: testToStringIsToonText");
        assertThat(ToonString.of("a:b").toString()).isEqualTo("\"a:b\"");
        assertThat(ToonNumber.of(3.0).toString()).isEqualTo("3");
        assertThat(ToonBigInt.of(BigInteger.TWO).toString()).isEqualTo("2n");
        assertThat(json("{\"a\":[1,2]}").toString()).isEqualTo("a: [2]: 1,2");
    }
}
