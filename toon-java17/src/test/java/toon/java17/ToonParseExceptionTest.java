package toon.java17;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Unit tests for parse error kinds, positions and messages.
class ToonParseExceptionTest extends ToonTestBase {

    @Test
    void testDeeperSiblingIsIndentationError() {
        LOG.info(() -> "TEST: testDeeperSiblingIsIndentationError");
        assertThatThrownBy(() -> Toon.parse("a: 1\n  b: 2"))
                .isInstanceOf(ToonIndentationException.class)
                .satisfies(e -> {
                    final var ex = (ToonIndentationException) e;
                    assertThat(ex.line()).isEqualTo(2);
                    assertThat(ex.column()).isEqualTo(3);
                    assertThat(ex.expected()).isZero();
                    assertThat(ex.found()).isEqualTo(2);
                    assertThat(ex.getMessage()).startsWith("Indentation error at line 2, column 3:");
                    assertThat(ex.getMessage()).contains("Expected 0 spaces, found 2 spaces");
                    assertThat(ex.context()).contains("  b: 2").contains("^");
                });
    }

    @Test
    void testInlineArrayWithTooFewValues() {
        LOG.info(() -> "TEST: testInlineArrayWithTooFewValues");
        assertThatThrownBy(() -> Toon.parse("[3]: 1,2"))
                .isInstanceOf(ToonFormatException.class)
                .satisfies(e -> {
                    final var ex = (ToonFormatException) e;
                    assertThat(ex.line()).isEqualTo(1);
                    assertThat(ex.column()).isEqualTo(9);
                    assertThat(ex.getMessage())
                            .startsWith("Invalid TOON format at line 1, column 9: Inline array has 2 values, expected 3");
                });
    }

    @Test
    void testInlineArrayWithTooManyValues() {
        LOG.info(() -> "TEST: testInlineArrayWithTooManyValues");
        assertThatThrownBy(() -> Toon.parse("[2]: 1,2,3"))
                .isInstanceOf(ToonFormatException.class)
                .hasMessageContaining("more than 2 values");
    }

    @Test
    void testShortTableRow() {
        LOG.info(() -> "TEST: testShortTableRow");
        assertThatThrownBy(() -> Toon.parse("[2]{a,b}:\n  1\n  3,4"))
                .isInstanceOf(ToonFormatException.class)
                .satisfies(e -> {
                    final var ex = (ToonFormatException) e;
                    assertThat(ex.line()).isEqualTo(2);
                    assertThat(ex.detail()).isEqualTo("Row 1 has 1 values, expected 2");
                });
    }

    @Test
    void testExtraRowsAndItemsAreReported() {
        LOG.info(() -> "TEST: testExtraRowsAndItemsAreReported");
        assertThatThrownBy(() -> Toon.parse("users: [1]{id}:\n  1\n  2\ncount: 1"))
                .isInstanceOf(ToonFormatException.class)
                .hasMessageContaining("Table declares 1 rows but more follow");
        assertThatThrownBy(() -> Toon.parse("[1]:\n  - a\n  - b"))
                .isInstanceOf(ToonFormatException.class)
                .hasMessageContaining("List declares 1 items but more follow");
    }

    @Test
    void testMissingListItemIsEndOfInput() {
        LOG.info(() -> "TEST: testMissingListItemIsEndOfInput");
        assertThatThrownBy(() -> Toon.parse("[2]:\n  - a"))
                .isInstanceOf(ToonEofException.class)
                .satisfies(e -> {
                    final var ex = (ToonEofException) e;
                    assertThat(ex.line()).isEqualTo(2);
                    assertThat(ex.column()).isEqualTo(6);
                    assertThat(ex.expected()).isEqualTo("list item 2 of 2");
                    assertThat(ex.getMessage()).startsWith("Unexpected end of input at line 2, column 6");
                    assertThat(ex.getMessage()).endsWith("Expected: list item 2 of 2");
                });
        assertThatThrownBy(() -> Toon.parse("[2]{a}:\n  1"))
                .isInstanceOf(ToonEofException.class)
                .hasMessageContaining("row 2 of 2");
    }

    @Test
    void testUnterminatedStrings() {
        LOG.info(() -> "TEST: testUnterminatedStrings");
        assertThatThrownBy(() -> Toon.parse("a: \"abc"))
                .isInstanceOf(ToonEofException.class);
        assertThatThrownBy(() -> Toon.parse("a: \"abc\nb: 1"))
                .isInstanceOf(ToonParseException.class)
                .satisfies(e -> {
                    final var ex = (ToonParseException) e;
                    assertThat(ex.line()).isEqualTo(1);
                    assertThat(ex.column()).isEqualTo(4);
                    assertThat(ex.detail()).isEqualTo("Unterminated string");
                    assertThat(ex.suggestion()).isPresent();
                });
    }

    @Test
    void testMalformedUnicodeEscape() {
        LOG.info(() -> "TEST: testMalformedUnicodeEscape");
        assertThatThrownBy(() -> Toon.parse("a: \"\\u12G4\""))
                .isInstanceOf(ToonParseException.class)
                .hasMessageContaining("Invalid unicode escape sequence");
        assertThatThrownBy(() -> Toon.parse("a: \"\\u12\""))
                .isInstanceOf(ToonParseException.class)
                .hasMessageContaining("Invalid unicode escape sequence");
    }

    @Test
    void testIntegerOutOfRange() {
        LOG.info(() -> "TEST: testIntegerOutOfRange");
        assertThatThrownBy(() -> Toon.parse("a: 99999999999999999999"))
                .isInstanceOf(ToonParseException.class)
                .satisfies(e -> {
                    final var ex = (ToonParseException) e;
                    assertThat(ex.getMessage()).startsWith("Syntax error at line 1, column 4:");
                    assertThat(ex.detail()).isEqualTo("Integer out of range: 99999999999999999999");
                    assertThat(ex.suggestion()).hasValueSatisfying(s -> assertThat(s).contains("99999999999999999999n"));
                });
    }

    @Test
    void testHeaderWithoutColon() {
        LOG.info(() -> "TEST: testHeaderWithoutColon");
        assertThatThrownBy(() -> Toon.parse("[2]"))
                .isInstanceOf(ToonParseException.class)
                .hasMessageContaining("Expected ':' after the array header");
    }

    @Test
    void testLeftoverLineSuggestsField() {
        LOG.info(() -> "TEST: testLeftoverLineSuggestsField");
        assertThatThrownBy(() -> Toon.parse("x: 1\nhello"))
                .isInstanceOf(ToonParseException.class)
                .satisfies(e -> {
                    final var ex = (ToonParseException) e;
                    assertThat(ex.line()).isEqualTo(2);
                    assertThat(ex.column()).isEqualTo(1);
                    assertThat(ex.suggestion()).contains("did you mean `key: value`?");
                    assertThat(ex.getMessage()).endsWith("Help: did you mean `key: value`?");
                });
    }

    @Test
    void testDuplicateHeaderField() {
        LOG.info(() -> "TEST: testDuplicateHeaderField");
        assertThatThrownBy(() -> Toon.parse("[1]{a,a}:\n  1,2"))
                .isInstanceOf(ToonFormatException.class)
                .hasMessageContaining("Duplicate field \"a\"");
    }

    @Test
    void testListLineWithoutDash() {
        LOG.info(() -> "TEST: testListLineWithoutDash");
        assertThatThrownBy(() -> Toon.parse("[1]:\n  a"))
                .isInstanceOf(ToonParseException.class)
                .hasMessageContaining("Expected list item 1 of 1");
    }

    @Test
    void testNonFieldLineInsideNestedObject() {
        LOG.info(() -> "TEST: testNonFieldLineInsideNestedObject");
        assertThatThrownBy(() -> Toon.parse("a:\n  b: 1\n  stray"))
                .isInstanceOf(ToonParseException.class)
                .satisfies(e -> {
                    final var ex = (ToonParseException) e;
                    assertThat(ex.line()).isEqualTo(3);
                    assertThat(ex.detail()).isEqualTo("Expected a field inside the object");
                });
    }

    @Test
    void testSyntaxErrorMessageLayout() {
        LOG.info(() -> "TEST: testSyntaxErrorMessageLayout");
        final var ex = new ToonParseException("Bad thing", 3, 7, "  ctx", "fix it");
        assertThat(ex.getMessage()).isEqualTo("Syntax error at line 3, column 7:\n  ctx\nBad thing\nHelp: fix it");
        final var plain = new ToonParseException("Bad thing", 1, 1, "", null);
        assertThat(plain.getMessage()).isEqualTo("Syntax error at line 1, column 1:\nBad thing");
        assertThat(plain.suggestion()).isEmpty();
    }

    @Test
    void testOtherErrorKindsFormatting() {
        LOG.info(() -> "TEST: testOtherErrorKindsFormatting");
        assertThat(new ToonTypeException("string", "number").getMessage())
                .isEqualTo("Type mismatch: expected string, found number");
        assertThat(new ToonTypeException("string", "number", 2, 5).getMessage())
                .isEqualTo("Type mismatch at line 2, column 5: expected string, found number");
        assertThat(new ToonUnsupportedTypeException("java.lang.Thread").getMessage())
                .isEqualTo("Unsupported type: java.lang.Thread");
        assertThat(ToonException.custom("boom").getMessage()).isEqualTo("Error: boom");
    }

    @Test
    void testHugeDeclaredLengthsFailWithoutAllocating() {
        LOG.info(() -> "TEST: testHugeDeclaredLengthsFailWithoutAllocating");
        assertThatThrownBy(() -> Toon.parse("[2147483647]: 1"))
                .isInstanceOf(ToonFormatException.class)
                .hasMessageContaining("Inline array has 1 values, expected 2147483647");
        assertThatThrownBy(() -> Toon.parse("[2147483647]:\n  - 1"))
                .isInstanceOf(ToonEofException.class)
                .hasMessageContaining("list item 2 of 2147483647");
        assertThatThrownBy(() -> Toon.parse("[2147483647]{a}:\n  1"))
                .isInstanceOf(ToonEofException.class)
                .hasMessageContaining("row 2 of 2147483647");
        assertThatThrownBy(() -> Toon.parse("[99999999999]: 1"))
                .isInstanceOf(ToonParseException.class)
                .hasMessageContaining("Array length out of range: 99999999999");
    }
}
