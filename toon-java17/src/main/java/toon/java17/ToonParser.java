package toon.java17;

import java.math.BigInteger;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Single-pass reader turning TOON text into a value tree.
///
/// The cursor only moves forward. Structure is decided by looking ahead
/// within the current line (is there a `key:`? is this a well-formed array
/// header?) and by comparing the indentation of the next non-blank line with
/// the base column of the object being read. Array bodies are driven by the
/// length in their header.
///
/// Tabular arrays come back as {@link ToonTable}; {@link Toon#parse(String)}
/// turns them into arrays of objects.
final class ToonParser {

    private static final Logger LOG = Logger.getLogger(ToonParser.class.getName());

    /// Declared lengths come from the input, so lists are not pre-sized beyond this.
    private static final int INITIAL_CAPACITY = 64;

    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern FLOAT = Pattern.compile("-?\\d+\\.\\d+");
    private static final Pattern BIG_INT = Pattern.compile("-?\\d+n");
    private static final Pattern DATE_PREFIX = Pattern.compile("[+-]?\\d{4,}-\\d{2}-\\d{2}T");

    private static final String FIELD_HINT = "did you mean `key: value`?";

    private final String input;
    private int pos;
    private int line = 1;
    private int lineStart;

    /// Base columns of the objects currently open.
    private final Deque<Integer> indents = new ArrayDeque<>();

    private ToonParser(String input) {
        this.input = input;
    }

    /// Parses a complete document.
    ///
    /// @param input the TOON text
    /// @return the root value; an empty or blank document is an empty object
    /// @throws ToonParseException if the text is not valid TOON
    static ToonValue parse(String input) {
        Objects.requireNonNull(input, "input must not be null");
        LOG.fine(() -> "Parsing TOON document of " + input.length() + " chars");
        return new ToonParser(input).parseDocument();
    }

    private ToonValue parseDocument() {
        final int start = findContent(0);
        if (start < 0) {
            return ToonObject.empty();
        }
        moveTo(start);
        final ToonValue root = parseValue(true);
        final int next = nextContentLine();
        if (next >= 0) {
            moveTo(next);
            throw syntax("Unexpected content after the document value",
                    looksLikeField(pos) ? null : FIELD_HINT);
        }
        return root;
    }

    /// Reads the value starting at the cursor. On return the cursor sits at
    /// the end of the last line the value occupies.
    ///
    /// @param objectAllowed whether a `key:` on this line opens an object
    private ToonValue parseValue(boolean objectAllowed) {
        skipBlanks();
        if (atLineEnd()) {
            throw syntax("Expected a value", null);
        }
        final int c = peek();
        if (objectAllowed && looksLikeField(pos)) {
            return parseObject();
        }
        if (c == '[' && looksLikeArrayHeader()) {
            return parseArray();
        }
        final ToonValue value;
        if (c == '"') {
            value = ToonString.of(parseQuoted());
        } else {
            final int start = pos;
            value = coerce(readToken(null), start);
        }
        expectLineEnd();
        return value;
    }

    private ToonObject parseObject() {
        final int base = pos - lineStart;
        indents.push(base);
        LOG.finer(() -> "object at line " + line + " column " + (base + 1));
        final var members = new LinkedHashMap<String, ToonValue>();
        while (true) {
            final String key = parseKey();
            skipBlanks();
            if (peek() != ':') {
                throw syntax("Expected ':' after key \"" + key + "\"", "did you mean `" + key + ": value`?");
            }
            advance();
            skipBlanks();
            final ToonValue value = atLineEnd() ? parseNestedBlock(base) : parseValue(false);
            if (members.containsKey(key)) {
                LOG.finer(() -> "duplicate key \"" + key + "\" at line " + line + " replaces the earlier value");
            }
            members.put(key, value);

            final int next = nextContentLine();
            if (next < 0) {
                break;
            }
            final int indent = indentOf(next);
            if (indent < base) {
                break;
            }
            if (indent > base) {
                moveTo(next);
                throw new ToonIndentationException(indents.peek(), indent, line, column(), context(pos));
            }
            if (!looksLikeField(next)) {
                if (base == 0) {
                    break;
                }
                moveTo(next);
                throw syntax("Expected a field inside the object", FIELD_HINT);
            }
            moveTo(next);
        }
        indents.pop();
        return new ToonObject(members);
    }

    private String parseKey() {
        if (peek() == '"') {
            return parseQuoted();
        }
        final int start = pos;
        while (!atLineEnd() && peek() != ':') {
            advance();
        }
        final String key = trimBlanks(input.substring(start, pos));
        if (key.isEmpty()) {
            throw syntaxAt(start, "Expected a key", null);
        }
        return key;
    }

    /// The value of `key:` at the end of a line: the following block when it is
    /// more indented than the key, otherwise an empty object.
    private ToonValue parseNestedBlock(int keyColumn) {
        final int next = nextContentLine();
        if (next < 0 || indentOf(next) <= keyColumn) {
            return ToonObject.empty();
        }
        moveTo(next);
        return parseValue(true);
    }

    private ToonValue parseArray() {
        advance();
        if (!isDigit(peek())) {
            advance();
        }
        final int digitsStart = pos;
        while (isDigit(peek())) {
            advance();
        }
        final int length;
        try {
            length = Integer.parseInt(input.substring(digitsStart, pos));
        } catch (NumberFormatException ex) {
            throw syntaxAt(digitsStart, "Array length out of range: " + input.substring(digitsStart, pos), null);
        }
        final Delimiter delimiter = readHeaderDelimiter();
        advance();

        if (peek() == '{') {
            final List<String> headers = parseHeaderFields(delimiter);
            if (peek() != ':') {
                throw syntax("Expected ':' after the table header", null);
            }
            advance();
            expectLineEnd();
            return parseTableRows(length, headers, delimiter);
        }

        if (peek() == ':') {
            advance();
        } else if (length != 0) {
            throw syntax("Expected ':' after the array header", "write `[" + length + "]: ...`");
        }
        skipSpaces();
        if (length == 0) {
            if (!atLineEnd()) {
                throw format("Array declares 0 values but the line holds more");
            }
            return ToonArray.empty();
        }
        if (atLineEnd()) {
            return parseListItems(length);
        }
        final List<ToonValue> values = parseDelimitedValues(length, delimiter, "Inline array");
        return new ToonArray(values);
    }

    /// Consumes the optional delimiter indicator and leaves the cursor on `]`.
    private Delimiter readHeaderDelimiter() {
        if (peek() == '|') {
            advance();
            return Delimiter.PIPE;
        }
        if (peek() == '\t') {
            advance();
            return Delimiter.TAB;
        }
        if (peek() == ' ') {
            while (peek() == ' ') {
                advance();
            }
            return Delimiter.TAB;
        }
        return Delimiter.COMMA;
    }

    private List<String> parseHeaderFields(Delimiter delimiter) {
        advance();
        final var headers = new ArrayList<String>();
        while (true) {
            skipSpaces();
            final int fieldStart = pos;
            final boolean quoted = peek() == '"';
            final String name = quoted ? parseQuoted() : readHeaderName(delimiter);
            if (name.isEmpty() && !quoted) {
                throw syntaxAt(fieldStart, "Expected a field name in the table header", null);
            }
            if (headers.contains(name)) {
                throw new ToonFormatException("Duplicate field \"" + name + "\" in table header",
                        line, fieldStart - lineStart + 1, context(fieldStart));
            }
            headers.add(name);

            if (delimiter == Delimiter.TAB && peek() == '\t') {
                advance();
                continue;
            }
            final int spacesStart = pos;
            skipSpaces();
            if (peek() == '}') {
                advance();
                return headers;
            }
            if (delimiter == Delimiter.TAB && pos - spacesStart >= 4) {
                continue;
            }
            if (delimiter != Delimiter.TAB && peek() == delimiter.symbol()) {
                advance();
                continue;
            }
            if (atLineEnd()) {
                throw syntax("Unterminated table header, expected '}'", null);
            }
            throw syntax("Expected " + describe(delimiter) + " or '}' in the table header", null);
        }
    }

    private String readHeaderName(Delimiter delimiter) {
        final int start = pos;
        while (!atLineEnd() && peek() != '}' && peek() != delimiter.symbol()
                && !(delimiter == Delimiter.TAB && input.startsWith("    ", pos))) {
            advance();
        }
        return trimBlanks(input.substring(start, pos));
    }

    private ToonTable parseTableRows(int length, List<String> headers, Delimiter delimiter) {
        final var rows = new ArrayList<List<ToonValue>>(Math.min(length, INITIAL_CAPACITY));
        int rowIndent = -1;
        for (int i = 0; i < length; i++) {
            final int next = nextContentLine();
            if (next < 0) {
                throw eof("row " + (i + 1) + " of " + length);
            }
            moveTo(next);
            rowIndent = pos - lineStart;
            rows.add(parseDelimitedValues(headers.size(), delimiter, "Row " + (i + 1)));
        }
        final int next = nextContentLine();
        if (rowIndent > 0 && next >= 0 && indentOf(next) == rowIndent && !looksLikeField(next)) {
            moveTo(next);
            throw format("Table declares " + length + " rows but more follow");
        }
        return new ToonTable(headers, rows);
    }

    private ToonArray parseListItems(int length) {
        final var items = new ArrayList<ToonValue>(Math.min(length, INITIAL_CAPACITY));
        int itemIndent = -1;
        for (int i = 0; i < length; i++) {
            final int next = nextContentLine();
            if (next < 0) {
                throw eof("list item " + (i + 1) + " of " + length);
            }
            moveTo(next);
            itemIndent = pos - lineStart;
            if (peek() != '-') {
                throw syntax("Expected list item " + (i + 1) + " of " + length,
                        "list items are written as `- value`");
            }
            advance();
            if (!atLineEnd()) {
                if (peek() != ' ') {
                    throw syntax("Expected a space after '-'", null);
                }
                skipSpaces();
            }
            items.add(atLineEnd() ? ToonObject.empty() : parseValue(true));
        }
        final int next = nextContentLine();
        if (itemIndent >= 0 && next >= 0 && indentOf(next) == itemIndent && input.charAt(next) == '-'
                && (next + 1 >= input.length() || " \r\n".indexOf(input.charAt(next + 1)) >= 0)) {
            moveTo(next);
            throw format("List declares " + length + " items but more follow");
        }
        return new ToonArray(items);
    }

    /// Reads exactly `expected` primitives separated by `delimiter` and
    /// requires the line to end after them.
    private List<ToonValue> parseDelimitedValues(int expected, Delimiter delimiter, String what) {
        final var values = new ArrayList<ToonValue>(Math.min(expected, INITIAL_CAPACITY));
        for (int i = 0; i < expected; i++) {
            if (i > 0) {
                if (atLineEnd()) {
                    throw format(what + " has " + i + " values, expected " + expected);
                }
                if (peek() != delimiter.symbol()) {
                    throw syntax("Expected " + describe(delimiter) + " between values", null);
                }
                advance();
            }
            values.add(parsePrimitive(delimiter));
        }
        skipSpaces();
        if (!atLineEnd()) {
            if (peek() == delimiter.symbol()) {
                throw format(what + " has more than " + expected + " values");
            }
            throw syntax("Unexpected content after value", null);
        }
        return values;
    }

    private ToonValue parsePrimitive(Delimiter delimiter) {
        skipSpaces();
        if (atLineEnd() || peek() == delimiter.symbol()) {
            throw syntax("Expected a value", null);
        }
        if (peek() == '"') {
            final String text = parseQuoted();
            skipSpaces();
            return ToonString.of(text);
        }
        final int start = pos;
        return coerce(readToken(delimiter), start);
    }

    /// Reads unquoted text up to the end of the line, or up to `delimiter`
    /// when one is given, without surrounding blanks.
    private String readToken(Delimiter delimiter) {
        final int start = pos;
        while (!atLineEnd() && (delimiter == null || peek() != delimiter.symbol())) {
            advance();
        }
        return trimBlanks(input.substring(start, pos));
    }

    private ToonValue coerce(String token, int start) {
        if (token.equals("true")) {
            return ToonBoolean.TRUE;
        }
        if (token.equals("false")) {
            return ToonBoolean.FALSE;
        }
        if (token.equals("null")) {
            return ToonNull.of();
        }
        if (INTEGER.matcher(token).matches()) {
            try {
                return ToonNumber.of(Long.parseLong(token));
            } catch (NumberFormatException ex) {
                throw syntaxAt(start, "Integer out of range: " + token,
                        "append `n` to write a big integer, as in `" + token + "n`");
            }
        }
        if (FLOAT.matcher(token).matches()) {
            return ToonNumber.of(Double.parseDouble(token));
        }
        if (BIG_INT.matcher(token).matches()) {
            return ToonBigInt.of(new BigInteger(token.substring(0, token.length() - 1)));
        }
        if (DATE_PREFIX.matcher(token).lookingAt()) {
            try {
                return ToonDate.of(Instant.parse(token));
            } catch (DateTimeParseException ex) {
                LOG.finer(() -> "\"" + token + "\" is not a date, keeping it as a string: " + ex.getMessage());
            }
        }
        return ToonString.of(token);
    }

    private String parseQuoted() {
        final int start = pos;
        advance();
        final var sb = new StringBuilder();
        while (true) {
            if (atEnd()) {
                throw eof("closing '\"' of the string starting at column " + (start - lineStart + 1));
            }
            final char c = input.charAt(pos);
            if (c == '"') {
                advance();
                return sb.toString();
            }
            if (c == '\n') {
                throw syntaxAt(start, "Unterminated string", "write line breaks inside strings as \\n");
            }
            if (c != '\\') {
                sb.append(c);
                advance();
                continue;
            }
            advance();
            if (atEnd()) {
                throw eof("escape sequence");
            }
            final char e = input.charAt(pos);
            switch (e) {
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case '0' -> sb.append('\0');
                case 'u' -> {
                    sb.append(readUnicodeEscape());
                    continue;
                }
                default -> sb.append('\\').append(e);
            }
            advance();
        }
    }

    /// Cursor on the `u` of a unicode escape; consumes the `u` and four hex digits.
    private char readUnicodeEscape() {
        if (pos + 5 > input.length()) {
            throw syntax("Invalid unicode escape sequence, expected 4 hex digits", null);
        }
        int code = 0;
        for (int i = 1; i <= 4; i++) {
            final int digit = Character.digit(input.charAt(pos + i), 16);
            if (digit < 0) {
                throw syntax("Invalid unicode escape sequence, expected 4 hex digits", null);
            }
            code = code * 16 + digit;
        }
        for (int i = 0; i < 5; i++) {
            advance();
        }
        return (char) code;
    }

    /// Whether the line starting at `at` reads as `key: ...`.
    private boolean looksLikeField(int at) {
        if (at >= input.length()) {
            return false;
        }
        final char c = input.charAt(at);
        if (c == '"') {
            final int end = quotedEnd(at);
            if (end < 0) {
                return false;
            }
            int i = end;
            while (i < input.length() && (input.charAt(i) == ' ' || input.charAt(i) == '\t')) {
                i++;
            }
            return i < input.length() && input.charAt(i) == ':';
        }
        if (isDigit(c) || c == '-' || c == '[') {
            return false;
        }
        for (int i = at; i < input.length() && input.charAt(i) != '\n'; i++) {
            if (input.charAt(i) == ':') {
                return !trimBlanks(input.substring(at, i)).isEmpty();
            }
        }
        return false;
    }

    /// Index just past the closing quote of the string opening at `at`, or -1
    /// when it does not close on this line.
    private int quotedEnd(int at) {
        int i = at + 1;
        while (i < input.length()) {
            final char c = input.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == '"') {
                return i + 1;
            } else if (c == '\n') {
                return -1;
            } else {
                i++;
            }
        }
        return -1;
    }

    /// `[` optional marker, digits, optional delimiter indicator, `]`, then
    /// `{`, `:` or end of line.
    private boolean looksLikeArrayHeader() {
        int i = pos + 1;
        final int n = input.length();
        if (i < n && !isDigit(input.charAt(i)) && input.charAt(i) != ']'
                && !Character.isWhitespace(input.charAt(i))) {
            i++;
        }
        final int digitsStart = i;
        while (i < n && isDigit(input.charAt(i))) {
            i++;
        }
        if (i == digitsStart) {
            return false;
        }
        if (i < n && (input.charAt(i) == '|' || input.charAt(i) == '\t')) {
            i++;
        } else {
            final int spacesStart = i;
            while (i < n && input.charAt(i) == ' ') {
                i++;
            }
            if (i > spacesStart && i - spacesStart < 4) {
                return false;
            }
        }
        if (i >= n || input.charAt(i) != ']') {
            return false;
        }
        i++;
        if (i >= n) {
            return true;
        }
        final char after = input.charAt(i);
        return after == ':' || after == '{' || after == '\n' || after == '\r';
    }

    // ---- cursor -----------------------------------------------------------

    private boolean atEnd() {
        return pos >= input.length();
    }

    private int peek() {
        return pos < input.length() ? input.charAt(pos) : -1;
    }

    private boolean atLineEnd() {
        if (pos >= input.length()) {
            return true;
        }
        final char c = input.charAt(pos);
        return c == '\n' || (c == '\r' && pos + 1 < input.length() && input.charAt(pos + 1) == '\n');
    }

    private void advance() {
        if (input.charAt(pos++) == '\n') {
            line++;
            lineStart = pos;
        }
    }

    private void moveTo(int index) {
        while (pos < index) {
            advance();
        }
    }

    private void skipSpaces() {
        while (peek() == ' ') {
            advance();
        }
    }

    private void skipBlanks() {
        while (peek() == ' ' || peek() == '\t') {
            advance();
        }
    }

    private void expectLineEnd() {
        skipBlanks();
        if (!atLineEnd()) {
            throw syntax("Unexpected content after value", null);
        }
    }

    /// Index of the first non-space character of the next non-blank line
    /// after the cursor's line, or -1 at end of input.
    private int nextContentLine() {
        int i = pos;
        while (i < input.length() && input.charAt(i) != '\n') {
            i++;
        }
        return i >= input.length() ? -1 : findContent(i + 1);
    }

    /// Same as {@link #nextContentLine()} but starting with the line at `from`.
    private int findContent(int from) {
        int lineBegin = from;
        int i = from;
        while (i < input.length()) {
            final char c = input.charAt(i);
            if (c == '\n') {
                lineBegin = i + 1;
                i = lineBegin;
            } else if (c == ' ' || c == '\t' || c == '\r') {
                i++;
            } else {
                int content = lineBegin;
                while (input.charAt(content) == ' ') {
                    content++;
                }
                return content;
            }
        }
        return -1;
    }

    private int indentOf(int contentIndex) {
        return contentIndex - (input.lastIndexOf('\n', contentIndex - 1) + 1);
    }

    private static boolean isDigit(int c) {
        return c >= '0' && c <= '9';
    }

    private static String trimBlanks(String s) {
        int start = 0;
        int end = s.length();
        while (start < end && (s.charAt(start) == ' ' || s.charAt(start) == '\t')) {
            start++;
        }
        while (end > start && (s.charAt(end - 1) == ' ' || s.charAt(end - 1) == '\t')) {
            end--;
        }
        return s.substring(start, end);
    }

    private static String describe(Delimiter delimiter) {
        return switch (delimiter) {
            case COMMA -> "','";
            case TAB -> "tab";
            case PIPE -> "'|'";
        };
    }

    // ---- errors -----------------------------------------------------------

    private int column() {
        return pos - lineStart + 1;
    }

    /// The current line, indented, with a caret under `index`.
    private String context(int index) {
        int end = input.indexOf('\n', lineStart);
        if (end < 0) {
            end = input.length();
        }
        if (end > lineStart && input.charAt(end - 1) == '\r') {
            end--;
        }
        return "  " + input.substring(lineStart, end) + "\n  " + " ".repeat(Math.max(0, index - lineStart)) + "^";
    }

    private ToonParseException syntax(String detail, String suggestion) {
        return syntaxAt(pos, detail, suggestion);
    }

    private ToonParseException syntaxAt(int index, String detail, String suggestion) {
        return new ToonParseException(detail, line, index - lineStart + 1, context(index), suggestion);
    }

    private ToonFormatException format(String detail) {
        return new ToonFormatException(detail, line, column(), context(pos));
    }

    private ToonEofException eof(String expected) {
        return new ToonEofException(expected, line, column(), context(pos));
    }
}
