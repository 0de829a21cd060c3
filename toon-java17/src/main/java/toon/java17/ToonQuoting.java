package toon.java17;

import java.util.Objects;
import java.util.regex.Pattern;

/// Decides when strings and keys must be quoted and writes them.
///
/// A string is written bare only when reading it back cannot mistake it for
/// something else: a literal, a number, structure, or a value boundary under
/// the active delimiter.
public final class ToonQuoting {

    private static final Pattern NUMBER_LIKE = Pattern.compile(
            "[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    private static final Pattern NON_FINITE_LIKE = Pattern.compile(
            "[+-]?(inf|infinity|nan)", Pattern.CASE_INSENSITIVE);

    private static final Pattern BIG_INT_LIKE = Pattern.compile("-?\\d+n");

    private static final Pattern BARE_KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_.-]*");

    private ToonQuoting() {
    }

    /// {@return `true` when `value` must be written quoted under `delimiter`}
    public static boolean needsQuotes(String value, Delimiter delimiter) {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(delimiter, "delimiter must not be null");
        if (value.isEmpty()) {
            return true;
        }
        if (value.charAt(0) == ' ' || value.charAt(value.length() - 1) == ' ') {
            return true;
        }
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (c == ':' || c == '"' || c == '\\' || c == '\n' || c == '\r' || c == '\t' || c == '\0'
                    || c == delimiter.symbol()) {
                return true;
            }
        }
        if (value.equals("true") || value.equals("false") || value.equals("null")) {
            return true;
        }
        if (isNumberLike(value)) {
            return true;
        }
        if (value.startsWith("- ")) {
            return true;
        }
        return (value.charAt(0) == '[' && value.indexOf(']') > 0)
                || (value.charAt(0) == '{' && value.indexOf('}') > 0);
    }

    /// {@return `true` when `value` would be read as a number, including
    /// exponent forms, infinity and NaN spellings, and `n`-suffixed big integers}
    public static boolean isNumberLike(String value) {
        return NUMBER_LIKE.matcher(value).matches()
                || NON_FINITE_LIKE.matcher(value).matches()
                || BIG_INT_LIKE.matcher(value).matches();
    }

    /// {@return `true` when `key` must be written quoted}
    public static boolean needsKeyQuotes(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return !BARE_KEY.matcher(key).matches();
    }

    /// {@return `value` wrapped in double quotes with its special characters escaped}
    public static String quote(String value) {
        final var sb = new StringBuilder(value.length() + 2);
        appendQuoted(sb, value);
        return sb.toString();
    }

    /// {@return `value` as it is written in a value position under `delimiter`}
    public static String format(String value, Delimiter delimiter) {
        return needsQuotes(value, delimiter) ? quote(value) : value;
    }

    static void appendValue(StringBuilder out, String value, Delimiter delimiter) {
        if (needsQuotes(value, delimiter)) {
            appendQuoted(out, value);
        } else {
            out.append(value);
        }
    }

    static void appendKey(StringBuilder out, String key) {
        if (needsKeyQuotes(key)) {
            appendQuoted(out, key);
        } else {
            out.append(key);
        }
    }

    static void appendQuoted(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            final char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\0' -> out.append("\\0");
                default -> out.append(c);
            }
        }
        out.append('"');
    }
}
