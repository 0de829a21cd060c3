package toon.java17;

import java.util.Objects;
import java.util.Optional;

/// Settings for {@link Toon#serialize(ToonValue, ToonOptions)}.
///
/// Parsing needs no options: indentation is measured and the delimiter is
/// read from each array header.
///
/// @param indentWidth spaces per nesting level, at least 1
/// @param delimiter separator for inline arrays and table rows
/// @param lengthMarker optional character written before array lengths, as
///        in `[#3]`; `null` for none
/// @param pretty when `true`, a space follows each comma or pipe delimiter
public record ToonOptions(int indentWidth, Delimiter delimiter, Character lengthMarker, boolean pretty) {

    private static final String FORBIDDEN_MARKERS = "[]{}:|\"";

    private static final ToonOptions DEFAULTS = new ToonOptions(2, Delimiter.COMMA, null, false);

    public ToonOptions {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be at least 1, was " + indentWidth);
        }
        Objects.requireNonNull(delimiter, "delimiter must not be null");
        if (lengthMarker != null) {
            final char c = lengthMarker;
            if (Character.isDigit(c) || Character.isWhitespace(c) || FORBIDDEN_MARKERS.indexOf(c) >= 0) {
                throw new IllegalArgumentException("Unusable length marker '" + c + "'");
            }
        }
    }

    /// {@return two-space indentation, comma delimiter, no length marker, compact}
    public static ToonOptions defaults() {
        return DEFAULTS;
    }

    /// {@return the defaults with pretty spacing switched on}
    public static ToonOptions prettyPrinted() {
        return DEFAULTS.withPretty(true);
    }

    public ToonOptions withIndent(int indentWidth) {
        return new ToonOptions(indentWidth, delimiter, lengthMarker, pretty);
    }

    public ToonOptions withDelimiter(Delimiter delimiter) {
        return new ToonOptions(indentWidth, delimiter, lengthMarker, pretty);
    }

    public ToonOptions withLengthMarker(char lengthMarker) {
        return new ToonOptions(indentWidth, delimiter, lengthMarker, pretty);
    }

    public ToonOptions withoutLengthMarker() {
        return new ToonOptions(indentWidth, delimiter, null, pretty);
    }

    public ToonOptions withPretty(boolean pretty) {
        return new ToonOptions(indentWidth, delimiter, lengthMarker, pretty);
    }

    /// {@return the length marker, if one is configured}
    public Optional<Character> marker() {
        return Optional.ofNullable(lengthMarker);
    }
}
