package toon.java17;

/// The separator between values of an inline array or a table row.
///
/// Comma is the default and is not announced in array headers. Tab and pipe
/// mark themselves inside the header brackets, `[3    ]` and `[3|]`, so the
/// parser always learns the delimiter from the text.
public enum Delimiter {
    COMMA(',', "", ","),
    TAB('\t', "    ", "    "),
    PIPE('|', "|", "|");

    private final char symbol;
    private final String headerSuffix;
    private final String headerSeparator;

    Delimiter(char symbol, String headerSuffix, String headerSeparator) {
        this.symbol = symbol;
        this.headerSuffix = headerSuffix;
        this.headerSeparator = headerSeparator;
    }

    /// {@return the character placed between values}
    public char symbol() {
        return symbol;
    }

    /// {@return the marker written after the length inside `[...]`}
    public String headerSuffix() {
        return headerSuffix;
    }

    /// {@return the separator written between field names inside `{...}`}
    public String headerSeparator() {
        return headerSeparator;
    }
}
