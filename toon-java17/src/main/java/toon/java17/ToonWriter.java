package toon.java17;

import java.math.BigInteger;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/// Writes a value tree as TOON text.
///
/// Every method receives the column at which its construct starts; nested
/// blocks go one indent width further right. A list item's content column is
/// two past its dash, which is where an object item's later fields line up.
final class ToonWriter {

    private static final Logger LOG = Logger.getLogger(ToonWriter.class.getName());

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private final ToonOptions options;
    private final StringBuilder out = new StringBuilder(256);

    private ToonWriter(ToonOptions options) {
        this.options = options;
    }

    static String write(ToonValue value, ToonOptions options) {
        final var writer = new ToonWriter(options);
        writer.writeRoot(value);
        LOG.fine(() -> "wrote " + value.typeName() + " as " + writer.out.length() + " chars");
        return writer.out.toString();
    }

    private void writeRoot(ToonValue value) {
        if (value instanceof ToonObject object) {
            writeFields(object.members(), 0);
        } else if (value instanceof ToonArray array) {
            writeArray(array.elements(), 0);
        } else if (value instanceof ToonTable table) {
            writeTable(table, 0);
        } else {
            writeScalar(value);
        }
    }

    private void writeFields(Map<String, ToonValue> members, int column) {
        boolean first = true;
        for (Map.Entry<String, ToonValue> entry : members.entrySet()) {
            if (!first) {
                newLine(column);
            }
            first = false;
            writeField(entry.getKey(), entry.getValue(), column);
        }
    }

    private void writeField(String key, ToonValue value, int column) {
        ToonQuoting.appendKey(out, key);
        out.append(':');
        if (value instanceof ToonObject nested) {
            if (!nested.isEmpty()) {
                newLine(column + options.indentWidth());
                writeFields(nested.members(), column + options.indentWidth());
            }
        } else if (value instanceof ToonArray array) {
            out.append(' ');
            writeArray(array.elements(), column);
        } else if (value instanceof ToonTable table) {
            out.append(' ');
            writeTable(table, column);
        } else {
            out.append(' ');
            writeScalar(value);
        }
    }

    private void writeArray(List<ToonValue> elements, int column) {
        final ToonFormat.Layout layout = ToonFormat.select(elements);
        if (layout instanceof ToonFormat.Tabular tabular) {
            writeTable(tabular.headers(), tabular.rows(), column);
        } else if (layout instanceof ToonFormat.Inline) {
            writeHeader(elements.size(), true);
            out.append(':');
            if (!elements.isEmpty()) {
                out.append(' ');
                writeDelimited(elements);
            }
        } else {
            writeHeader(elements.size(), false);
            out.append(':');
            final int itemColumn = column + options.indentWidth();
            for (ToonValue element : elements) {
                newLine(itemColumn);
                writeListItem(element, itemColumn);
            }
        }
    }

    /// A table without fields has no header form; its rows are written as empty objects.
    private void writeTable(ToonTable table, int column) {
        if (table.headers().isEmpty()) {
            writeArray(table.toArray().elements(), column);
        } else {
            writeTable(table.headers(), table.rows(), column);
        }
    }

    private void writeTable(List<String> headers, List<List<ToonValue>> rows, int column) {
        writeHeader(rows.size(), true);
        out.append('{');
        final String separator = options.delimiter().headerSeparator();
        for (int i = 0; i < headers.size(); i++) {
            if (i > 0) {
                out.append(separator);
                if (spaceAfterDelimiter()) {
                    out.append(' ');
                }
            }
            ToonQuoting.appendKey(out, headers.get(i));
        }
        out.append("}:");
        for (List<ToonValue> row : rows) {
            newLine(column + options.indentWidth());
            writeDelimited(row);
        }
    }

    private void writeHeader(int length, boolean withDelimiter) {
        out.append('[');
        if (options.lengthMarker() != null) {
            out.append(options.lengthMarker().charValue());
        }
        out.append(length);
        if (withDelimiter) {
            out.append(options.delimiter().headerSuffix());
        }
        out.append(']');
    }

    private void writeDelimited(List<ToonValue> values) {
        final Iterator<ToonValue> it = values.iterator();
        while (it.hasNext()) {
            writeScalar(it.next());
            if (it.hasNext()) {
                out.append(options.delimiter().symbol());
                if (spaceAfterDelimiter()) {
                    out.append(' ');
                }
            }
        }
    }

    private boolean spaceAfterDelimiter() {
        return options.pretty() && options.delimiter() != Delimiter.TAB;
    }

    private void writeListItem(ToonValue item, int dashColumn) {
        out.append('-');
        final int contentColumn = dashColumn + 2;
        if (item instanceof ToonObject object) {
            if (object.isEmpty()) {
                return;
            }
            out.append(' ');
            writeFields(object.members(), contentColumn);
        } else if (item instanceof ToonArray array) {
            out.append(' ');
            writeArray(array.elements(), contentColumn);
        } else if (item instanceof ToonTable table) {
            out.append(' ');
            writeTable(table, contentColumn);
        } else {
            out.append(' ');
            writeScalar(item);
        }
    }

    private void writeScalar(ToonValue value) {
        if (value instanceof ToonString s) {
            ToonQuoting.appendValue(out, s.value(), options.delimiter());
        } else if (value instanceof ToonNumber.OfLong n) {
            out.append(n.value());
        } else if (value instanceof ToonNumber.OfDouble d) {
            out.append(doubleText(d));
        } else if (value instanceof ToonNumber.Special special) {
            LOG.finer(() -> special.canonical() + " has no TOON literal, writing null");
            out.append("null");
        } else if (value instanceof ToonBoolean b) {
            out.append(b.value());
        } else if (value instanceof ToonNull) {
            out.append("null");
        } else if (value instanceof ToonDate date) {
            out.append(date.text());
        } else if (value instanceof ToonBigInt big) {
            out.append(big.value()).append('n');
        } else {
            throw new IllegalStateException("Not a scalar: " + value.typeName());
        }
    }

    /// Whole doubles outside `long` range keep a `.0` so they read back as floats.
    static String doubleText(ToonNumber.OfDouble number) {
        final String text = number.canonical();
        if (text.indexOf('.') < 0) {
            final var whole = new BigInteger(text);
            if (whole.compareTo(LONG_MIN) < 0 || whole.compareTo(LONG_MAX) > 0) {
                return text + ".0";
            }
        }
        return text;
    }

    private void newLine(int column) {
        out.append('\n');
        for (int i = 0; i < column; i++) {
            out.append(' ');
        }
    }
}
