package toon.java17;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// Rows of primitive values under a shared list of field names, the product
/// of parsing a tabular array such as
///
/// ```
/// [2]{id,name}:
///   1,Alice
///   2,Bob
/// ```
///
/// {@link Toon#parse(String)} hands callers the equivalent array of objects;
/// use {@link #toArray()} to do the same for a table built directly.
public record ToonTable(List<String> headers, List<List<ToonValue>> rows) implements ToonValue {

    public ToonTable {
        Objects.requireNonNull(headers, "headers must not be null");
        Objects.requireNonNull(rows, "rows must not be null");
        headers = List.copyOf(headers);
        if (new HashSet<>(headers).size() != headers.size()) {
            throw new IllegalArgumentException("Duplicate field in table headers " + headers);
        }
        final var copy = new ArrayList<List<ToonValue>>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            final List<ToonValue> row = List.copyOf(rows.get(i));
            if (row.size() != headers.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + row.size()
                        + " values but the table has " + headers.size() + " fields");
            }
            for (ToonValue cell : row) {
                if (!cell.isPrimitive()) {
                    throw new IllegalArgumentException("Table cells must be primitive, found " + cell.typeName());
                }
            }
            copy.add(row);
        }
        rows = List.copyOf(copy);
    }

    /// {@return an array with one object per row, keyed by the headers in order}
    public ToonArray toArray() {
        final var objects = new ArrayList<ToonValue>(rows.size());
        for (List<ToonValue> row : rows) {
            final var members = new LinkedHashMap<String, ToonValue>();
            for (int i = 0; i < headers.size(); i++) {
                members.put(headers.get(i), row.get(i));
            }
            objects.add(new ToonObject(members));
        }
        return new ToonArray(objects);
    }

    @Override
    public Optional<List<ToonValue>> asArray() {
        return Optional.of(toArray().elements());
    }

    @Override
    public String typeName() {
        return "table";
    }

    @Override
    public String toString() {
        return Toon.serialize(this);
    }
}
