package toon.java17;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Chooses how an array is written.
///
/// The choice depends only on the elements, never on options:
///
/// 1. an empty array is written inline as `[0]:`;
/// 2. objects sharing one non-empty key set whose values are all primitive
///    become a table with the keys sorted as headers;
/// 3. all-primitive arrays are written inline on one line;
/// 4. anything else becomes a list of `- ` items.
public final class ToonFormat {

    private static final Logger LOG = Logger.getLogger(ToonFormat.class.getName());

    private ToonFormat() {
    }

    /// The selected layout of an array.
    public sealed interface Layout permits Tabular, Inline, Listed {
    }

    /// Field names and the row values in header order.
    public record Tabular(List<String> headers, List<List<ToonValue>> rows) implements Layout {
        public Tabular {
            headers = List.copyOf(headers);
            rows = rows.stream().map(List::copyOf).toList();
        }
    }

    /// Primitive values on the header line.
    public record Inline() implements Layout {
    }

    /// One `- ` item per line.
    public record Listed() implements Layout {
    }

    /// {@return the layout for `elements`}
    public static Layout select(List<ToonValue> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        if (elements.isEmpty()) {
            return new Inline();
        }
        final Tabular tabular = tabular(elements);
        if (tabular != null) {
            LOG.finer(() -> "tabular layout for " + elements.size() + " rows with fields " + tabular.headers());
            return tabular;
        }
        for (ToonValue element : elements) {
            if (!element.isPrimitive()) {
                LOG.finer(() -> "list layout for " + elements.size() + " elements");
                return new Listed();
            }
        }
        LOG.finer(() -> "inline layout for " + elements.size() + " elements");
        return new Inline();
    }

    private static Tabular tabular(List<ToonValue> elements) {
        if (!(elements.get(0) instanceof ToonObject first) || first.isEmpty()) {
            return null;
        }
        final Set<String> keys = first.members().keySet();
        for (ToonValue element : elements) {
            if (!(element instanceof ToonObject object) || !object.members().keySet().equals(keys)) {
                return null;
            }
            for (ToonValue value : object.members().values()) {
                if (!value.isPrimitive()) {
                    return null;
                }
            }
        }
        final List<String> headers = new ArrayList<>(keys);
        headers.sort(null);
        final var rows = new ArrayList<List<ToonValue>>(elements.size());
        for (ToonValue element : elements) {
            final Map<String, ToonValue> members = ((ToonObject) element).members();
            final var row = new ArrayList<ToonValue>(headers.size());
            for (String header : headers) {
                row.add(members.getOrDefault(header, ToonNull.of()));
            }
            rows.add(row);
        }
        return new Tabular(headers, rows);
    }
}
