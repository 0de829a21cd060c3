package toon.java17;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/// An ordered sequence of values. How it is written (tabular, inline or as a
/// list) is chosen by {@link ToonFormat#select(List)}.
public record ToonArray(List<ToonValue> elements) implements ToonValue {

    private static final ToonArray EMPTY = new ToonArray(List.of());

    public ToonArray {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    public static ToonArray of(List<? extends ToonValue> elements) {
        Objects.requireNonNull(elements, "elements must not be null");
        return new ToonArray(List.copyOf(elements));
    }

    public static ToonArray of(ToonValue... elements) {
        return new ToonArray(List.of(elements));
    }

    public static ToonArray empty() {
        return EMPTY;
    }

    public int size() {
        return elements.size();
    }

    @Override
    public Optional<List<ToonValue>> asArray() {
        return Optional.of(elements);
    }

    @Override
    public String typeName() {
        return "array";
    }

    @Override
    public String toString() {
        return Toon.serialize(this);
    }
}
