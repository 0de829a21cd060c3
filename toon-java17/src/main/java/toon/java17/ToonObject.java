package toon.java17;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// An insertion-ordered map from string keys to values.
///
/// Iteration follows insertion order; equality does not, so an object read
/// back from a tabular array (whose fields are written sorted) still equals
/// the object that was written.
public record ToonObject(Map<String, ToonValue> members) implements ToonValue {

    private static final ToonObject EMPTY = new ToonObject(Map.of());

    public ToonObject {
        Objects.requireNonNull(members, "members must not be null");
        final var copy = new LinkedHashMap<String, ToonValue>(Math.max(16, members.size() * 2));
        for (Map.Entry<String, ? extends ToonValue> entry : members.entrySet()) {
            copy.put(Objects.requireNonNull(entry.getKey(), "key must not be null"),
                    Objects.requireNonNull(entry.getValue(), "value must not be null"));
        }
        members = Collections.unmodifiableMap(copy);
    }

    public static ToonObject of(Map<String, ? extends ToonValue> members) {
        Objects.requireNonNull(members, "members must not be null");
        return new ToonObject(Collections.unmodifiableMap(members));
    }

    public static ToonObject empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    @Override
    public Optional<Map<String, ToonValue>> asObject() {
        return Optional.of(members);
    }

    @Override
    public String typeName() {
        return "object";
    }

    @Override
    public String toString() {
        return Toon.serialize(this);
    }

    /// Collects members in insertion order. Putting a key again replaces its
    /// value and keeps its original position.
    public static final class Builder {
        private final LinkedHashMap<String, ToonValue> members = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String key, ToonValue value) {
            members.put(Objects.requireNonNull(key, "key must not be null"),
                    Objects.requireNonNull(value, "value must not be null"));
            return this;
        }

        public Builder put(String key, String value) {
            return put(key, ToonString.of(value));
        }

        public Builder put(String key, long value) {
            return put(key, ToonNumber.of(value));
        }

        public Builder put(String key, boolean value) {
            return put(key, ToonBoolean.of(value));
        }

        public ToonObject build() {
            return new ToonObject(members);
        }
    }
}
