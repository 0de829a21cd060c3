package toon.java17;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/// A point in time, written as an unquoted ISO-8601 instant such as
/// `2024-01-15T10:30:00Z`.
public record ToonDate(Instant value) implements ToonValue {

    public ToonDate {
        Objects.requireNonNull(value, "value must not be null");
    }

    public static ToonDate of(Instant value) {
        return new ToonDate(value);
    }

    /// {@return the ISO-8601 text of this instant}
    public String text() {
        return DateTimeFormatter.ISO_INSTANT.format(value);
    }

    @Override
    public Optional<Instant> asDate() {
        return Optional.of(value);
    }

    @Override
    public String typeName() {
        return "date";
    }

    @Override
    public String toString() {
        return text();
    }
}
