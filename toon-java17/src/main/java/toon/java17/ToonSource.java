package toon.java17;

/// Something that can describe itself as TOON by emitting events.
///
/// ```java
/// ToonSource user = e -> {
///     e.beginObject();
///     e.field("id");
///     e.number(1);
///     e.field("name");
///     e.string("Alice");
///     e.endObject();
/// };
/// String text = Toon.serialize(user, ToonOptions.defaults());
/// ```
@FunctionalInterface
public interface ToonSource {

    /// Emits exactly one value, with its nested content, to `emitter`.
    void emitTo(ToonEmitter emitter);
}
