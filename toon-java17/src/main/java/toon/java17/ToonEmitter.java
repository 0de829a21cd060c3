package toon.java17;

import java.math.BigInteger;
import java.time.Instant;

/// Receives a value as a stream of events from a {@link ToonSource}.
///
/// Scalars are single events. Arrays are `beginArray`, the elements, then
/// `endArray`. Objects are `beginObject`, then for each member a `field`
/// followed by exactly one value, then `endObject`.
public interface ToonEmitter {

    void nullValue();

    void bool(boolean value);

    void number(long value);

    /// Non-finite values become the special numbers, which are written as `null`.
    void number(double value);

    void bigInt(BigInteger value);

    void string(String value);

    void date(Instant value);

    /// Emits an already built value in one step.
    void value(ToonValue value);

    void beginArray();

    void endArray();

    void beginObject();

    /// Names the member whose value is emitted next.
    void field(String name);

    void endObject();
}
