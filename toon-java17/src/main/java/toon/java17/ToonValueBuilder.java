package toon.java17;

import java.math.BigInteger;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Assembles emitter events into a {@link ToonValue}.
///
/// Misordered events, such as a value inside an object without a preceding
/// `field`, fail with a {@link ToonException}.
final class ToonValueBuilder implements ToonEmitter {

    /// An array or object under construction.
    private static final class Frame {
        final List<ToonValue> elements;
        final Map<String, ToonValue> members;
        String pendingField;

        private Frame(List<ToonValue> elements, Map<String, ToonValue> members) {
            this.elements = elements;
            this.members = members;
        }

        static Frame array() {
            return new Frame(new ArrayList<>(), null);
        }

        static Frame object() {
            return new Frame(null, new LinkedHashMap<>());
        }

        boolean isArray() {
            return elements != null;
        }
    }

    private final Deque<Frame> open = new ArrayDeque<>();
    private ToonValue result;

    @Override
    public void nullValue() {
        add(ToonNull.of());
    }

    @Override
    public void bool(boolean value) {
        add(ToonBoolean.of(value));
    }

    @Override
    public void number(long value) {
        add(ToonNumber.of(value));
    }

    @Override
    public void number(double value) {
        add(ToonNumber.of(value));
    }

    @Override
    public void bigInt(BigInteger value) {
        add(ToonBigInt.of(value));
    }

    @Override
    public void string(String value) {
        add(ToonString.of(value));
    }

    @Override
    public void date(Instant value) {
        add(ToonDate.of(value));
    }

    @Override
    public void value(ToonValue value) {
        add(Objects.requireNonNull(value, "value must not be null"));
    }

    @Override
    public void beginArray() {
        checkCanAdd();
        open.push(Frame.array());
    }

    @Override
    public void endArray() {
        final Frame frame = open.peek();
        if (frame == null || !frame.isArray()) {
            throw ToonException.custom("endArray without a matching beginArray");
        }
        open.pop();
        add(new ToonArray(frame.elements));
    }

    @Override
    public void beginObject() {
        checkCanAdd();
        open.push(Frame.object());
    }

    @Override
    public void field(String name) {
        Objects.requireNonNull(name, "name must not be null");
        final Frame frame = open.peek();
        if (frame == null || frame.isArray()) {
            throw ToonException.custom("field \"" + name + "\" emitted outside an object");
        }
        if (frame.pendingField != null) {
            throw ToonException.custom("field \"" + frame.pendingField + "\" has no value");
        }
        frame.pendingField = name;
    }

    @Override
    public void endObject() {
        final Frame frame = open.peek();
        if (frame == null || frame.isArray()) {
            throw ToonException.custom("endObject without a matching beginObject");
        }
        if (frame.pendingField != null) {
            throw ToonException.custom("field \"" + frame.pendingField + "\" has no value");
        }
        open.pop();
        add(new ToonObject(frame.members));
    }

    /// {@return the single complete value that was emitted}
    ToonValue build() {
        if (!open.isEmpty()) {
            throw ToonException.custom(open.size() + " array or object scope(s) left open");
        }
        if (result == null) {
            throw ToonException.custom("no value was emitted");
        }
        return result;
    }

    private void checkCanAdd() {
        final Frame frame = open.peek();
        if (frame == null) {
            if (result != null) {
                throw ToonException.custom("more than one root value emitted");
            }
        } else if (!frame.isArray() && frame.pendingField == null) {
            throw ToonException.custom("value emitted inside an object without a field name");
        }
    }

    private void add(ToonValue value) {
        checkCanAdd();
        final Frame frame = open.peek();
        if (frame == null) {
            result = value;
        } else if (frame.isArray()) {
            frame.elements.add(value);
        } else {
            frame.members.put(frame.pendingField, value);
            frame.pendingField = null;
        }
    }
}
