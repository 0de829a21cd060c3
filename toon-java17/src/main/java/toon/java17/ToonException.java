package toon.java17;

/// Base of every error raised while reading, writing or converting TOON.
///
/// A bare `ToonException` carries a free-text message. It is used where no
/// more specific kind applies, for example when a {@link ToonSource} emits
/// events in an order that cannot form a value.
public class ToonException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    /// Creates an exception with the given message.
    public ToonException(String message) {
        super(message);
    }

    /// Creates an exception with the given message and cause.
    public ToonException(String message, Throwable cause) {
        super(message, cause);
    }

    /// Builds the `Error: ...` form used for errors raised by user callbacks.
    public static ToonException custom(String message) {
        return new ToonException("Error: " + message);
    }
}
