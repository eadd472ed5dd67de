package org.relay.http.extract;

import java.util.Objects;

/**
 * Raised while deserializing captures into a target shape.
 * <p>
 * Custom scalar parsers throw {@link #custom(String)} to reject a value with their own message,
 * which is reported verbatim as {@link ErrorKind.Message}.
 */
public final class PathDeserializationException extends RuntimeException {
    private final ErrorKind kind;

    public PathDeserializationException(ErrorKind kind) {
        super(Objects.requireNonNull(kind, "kind").message(), null, false, false);
        this.kind = kind;
    }

    public static PathDeserializationException custom(String message) {
        return new PathDeserializationException(new ErrorKind.Message(message));
    }

    static PathDeserializationException wrongNumberOfParameters(int got, int expected) {
        return new PathDeserializationException(new ErrorKind.WrongNumberOfParameters(got, expected));
    }

    static PathDeserializationException unsupportedType(String name) {
        return new PathDeserializationException(new ErrorKind.UnsupportedType(name));
    }

    public ErrorKind kind() {
        return kind;
    }
}
