package org.relay.http.extract;

import java.util.Objects;

/**
 * Named field of a {@link PathShape.RecordShape}, matched to the capture with the same name.
 *
 * @param name  capture name
 * @param shape value shape, scalar or optional
 * @param <T>   field value type
 */
public record Field<T>(String name, PathShape<T> shape) {
    public Field {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(shape, "shape");
    }

    public static <T> Field<T> field(String name, PathShape<T> shape) {
        return new Field<>(name, shape);
    }
}
