package org.relay.http;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Request-scoped side table keyed by value type.
 * <p>
 * Created by the worker for every request and handed to the dispatcher, which uses it to pass
 * data such as {@link Captures} from the router to extractors. Instances are confined to the
 * worker serving the request and are not thread-safe.
 */
public final class Extensions {
    private final Map<Class<?>, Object> values = new HashMap<>();

    /**
     * Store value under its type, returning the value previously stored under that type.
     */
    public <T> Optional<T> put(Class<T> type, T value) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        return Optional.ofNullable(type.cast(values.put(type, value)));
    }

    public <T> Optional<T> get(Class<T> type) {
        return Optional.ofNullable(type.cast(values.get(type)));
    }

    /**
     * Get value which must have been installed earlier in the request pipeline.
     *
     * @throws IllegalStateException if no value of the given type is present
     */
    public <T> T require(Class<T> type) {
        var value = values.get(type);
        if (value == null) {
            throw new IllegalStateException("No " + type.getSimpleName() + " in request extensions");
        }
        return type.cast(value);
    }

    public boolean contains(Class<?> type) {
        return values.containsKey(type);
    }

    public <T> Optional<T> remove(Class<T> type) {
        return Optional.ofNullable(type.cast(values.remove(type)));
    }

    public int size() {
        return values.size();
    }
}
