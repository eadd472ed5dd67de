package org.relay.http;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Path captures bound while matching a route, in the order the route declares them.
 * <p>
 * Keys are unique. Values are kept exactly as they appear in the request target, i.e. still
 * percent-encoded. The router fills the instance installed in the request {@link Extensions};
 * extractors only read it.
 */
public final class Captures implements Iterable<Captures.Capture> {
    private final LinkedHashMap<String, String> values = new LinkedHashMap<>();

    /**
     * Single named capture.
     *
     * @param key   capture name from the route pattern
     * @param value raw, possibly percent-encoded value
     */
    public record Capture(String key, String value) {
        public Capture {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }
    }

    public static Captures empty() {
        return new Captures();
    }

    public static Captures of(String key, String value) {
        return empty().insert(key, value);
    }

    public static Captures of(String key1, String value1, String key2, String value2) {
        return empty().insert(key1, value1)
                      .insert(key2, value2);
    }

    public static Captures of(List<Capture> captures) {
        var result = empty();
        captures.forEach(capture -> result.insert(capture.key(), capture.value()));
        return result;
    }

    /**
     * Insert capture. An existing capture with the same key gets the new value and keeps its position.
     */
    public Captures insert(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        values.put(key, value);
        return this;
    }

    /**
     * Merge captures contributed by a nested router into this instance.
     * <p>
     * On key collision the incoming value wins and the key keeps its original position; new keys
     * are appended in the incoming order.
     */
    public Captures merge(Captures incoming) {
        values.putAll(incoming.values);
        return this;
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean containsKey(String key) {
        return values.containsKey(key);
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Snapshot of all captures in order.
     */
    public List<Capture> entries() {
        var result = new ArrayList<Capture>(values.size());
        for (var entry : values.entrySet()) {
            result.add(new Capture(entry.getKey(), entry.getValue()));
        }
        return Collections.unmodifiableList(result);
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public Iterator<Capture> iterator() {
        return entries().iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Captures other && values.equals(other.values)
               && List.copyOf(values.keySet()).equals(List.copyOf(other.values.keySet()));
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Captures" + values;
    }
}
