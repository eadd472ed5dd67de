package org.relay.http.extract;

import java.util.Map;

/**
 * Decoded field values handed to a record assembler.
 */
public final class FieldValues {
    private final Map<String, Object> values;

    FieldValues(Map<String, Object> values) {
        this.values = Map.copyOf(values);
    }

    /**
     * Get decoded value of the field.
     *
     * @throws IllegalArgumentException if the field is not declared by the record shape
     */
    @SuppressWarnings("unchecked")
    public <T> T get(Field<T> field) {
        var value = values.get(field.name());
        if (value == null) {
            throw new IllegalArgumentException("Field `" + field.name() + "` is not part of this record");
        }
        return (T) value;
    }

    public int size() {
        return values.size();
    }
}
