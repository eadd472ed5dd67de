package org.relay.http.extract;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Describes the shape of the value path captures are extracted into.
 * <p>
 * Shapes are immutable descriptors, typically built once as constants next to the handler using
 * them:
 * <pre>{@code
 * record TeamMember(long userId, long teamId) {}
 *
 * static final Field<Long> USER_ID = Field.field("user_id", Scalars.LONG);
 * static final Field<Long> TEAM_ID = Field.field("team_id", Scalars.LONG);
 * static final PathShape<TeamMember> MEMBER =
 *         PathShape.record("TeamMember", values -> new TeamMember(values.get(USER_ID), values.get(TEAM_ID)),
 *                          USER_ID, TEAM_ID);
 * }</pre>
 * Aggregate shapes (tuple, list, map, record) hold scalar or optional elements only. Nesting
 * aggregates is rejected with {@link ErrorKind.UnsupportedType} when the shape is used.
 *
 * @param <T> extracted value type
 */
public sealed interface PathShape<T> {
    /**
     * Type name used in error texts.
     */
    String typeName();

    /**
     * Parses a single decoded capture value.
     */
    @FunctionalInterface
    interface ScalarParser<T> {
        /**
         * Parse value. Any exception except {@link PathDeserializationException} is reported as a
         * parse error for the expected type.
         */
        T parse(String value) throws Exception;
    }

    /**
     * Single value parsed from one capture.
     */
    record ScalarShape<T>(String typeName, ScalarParser<T> parser) implements PathShape<T> {
        public ScalarShape {
            Objects.requireNonNull(typeName, "typeName");
            Objects.requireNonNull(parser, "parser");
        }
    }

    /**
     * Value wrapped in {@link Optional}. Values decoded from captures are always present.
     */
    record OptionalShape<T>(PathShape<T> inner) implements PathShape<Optional<T>> {
        public OptionalShape {
            Objects.requireNonNull(inner, "inner");
        }

        @Override
        public String typeName() {
            return "Optional<" + inner.typeName() + ">";
        }
    }

    /**
     * Fixed number of positional values; the capture count must match exactly.
     */
    record TupleShape<T>(List<PathShape<?>> elements, Function<List<Object>, T> assembler) implements PathShape<T> {
        public TupleShape {
            elements = List.copyOf(elements);
            Objects.requireNonNull(assembler, "assembler");
        }

        @Override
        public String typeName() {
            return elements.stream()
                           .map(PathShape::typeName)
                           .collect(Collectors.joining(", ", "(", ")"));
        }
    }

    /**
     * All captures in order, any count.
     */
    record ListShape<E>(PathShape<E> element) implements PathShape<List<E>> {
        public ListShape {
            Objects.requireNonNull(element, "element");
        }

        @Override
        public String typeName() {
            return "List<" + element.typeName() + ">";
        }
    }

    /**
     * Capture name and value as a pair. Only valid as element of a {@link ListShape}.
     */
    record EntryShape<K, V>(ScalarShape<K> key, ScalarShape<V> value) implements PathShape<Map.Entry<K, V>> {
        public EntryShape {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String typeName() {
            return "Entry<" + key.typeName() + ", " + value.typeName() + ">";
        }
    }

    /**
     * All captures keyed by name, any count. Iteration order follows the captures.
     */
    record MapShape<V>(PathShape<V> value) implements PathShape<Map<String, V>> {
        public MapShape {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String typeName() {
            return "Map<String, " + value.typeName() + ">";
        }
    }

    /**
     * Named fields matched to captures by name; the capture count must equal the field count.
     */
    record RecordShape<T>(String typeName, List<Field<?>> fields, Function<FieldValues, T> assembler)
            implements PathShape<T> {
        public RecordShape {
            Objects.requireNonNull(typeName, "typeName");
            fields = List.copyOf(fields);
            Objects.requireNonNull(assembler, "assembler");

            var names = fields.stream().map(Field::name).distinct().count();
            if (names != fields.size()) {
                throw new IllegalArgumentException("Duplicate field name in " + typeName);
            }
        }
    }

    static <T> ScalarShape<T> scalar(String typeName, ScalarParser<T> parser) {
        return new ScalarShape<>(typeName, parser);
    }

    static <T> OptionalShape<T> optional(PathShape<T> inner) {
        return new OptionalShape<>(inner);
    }

    /**
     * Tuple of arbitrary arity, values in capture order.
     */
    static TupleShape<List<Object>> tuple(List<PathShape<?>> elements) {
        return new TupleShape<>(elements, values -> values);
    }

    static TupleShape<List<Object>> tuple(PathShape<?>... elements) {
        return tuple(Arrays.asList(elements));
    }

    @SuppressWarnings("unchecked")
    static <A, B, R> TupleShape<R> tuple(PathShape<A> first, PathShape<B> second, BiFunction<A, B, R> assembler) {
        return new TupleShape<>(List.of(first, second),
                                values -> assembler.apply((A) values.get(0), (B) values.get(1)));
    }

    @SuppressWarnings("unchecked")
    static <A, B, C, R> TupleShape<R> tuple(PathShape<A> first,
                                            PathShape<B> second,
                                            PathShape<C> third,
                                            Function3<A, B, C, R> assembler) {
        return new TupleShape<>(List.of(first, second, third),
                                values -> assembler.apply((A) values.get(0), (B) values.get(1), (C) values.get(2)));
    }

    /**
     * Two positional values as a map entry.
     */
    static <A, B> TupleShape<Map.Entry<A, B>> pair(PathShape<A> first, PathShape<B> second) {
        return tuple(first, second, Map::entry);
    }

    static <E> ListShape<E> list(PathShape<E> element) {
        return new ListShape<>(element);
    }

    /**
     * All captures as (name, value) pairs.
     */
    static <K, V> ListShape<Map.Entry<K, V>> entries(ScalarShape<K> key, ScalarShape<V> value) {
        return new ListShape<>(new EntryShape<>(key, value));
    }

    static <V> MapShape<V> map(PathShape<V> value) {
        return new MapShape<>(value);
    }

    static <T> RecordShape<T> record(String typeName, Function<FieldValues, T> assembler, Field<?>... fields) {
        return new RecordShape<>(typeName, new ArrayList<>(Arrays.asList(fields)), assembler);
    }

    @FunctionalInterface
    interface Function3<A, B, C, R> {
        R apply(A first, B second, C third);
    }
}
