package org.relay.http.extract;

import org.relay.http.Captures.Capture;
import org.relay.http.extract.ErrorKind.ParseError;
import org.relay.http.extract.ErrorKind.ParseErrorAtIndex;
import org.relay.http.extract.ErrorKind.ParseErrorAtKey;
import org.relay.http.extract.PathShape.EntryShape;
import org.relay.http.extract.PathShape.ListShape;
import org.relay.http.extract.PathShape.MapShape;
import org.relay.http.extract.PathShape.OptionalShape;
import org.relay.http.extract.PathShape.RecordShape;
import org.relay.http.extract.PathShape.ScalarShape;
import org.relay.http.extract.PathShape.TupleShape;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Decodes percent-decoded captures into the value described by a {@link PathShape}.
 * <p>
 * The shape is validated before any capture is looked at, so an unsupported nesting is reported
 * the same way regardless of what the URL contained.
 */
final class PathDeserializer {
    private final List<Capture> captures;

    PathDeserializer(List<Capture> captures) {
        this.captures = List.copyOf(captures);
    }

    /**
     * @throws PathDeserializationException if the captures do not fit the shape
     */
    @SuppressWarnings("unchecked")
    <T> T deserialize(PathShape<T> shape) {
        validateTop(shape);
        return (T) decodeTop(shape);
    }

    private Object decodeTop(PathShape<?> shape) {
        if (shape instanceof ScalarShape<?> scalar) {
            requireArity(1);
            var capture = captures.get(0);
            return parse(scalar, capture.value(), Position.TOP);
        }
        if (shape instanceof OptionalShape<?> optional) {
            return Optional.of(decodeTop(optional.inner()));
        }
        if (shape instanceof TupleShape<?> tuple) {
            return decodeTuple(tuple);
        }
        if (shape instanceof ListShape<?> list) {
            return decodeList(list);
        }
        if (shape instanceof MapShape<?> map) {
            return decodeMap(map);
        }
        if (shape instanceof RecordShape<?> record) {
            return decodeRecord(record);
        }
        throw PathDeserializationException.unsupportedType(shape.typeName());
    }

    private Object decodeTuple(TupleShape<?> tuple) {
        var elements = tuple.elements();
        requireArity(elements.size());

        var values = new ArrayList<>(elements.size());
        for (var i = 0; i < elements.size(); i++) {
            values.add(decodeValue(elements.get(i), captures.get(i), Position.index(i)));
        }
        return tuple.assembler().apply(Collections.unmodifiableList(values));
    }

    private Object decodeList(ListShape<?> list) {
        var values = new ArrayList<>(captures.size());
        for (var i = 0; i < captures.size(); i++) {
            values.add(decodeValue(list.element(), captures.get(i), Position.index(i)));
        }
        return Collections.unmodifiableList(values);
    }

    private Object decodeMap(MapShape<?> map) {
        var values = new LinkedHashMap<String, Object>();
        for (var capture : captures) {
            values.put(capture.key(), decodeValue(map.value(), capture, Position.key(capture.key())));
        }
        return Collections.unmodifiableMap(values);
    }

    private Object decodeRecord(RecordShape<?> record) {
        var fields = record.fields();
        requireArity(fields.size());

        var byName = new HashMap<String, Capture>();
        captures.forEach(capture -> byName.put(capture.key(), capture));

        var values = new HashMap<String, Object>();
        for (var field : fields) {
            var capture = byName.get(field.name());
            if (capture == null) {
                throw PathDeserializationException.custom("missing field `" + field.name() + "`");
            }
            values.put(field.name(), decodeValue(field.shape(), capture, Position.key(field.name())));
        }
        return record.assembler().apply(new FieldValues(values));
    }

    private Object decodeValue(PathShape<?> shape, Capture capture, Position position) {
        if (shape instanceof ScalarShape<?> scalar) {
            return parse(scalar, capture.value(), position);
        }
        if (shape instanceof OptionalShape<?> optional) {
            return Optional.of(decodeValue(optional.inner(), capture, position));
        }
        if (shape instanceof EntryShape<?, ?> entry) {
            var key = parse(entry.key(), capture.key(), position);
            var value = parse(entry.value(), capture.value(), position);
            return Map.entry(key, value);
        }
        throw PathDeserializationException.unsupportedType(shape.typeName());
    }

    private static Object parse(ScalarShape<?> scalar, String value, Position position) {
        try {
            return Objects.requireNonNull(scalar.parser().parse(value), "parsed value");
        } catch (PathDeserializationException e) {
            throw e;
        } catch (Exception e) {
            throw new PathDeserializationException(position.parseError(value, scalar.typeName()));
        }
    }

    private void requireArity(int expected) {
        if (captures.size() != expected) {
            throw PathDeserializationException.wrongNumberOfParameters(captures.size(), expected);
        }
    }

    private static void validateTop(PathShape<?> shape) {
        if (shape instanceof ScalarShape<?>) {
            return;
        }
        if (shape instanceof OptionalShape<?> optional) {
            validateTop(optional.inner());
        } else if (shape instanceof TupleShape<?> tuple) {
            tuple.elements().forEach(element -> validateValue(element, false));
        } else if (shape instanceof ListShape<?> list) {
            validateValue(list.element(), true);
        } else if (shape instanceof MapShape<?> map) {
            validateValue(map.value(), false);
        } else if (shape instanceof RecordShape<?> record) {
            record.fields().forEach(field -> validateValue(field.shape(), false));
        } else {
            throw PathDeserializationException.unsupportedType(shape.typeName());
        }
    }

    private static void validateValue(PathShape<?> shape, boolean entryAllowed) {
        if (shape instanceof ScalarShape<?>) {
            return;
        }
        if (shape instanceof OptionalShape<?> optional) {
            validateValue(optional.inner(), entryAllowed);
        } else if (!(entryAllowed && shape instanceof EntryShape<?, ?>)) {
            throw PathDeserializationException.unsupportedType(shape.typeName());
        }
    }

    /**
     * Where a value sits in the target, determines which parse error kind is reported.
     */
    private sealed interface Position {
        Position TOP = new Top();

        ErrorKind parseError(String value, String expectedType);

        static Position index(int index) {
            return new AtIndex(index);
        }

        static Position key(String key) {
            return new AtKey(key);
        }

        record Top() implements Position {
            @Override
            public ErrorKind parseError(String value, String expectedType) {
                return new ParseError(value, expectedType);
            }
        }

        record AtIndex(int index) implements Position {
            @Override
            public ErrorKind parseError(String value, String expectedType) {
                return new ParseErrorAtIndex(index, value, expectedType);
            }
        }

        record AtKey(String key) implements Position {
            @Override
            public ErrorKind parseError(String value, String expectedType) {
                return new ParseErrorAtKey(key, value, expectedType);
            }
        }
    }
}
