package org.relay.http.extract;

import org.relay.http.Captures;
import org.relay.http.Captures.Capture;
import org.relay.http.Extensions;
import org.relay.http.Extractor;
import org.relay.http.Request;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Objects;

/**
 * Extractor for typed values out of the path captures of the matched route.
 * <pre>{@code
 * static final PathExtractor<Map.Entry<Long, Long>> MEMBER =
 *         PathExtractor.path(PathShape.pair(Scalars.LONG, Scalars.LONG));
 *
 * Handler handler = Handler.extracting(MEMBER, (request, ids) -> Response.ok(ids.getKey() + "/" + ids.getValue()));
 * }</pre>
 * The router must have installed {@link Captures} in the request extensions before the extractor
 * runs; its absence is a programmer error and raises {@link IllegalStateException}.
 *
 * @param <T> extracted value type
 */
public final class PathExtractor<T> implements Extractor<T> {
    private static final Logger LOG = LoggerFactory.getLogger(PathExtractor.class);

    private final PathShape<T> shape;

    private PathExtractor(PathShape<T> shape) {
        this.shape = Objects.requireNonNull(shape, "shape");
    }

    public static <T> PathExtractor<T> path(PathShape<T> shape) {
        return new PathExtractor<>(shape);
    }

    public PathShape<T> shape() {
        return shape;
    }

    @Override
    public T extract(Request request, Extensions extensions) throws PathRejection {
        return extract(extensions.require(Captures.class), shape);
    }

    /**
     * Percent-decode all captures and deserialize them into the given shape.
     * <p>
     * A capture which does not decode to valid UTF-8 fails immediately with
     * {@link ErrorKind.InvalidUtf8InPathParam}, before deserialization starts. The captures are
     * not modified.
     */
    public static <T> T extract(Captures captures, PathShape<T> shape) throws PathRejection {
        var decoded = new ArrayList<Capture>(captures.size());

        for (var capture : captures.entries()) {
            var value = PercentDecoding.decode(capture.value());

            if (value.isEmpty()) {
                throw rejection(new ErrorKind.InvalidUtf8InPathParam(capture.key()));
            }
            decoded.add(new Capture(capture.key(), value.get()));
        }

        try {
            return new PathDeserializer(decoded).deserialize(shape);
        } catch (PathDeserializationException e) {
            throw rejection(e.kind());
        }
    }

    private static PathRejection rejection(ErrorKind kind) {
        if (kind.isClientError()) {
            LOG.debug("Rejected path captures: {}", kind.message());
        } else {
            LOG.error("Path captures do not fit target type: {}", kind.message());
        }
        return new PathRejection(kind);
    }
}
