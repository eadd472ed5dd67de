package org.relay.http;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Route handler as seen by the dispatch layer.
 * <p>
 * Extraction failures are thrown as {@link Rejection}s and turned into
 * {@link DispatchOutcome.ExtractorFailed} by {@link #invoke(Request, Extensions)}.
 */
@FunctionalInterface
public interface Handler {
    Response handle(Request request, Extensions extensions) throws Rejection;

    /**
     * Run handler, converting a rejection into the corresponding dispatch outcome.
     */
    default DispatchOutcome invoke(Request request, Extensions extensions) {
        try {
            return DispatchOutcome.handled(handle(request, extensions));
        } catch (Rejection rejection) {
            return DispatchOutcome.extractorFailed(rejection);
        }
    }

    /**
     * Create handler which runs the extractor first and passes its value to the body.
     *
     * @param extractor extractor producing the handler argument
     * @param body      handler body
     */
    static <T> Handler extracting(Extractor<T> extractor, BiFunction<Request, ? super T, ? extends IntoResponse> body) {
        Objects.requireNonNull(extractor, "extractor");
        Objects.requireNonNull(body, "body");

        return (request, extensions) -> body.apply(request, extractor.extract(request, extensions))
                                            .toResponse();
    }
}
