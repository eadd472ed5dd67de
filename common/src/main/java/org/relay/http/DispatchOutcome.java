package org.relay.http;

/**
 * Result of dispatching a request.
 */
public sealed interface DispatchOutcome extends IntoResponse {

    /**
     * A route matched and its handler produced a response.
     */
    record Handled(Response response) implements DispatchOutcome {
        @Override
        public Response toResponse() {
            return response;
        }
    }

    /**
     * A route matched but one of its extractors rejected the request.
     */
    record ExtractorFailed(Response response) implements DispatchOutcome {
        @Override
        public Response toResponse() {
            return response;
        }
    }

    /**
     * No route matched the request.
     */
    record NoRouteMatched(Request request) implements DispatchOutcome {
        @Override
        public Response toResponse() {
            return Response.notFound();
        }
    }

    static DispatchOutcome handled(Response response) {
        return new Handled(response);
    }

    static DispatchOutcome extractorFailed(Rejection rejection) {
        return new ExtractorFailed(rejection.toResponse());
    }

    static DispatchOutcome noRouteMatched(Request request) {
        return new NoRouteMatched(request);
    }
}
