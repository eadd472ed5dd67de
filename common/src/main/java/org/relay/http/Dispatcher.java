package org.relay.http;

/**
 * Dispatch entry point invoked by the server for every parsed request.
 * <p>
 * Implementations are built once at startup and shared by all connection workers, so they must
 * not hold mutable state. Route matching happens behind this interface: a matching router
 * populates the {@link Captures} found in {@code extensions} and runs the route's handler.
 */
@FunctionalInterface
public interface Dispatcher {
    /**
     * Dispatch request.
     *
     * @param request    parsed request
     * @param extensions request-scoped side table; always contains a {@link Captures} instance
     * @return outcome of the dispatch
     */
    DispatchOutcome dispatch(Request request, Extensions extensions);
}
