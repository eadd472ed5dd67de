package org.relay.http;

/**
 * Pulls a typed value out of a request.
 *
 * @param <T> extracted value type
 */
@FunctionalInterface
public interface Extractor<T> {
    /**
     * Extract value.
     *
     * @param request    request being handled
     * @param extensions request-scoped side table
     * @return extracted value
     * @throws Rejection if the request does not carry a valid value
     */
    T extract(Request request, Extensions extensions) throws Rejection;
}
