package org.relay.http;

/**
 * Anything that can be rendered as an HTTP {@link Response}.
 */
@FunctionalInterface
public interface IntoResponse {
    Response toResponse();
}
