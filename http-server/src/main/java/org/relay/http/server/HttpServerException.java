package org.relay.http.server;

import java.util.Objects;

/**
 * Carries an {@link HttpServerError} through the server's lifecycle futures.
 */
public final class HttpServerException extends RuntimeException {
    private final HttpServerError error;

    public HttpServerException(HttpServerError error) {
        super(Objects.requireNonNull(error, "error").message(), error.cause());
        this.error = error;
    }

    public HttpServerError error() {
        return error;
    }
}
