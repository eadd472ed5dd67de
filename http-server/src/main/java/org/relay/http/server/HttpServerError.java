package org.relay.http.server;

/**
 * Error types for HTTP server operations.
 */
public sealed interface HttpServerError {

    String message();

    /**
     * Underlying failure.
     */
    Throwable cause();

    /**
     * Failed to bind to the specified port.
     */
    record BindFailed(int port, Throwable cause) implements HttpServerError {
        @Override
        public String message() {
            return "Failed to bind to port " + port + ": " + cause.getMessage();
        }
    }

    /**
     * Accepting a connection failed; the accept loop has been terminated.
     */
    record AcceptFailed(Throwable cause) implements HttpServerError {
        @Override
        public String message() {
            return "Failed to accept connection: " + cause.getMessage();
        }
    }
}
