package org.relay.http.server;

import org.relay.net.SocketOptions;

import java.util.Objects;

/**
 * Configuration for HTTP server.
 *
 * @param port             server port, 0 for an ephemeral port
 * @param maxContentLength maximum request body size in bytes
 * @param socketOptions    listening socket options
 */
public record HttpServerConfig(
        int port,
        int maxContentLength,
        SocketOptions socketOptions
) {
    public static final int DEFAULT_PORT = 8080;
    public static final int DEFAULT_MAX_CONTENT = 1024 * 1024; // 1MB

    public HttpServerConfig {
        Objects.requireNonNull(socketOptions, "socketOptions");
    }

    /**
     * Create HTTP server configuration.
     */
    public static HttpServerConfig http(int port) {
        return new HttpServerConfig(port, DEFAULT_MAX_CONTENT, SocketOptions.defaults());
    }

    /**
     * Create HTTP server configuration with custom max content length.
     */
    public static HttpServerConfig http(int port, int maxContentLength) {
        return new HttpServerConfig(port, maxContentLength, SocketOptions.defaults());
    }

    /**
     * Create default HTTP server on port 8080.
     */
    public static HttpServerConfig defaultConfig() {
        return http(DEFAULT_PORT);
    }

    public HttpServerConfig withPort(int port) {
        return new HttpServerConfig(port, maxContentLength, socketOptions);
    }

    public HttpServerConfig withMaxContentLength(int maxContentLength) {
        return new HttpServerConfig(port, maxContentLength, socketOptions);
    }

    public HttpServerConfig withSocketOptions(SocketOptions socketOptions) {
        return new HttpServerConfig(port, maxContentLength, socketOptions);
    }
}
