package org.relay.http.server;

import org.relay.http.Dispatcher;
import org.relay.http.server.impl.NettyHttpServer;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP server interface.
 * <p>
 * Create instances using the factory method {@link #httpServer(HttpServerConfig, Dispatcher)}.
 * Every accepted connection is served by its own worker, which reads one request, passes it to
 * the dispatcher, writes the response and closes the connection. A failure inside one worker is
 * answered with {@code 500} on that connection only.
 *
 * <h2>Example Usage</h2>
 * <pre>{@code
 * var server = HttpServer.httpServer(HttpServerConfig.http(3000), router);
 *
 * server.start()
 *       .thenRun(() -> System.out.println("Listening on " + server.boundPort().orElseThrow()))
 *       .join();
 * server.terminationFuture().join();
 * }</pre>
 */
public interface HttpServer {

    /**
     * Bind the listening socket and start accepting connections.
     *
     * @return future completing once the server is listening, or failing with
     *         {@link HttpServerException} carrying {@link HttpServerError.BindFailed}
     */
    CompletableFuture<Void> start();

    /**
     * Stop accepting connections and release server resources.
     *
     * @return future completing when the server is stopped
     */
    CompletableFuture<Void> stop();

    /**
     * Get the port the server is configured to listen on.
     *
     * @return configured port number
     */
    int port();

    /**
     * Get the port the server actually listens on, which differs from {@link #port()} when the
     * configured port is 0.
     *
     * @return bound port, empty while the server is not listening
     */
    Optional<Integer> boundPort();

    /**
     * Future completing when the accept loop ends: normally after {@link #stop()}, exceptionally
     * with {@link HttpServerException} carrying {@link HttpServerError.AcceptFailed} when
     * accepting a connection failed.
     */
    CompletableFuture<Void> terminationFuture();

    /**
     * Create a new HTTP server.
     *
     * @param config     server configuration
     * @param dispatcher dispatch entry point shared by all workers
     * @return server instance, not yet started
     */
    static HttpServer httpServer(HttpServerConfig config, Dispatcher dispatcher) {
        return NettyHttpServer.create(config, dispatcher);
    }
}
