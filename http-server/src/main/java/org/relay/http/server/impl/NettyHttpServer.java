package org.relay.http.server.impl;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import org.relay.http.Dispatcher;
import org.relay.http.server.HttpServer;
import org.relay.http.server.HttpServerConfig;
import org.relay.http.server.HttpServerError;
import org.relay.http.server.HttpServerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Netty-based HTTP server implementation.
 * <p>
 * The single-threaded boss group is the connection acceptor. Request workers run on a
 * per-connection task executor so a slow or failing dispatch never blocks an event loop.
 */
public final class NettyHttpServer implements HttpServer {
    private static final Logger LOG = LoggerFactory.getLogger(NettyHttpServer.class);

    private final HttpServerConfig config;
    private final Dispatcher dispatcher;
    private final CompletableFuture<Void> termination = new CompletableFuture<>();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private ExecutorService workerExecutor;
    private volatile Channel serverChannel;

    private NettyHttpServer(HttpServerConfig config, Dispatcher dispatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
    }

    /**
     * Create a new Netty HTTP server.
     *
     * @param config     server configuration
     * @param dispatcher dispatch entry point
     * @return server instance
     */
    public static HttpServer create(HttpServerConfig config, Dispatcher dispatcher) {
        return new NettyHttpServer(config, dispatcher);
    }

    @Override
    public CompletableFuture<Void> start() {
        var started = new CompletableFuture<Void>();

        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        workerExecutor = WorkerThreads.newExecutor("relay-worker");

        try {
            var bootstrap = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .handler(new AcceptFailureHandler(termination))
                    .childHandler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        protected void initChannel(SocketChannel ch) {
                            var pipeline = ch.pipeline();

                            pipeline.addLast(new HttpServerCodec());
                            pipeline.addLast(new HttpObjectAggregator(config.maxContentLength()));
                            pipeline.addLast(new RequestWorker(dispatcher, workerExecutor));
                        }
                    })
                    .option(ChannelOption.SO_BACKLOG, config.socketOptions().soBacklog())
                    .childOption(ChannelOption.SO_KEEPALIVE, config.socketOptions().soKeepalive());

            var channelFuture = bootstrap.bind(config.port());

            channelFuture.addListener(future -> {
                if (future.isSuccess()) {
                    serverChannel = channelFuture.channel();
                    serverChannel.closeFuture().addListener(closed -> termination.complete(null));
                    LOG.info("HTTP server started on port {}", boundPort().orElse(config.port()));
                    started.complete(null);
                } else {
                    cleanup();
                    started.completeExceptionally(bindFailed(future.cause()));
                }
            });
        } catch (Exception e) {
            cleanup();
            started.completeExceptionally(bindFailed(e));
        }
        return started;
    }

    @Override
    public CompletableFuture<Void> stop() {
        var stopped = new CompletableFuture<Void>();

        LOG.info("Stopping HTTP server on port {}", boundPort().orElse(config.port()));

        var channel = serverChannel;
        if (channel != null) {
            channel.close().addListener(future -> {
                cleanup();
                stopped.complete(null);
            });
        } else {
            cleanup();
            stopped.complete(null);
        }
        return stopped;
    }

    @Override
    public int port() {
        return config.port();
    }

    @Override
    public Optional<Integer> boundPort() {
        var channel = serverChannel;

        if (channel == null || !channel.isActive()) {
            return Optional.empty();
        }
        return Optional.of(((InetSocketAddress) channel.localAddress()).getPort());
    }

    @Override
    public CompletableFuture<Void> terminationFuture() {
        return termination;
    }

    private HttpServerException bindFailed(Throwable cause) {
        LOG.error("Failed to bind to port {}", config.port(), cause);
        return new HttpServerException(new HttpServerError.BindFailed(config.port(), cause));
    }

    private void cleanup() {
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
        }
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
        }
        if (workerExecutor != null) {
            workerExecutor.shutdown();
        }
    }
}
