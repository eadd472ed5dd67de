package org.relay.http.server.impl;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInboundHandlerAdapter;
import org.relay.http.server.HttpServerError;
import org.relay.http.server.HttpServerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Sits on the listening channel. An accept failure is fatal for the accept loop: the listening
 * channel is closed and the server's termination future fails with
 * {@link HttpServerError.AcceptFailed}. Workers already running are not affected.
 */
final class AcceptFailureHandler extends ChannelInboundHandlerAdapter {
    private static final Logger LOG = LoggerFactory.getLogger(AcceptFailureHandler.class);

    private final CompletableFuture<Void> termination;

    AcceptFailureHandler(CompletableFuture<Void> termination) {
        this.termination = termination;
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.error("Failed to accept connection, stopping accept loop", cause);
        termination.completeExceptionally(new HttpServerException(new HttpServerError.AcceptFailed(cause)));
        ctx.channel().close();
    }
}
