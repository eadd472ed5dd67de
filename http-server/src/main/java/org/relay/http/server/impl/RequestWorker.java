package org.relay.http.server.impl;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.relay.http.Captures;
import org.relay.http.Dispatcher;
import org.relay.http.Extensions;
import org.relay.http.Request;
import org.relay.http.Response;
import org.relay.http.server.ResponseFinalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;

/**
 * Per-connection request pipeline.
 * <p>
 * One instance is installed on every accepted connection. It takes the first decoded request,
 * stops reading from the connection and hands the request to the executor, where dispatch,
 * extraction and response finalization run. The connection is closed once the response has been
 * written. Anything thrown by the dispatcher is contained here and answered with {@code 500}.
 */
public final class RequestWorker extends SimpleChannelInboundHandler<FullHttpRequest> {
    private static final Logger LOG = LoggerFactory.getLogger(RequestWorker.class);

    private final Dispatcher dispatcher;
    private final Executor executor;
    private boolean requestReceived;

    public RequestWorker(Dispatcher dispatcher, Executor executor) {
        this.dispatcher = dispatcher;
        this.executor = executor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest nettyRequest) {
        if (requestReceived) {
            return;
        }
        requestReceived = true;
        ctx.channel().config().setAutoRead(false);

        if (!nettyRequest.decoderResult().isSuccess()) {
            LOG.debug("Rejecting undecodable request", nettyRequest.decoderResult().cause());
            sendBadRequest(ctx, nettyRequest.protocolVersion());
            return;
        }

        Request request;
        try {
            request = NettyMessages.toRequest(nettyRequest);
        } catch (IllegalArgumentException e) {
            LOG.debug("Rejecting request: {}", e.getMessage());
            sendBadRequest(ctx, nettyRequest.protocolVersion());
            return;
        }

        executor.execute(() -> serve(ctx, request));
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOG.warn("Connection error", cause);
        ctx.close();
    }

    private void serve(ChannelHandlerContext ctx, Request request) {
        LOG.debug("Dispatching {}", request);

        Response response;
        try {
            var extensions = new Extensions();
            extensions.put(Captures.class, Captures.empty());

            response = dispatcher.dispatch(request, extensions).toResponse();
        } catch (Throwable t) {
            LOG.error("Request worker failed for {}", request, t);
            response = Response.internalError(HttpResponseStatus.INTERNAL_SERVER_ERROR.reasonPhrase());
        }

        send(ctx, ResponseFinalizer.prepare(response, request.version()));
    }

    private static void sendBadRequest(ChannelHandlerContext ctx, HttpVersion version) {
        send(ctx, ResponseFinalizer.prepare(Response.badRequest("Invalid HTTP request"), version));
    }

    private static void send(ChannelHandlerContext ctx, Response response) {
        ctx.writeAndFlush(NettyMessages.toNetty(response))
           .addListener(future -> {
               if (!future.isSuccess()) {
                   LOG.warn("Failed to send response", future.cause());
               }
               ctx.close();
           });
    }
}
