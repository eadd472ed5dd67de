package org.relay.http.server;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpVersion;
import org.relay.http.Response;

/**
 * Last step before a response goes on the wire.
 */
public final class ResponseFinalizer {
    private ResponseFinalizer() {}

    /**
     * Append {@code Content-Length} computed from the body and copy the request's protocol
     * version onto the response. A {@code Content-Length} already present is not removed.
     *
     * @param response       outbound response, modified in place
     * @param requestVersion protocol version of the inbound request
     * @return the same response
     */
    public static Response prepare(Response response, HttpVersion requestVersion) {
        response.headers().add(HttpHeaderNames.CONTENT_LENGTH, response.body().length);
        return response.version(requestVersion);
    }
}
