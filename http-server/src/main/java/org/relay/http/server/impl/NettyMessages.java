package org.relay.http.server.impl;

import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.FullHttpResponse;
import org.relay.http.HttpMethod;
import org.relay.http.Request;
import org.relay.http.Response;

import java.util.HashMap;
import java.util.Map;

/**
 * Conversion between Netty's HTTP messages and the request/response model.
 */
final class NettyMessages {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private NettyMessages() {}

    /**
     * Copy a decoded Netty request into a {@link Request}. The Netty message may be released
     * afterwards.
     *
     * @throws IllegalArgumentException if the request method is not a known {@link HttpMethod}
     */
    static Request toRequest(FullHttpRequest request) {
        var method = HttpMethod.from(request.method().name());
        var body = ByteBufUtil.getBytes(request.content());

        return Request.request(method, escapeRawBytes(request.uri()), request.protocolVersion(),
                               extractHeaders(request), body);
    }

    /**
     * Netty decodes the request line as ISO-8859-1, one char per byte. Bytes outside ASCII are
     * percent-escaped so that later decoding sees the bytes actually received.
     */
    static String escapeRawBytes(String uri) {
        var firstRaw = 0;
        while (firstRaw < uri.length() && uri.charAt(firstRaw) < 0x80) {
            firstRaw++;
        }
        if (firstRaw == uri.length()) {
            return uri;
        }

        var sb = new StringBuilder(uri.length() + 16).append(uri, 0, firstRaw);
        for (var i = firstRaw; i < uri.length(); i++) {
            var c = uri.charAt(i);

            if (c < 0x80) {
                sb.append(c);
            } else {
                sb.append('%').append(HEX[(c >> 4) & 0x0F]).append(HEX[c & 0x0F]);
            }
        }
        return sb.toString();
    }

    static FullHttpResponse toNetty(Response response) {
        var nettyResponse = new DefaultFullHttpResponse(response.version(),
                                                        response.status(),
                                                        Unpooled.wrappedBuffer(response.body()));
        nettyResponse.headers().add(response.headers());
        return nettyResponse;
    }

    private static Map<String, String> extractHeaders(FullHttpRequest request) {
        var headers = new HashMap<String, String>();
        for (var entry : request.headers()) {
            headers.put(entry.getKey().toLowerCase(), entry.getValue());
        }
        return headers;
    }
}
