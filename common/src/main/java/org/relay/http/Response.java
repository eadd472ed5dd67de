package org.relay.http;

import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Outbound HTTP response.
 * <p>
 * The body is fixed at construction. Headers are multi-valued and may be appended to; the
 * protocol version is overwritten with the request's version right before the response is written.
 */
public final class Response implements IntoResponse {
    public static final String TEXT_PLAIN_UTF8 = "text/plain; charset=utf-8";

    private static final byte[] NO_BODY = new byte[0];

    private final HttpResponseStatus status;
    private final HttpHeaders headers = new DefaultHttpHeaders();
    private final byte[] body;
    private HttpVersion version = HttpVersion.HTTP_1_1;

    private Response(HttpResponseStatus status, byte[] body) {
        this.status = Objects.requireNonNull(status, "status");
        this.body = body == null ? NO_BODY : body;
    }

    /**
     * Create response with raw body and no headers.
     */
    public static Response response(HttpResponseStatus status, byte[] body) {
        return new Response(status, body);
    }

    /**
     * Create body-less response.
     */
    public static Response empty(HttpResponseStatus status) {
        return new Response(status, NO_BODY);
    }

    /**
     * Create plain text UTF-8 response.
     */
    public static Response text(HttpResponseStatus status, String body) {
        return new Response(status, body.getBytes(StandardCharsets.UTF_8))
                .header(HttpHeaderNames.CONTENT_TYPE, TEXT_PLAIN_UTF8);
    }

    public static Response ok(String body) {
        return text(HttpResponseStatus.OK, body);
    }

    public static Response notFound() {
        return text(HttpResponseStatus.NOT_FOUND, "Not Found");
    }

    public static Response badRequest(String message) {
        return text(HttpResponseStatus.BAD_REQUEST, message);
    }

    public static Response internalError(String message) {
        return text(HttpResponseStatus.INTERNAL_SERVER_ERROR, message);
    }

    public HttpResponseStatus status() {
        return status;
    }

    public HttpHeaders headers() {
        return headers;
    }

    public byte[] body() {
        return body;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    public HttpVersion version() {
        return version;
    }

    public Response version(HttpVersion version) {
        this.version = Objects.requireNonNull(version, "version");
        return this;
    }

    /**
     * Append header value, keeping values already present under the same name.
     */
    public Response header(CharSequence name, Object value) {
        headers.add(name, value);
        return this;
    }

    @Override
    public Response toResponse() {
        return this;
    }

    @Override
    public String toString() {
        return "Response[" + version + " " + status + ", " + body.length + " bytes]";
    }
}
