package org.relay.http.extract;

import io.netty.handler.codec.http.HttpResponseStatus;
import org.relay.http.Rejection;
import org.relay.http.Response;

import java.util.Objects;

/**
 * Rejection produced when path captures cannot be extracted into the target type.
 * <p>
 * Client errors render as {@code 400 Bad Request} with an {@code "Invalid URL: "} prefix; errors
 * caused by route and target type not fitting together render as {@code 500 Internal Server Error}
 * with the bare message.
 */
public final class PathRejection extends Rejection {
    private static final String INVALID_URL_PREFIX = "Invalid URL: ";

    private final ErrorKind kind;

    public PathRejection(ErrorKind kind) {
        super(Objects.requireNonNull(kind, "kind").message());
        this.kind = kind;
    }

    /**
     * Underlying error kind.
     */
    public ErrorKind kind() {
        return kind;
    }

    public HttpResponseStatus status() {
        return kind.isClientError()
               ? HttpResponseStatus.BAD_REQUEST
               : HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }

    @Override
    public Response toResponse() {
        var body = kind.isClientError()
                   ? INVALID_URL_PREFIX + kind.message()
                   : kind.message();
        return Response.text(status(), body);
    }
}
