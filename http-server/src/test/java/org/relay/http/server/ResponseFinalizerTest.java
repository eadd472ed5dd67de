package org.relay.http.server;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;
import org.relay.http.Response;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseFinalizerTest {

    @Test
    void content_length_matches_body_bytes() {
        var response = ResponseFinalizer.prepare(Response.ok("héllo"), HttpVersion.HTTP_1_1);

        assertThat(response.headers().get(HttpHeaderNames.CONTENT_LENGTH)).isEqualTo("6");
    }

    @Test
    void empty_body_gets_zero_length() {
        var response = ResponseFinalizer.prepare(Response.empty(HttpResponseStatus.NO_CONTENT), HttpVersion.HTTP_1_1);

        assertThat(response.headers().get(HttpHeaderNames.CONTENT_LENGTH)).isEqualTo("0");
    }

    @Test
    void content_length_is_appended_not_replaced() {
        var response = Response.ok("abc").header(HttpHeaderNames.CONTENT_LENGTH, 99);

        ResponseFinalizer.prepare(response, HttpVersion.HTTP_1_1);

        assertThat(response.headers().getAll(HttpHeaderNames.CONTENT_LENGTH)).containsExactly("99", "3");
    }

    @Test
    void request_version_is_copied() {
        var response = ResponseFinalizer.prepare(Response.ok("x"), HttpVersion.HTTP_1_0);

        assertThat(response.version()).isEqualTo(HttpVersion.HTTP_1_0);
    }
}
