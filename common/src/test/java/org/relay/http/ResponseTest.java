package org.relay.http;

import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpVersion;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ResponseTest {

    @Test
    void text_sets_plain_text_content_type() {
        var response = Response.text(HttpResponseStatus.BAD_REQUEST, "nope");

        assertThat(response.status()).isEqualTo(HttpResponseStatus.BAD_REQUEST);
        assertThat(response.headers().get(HttpHeaderNames.CONTENT_TYPE)).isEqualTo(Response.TEXT_PLAIN_UTF8);
        assertThat(response.bodyAsString()).isEqualTo("nope");
    }

    @Test
    void header_appends_values() {
        var response = Response.empty(HttpResponseStatus.NO_CONTENT)
                               .header("x-trace", "a")
                               .header("x-trace", "b");

        assertThat(response.headers().getAll("x-trace")).containsExactly("a", "b");
        assertThat(response.body()).isEmpty();
    }

    @Test
    void version_defaults_to_http_1_1_and_can_be_replaced() {
        var response = Response.ok("hello");

        assertThat(response.version()).isEqualTo(HttpVersion.HTTP_1_1);
        assertThat(response.version(HttpVersion.HTTP_1_0).version()).isEqualTo(HttpVersion.HTTP_1_0);
    }

    @Test
    void notFound_has_fixed_body() {
        var response = Response.notFound();

        assertThat(response.status()).isEqualTo(HttpResponseStatus.NOT_FOUND);
        assertThat(response.bodyAsString()).isEqualTo("Not Found");
    }
}
