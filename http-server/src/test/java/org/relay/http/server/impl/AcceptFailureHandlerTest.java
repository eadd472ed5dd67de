package org.relay.http.server.impl;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;
import org.relay.http.server.HttpServerError;
import org.relay.http.server.HttpServerException;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AcceptFailureHandlerTest {

    @Test
    void accept_failure_closes_listener_and_fails_termination() {
        var termination = new CompletableFuture<Void>();
        var channel = new EmbeddedChannel(new AcceptFailureHandler(termination));
        var cause = new IOException("Too many open files");

        channel.pipeline().fireExceptionCaught(cause);

        assertThat(channel.isOpen()).isFalse();
        assertThatThrownBy(termination::get)
                .isInstanceOf(ExecutionException.class)
                .cause()
                .isInstanceOfSatisfying(HttpServerException.class, e -> {
                    assertThat(e.error()).isEqualTo(new HttpServerError.AcceptFailed(cause));
                    assertThat(e.getMessage()).isEqualTo("Failed to accept connection: Too many open files");
                    assertThat(e.getCause()).isSameAs(cause);
                });
    }

    @Test
    void termination_stays_pending_without_failure() {
        var termination = new CompletableFuture<Void>();
        var channel = new EmbeddedChannel(new AcceptFailureHandler(termination));

        assertThat(channel.isOpen()).isTrue();
        assertThat(termination).isNotDone();
        channel.finishAndReleaseAll();
    }
}
