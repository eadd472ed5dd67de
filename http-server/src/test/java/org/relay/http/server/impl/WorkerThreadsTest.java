package org.relay.http.server.impl;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class WorkerThreadsTest {

    @Test
    void executor_runs_tasks_on_daemon_threads() throws Exception {
        var executor = WorkerThreads.newExecutor("relay-test");
        try {
            var daemon = executor.submit(() -> Thread.currentThread().isDaemon()).get(5, TimeUnit.SECONDS);

            assertThat(daemon).isTrue();
        } finally {
            executor.shutdownNow();
        }
    }
}
