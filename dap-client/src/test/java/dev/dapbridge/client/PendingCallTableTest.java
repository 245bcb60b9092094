package dev.dapbridge.client;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.dapbridge.transport.DapMessage;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;

class PendingCallTableTest {

    private final PendingCallTable table = new PendingCallTable();

    @Test
    void completesCallWithMatchingSeq() throws Exception {
        PendingCall threads = table.register(3, "threads", Duration.ofSeconds(5));

        assertThat(table.complete(response(3, "threads"))).isTrue();

        assertThat(threads.response().get(1, TimeUnit.SECONDS).requestSeq()).isEqualTo(3);
        assertThat(table.size()).isZero();
    }

    @Test
    void secondResponseForSameSeqIsDiscarded() {
        table.register(3, "threads", Duration.ofSeconds(5));

        assertThat(table.complete(response(3, "threads"))).isTrue();
        assertThat(table.complete(response(3, "threads"))).isFalse();
    }

    @Test
    void responseForDifferentCommandIsDropped() {
        PendingCall threads = table.register(3, "threads", Duration.ofSeconds(5));

        assertThat(table.complete(response(3, "stackTrace"))).isFalse();

        assertThat(threads.response()).isNotDone();
        assertThat(table.size()).isEqualTo(1);
    }

    @Test
    void handshakeResponsesFallBackToCommandMatch() throws Exception {
        PendingCall launch = table.register(5, "launch", Duration.ofSeconds(5));
        PendingCall done = table.register(6, "configurationDone", Duration.ofSeconds(5));

        assertThat(table.complete(response(42, "configurationDone"))).isTrue();
        assertThat(table.complete(response(43, "launch"))).isTrue();

        assertThat(done.response().get(1, TimeUnit.SECONDS).command()).isEqualTo("configurationDone");
        assertThat(launch.response().get(1, TimeUnit.SECONDS).command()).isEqualTo("launch");
    }

    @Test
    void otherCommandsDoNotFallBack() {
        table.register(5, "threads", Duration.ofSeconds(5));

        assertThat(table.complete(response(42, "threads"))).isFalse();
    }

    @Test
    void expiredCallLeavesTheTable() throws Exception {
        PendingCall call = table.register(1, "threads", Duration.ofMillis(20));

        assertThatThrownBy(() -> call.response().get(1, TimeUnit.SECONDS))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(TimeoutException.class);
        Thread.sleep(20);
        assertThat(table.size()).isZero();
        assertThat(table.complete(response(1, "threads"))).isFalse();
    }

    @Test
    void failAllCompletesEveryCallWithConnectionClosed() {
        PendingCall launch = table.register(1, "launch", Duration.ofSeconds(5));
        PendingCall done = table.register(2, "configurationDone", Duration.ofSeconds(5));

        table.failAll("gone");

        assertThat(launch.response()).isCompletedExceptionally();
        assertThatThrownBy(() -> done.response().join())
            .hasCauseInstanceOf(DapConnectionClosedException.class)
            .hasMessageContaining("gone");
        assertThat(table.size()).isZero();
    }

    private static DapMessage response(int requestSeq, String command) {
        return DapMessage.response(100, requestSeq, command, true, null, null);
    }
}
