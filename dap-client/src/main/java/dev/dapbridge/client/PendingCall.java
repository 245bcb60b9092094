package dev.dapbridge.client;

import dev.dapbridge.transport.DapMessage;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * One outstanding command. The delivery slot is completed exactly once: with the matching response,
 * with a timeout, or with {@link DapConnectionClosedException} when the session goes away.
 */
final class PendingCall {

    private final int seq;
    private final String command;
    private final Duration timeout;
    private final CompletableFuture<DapMessage> response = new CompletableFuture<>();

    PendingCall(int seq, String command, Duration timeout) {
        this.seq = seq;
        this.command = command;
        this.timeout = timeout;
        response.orTimeout(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
    }

    int seq() {
        return seq;
    }

    String command() {
        return command;
    }

    Duration timeout() {
        return timeout;
    }

    CompletableFuture<DapMessage> response() {
        return response;
    }

    boolean complete(DapMessage message) {
        return response.complete(message);
    }

    boolean fail(Throwable cause) {
        return response.completeExceptionally(cause);
    }

    @Override
    public String toString() {
        return command + "#" + seq;
    }
}
