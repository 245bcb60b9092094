package dev.dapbridge.client;

import dev.dapbridge.transport.DapMessage;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Handle on a launch or attach request. The request itself is only written by
 * {@link DapClient#configurationDone()}, so the handle completes after that call.
 */
public final class PendingLaunch {

    private final String command;
    private final CompletableFuture<DapMessage> acknowledgement = new CompletableFuture<>();

    PendingLaunch(String command) {
        this.command = command;
    }

    /** {@code launch} or {@code attach}. */
    public String command() {
        return command;
    }

    public boolean isDone() {
        return acknowledgement.isDone();
    }

    /** Whether the debugger acknowledged the request with {@code success=true}. */
    public boolean isAcknowledged() {
        return acknowledgement.isDone() && !acknowledgement.isCompletedExceptionally()
            && acknowledgement.join().succeeded();
    }

    /**
     * Waits for the debugger's answer to the launch or attach request.
     *
     * @throws DapRemoteException when the debugger rejected the request
     */
    public void await(Duration timeout) throws DapException, InterruptedException {
        DapMessage response;
        try {
            response = acknowledgement.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new DapTimeoutException(command, timeout);
        } catch (ExecutionException e) {
            throw DapSession.unwrap(command, e.getCause());
        }
        if (!response.succeeded()) {
            throw new DapRemoteException(command, response.message(), response.body());
        }
    }

    CompletableFuture<DapMessage> future() {
        return acknowledgement;
    }

    void bind(PendingCall call) {
        call.response().whenComplete((message, error) -> {
            if (error != null) {
                acknowledgement.completeExceptionally(DapSession.failure(call, error));
            } else {
                acknowledgement.complete(message);
            }
        });
    }

    void fail(Throwable cause) {
        acknowledgement.completeExceptionally(cause);
    }
}
