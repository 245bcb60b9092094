package dev.dapbridge.client;

import java.time.Duration;

/**
 * No matching response arrived before the deadline. The connection stays open; a response that shows
 * up later is discarded.
 */
public class DapTimeoutException extends DapException {

    private final Duration timeout;

    public DapTimeoutException(String command, Duration timeout) {
        this(command, timeout, "Timed out after " + timeout.toMillis() + " ms waiting for '" + command + "'");
    }

    public DapTimeoutException(String command, Duration timeout, String message) {
        super(command, message);
        this.timeout = timeout;
    }

    public Duration timeout() {
        return timeout;
    }
}
