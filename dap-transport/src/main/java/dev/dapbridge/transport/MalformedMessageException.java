package dev.dapbridge.transport;

import java.io.IOException;

/**
 * Raised when a correctly framed body is not a JSON object. The frame has been consumed in full, so
 * the reader may keep going with the next one.
 */
public class MalformedMessageException extends IOException {

    private final byte[] body;

    public MalformedMessageException(String message, byte[] body, Throwable cause) {
        super(message, cause);
        this.body = body;
    }

    public byte[] body() {
        return body.clone();
    }
}
