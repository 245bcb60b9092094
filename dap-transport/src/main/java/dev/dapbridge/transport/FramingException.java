package dev.dapbridge.transport;

import java.io.IOException;

/**
 * Raised when a frame header cannot be parsed. The stream position is unknown afterwards, so the
 * connection carrying it has to be closed.
 */
public class FramingException extends IOException {

    public FramingException(String message) {
        super(message);
    }
}
