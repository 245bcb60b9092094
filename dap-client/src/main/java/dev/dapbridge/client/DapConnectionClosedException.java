package dev.dapbridge.client;

/**
 * The session was torn down while the call was outstanding, or the call was issued on a connection
 * that could no longer be written to.
 */
public class DapConnectionClosedException extends DapException {

    public DapConnectionClosedException(String command, String message) {
        super(command, message);
    }

    public DapConnectionClosedException(String command, String message, Throwable cause) {
        super(command, message, cause);
    }
}
