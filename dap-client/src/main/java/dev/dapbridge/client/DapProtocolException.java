package dev.dapbridge.client;

/**
 * The debugger sent something that does not fit the protocol, for example a response body that
 * cannot be mapped to the expected result.
 */
public class DapProtocolException extends DapException {

    public DapProtocolException(String command, String message) {
        super(command, message);
    }

    public DapProtocolException(String command, String message, Throwable cause) {
        super(command, message, cause);
    }
}
