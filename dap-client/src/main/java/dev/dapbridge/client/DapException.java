package dev.dapbridge.client;

/**
 * Base type of every failure raised by the DAP client. Each subtype maps to one failure class so that
 * callers can decide what to tell the user without parsing messages.
 */
public class DapException extends Exception {

    private final String command;

    public DapException(String command, String message) {
        super(message);
        this.command = command;
    }

    public DapException(String command, String message, Throwable cause) {
        super(message, cause);
        this.command = command;
    }

    /** The DAP command that failed, or {@code null} when the failure is not tied to one. */
    public String command() {
        return command;
    }
}
