package dev.dapbridge.client;

/**
 * The connected debugger is known not to implement a command. Godot, for one, accepts
 * {@code stepOut} on the wire but never answers it.
 */
public class DapUnsupportedCommandException extends DapRemoteException {

    public DapUnsupportedCommandException(String command) {
        super(command, "'" + command + "' is not implemented by the connected debugger",
            "unsupported command");
    }
}
