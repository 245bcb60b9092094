package dev.dapbridge.client;

import java.util.Set;

/**
 * A command was issued in a session state where it is not legal. Raised before anything is written
 * to the connection.
 */
public class DapStateException extends DapException {

    private final SessionState state;
    private final Set<SessionState> allowed;

    public DapStateException(String command, SessionState state, Set<SessionState> allowed) {
        super(command, "Cannot send '" + command + "': session is " + state + " (allowed: " + allowed + ")");
        this.state = state;
        this.allowed = Set.copyOf(allowed);
    }

    public SessionState state() {
        return state;
    }

    public Set<SessionState> allowed() {
        return allowed;
    }
}
