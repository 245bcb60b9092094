package dev.dapbridge.client;

import java.util.Locale;

/**
 * Lifecycle of a debug session. The order of the constants is the forward direction of the
 * lifecycle; the only moves against it are the {@code PAUSED -> RUNNING} toggle and the reset to
 * {@link #DISCONNECTED}.
 */
public enum SessionState {

    DISCONNECTED,
    CONNECTED,
    INITIALIZED,
    CONFIGURING,
    RUNNING,
    PAUSED,
    TERMINATED;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Whether a connection to the debugger is open in this state. */
    public boolean isConnected() {
        return this != DISCONNECTED;
    }

    /** Whether the debuggee has been started and not yet terminated. */
    public boolean isActive() {
        return this == RUNNING || this == PAUSED;
    }

    @Override
    public String toString() {
        return label();
    }
}
