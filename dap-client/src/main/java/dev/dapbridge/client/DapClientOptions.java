package dev.dapbridge.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Set;

/**
 * Tuning for a {@link DapClient}.
 *
 * @param connectTimeout      bound on opening the socket and on the initialize handshake
 * @param commandTimeout      default deadline of every other command
 * @param disconnectTimeout   how long {@code disconnect} waits for its acknowledgement before closing anyway
 * @param eventLogCapacity    number of events kept by the {@link EventLog}
 * @param unsupportedCommands commands rejected locally because the debugger never answers them
 */
public record DapClientOptions(Duration connectTimeout, Duration commandTimeout, Duration disconnectTimeout,
                               int eventLogCapacity, Set<String> unsupportedCommands) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_COMMAND_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_DISCONNECT_TIMEOUT = Duration.ofSeconds(2);

    public DapClientOptions {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(commandTimeout, "commandTimeout");
        Objects.requireNonNull(disconnectTimeout, "disconnectTimeout");
        unsupportedCommands = unsupportedCommands == null ? Set.of() : Set.copyOf(unsupportedCommands);
    }

    public static DapClientOptions defaults() {
        return new DapClientOptions(DEFAULT_CONNECT_TIMEOUT, DEFAULT_COMMAND_TIMEOUT, DEFAULT_DISCONNECT_TIMEOUT,
            EventLog.DEFAULT_CAPACITY, Set.of("stepOut"));
    }

    public DapClientOptions withCommandTimeout(Duration timeout) {
        return new DapClientOptions(connectTimeout, timeout, disconnectTimeout, eventLogCapacity, unsupportedCommands);
    }

    public DapClientOptions withConnectTimeout(Duration timeout) {
        return new DapClientOptions(timeout, commandTimeout, disconnectTimeout, eventLogCapacity, unsupportedCommands);
    }

    public DapClientOptions withUnsupportedCommands(Set<String> commands) {
        return new DapClientOptions(connectTimeout, commandTimeout, disconnectTimeout, eventLogCapacity, commands);
    }
}
