package dev.dapbridge.server.config;

import java.time.Duration;
import java.util.Set;

import org.springframework.boot.context.properties.ConfigurationProperties;

import dev.dapbridge.client.DapClientOptions;
import dev.dapbridge.client.EventLog;

/**
 * Connection settings for the Godot debug adapter. Unset values fall back to the client defaults;
 * the editor listens on {@code localhost:6006} unless configured otherwise.
 */
@ConfigurationProperties("dap")
public record DapProperties(String host, Integer port, Duration connectTimeout, Duration commandTimeout,
		Duration disconnectTimeout, Integer eventLogCapacity, Set<String> unsupportedCommands, String projectRoot) {

	public static final int DEFAULT_PORT = 6006;

	public DapProperties {
		host = host == null || host.isBlank() ? "localhost" : host;
		port = port == null ? DEFAULT_PORT : port;
		connectTimeout = connectTimeout == null ? DapClientOptions.DEFAULT_CONNECT_TIMEOUT : connectTimeout;
		commandTimeout = commandTimeout == null ? DapClientOptions.DEFAULT_COMMAND_TIMEOUT : commandTimeout;
		disconnectTimeout = disconnectTimeout == null ? DapClientOptions.DEFAULT_DISCONNECT_TIMEOUT
				: disconnectTimeout;
		eventLogCapacity = eventLogCapacity == null ? EventLog.DEFAULT_CAPACITY : eventLogCapacity;
		unsupportedCommands = unsupportedCommands == null ? Set.of("stepOut") : Set.copyOf(unsupportedCommands);
		projectRoot = projectRoot == null || projectRoot.isBlank() ? null : projectRoot;
	}

	/**
	 * Convert these settings into client options.
	 * @return options for a new {@link dev.dapbridge.client.DapClient}
	 */
	public DapClientOptions toClientOptions() {
		return new DapClientOptions(connectTimeout, commandTimeout, disconnectTimeout, eventLogCapacity,
				unsupportedCommands);
	}

}
