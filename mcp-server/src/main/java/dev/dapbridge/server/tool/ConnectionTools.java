package dev.dapbridge.server.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import lombok.RequiredArgsConstructor;

import dev.dapbridge.client.DapClient;
import dev.dapbridge.client.DapException;
import dev.dapbridge.client.SessionState;
import dev.dapbridge.client.model.Capabilities;
import dev.dapbridge.server.mcp.ParameterType;
import dev.dapbridge.server.mcp.ToolArguments;
import dev.dapbridge.server.mcp.ToolDefinition;
import dev.dapbridge.server.mcp.ToolParameter;

/**
 * Tools that open and close the debugging session with the Godot editor.
 */
@Component
@Order(10)
@RequiredArgsConstructor
public class ConnectionTools implements ToolProvider {

	private static final Logger logger = LoggerFactory.getLogger(ConnectionTools.class);

	private final DebugSessionManager sessions;

	@Override
	public List<ToolDefinition> tools() {
		return List.of(
				new ToolDefinition("godot_connect", """
						Connect to the Godot editor's debug adapter and perform the initialize handshake.

						The Godot editor must be running with the debug adapter enabled \
						(Editor Settings > Network > Debug Adapter). After connecting, set breakpoints \
						and start the game with one of the launch tools or godot_attach.""",
						List.of(ToolParameter.optional("port", ParameterType.NUMBER,
								"Debug adapter port of the Godot editor (default: 6006)", sessions.defaultPort()),
								ToolParameter.optional("project", ParameterType.STRING,
										"Absolute path to project root (optional, enables res:// path resolution)")),
						this::handleConnect),
				new ToolDefinition("godot_disconnect",
						"Close the debugging session. A game started by a launch tool is stopped by Godot.", List.of(),
						this::handleDisconnect));
	}

	private Object handleConnect(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.client();
		SessionState state = client.getState();
		if (state.isConnected() && state != SessionState.TERMINATED) {
			Map<String, Object> result = new LinkedHashMap<>();
			result.put("status", "already_connected");
			result.put("message", "Already connected to Godot DAP server");
			result.put("state", state.label());
			return result;
		}
		if (state == SessionState.TERMINATED) {
			logger.info("Previous session terminated, closing it before reconnecting");
			client.close();
		}

		int port = arguments.integer("port");
		String host = this.sessions.host();
		String project = arguments.string("project");
		if (StringUtils.hasText(project)) {
			this.sessions.setProjectRoot(project);
		}
		this.sessions.forgetBreakpoints();

		try {
			client.connect(host, port);
		}
		catch (DapException e) {
			logger.warn("Cannot connect to {}:{}: {}", host, port, e.getMessage());
			throw ToolErrors.failure("Failed to connect to Godot DAP server", host + ":" + port,
					List.of("Launch Godot editor",
							"Enable DAP in Editor > Editor Settings > Network > Debug Adapter",
							"Check port setting (default: 6006, tried: " + port + ")"),
					e);
		}

		Capabilities capabilities;
		try {
			capabilities = client.initialize();
		}
		catch (DapException e) {
			logger.warn("Initialize handshake failed: {}", e.getMessage());
			client.close();
			throw ToolErrors.failure("Failed to initialize DAP session", host + ":" + port,
					List.of("Check that the port belongs to the Godot editor's debug adapter",
							"Restart the Godot editor and try again"),
					e);
		}

		Map<String, Object> result = new LinkedHashMap<>();
		result.put("status", "connected");
		result.put("message", "Connected to Godot DAP server at " + host + ":" + port + ". Ready to launch.");
		result.put("state", client.getState().label());
		if (this.sessions.projectRoot() != null) {
			result.put("project", this.sessions.projectRoot());
		}
		result.put("supports_configuration_done", capabilities.supportsConfigurationDoneRequest());
		return result;
	}

	private Object handleDisconnect(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.client();
		Map<String, Object> result = new LinkedHashMap<>();
		if (!client.isConnected()) {
			result.put("status", "not_connected");
			result.put("message", "Not currently connected to Godot DAP server");
			return result;
		}
		try {
			client.disconnect();
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("disconnect", e);
		}
		finally {
			this.sessions.forgetBreakpoints();
		}
		result.put("status", "disconnected");
		result.put("message", "Disconnected from Godot DAP server");
		return result;
	}

}
