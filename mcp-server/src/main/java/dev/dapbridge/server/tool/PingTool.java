package dev.dapbridge.server.tool;

import java.util.List;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import dev.dapbridge.server.mcp.ParameterType;
import dev.dapbridge.server.mcp.ToolArguments;
import dev.dapbridge.server.mcp.ToolDefinition;
import dev.dapbridge.server.mcp.ToolParameter;

/**
 * Connectivity check that answers without touching the debugger.
 */
@Component
@Order(0)
public class PingTool implements ToolProvider {

	@Override
	public List<ToolDefinition> tools() {
		return List.of(new ToolDefinition("godot_ping",
				"Test tool that echoes back a message. Use it to verify the MCP server is responding.",
				List.of(ToolParameter.optional("message", ParameterType.STRING, "Message to echo back", "pong")),
				this::handlePing));
	}

	private Object handlePing(ToolArguments arguments) {
		return "Echo: " + arguments.string("message");
	}

}
