package dev.dapbridge.server.tool;

import java.util.List;
import java.util.regex.Pattern;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.dapbridge.client.DapClient;
import dev.dapbridge.client.DapException;
import dev.dapbridge.server.mcp.ParameterType;
import dev.dapbridge.server.mcp.ToolArguments;
import dev.dapbridge.server.mcp.ToolDefinition;
import dev.dapbridge.server.mcp.ToolParameter;

/**
 * Pausing a running game and the variable modification tool, which Godot cannot serve yet.
 */
@Component
@Order(60)
@RequiredArgsConstructor
public class AdvancedTools implements ToolProvider {

	private static final Pattern IDENTIFIER = Pattern.compile("^[a-zA-Z_][a-zA-Z0-9_]*$");

	private final DebugSessionManager sessions;

	@Override
	public List<ToolDefinition> tools() {
		return List.of(
				new ToolDefinition("godot_pause",
						"Pause the running game. Use godot_get_stack_trace to inspect the current state, "
								+ "then godot_continue to resume.",
						List.of(ExecutionTools.threadParameter("Thread ID to pause")), this::handlePause),
				new ToolDefinition("godot_set_variable",
						"Change the value of a variable in the paused game. Currently unavailable because "
								+ "Godot's debug adapter does not implement setVariable.",
						List.of(ToolParameter.required("variable_name", ParameterType.STRING,
								"Name of the variable to modify (a plain GDScript identifier)"),
								ToolParameter.required("value", ParameterType.ANY,
										"New value: string, number or boolean"),
								ToolParameter.optional("frame_id", ParameterType.NUMBER,
										"Stack frame ID (default: 0 = top frame)", 0)),
						this::handleSetVariable));
	}

	private Object handlePause(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		try {
			client.pause(arguments.integer("thread_id"));
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("pause", e);
		}
		return ExecutionTools.status("paused",
				"Execution paused. Use godot_get_stack_trace to inspect current state, then godot_continue to resume.");
	}

	private Object handleSetVariable(ToolArguments arguments) throws ToolException {
		this.sessions.requireSession();
		String name = arguments.requireString("variable_name");
		if (!IDENTIFIER.matcher(name).matches()) {
			throw ToolErrors.invalidArgument("Invalid variable name: '" + name + "'",
					"Use a plain GDScript identifier such as health or player_speed");
		}
		throw ToolErrors.failure("godot_set_variable is currently unavailable",
				"Godot 4.x advertises supportsSetVariable but its debug adapter does not implement setVariable",
				List.of("Inspect values with godot_get_variables or godot_evaluate",
						"Change the value in the script and relaunch the scene"),
				null);
	}

}
