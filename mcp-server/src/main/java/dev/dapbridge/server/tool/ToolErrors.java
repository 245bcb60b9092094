package dev.dapbridge.server.tool;

import java.util.List;
import java.util.stream.Collectors;

import dev.dapbridge.client.DapConnectionClosedException;
import dev.dapbridge.client.DapException;
import dev.dapbridge.client.DapProtocolException;
import dev.dapbridge.client.DapRemoteException;
import dev.dapbridge.client.DapStateException;
import dev.dapbridge.client.DapTimeoutException;
import dev.dapbridge.client.DapUnsupportedCommandException;
import dev.dapbridge.client.SessionState;

/**
 * Builds tool error messages made of a problem statement, optional context, numbered suggestions
 * and the underlying error.
 */
public final class ToolErrors {

	private ToolErrors() {
	}

	/**
	 * Format a structured error message.
	 * @param problem what went wrong
	 * @param context short detail appended in parentheses, or {@code null}
	 * @param suggestions actionable steps, may be empty
	 * @param cause underlying error, or {@code null}
	 * @return the formatted message
	 */
	public static String format(String problem, String context, List<String> suggestions, Throwable cause) {
		StringBuilder message = new StringBuilder(problem);
		if (context != null && !context.isEmpty()) {
			message.append(" (").append(context).append(')');
		}
		message.append("\n\n");
		if (!suggestions.isEmpty()) {
			message.append("Suggestions:\n");
			for (int i = 0; i < suggestions.size(); i++) {
				message.append(i + 1).append(". ").append(suggestions.get(i)).append('\n');
			}
			message.append('\n');
		}
		if (cause != null) {
			message.append("Error details: ").append(cause.getMessage());
		}
		return message.toString().stripTrailing();
	}

	public static ToolException failure(String problem, String context, List<String> suggestions, Throwable cause) {
		return new ToolException(format(problem, context, suggestions, cause), cause);
	}

	public static ToolException notConnected() {
		return failure("Not connected to Godot DAP server", null,
				List.of("Call godot_connect() to establish a connection", "Ensure Godot editor is running"), null);
	}

	public static ToolException invalidArgument(String problem, String... suggestions) {
		return failure(problem, null, List.of(suggestions), null);
	}

	/**
	 * Translate a debugger client failure into a tool error.
	 * @param operation human readable name of the attempted operation, such as "step over"
	 * @param e the client failure
	 * @return the tool error to throw
	 */
	public static ToolException fromDap(String operation, DapException e) {
		if (e instanceof DapStateException state) {
			return failure("Cannot " + operation + " while the session is " + state.state().label(),
					"allowed: " + state.allowed().stream().map(SessionState::label).collect(Collectors.joining(", ")),
					stateSuggestions(state.state()), null);
		}
		if (e instanceof DapTimeoutException timeout) {
			return failure("Timed out waiting for Godot to answer " + e.command(), "after " + timeout.timeout(),
					List.of("Check that the game is still running and not blocked",
							"Increase dap.command-timeout for slow projects"),
					e);
		}
		if (e instanceof DapUnsupportedCommandException) {
			return failure("Godot's debugger does not implement " + e.command(), null,
					List.of("Use godot_step_over until the current function returns",
							"Set a breakpoint after the call site and use godot_continue"),
					null);
		}
		if (e instanceof DapRemoteException remote) {
			return failure("Godot rejected " + e.command(), remote.remoteMessage(),
					List.of("Check the arguments of the request", "Look at the Godot editor output for details"), null);
		}
		if (e instanceof DapConnectionClosedException) {
			return failure("Connection to Godot DAP server was lost", null,
					List.of("Check that the Godot editor is still running",
							"Call godot_disconnect() and then godot_connect() to start a new session"),
					e);
		}
		if (e instanceof DapProtocolException) {
			return failure("Unexpected reply from Godot DAP server", e.command(),
					List.of("Retry the operation", "Check that the Godot version supports DAP"), e);
		}
		return failure("Failed to " + operation, e.command(), List.of(), e);
	}

	private static List<String> stateSuggestions(SessionState state) {
		switch (state) {
			case DISCONNECTED:
				return List.of("Call godot_connect() to establish a connection");
			case CONNECTED:
			case INITIALIZED:
				return List.of("Call godot_launch_main_scene() (or another launch tool) to start the game",
						"Call godot_attach() to debug a game that is already running");
			case RUNNING:
				return List.of("Wait for a breakpoint to be hit", "Call godot_pause() to stop the game");
			case PAUSED:
				return List.of("Call godot_continue() or a step tool to resume the game");
			case TERMINATED:
				return List.of("The game has exited; call godot_disconnect() and godot_connect() again");
			default:
				return List.of("Wait for the current launch to finish");
		}
	}

}
