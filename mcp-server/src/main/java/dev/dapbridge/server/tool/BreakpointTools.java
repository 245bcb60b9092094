package dev.dapbridge.server.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.dapbridge.client.DapClient;
import dev.dapbridge.client.DapException;
import dev.dapbridge.client.SessionState;
import dev.dapbridge.client.model.Breakpoint;
import dev.dapbridge.client.model.SetBreakpointsResult;
import dev.dapbridge.server.mcp.ParameterType;
import dev.dapbridge.server.mcp.ToolArguments;
import dev.dapbridge.server.mcp.ToolDefinition;
import dev.dapbridge.server.mcp.ToolParameter;

/**
 * Breakpoint tools. Breakpoints requested before a launch are staged by the
 * {@link DebugSessionManager}; during configuration they are sent to Godot straight away.
 */
@Component
@Order(30)
@RequiredArgsConstructor
public class BreakpointTools implements ToolProvider {

	private static final Logger logger = LoggerFactory.getLogger(BreakpointTools.class);

	private final DebugSessionManager sessions;

	@Override
	public List<ToolDefinition> tools() {
		ToolParameter file = ToolParameter.required("file", ParameterType.STRING,
				"Path to GDScript file (absolute or res:// path)");
		return List.of(
				new ToolDefinition("godot_set_breakpoint",
						"Set a breakpoint in a GDScript file at the specified line. Godot may move it to the next "
								+ "executable line; the verified location is returned. Set breakpoints after "
								+ "godot_connect and before launching the game.",
						List.of(file, ToolParameter.required("line", ParameterType.NUMBER,
								"Line number where breakpoint should be set (1-indexed)")),
						this::handleSetBreakpoint),
				new ToolDefinition("godot_clear_breakpoint", "Clear all breakpoints of a GDScript file.",
						List.of(file), this::handleClearBreakpoint));
	}

	private Object handleSetBreakpoint(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		String file = arguments.requireString("file");
		int line = arguments.integer("line");
		if (line < 1) {
			throw ToolErrors.invalidArgument("line must be a positive integer (got: " + line + ")");
		}
		String path = ResPathResolver.resolve(file, this.sessions.projectRoot());
		List<Integer> lines = this.sessions.linesWith(path, line);

		Map<String, Object> result = new LinkedHashMap<>();
		if (client.getState() == SessionState.INITIALIZED) {
			this.sessions.recordBreakpoints(path, lines);
			logger.debug("Staged breakpoint {}:{}", path, line);
			result.put("status", "staged");
			result.put("message", "Breakpoint at " + file + ":" + line + " will be sent when the game is launched");
			result.put("file", file);
			result.put("requested_line", line);
			result.put("lines", lines);
			return result;
		}

		SetBreakpointsResult response;
		try {
			response = client.setBreakpoints(path, lines);
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("set a breakpoint", e);
		}
		this.sessions.recordBreakpoints(path, lines);

		int index = lines.indexOf(line);
		if (index >= response.breakpoints().size()) {
			throw ToolErrors.failure("Godot did not report the requested breakpoint", file + ":" + line,
					List.of("Check that the file is a GDScript file of the project"), null);
		}
		Breakpoint breakpoint = response.breakpoints().get(index);
		Integer actual = breakpoint.line() != null ? breakpoint.line() : line;
		if (!breakpoint.verified()) {
			result.put("status", "unverified");
			result.put("message", "Breakpoint set but not verified by Godot");
			result.put("file", file);
			result.put("requested_line", line);
			result.put("actual_line", actual);
			result.put("reason", breakpoint.message() != null ? breakpoint.message()
					: "File may not be loaded or line may not be executable");
			return result;
		}
		result.put("status", "verified");
		result.put("message", "Breakpoint set at " + file + ":" + actual);
		result.put("file", file);
		result.put("requested_line", line);
		result.put("actual_line", actual);
		result.put("adjusted", actual != line);
		if (breakpoint.id() != null) {
			result.put("id", breakpoint.id());
		}
		return result;
	}

	private Object handleClearBreakpoint(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		String file = arguments.requireString("file");
		String path = ResPathResolver.resolve(file, this.sessions.projectRoot());
		if (client.getState() != SessionState.INITIALIZED) {
			try {
				client.setBreakpoints(path, List.of());
			}
			catch (DapException e) {
				throw ToolErrors.fromDap("clear breakpoints", e);
			}
		}
		this.sessions.clearBreakpoints(path);
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("status", "cleared");
		result.put("message", "All breakpoints cleared in " + file);
		result.put("file", file);
		return result;
	}

}
