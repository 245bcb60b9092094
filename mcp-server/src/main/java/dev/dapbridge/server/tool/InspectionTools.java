package dev.dapbridge.server.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.dapbridge.client.DapClient;
import dev.dapbridge.client.DapException;
import dev.dapbridge.client.StoppedEvent;
import dev.dapbridge.client.model.DapThread;
import dev.dapbridge.client.model.EvaluateResult;
import dev.dapbridge.client.model.Scope;
import dev.dapbridge.client.model.ScopesResult;
import dev.dapbridge.client.model.StackFrame;
import dev.dapbridge.client.model.StackTraceResult;
import dev.dapbridge.client.model.ThreadsResult;
import dev.dapbridge.client.model.VariablesResult;
import dev.dapbridge.server.mcp.ParameterType;
import dev.dapbridge.server.mcp.ToolArguments;
import dev.dapbridge.server.mcp.ToolDefinition;
import dev.dapbridge.server.mcp.ToolParameter;

/**
 * Read-only inspection of a paused game: threads, stack frames, scopes, variables and expression
 * evaluation, with Godot values rendered by {@link GodotValueFormatter}.
 */
@Component
@Order(50)
@RequiredArgsConstructor
public class InspectionTools implements ToolProvider {

	private final DebugSessionManager sessions;

	@Override
	public List<ToolDefinition> tools() {
		return List.of(
				new ToolDefinition("godot_get_threads",
						"List the threads of the debugged game. Godot games typically run on a single thread "
								+ "(ID: 1, Name: \"Main\").",
						List.of(), this::handleGetThreads),
				new ToolDefinition("godot_get_stack_trace",
						"Get the call stack of a paused thread. Frame IDs are used by godot_get_scopes and "
								+ "godot_evaluate.",
						List.of(ExecutionTools.threadParameter("Thread ID"),
								ToolParameter.optional("max_frames", ParameterType.NUMBER,
										"Maximum number of frames to return", 20)),
						this::handleGetStackTrace),
				new ToolDefinition("godot_get_scopes",
						"Get the variable scopes (Locals, Members, Globals) of a stack frame.",
						List.of(ToolParameter.required("frame_id", ParameterType.NUMBER,
								"Stack frame ID from godot_get_stack_trace")),
						this::handleGetScopes),
				new ToolDefinition("godot_get_variables",
						"Get the variables of a scope, or expand a complex variable such as a Node, Array or "
								+ "Dictionary. Variables with variables_reference > 0 can be expanded again.",
						List.of(ToolParameter.required("variables_reference", ParameterType.NUMBER,
								"Variables reference ID (from godot_get_scopes or a complex variable)")),
						this::handleGetVariables),
				new ToolDefinition("godot_evaluate",
						"Evaluate a GDScript expression in the context of a stack frame. The expression can "
								+ "modify game state.",
						List.of(ToolParameter.required("expression", ParameterType.STRING,
								"GDScript expression to evaluate"),
								ToolParameter.optional("frame_id", ParameterType.NUMBER,
										"Stack frame ID for evaluation context (default: 0 = top frame)", 0),
								ToolParameter.optional("context", ParameterType.STRING,
										"Evaluation context: 'watch', 'repl', or 'hover' (default: 'repl')", "repl")),
						this::handleEvaluate),
				new ToolDefinition("godot_get_last_stop",
						"Report why the game last stopped: reason, thread and description of the most recent "
								+ "stopped event.",
						List.of(), this::handleGetLastStop));
	}

	private Object handleGetThreads(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		ThreadsResult response;
		try {
			response = client.threads();
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("get threads", e);
		}
		List<Map<String, Object>> threads = new ArrayList<>();
		for (DapThread thread : response.threads()) {
			Map<String, Object> entry = new LinkedHashMap<>();
			entry.put("id", thread.id());
			entry.put("name", thread.name());
			threads.add(entry);
		}
		Map<String, Object> result = success();
		result.put("threads", threads);
		result.put("count", threads.size());
		return result;
	}

	private Object handleGetStackTrace(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		int maxFrames = arguments.integer("max_frames");
		if (maxFrames < 1) {
			throw ToolErrors.invalidArgument("max_frames must be at least 1 (got: " + maxFrames + ")");
		}
		StackTraceResult response;
		try {
			response = client.stackTrace(arguments.integer("thread_id"), 0, maxFrames);
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("get the stack trace", e);
		}
		List<Map<String, Object>> frames = new ArrayList<>();
		for (StackFrame frame : response.stackFrames()) {
			Map<String, Object> entry = new LinkedHashMap<>();
			entry.put("id", frame.id());
			entry.put("name", frame.name());
			entry.put("line", frame.line());
			entry.put("column", frame.column());
			if (frame.source() != null) {
				Map<String, Object> source = new LinkedHashMap<>();
				source.put("name", frame.source().name());
				source.put("path", frame.source().path());
				entry.put("source", source);
			}
			frames.add(entry);
		}
		Map<String, Object> result = success();
		result.put("frames", frames);
		result.put("total_frames", response.totalFrames() != null ? response.totalFrames() : frames.size());
		return result;
	}

	private Object handleGetScopes(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		ScopesResult response;
		try {
			response = client.scopes(arguments.integer("frame_id"));
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("get scopes", e);
		}
		List<Map<String, Object>> scopes = new ArrayList<>();
		for (Scope scope : response.scopes()) {
			Map<String, Object> entry = new LinkedHashMap<>();
			entry.put("name", scope.name());
			entry.put("variables_reference", scope.variablesReference());
			entry.put("expensive", scope.expensive());
			scopes.add(entry);
		}
		Map<String, Object> result = success();
		result.put("scopes", scopes);
		result.put("count", scopes.size());
		return result;
	}

	private Object handleGetVariables(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		VariablesResult response;
		try {
			response = client.variables(arguments.integer("variables_reference"));
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("get variables", e);
		}
		List<Map<String, Object>> variables = GodotValueFormatter.formatVariables(response.variables());
		Map<String, Object> result = success();
		result.put("variables", variables);
		result.put("count", variables.size());
		return result;
	}

	private Object handleEvaluate(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		String expression = arguments.requireString("expression");
		EvaluateResult response;
		try {
			response = client.evaluate(expression, arguments.integer("frame_id"), arguments.string("context"));
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("evaluate the expression", e);
		}
		Map<String, Object> result = success();
		result.put("result", response.result());
		result.put("type", response.type());
		String formatted = GodotValueFormatter.format(response.type(), response.result());
		if (formatted != null) {
			result.put("formatted", formatted);
		}
		if (response.variablesReference() > 0) {
			result.put("expandable", true);
			result.put("variables_reference", response.variablesReference());
		}
		return result;
	}

	private Object handleGetLastStop(ToolArguments arguments) {
		DapClient client = this.sessions.client();
		Optional<StoppedEvent> stop = client.lastStop();
		Map<String, Object> result = new LinkedHashMap<>();
		if (stop.isEmpty()) {
			result.put("status", "no_stop");
			result.put("message", "The game has not stopped in this session");
			result.put("state", client.getState().label());
			return result;
		}
		StoppedEvent event = stop.get();
		result.put("status", "success");
		result.put("state", client.getState().label());
		result.put("reason", event.reason().value());
		result.put("thread_id", event.threadId());
		if (event.description() != null) {
			result.put("description", event.description());
		}
		if (event.text() != null) {
			result.put("text", event.text());
		}
		result.put("all_threads_stopped", event.allThreadsStopped());
		result.put("hit_breakpoint_ids", event.hitBreakpointIds());
		result.put("received_at", event.receivedAt().toString());
		return result;
	}

	private static Map<String, Object> success() {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("status", "success");
		return result;
	}

}
