package dev.dapbridge.server.tool;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.dapbridge.client.DapClient;
import dev.dapbridge.client.DapException;
import dev.dapbridge.client.model.ContinueResult;
import dev.dapbridge.server.mcp.ParameterType;
import dev.dapbridge.server.mcp.ToolArguments;
import dev.dapbridge.server.mcp.ToolDefinition;
import dev.dapbridge.server.mcp.ToolParameter;

/**
 * Tools that resume a paused game: continue and the step family.
 */
@Component
@Order(40)
@RequiredArgsConstructor
public class ExecutionTools implements ToolProvider {

	static final int DEFAULT_THREAD_ID = 1;

	private final DebugSessionManager sessions;

	@Override
	public List<ToolDefinition> tools() {
		return List.of(
				new ToolDefinition("godot_continue",
						"Resume execution of the paused game until the next breakpoint or pause.",
						List.of(threadParameter("Thread ID to continue")), this::handleContinue),
				new ToolDefinition("godot_step_over",
						"Execute the current line and stop at the next line of the same function.",
						List.of(threadParameter("Thread ID to step")), this::handleStepOver),
				new ToolDefinition("godot_step_into",
						"Step into the function called on the current line, or to the next line if there is none.",
						List.of(threadParameter("Thread ID to step")), this::handleStepInto),
				new ToolDefinition("godot_step_out",
						"Run until the current function returns. Godot 4.x does not implement this request, "
								+ "so it is normally refused with advice on alternatives.",
						List.of(threadParameter("Thread ID to step")), this::handleStepOut));
	}

	static ToolParameter threadParameter(String description) {
		return ToolParameter.optional("thread_id", ParameterType.NUMBER,
				description + " (default: 1, Godot typically uses single thread)", DEFAULT_THREAD_ID);
	}

	private Object handleContinue(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		ContinueResult response;
		try {
			response = client.continueExecution(arguments.integer("thread_id"));
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("continue", e);
		}
		Map<String, Object> result = status("continued", "Execution resumed");
		result.put("all_threads_continued", response.resumedAllThreads());
		return result;
	}

	private Object handleStepOver(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		try {
			client.next(arguments.integer("thread_id"));
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("step over", e);
		}
		return status("stepped_over", "Stepped over current line");
	}

	private Object handleStepInto(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		try {
			client.stepIn(arguments.integer("thread_id"));
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("step into", e);
		}
		return status("stepped_in", "Stepped into function");
	}

	private Object handleStepOut(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		try {
			client.stepOut(arguments.integer("thread_id"));
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("step out", e);
		}
		return status("stepped_out", "Stepped out of function");
	}

	static Map<String, Object> status(String status, String message) {
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("status", status);
		result.put("message", message);
		return result;
	}

}
