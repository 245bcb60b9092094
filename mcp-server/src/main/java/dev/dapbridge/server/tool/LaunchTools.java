package dev.dapbridge.server.tool;

import java.util.ArrayList;
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
import dev.dapbridge.client.GodotLaunchConfig;
import dev.dapbridge.client.LaunchOutcome;
import dev.dapbridge.client.model.Breakpoint;
import dev.dapbridge.client.model.SetBreakpointsResult;
import dev.dapbridge.server.mcp.ParameterType;
import dev.dapbridge.server.mcp.ToolArguments;
import dev.dapbridge.server.mcp.ToolDefinition;
import dev.dapbridge.server.mcp.ToolParameter;

/**
 * Tools that start the game under the debugger or attach to a running one. Each performs the whole
 * configuration handshake, sending the breakpoints staged since {@code godot_connect}.
 */
@Component
@Order(20)
@RequiredArgsConstructor
public class LaunchTools implements ToolProvider {

	private static final Logger logger = LoggerFactory.getLogger(LaunchTools.class);

	private final DebugSessionManager sessions;

	@Override
	public List<ToolDefinition> tools() {
		List<ToolParameter> scene = new ArrayList<>();
		scene.add(projectParameter());
		scene.add(ToolParameter.required("scene", ParameterType.STRING,
				"Scene to launch as a res:// path, e.g. res://scenes/level_1.tscn"));
		scene.addAll(launchOptions());
		return List.of(
				new ToolDefinition("godot_launch_main_scene",
						"Launch the main scene configured in the Godot project, like pressing F5 in the editor.",
						withProject(launchOptions()), this::handleLaunchMainScene),
				new ToolDefinition("godot_launch_scene",
						"Launch a specific scene by resource path, like pressing F6 on that scene in the editor.",
						scene, this::handleLaunchScene),
				new ToolDefinition("godot_launch_current_scene",
						"Launch the scene currently open in the Godot editor.", withProject(launchOptions()),
						this::handleLaunchCurrentScene),
				new ToolDefinition("godot_attach",
						"Attach to a game that is already running from the Godot editor instead of launching one.",
						List.of(), this::handleAttach));
	}

	private Object handleLaunchMainScene(ToolArguments arguments) throws ToolException, InterruptedException {
		String project = arguments.requireString("project");
		GodotLaunchConfig config = applyOptions(GodotLaunchConfig.mainScene(project), arguments).build();
		return launch(config, "main", "Main scene launched successfully");
	}

	private Object handleLaunchScene(ToolArguments arguments) throws ToolException, InterruptedException {
		String project = arguments.requireString("project");
		String scene = arguments.requireString("scene");
		GodotLaunchConfig config = applyOptions(GodotLaunchConfig.customScene(project, scene), arguments).build();
		return launch(config, scene, "Scene " + scene + " launched successfully");
	}

	private Object handleLaunchCurrentScene(ToolArguments arguments) throws ToolException, InterruptedException {
		String project = arguments.requireString("project");
		GodotLaunchConfig config = applyOptions(GodotLaunchConfig.currentScene(project), arguments).build();
		return launch(config, "current", "Current scene launched successfully");
	}

	private Object handleAttach(ToolArguments arguments) throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		LaunchOutcome outcome;
		try {
			outcome = client.attachAndConfigure(Map.of(), this.sessions.breakpoints());
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("attach", e);
		}
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("status", "attached");
		result.put("message", "Successfully attached to running game");
		result.put("state", client.getState().label());
		putBreakpoints(result, outcome);
		return result;
	}

	private Map<String, Object> launch(GodotLaunchConfig config, String scene, String message)
			throws ToolException, InterruptedException {
		DapClient client = this.sessions.requireSession();
		try {
			config.validate();
		}
		catch (IllegalArgumentException e) {
			throw ToolErrors.failure("Invalid Godot project", e.getMessage(),
					List.of("Pass the absolute path of the directory that contains project.godot",
							"Use res:// paths for scenes, e.g. res://scenes/main.tscn"),
					null);
		}
		if (this.sessions.projectRoot() == null) {
			this.sessions.setProjectRoot(config.project());
		}

		logger.info("Launching {} scene of {}", scene, config.project());
		LaunchOutcome outcome;
		try {
			outcome = client.launchAndConfigure(config.toLaunchArguments(), this.sessions.breakpoints());
		}
		catch (DapException e) {
			throw ToolErrors.fromDap("launch the " + scene + " scene", e);
		}
		Map<String, Object> result = new LinkedHashMap<>();
		result.put("status", "launched");
		result.put("message", message);
		result.put("project", config.project());
		result.put("scene", scene);
		putBreakpoints(result, outcome);
		return result;
	}

	private static void putBreakpoints(Map<String, Object> result, LaunchOutcome outcome) {
		if (outcome.breakpoints().isEmpty()) {
			return;
		}
		List<Map<String, Object>> reports = new ArrayList<>();
		for (Map.Entry<String, SetBreakpointsResult> entry : outcome.breakpoints().entrySet()) {
			for (Breakpoint breakpoint : entry.getValue().breakpoints()) {
				Map<String, Object> report = new LinkedHashMap<>();
				report.put("file", entry.getKey());
				report.put("line", breakpoint.line());
				report.put("verified", breakpoint.verified());
				reports.add(report);
			}
		}
		result.put("breakpoints", reports);
	}

	private static GodotLaunchConfig.Builder applyOptions(GodotLaunchConfig.Builder builder, ToolArguments arguments) {
		return builder.noDebug(arguments.bool("no_debug"))
			.profiling(arguments.bool("profiling"))
			.debugCollisions(arguments.bool("debug_collisions"))
			.debugPaths(arguments.bool("debug_paths"))
			.debugNavigation(arguments.bool("debug_navigation"));
	}

	private static ToolParameter projectParameter() {
		return ToolParameter.required("project", ParameterType.STRING,
				"Absolute path to Godot project directory (must contain project.godot)");
	}

	private static List<ToolParameter> withProject(List<ToolParameter> options) {
		List<ToolParameter> parameters = new ArrayList<>();
		parameters.add(projectParameter());
		parameters.addAll(options);
		return parameters;
	}

	private static List<ToolParameter> launchOptions() {
		return List.of(
				ToolParameter.optional("no_debug", ParameterType.BOOLEAN,
						"If true, run without debugger (breakpoints will be ignored)", false),
				ToolParameter.optional("profiling", ParameterType.BOOLEAN, "Enable performance profiling", false),
				ToolParameter.optional("debug_collisions", ParameterType.BOOLEAN, "Show collision shapes visually",
						false),
				ToolParameter.optional("debug_paths", ParameterType.BOOLEAN, "Show path lines", false),
				ToolParameter.optional("debug_navigation", ParameterType.BOOLEAN, "Show navigation mesh", false));
	}

}
