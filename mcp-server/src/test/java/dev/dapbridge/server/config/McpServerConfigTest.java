package dev.dapbridge.server.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;

import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import dev.dapbridge.client.DapClient;
import dev.dapbridge.client.SessionState;
import dev.dapbridge.server.mcp.McpServer;
import dev.dapbridge.server.tool.AdvancedTools;
import dev.dapbridge.server.tool.BreakpointTools;
import dev.dapbridge.server.tool.ConnectionTools;
import dev.dapbridge.server.tool.DebugSessionManager;
import dev.dapbridge.server.tool.ExecutionTools;
import dev.dapbridge.server.tool.InspectionTools;
import dev.dapbridge.server.tool.LaunchTools;
import dev.dapbridge.server.tool.PingTool;

class McpServerConfigTest {

	private final ApplicationContextRunner contextRunner = new ApplicationContextRunner().withUserConfiguration(
			McpServerConfig.class, DebugSessionManager.class, PingTool.class, ConnectionTools.class,
			LaunchTools.class, BreakpointTools.class, ExecutionTools.class, InspectionTools.class,
			AdvancedTools.class);

	@Test
	void registersEveryGodotToolInProviderOrder() {
		this.contextRunner.run(context -> {
			McpServer server = context.getBean(McpServer.class);
			assertThat(server.toolNames()).hasSize(21);
			assertThat(server.toolNames().get(0)).isEqualTo("godot_ping");
			assertThat(server.toolNames()).contains("godot_connect", "godot_launch_main_scene",
					"godot_set_breakpoint", "godot_step_out", "godot_evaluate", "godot_get_last_stop",
					"godot_set_variable");
			assertThat(server.isRunning()).isFalse();
		});
	}

	@Test
	void clientStartsDisconnectedWithDefaults() {
		this.contextRunner.run(context -> {
			DapClient client = context.getBean(DapClient.class);
			assertThat(client.getState()).isEqualTo(SessionState.DISCONNECTED);
			assertThat(client.options().unsupportedCommands()).containsExactly("stepOut");
			assertThat(context.getBean(DapProperties.class).port()).isEqualTo(6006);
			assertThat(context.getBean(McpServerProperties.class).shutdownGrace()).isEqualTo(Duration.ofSeconds(5));
		});
	}

	@Test
	void propertiesOverrideClientOptions() {
		this.contextRunner
			.withPropertyValues("dap.port=7007", "dap.command-timeout=2s", "dap.unsupported-commands=",
					"dap.project-root=/games/demo")
			.run(context -> {
				DapClient client = context.getBean(DapClient.class);
				assertThat(context.getBean(DapProperties.class).port()).isEqualTo(7007);
				assertThat(client.options().commandTimeout()).isEqualTo(Duration.ofSeconds(2));
				assertThat(client.options().unsupportedCommands()).isEmpty();
				assertThat(client.projectRoot()).isEqualTo("/games/demo");
			});
	}

}
