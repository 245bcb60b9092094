package dev.dapbridge.server.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Identity reported to MCP clients and the time allowed for in-flight requests once stdin closes.
 */
@ConfigurationProperties("mcp.server")
public record McpServerProperties(String name, String version, Duration shutdownGrace) {

	public McpServerProperties {
		name = name == null || name.isBlank() ? "godot-dap-mcp-server" : name;
		version = version == null || version.isBlank() ? "0.1.0" : version;
		shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(5) : shutdownGrace;
	}

}
