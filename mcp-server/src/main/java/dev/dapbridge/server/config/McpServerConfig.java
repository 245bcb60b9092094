package dev.dapbridge.server.config;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import dev.dapbridge.client.DapClient;
import dev.dapbridge.server.mcp.McpServer;
import dev.dapbridge.server.mcp.ToolDefinition;
import dev.dapbridge.server.tool.ToolProvider;

/**
 * Spring configuration class that assembles the stdio MCP server and the single debugger client
 * shared by all Godot tools.
 */
@Configuration
@EnableConfigurationProperties({ DapProperties.class, McpServerProperties.class })
public class McpServerConfig {

	private static final Logger logger = LoggerFactory.getLogger(McpServerConfig.class);

	/**
	 * Create the debugger client. It stays disconnected until a client calls {@code godot_connect}.
	 * @param properties debugger connection settings
	 * @return the shared client, closed on shutdown
	 */
	@Bean(destroyMethod = "close")
	public DapClient dapClient(DapProperties properties) {
		DapClient client = new DapClient(properties.toClientOptions());
		if (properties.projectRoot() != null) {
			client.setProjectRoot(properties.projectRoot());
		}
		return client;
	}

	/**
	 * Build the MCP server on the process standard streams, registering the tools of every
	 * {@link ToolProvider} bean.
	 * @param properties server identity and shutdown settings
	 * @param providers tool groups discovered in the context
	 * @return a server ready to {@link McpServer#run() run}
	 */
	@Bean(destroyMethod = "close")
	public McpServer mcpServer(McpServerProperties properties, List<ToolProvider> providers) {
		McpServer.Builder builder = McpServer.stdioServer()
			.serverInfo(properties.name(), properties.version())
			.shutdownGrace(properties.shutdownGrace());
		int count = 0;
		for (ToolProvider provider : providers) {
			List<ToolDefinition> tools = provider.tools();
			builder.tools(tools);
			count += tools.size();
		}
		logger.info("Registered {} tools from {} providers", count, providers.size());
		return builder.build();
	}

}
