package dev.dapbridge.server;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.util.StringUtils;

import dev.dapbridge.server.mcp.McpServer;

/**
 * Entry point of the Godot debugging MCP server. It serves JSON-RPC on stdin/stdout until the
 * client closes stdin; logs go to stderr and, when {@code GODOT_MCP_LOG_FILE} is set, to that file.
 */
@SpringBootApplication
public class DapBridgeApplication {

	static final String LOG_FILE_VARIABLE = "GODOT_MCP_LOG_FILE";

	static final String LOG_FILE_PROFILE = "logfile";

	private static final Logger logger = LoggerFactory.getLogger(DapBridgeApplication.class);

	/**
	 * Bootstrap the application and exit once the MCP server has stopped.
	 * @param args application arguments passed from the command line
	 */
	public static void main(String[] args) {
		SpringApplication application = new SpringApplication(DapBridgeApplication.class);
		if (StringUtils.hasText(System.getenv(LOG_FILE_VARIABLE))) {
			application.setAdditionalProfiles(LOG_FILE_PROFILE);
		}
		ConfigurableApplicationContext context = application.run(args);
		System.exit(SpringApplication.exit(context));
	}

	/**
	 * Serve MCP requests on the calling thread until stdin reaches end of stream.
	 * @param server the configured MCP server
	 * @return runner executed once the context is ready
	 */
	@Bean
	CommandLineRunner mcpServerRunner(McpServer server) {
		return args -> {
			logger.info("Godot DAP MCP server ready on stdio");
			server.run();
			logger.info("MCP server stopped");
		};
	}

}
