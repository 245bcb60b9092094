package dev.dapbridge.server.tool;

import java.util.List;

import dev.dapbridge.server.mcp.ToolDefinition;

/**
 * A group of related MCP tools. Every provider bean is registered with the server at startup.
 */
public interface ToolProvider {

	/**
	 * Provide the tools of this group in the order they are listed to clients.
	 * @return tool definitions including schema and handler
	 */
	List<ToolDefinition> tools();

}
