package dev.dapbridge.server.tool;

/**
 * Failure of a tool call carrying a message meant for the MCP client. The router reports it as a
 * tool execution error.
 */
public class ToolException extends Exception {

	public ToolException(String message) {
		super(message);
	}

	public ToolException(String message, Throwable cause) {
		super(message, cause);
	}

}
