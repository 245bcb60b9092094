package dev.dapbridge.server.mcp;

/**
 * Executes a tool call. The returned value becomes the text content of the reply: strings are sent
 * as they are, anything else is rendered as JSON. A thrown exception becomes a JSON-RPC error whose
 * message carries the exception message.
 */
@FunctionalInterface
public interface ToolHandler {
    Object handle(ToolArguments arguments) throws Exception;
}
