package dev.dapbridge.server.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Line-delimited JSON-RPC 2.0 server speaking the MCP tool subset. Each request line is handled on
 * a worker thread so a slow tool never blocks {@code ping} or other calls; replies are written whole
 * under a single lock and may arrive in any order.
 */
public final class McpServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(McpServer.class);

    public static final String PROTOCOL_VERSION = "2024-11-05";

    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int TOOL_EXECUTION_FAILED = -32000;

    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final Map<String, ToolDefinition> tools;
    private final String name;
    private final String version;
    private final Duration shutdownGrace;
    private final ObjectMapper mapper;
    private final BufferedReader reader;
    private final BufferedWriter writer;
    private final ExecutorService executor;
    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicInteger workerCounter = new AtomicInteger();
    private final String[] toolOrder;

    private Thread readerThread;

    private McpServer(Builder builder) {
        this.tools = Map.copyOf(builder.tools);
        this.name = builder.name;
        this.version = builder.version;
        this.shutdownGrace = builder.shutdownGrace;
        this.mapper = builder.mapper;
        this.reader = new BufferedReader(new InputStreamReader(builder.in, StandardCharsets.UTF_8));
        this.writer = new BufferedWriter(new OutputStreamWriter(builder.out, StandardCharsets.UTF_8));
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "mcp-server-handler-" + workerCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.toolOrder = builder.tools.keySet().toArray(String[]::new);
    }

    /** Builder bound to the process standard streams. */
    public static Builder stdioServer() {
        return new Builder(System.in, System.out);
    }

    public static Builder builder(InputStream in, OutputStream out) {
        return new Builder(in, out);
    }

    /**
     * Serves until the input reaches end of stream, then waits up to the shutdown grace period for
     * in-flight requests.
     */
    public void run() {
        start();
        try {
            if (readerThread != null) {
                readerThread.join();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        readerThread = new Thread(this::readLoop, "mcp-server-reader");
        readerThread.setDaemon(true);
        readerThread.start();
    }

    /** Names of the registered tools in registration order. */
    public List<String> toolNames() {
        return List.of(toolOrder);
    }

    public boolean isRunning() {
        return running.get();
    }

    private void readLoop() {
        LOGGER.info("MCP server {} {} serving {} tools", name, version, tools.size());
        try {
            String line;
            while (running.get() && (line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                JsonNode message;
                try {
                    message = mapper.readTree(line);
                } catch (JsonProcessingException e) {
                    LOGGER.warn("Unparseable request line: {}", e.getOriginalMessage());
                    sendError(NullNode.getInstance(), PARSE_ERROR, "Parse error: " + e.getOriginalMessage());
                    continue;
                }
                dispatch(message);
            }
            LOGGER.info("Input closed, shutting down");
        } catch (IOException e) {
            LOGGER.error("MCP server stopping due to read error: {}", e.getMessage());
        } finally {
            running.set(false);
            drain();
        }
    }

    private void dispatch(JsonNode message) {
        if (!message.isObject()) {
            sendError(NullNode.getInstance(), INVALID_REQUEST, "Invalid Request: expected a JSON object");
            return;
        }
        JsonNode idNode = message.get("id");
        JsonNode id = idNode == null || idNode.isNull() ? null : idNode;
        if (!"2.0".equals(message.path("jsonrpc").asText())) {
            sendError(id, INVALID_REQUEST, "Invalid Request: jsonrpc must be \"2.0\"");
            return;
        }
        JsonNode method = message.get("method");
        if (method == null || !method.isTextual()) {
            if (message.has("result") || message.has("error")) {
                LOGGER.debug("Ignoring response message with id {}", id);
            } else {
                sendError(id, INVALID_REQUEST, "Invalid Request: method is required");
            }
            return;
        }
        JsonNode params = message.path("params");
        try {
            executor.submit(() -> handleRequest(id, method.asText(), params));
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Dropping {} request, server is shutting down", method.asText());
        }
    }

    private void handleRequest(JsonNode id, String method, JsonNode params) {
        try {
            switch (method) {
                case "initialize" -> handleInitialize(id, params);
                case "ping" -> sendResult(id, mapper.createObjectNode());
                case "tools/list" -> handleToolsList(id);
                case "tools/call" -> handleToolsCall(id, params);
                default -> {
                    if (id == null && method.startsWith("notifications/")) {
                        LOGGER.debug("Notification {}", method);
                    } else {
                        sendError(id, METHOD_NOT_FOUND, "method not found: " + method);
                    }
                }
            }
        } catch (RuntimeException e) {
            LOGGER.error("Failed to handle {} request", method, e);
            sendError(id, INTERNAL_ERROR, "Internal error: " + e.getMessage());
        }
    }

    private void handleInitialize(JsonNode id, JsonNode params) {
        JsonNode clientInfo = params.path("clientInfo");
        if (!clientInfo.isMissingNode()) {
            LOGGER.info("Client connected: {} {}", clientInfo.path("name").asText("unknown"),
                    clientInfo.path("version").asText(""));
        }
        ObjectNode result = mapper.createObjectNode();
        result.put("protocolVersion", PROTOCOL_VERSION);
        result.putObject("capabilities").putObject("tools");
        ObjectNode serverInfo = result.putObject("serverInfo");
        serverInfo.put("name", name);
        serverInfo.put("version", version);
        sendResult(id, result);
    }

    private void handleToolsList(JsonNode id) {
        ObjectNode result = mapper.createObjectNode();
        ArrayNode list = result.putArray("tools");
        for (String toolName : toolOrder) {
            ToolDefinition tool = tools.get(toolName);
            ObjectNode descriptor = list.addObject();
            descriptor.put("name", tool.name());
            descriptor.put("description", tool.description());
            descriptor.set("inputSchema", tool.inputSchema(mapper));
        }
        sendResult(id, result);
    }

    private void handleToolsCall(JsonNode id, JsonNode params) {
        JsonNode toolName = params.path("name");
        if (!toolName.isTextual()) {
            sendError(id, INVALID_PARAMS, "Invalid params: tool name is required");
            return;
        }
        ToolDefinition tool = tools.get(toolName.asText());
        if (tool == null) {
            sendError(id, METHOD_NOT_FOUND, "tool not found: " + toolName.asText());
            return;
        }
        JsonNode rawArguments = params.path("arguments");
        Map<String, Object> supplied = rawArguments.isObject()
                ? mapper.convertValue(rawArguments, ARGUMENTS_TYPE)
                : new LinkedHashMap<>();
        ToolArguments arguments;
        try {
            arguments = tool.bind(supplied);
        } catch (MissingParameterException e) {
            sendError(id, INVALID_PARAMS, e.getMessage());
            return;
        }

        LOGGER.debug("Calling tool {} with {}", tool.name(), arguments);
        Object result;
        try {
            result = tool.handler().handle(arguments);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            sendError(id, TOOL_EXECUTION_FAILED, "tool execution failed: interrupted");
            return;
        } catch (Exception e) {
            LOGGER.warn("Tool {} failed: {}", tool.name(), e.getMessage());
            sendError(id, TOOL_EXECUTION_FAILED, "tool execution failed: " + e.getMessage());
            return;
        }
        sendResult(id, textContent(result));
    }

    private ObjectNode textContent(Object result) {
        String text;
        if (result instanceof String string) {
            text = string;
        } else {
            try {
                text = mapper.writeValueAsString(result);
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Tool result is not serializable: " + e.getOriginalMessage(), e);
            }
        }
        ObjectNode content = mapper.createObjectNode();
        ObjectNode item = content.putArray("content").addObject();
        item.put("type", "text");
        item.put("text", text);
        return content;
    }

    private void sendResult(JsonNode id, JsonNode result) {
        if (id == null) {
            return;
        }
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        response.set("result", result);
        writeMessage(response);
    }

    /** A {@code null} id marks a notification, which never gets a reply. */
    private void sendError(JsonNode id, int code, String message) {
        if (id == null) {
            LOGGER.debug("Suppressed error reply to notification: {}", message);
            return;
        }
        ObjectNode response = mapper.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.set("id", id);
        ObjectNode error = response.putObject("error");
        error.put("code", code);
        error.put("message", message);
        writeMessage(response);
    }

    private void writeMessage(ObjectNode message) {
        String line;
        try {
            line = mapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to encode reply", e);
            return;
        }
        synchronized (writer) {
            try {
                writer.write(line);
                writer.write('\n');
                writer.flush();
            } catch (IOException e) {
                LOGGER.error("Failed to write reply: {}", e.getMessage());
            }
        }
    }

    private void drain() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                LOGGER.warn("Requests still running after {}, abandoning them", shutdownGrace);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }

    @Override
    public void close() {
        running.set(false);
        if (readerThread != null) {
            readerThread.interrupt();
        }
        executor.shutdownNow();
    }

    public static final class Builder {

        private final InputStream in;
        private final OutputStream out;
        private final Map<String, ToolDefinition> tools = new LinkedHashMap<>();
        private String name = "mcp-server";
        private String version = "0.0.0";
        private Duration shutdownGrace = Duration.ofSeconds(5);
        private ObjectMapper mapper = new ObjectMapper();

        private Builder(InputStream in, OutputStream out) {
            this.in = Objects.requireNonNull(in, "in");
            this.out = Objects.requireNonNull(out, "out");
        }

        public Builder serverInfo(String name, String version) {
            this.name = Objects.requireNonNull(name, "name");
            this.version = Objects.requireNonNull(version, "version");
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = Objects.requireNonNull(shutdownGrace, "shutdownGrace");
            return this;
        }

        public Builder objectMapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        public Builder tool(ToolDefinition tool) {
            if (tools.putIfAbsent(tool.name(), tool) != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.name());
            }
            return this;
        }

        public Builder tools(Collection<ToolDefinition> definitions) {
            definitions.forEach(this::tool);
            return this;
        }

        public McpServer build() {
            if (tools.isEmpty()) {
                throw new IllegalStateException("At least one tool must be registered");
            }
            return new McpServer(this);
        }
    }
}
