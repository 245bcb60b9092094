package dev.dapbridge.server.mcp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class McpServerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ByteArrayOutputStream output = new ByteArrayOutputStream();

    private final ToolDefinition echo = new ToolDefinition("echo", "Echoes a message",
        List.of(ToolParameter.optional("message", ParameterType.STRING, "text", "hello"),
            ToolParameter.optional("payload", ParameterType.ANY, "anything")),
        args -> "echo: " + args.string("message"));

    private final ToolDefinition add = new ToolDefinition("add", "Adds two numbers",
        List.of(ToolParameter.required("a", ParameterType.NUMBER, "first"),
            ToolParameter.required("b", ParameterType.NUMBER, "second")),
        args -> Map.of("sum", args.integer("a") + args.integer("b")));

    private final ToolDefinition failing = new ToolDefinition("fail", "Always fails", List.of(),
        args -> {
            throw new IllegalStateException("boom");
        });

    @Test
    void initializeReportsProtocolVersionAndServerInfo() {
        List<JsonNode> replies = exchange(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\",\"params\":{\"clientInfo\":{\"name\":\"test\"}}}");

        assertThat(replies).hasSize(1);
        JsonNode result = replies.get(0).path("result");
        assertThat(replies.get(0).path("id").asInt()).isEqualTo(1);
        assertThat(result.path("protocolVersion").asText()).isEqualTo("2024-11-05");
        assertThat(result.path("capabilities").path("tools").isObject()).isTrue();
        assertThat(result.path("serverInfo").path("name").asText()).isEqualTo("test-server");
        assertThat(result.path("serverInfo").path("version").asText()).isEqualTo("1.2.3");
    }

    @Test
    void notificationsGetNoReply() {
        List<JsonNode> replies = exchange(
            "{\"jsonrpc\":\"2.0\",\"method\":\"notifications/initialized\"}",
            "{\"jsonrpc\":\"2.0\",\"method\":\"tools/list\"}",
            "{\"jsonrpc\":\"2.0\",\"id\":\"p\",\"method\":\"ping\"}");

        assertThat(replies).hasSize(1);
        assertThat(replies.get(0).path("id").asText()).isEqualTo("p");
        assertThat(replies.get(0).path("result").isObject()).isTrue();
        assertThat(replies.get(0).path("result").size()).isZero();
    }

    @Test
    void invalidJsonIsAParseErrorWithNullId() {
        List<JsonNode> replies = exchange("{not json", "", "   ");

        assertThat(replies).hasSize(1);
        assertThat(replies.get(0).has("id")).isTrue();
        assertThat(replies.get(0).get("id").isNull()).isTrue();
        assertThat(replies.get(0).path("error").path("code").asInt()).isEqualTo(McpServer.PARSE_ERROR);
    }

    @Test
    void wrongJsonRpcVersionIsRejectedOnlyWhenAnIdIsPresent() {
        List<JsonNode> replies = exchange(
            "{\"jsonrpc\":\"1.0\",\"id\":7,\"method\":\"ping\"}",
            "{\"jsonrpc\":\"1.0\",\"method\":\"ping\"}");

        assertThat(replies).hasSize(1);
        assertThat(replies.get(0).path("id").asInt()).isEqualTo(7);
        assertThat(replies.get(0).path("error").path("code").asInt()).isEqualTo(McpServer.INVALID_REQUEST);
    }

    @Test
    void unknownMethodIsMethodNotFound() {
        List<JsonNode> replies = exchange("{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"resources/list\"}");

        assertThat(replies.get(0).path("error").path("code").asInt()).isEqualTo(McpServer.METHOD_NOT_FOUND);
    }

    @Test
    void toolsListCarriesInputSchemas() {
        List<JsonNode> replies = exchange("{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/list\"}");

        JsonNode tools = replies.get(0).path("result").path("tools");
        assertThat(tools).hasSize(3);
        assertThat(tools.get(0).path("name").asText()).isEqualTo("echo");
        JsonNode properties = tools.get(0).path("inputSchema").path("properties");
        assertThat(properties.path("message").path("type").asText()).isEqualTo("string");
        assertThat(properties.path("message").path("default").asText()).isEqualTo("hello");
        assertThat(properties.path("payload").has("type")).isFalse();
        assertThat(tools.get(0).path("inputSchema").path("required").isArray()).isTrue();
        assertThat(tools.get(1).path("inputSchema").path("required").toString()).isEqualTo("[\"a\",\"b\"]");
    }

    @Test
    void toolCallAppliesDefaultsAndWrapsTextContent() {
        List<JsonNode> replies = exchange(
            "{\"jsonrpc\":\"2.0\",\"id\":4,\"method\":\"tools/call\",\"params\":{\"name\":\"echo\"}}");

        JsonNode content = replies.get(0).path("result").path("content");
        assertThat(content).hasSize(1);
        assertThat(content.get(0).path("type").asText()).isEqualTo("text");
        assertThat(content.get(0).path("text").asText()).isEqualTo("echo: hello");
    }

    @Test
    void nonStringResultsAreRenderedAsJson() throws IOException {
        List<JsonNode> replies = exchange(
            "{\"jsonrpc\":\"2.0\",\"id\":5,\"method\":\"tools/call\",\"params\":{\"name\":\"add\",\"arguments\":{\"a\":2,\"b\":3}}}");

        String text = replies.get(0).path("result").path("content").get(0).path("text").asText();
        assertThat(mapper.readTree(text).path("sum").asInt()).isEqualTo(5);
    }

    @Test
    void toolCallErrorsUseTheirCodes() {
        List<JsonNode> replies = exchange(
            "{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"tools/call\",\"params\":{\"name\":\"nope\"}}",
            "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"add\",\"arguments\":{\"a\":1}}}",
            "{\"jsonrpc\":\"2.0\",\"id\":3,\"method\":\"tools/call\",\"params\":{\"name\":\"fail\"}}");

        assertThat(replies).hasSize(3);
        JsonNode unknown = byId(replies, 1).path("error");
        JsonNode missing = byId(replies, 2).path("error");
        JsonNode failed = byId(replies, 3).path("error");
        assertThat(unknown.path("code").asInt()).isEqualTo(McpServer.METHOD_NOT_FOUND);
        assertThat(missing.path("code").asInt()).isEqualTo(McpServer.INVALID_PARAMS);
        assertThat(missing.path("message").asText()).isEqualTo("missing required parameter: b");
        assertThat(failed.path("code").asInt()).isEqualTo(McpServer.TOOL_EXECUTION_FAILED);
        assertThat(failed.path("message").asText()).isEqualTo("tool execution failed: boom");
    }

    @Test
    void slowToolDoesNotHoldBackOtherRequests() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        ToolDefinition slow = new ToolDefinition("slow", "Blocks until released", List.of(), args -> {
            release.await(10, TimeUnit.SECONDS);
            return "slow done";
        });
        List<String> lines = new ArrayList<>();
        lines.add("{\"jsonrpc\":\"2.0\",\"id\":0,\"method\":\"tools/call\",\"params\":{\"name\":\"slow\"}}");
        for (int i = 1; i < 10; i++) {
            lines.add("{\"jsonrpc\":\"2.0\",\"id\":" + i + ",\"method\":\"tools/call\",\"params\":{\"name\":\"echo\","
                + "\"arguments\":{\"message\":\"" + "x".repeat(2000) + i + "\"}}}");
        }
        McpServer server = server(String.join("\n", lines) + "\n", slow, echo);
        Thread runner = new Thread(server::run, "mcp-test-runner");
        runner.start();

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (replies().size() < 9 && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
        List<JsonNode> beforeRelease = replies();
        assertThat(beforeRelease).hasSize(9);
        assertThat(beforeRelease).noneMatch(reply -> reply.path("id").asInt() == 0);

        release.countDown();
        runner.join(5000);
        assertThat(runner.isAlive()).isFalse();

        List<JsonNode> all = replies();
        assertThat(all).hasSize(10);
        Set<Integer> ids = new HashSet<>();
        all.forEach(reply -> ids.add(reply.path("id").asInt()));
        assertThat(ids).containsExactlyInAnyOrder(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
        for (JsonNode reply : all) {
            int id = reply.path("id").asInt();
            String text = reply.path("result").path("content").get(0).path("text").asText();
            assertThat(text).isEqualTo(id == 0 ? "slow done" : "echo: " + "x".repeat(2000) + id);
        }
    }

    @Test
    void duplicateToolNamesAreRejected() {
        McpServer.Builder builder = McpServer.builder(new ByteArrayInputStream(new byte[0]), output).tool(echo);

        assertThatThrownBy(() -> builder.tool(echo))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("echo");
    }

    private List<JsonNode> exchange(String... lines) {
        McpServer server = server(String.join("\n", lines) + "\n", echo, add, failing);
        server.run();
        return replies();
    }

    private McpServer server(String input, ToolDefinition... tools) {
        McpServer server = McpServer.builder(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), output)
            .serverInfo("test-server", "1.2.3")
            .shutdownGrace(Duration.ofSeconds(10))
            .tools(List.of(tools))
            .build();
        assertThat(server.toolNames()).hasSize(tools.length);
        return server;
    }

    /** Complete reply lines written so far; each must be a JSON object on its own. */
    private List<JsonNode> replies() {
        String written = output.toString(StandardCharsets.UTF_8);
        int end = written.lastIndexOf('\n');
        List<JsonNode> replies = new ArrayList<>();
        if (end < 0) {
            return replies;
        }
        for (String line : written.substring(0, end).split("\n")) {
            try {
                JsonNode reply = mapper.readTree(line);
                assertThat(reply.path("jsonrpc").asText()).isEqualTo("2.0");
                replies.add(reply);
            } catch (IOException e) {
                throw new UncheckedIOException("reply line is not JSON: " + line, e);
            }
        }
        return replies;
    }

    private static JsonNode byId(List<JsonNode> replies, int id) {
        return replies.stream().filter(reply -> reply.path("id").asInt(-1) == id).findFirst().orElseThrow();
    }
}
