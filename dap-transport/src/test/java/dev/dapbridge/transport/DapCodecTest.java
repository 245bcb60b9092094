package dev.dapbridge.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class DapCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void requestRoundTripsThroughTheWire() throws Exception {
        ObjectNode arguments = mapper.createObjectNode();
        arguments.putObject("source").put("path", "/game/player.gd");
        arguments.putArray("breakpoints").addObject().put("line", 56);
        DapMessage request = DapMessage.request(7, "setBreakpoints", arguments);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        new DapCodec(mapper, InputStream.nullInputStream(), out, "test").write(request);
        DapCodec reader = new DapCodec(mapper, new ByteArrayInputStream(out.toByteArray()),
            OutputStream.nullOutputStream(), "test");

        assertThat(reader.read()).isEqualTo(request);
        assertThat(reader.read()).isNull();
    }

    @Test
    void serializedRequestUsesProtocolFieldNamesAndOmitsNulls() throws Exception {
        DapCodec codec = new DapCodec(mapper, InputStream.nullInputStream(), OutputStream.nullOutputStream(), "t");

        JsonNode json = mapper.readTree(codec.encode(DapMessage.request(3, "threads", null)));

        assertThat(json.fieldNames()).toIterable().containsExactlyInAnyOrder("seq", "type", "command");
        assertThat(json.path("type").asText()).isEqualTo("request");
    }

    @Test
    void decodesResponseWithRequestSeq() throws Exception {
        DapCodec codec = new DapCodec(mapper, InputStream.nullInputStream(), OutputStream.nullOutputStream(), "t");
        String json = "{\"seq\":12,\"type\":\"response\",\"request_seq\":4,\"command\":\"threads\","
            + "\"success\":true,\"body\":{\"threads\":[{\"id\":1,\"name\":\"Main\"}]},\"extra\":1}";

        DapMessage message = codec.decode(json.getBytes(StandardCharsets.UTF_8));

        assertThat(message.isResponse()).isTrue();
        assertThat(message.requestSeq()).isEqualTo(4);
        assertThat(message.succeeded()).isTrue();
        assertThat(message.body().path("threads").get(0).path("name").asText()).isEqualTo("Main");
    }

    @Test
    void decodesEventNameAndResponseOutcome() throws Exception {
        DapCodec codec = new DapCodec(mapper, InputStream.nullInputStream(), OutputStream.nullOutputStream(), "t");

        DapMessage stopped = codec.decode(("{\"seq\":20,\"type\":\"event\",\"event\":\"stopped\","
            + "\"body\":{\"reason\":\"breakpoint\",\"threadId\":1}}").getBytes(StandardCharsets.UTF_8));
        DapMessage rejected = codec.decode(("{\"seq\":21,\"type\":\"response\",\"request_seq\":5,"
            + "\"command\":\"evaluate\",\"success\":false,\"message\":\"bad expression\"}")
            .getBytes(StandardCharsets.UTF_8));

        assertThat(stopped.event()).isEqualTo("stopped");
        assertThat(stopped.isEventMessage()).isTrue();
        assertThat(stopped.name()).isEqualTo("stopped");
        assertThat(stopped.body().path("reason").asText()).isEqualTo("breakpoint");
        assertThat(rejected.success()).isFalse();
        assertThat(rejected.succeeded()).isFalse();
        assertThat(rejected.message()).isEqualTo("bad expression");

        byte[] encoded = codec.encode(DapMessage.response(22, 6, "threads", true, null, null));
        DapMessage decoded = codec.decode(encoded);
        assertThat(decoded.success()).isTrue();
        assertThat(mapper.readTree(encoded).fieldNames()).toIterable()
            .containsExactlyInAnyOrder("seq", "type", "command", "request_seq", "success");
    }

    @Test
    void malformedBodyDoesNotDesynchronizeFraming() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ContentLengthCodec.writeFrame(out, "{not json");
        ContentLengthCodec.writeFrame(out, "[1,2]");
        ContentLengthCodec.writeFrame(out, "{\"seq\":1,\"type\":\"event\",\"event\":\"initialized\"}");
        DapCodec reader = new DapCodec(mapper, new ByteArrayInputStream(out.toByteArray()),
            OutputStream.nullOutputStream(), "t");

        assertThatThrownBy(reader::read).isInstanceOf(MalformedMessageException.class);
        assertThatThrownBy(reader::read).isInstanceOf(MalformedMessageException.class)
            .hasMessageContaining("not a JSON object");
        DapMessage event = reader.read();
        assertThat(event.isEventMessage()).isTrue();
        assertThat(event.name()).isEqualTo("initialized");
    }

    @Test
    void arbitraryJsonPayloadSurvivesFraming() throws Exception {
        String[] payloads = {
            "{}",
            "{\"nested\":{\"array\":[1,2.5,\"three\",null,true,{\"k\":\"v\"}]}}",
            "{\"unicode\":\"\\u00e9\\u4e2d\\ud83d\\ude00\",\"escaped\":\"line\\nbreak \\\"quoted\\\"\"}",
            "{\"big\":12345678901234567890,\"neg\":-0.0001}"
        };
        for (String payload : payloads) {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ContentLengthCodec.writeFrame(out, payload);
            byte[] body = ContentLengthCodec.readFrame(new ByteArrayInputStream(out.toByteArray()));
            assertThat(mapper.readTree(body)).isEqualTo(mapper.readTree(payload));
        }
    }
}
