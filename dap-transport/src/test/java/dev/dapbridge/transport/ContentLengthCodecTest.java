package dev.dapbridge.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class ContentLengthCodecTest {

    @Test
    void writesHeaderThenExactBody() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ContentLengthCodec.writeFrame(out, "{\"seq\":1}");

        assertThat(out.toString(StandardCharsets.UTF_8)).isEqualTo("Content-Length: 9\r\n\r\n{\"seq\":1}");
    }

    @Test
    void lengthCountsBytesNotCharacters() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ContentLengthCodec.writeFrame(out, "{\"v\":\"é\"}");

        assertThat(out.toString(StandardCharsets.UTF_8)).startsWith("Content-Length: 10\r\n");
        byte[] body = ContentLengthCodec.readFrame(new ByteArrayInputStream(out.toByteArray()));
        assertThat(new String(body, StandardCharsets.UTF_8)).isEqualTo("{\"v\":\"é\"}");
    }

    @Test
    void readsConsecutiveFrames() throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ContentLengthCodec.writeFrame(out, "{\"a\":1}");
        ContentLengthCodec.writeFrame(out, "[]");
        InputStream in = new ByteArrayInputStream(out.toByteArray());

        assertThat(new String(ContentLengthCodec.readFrame(in), StandardCharsets.UTF_8)).isEqualTo("{\"a\":1}");
        assertThat(new String(ContentLengthCodec.readFrame(in), StandardCharsets.UTF_8)).isEqualTo("[]");
        assertThat(ContentLengthCodec.readFrame(in)).isNull();
    }

    @Test
    void acceptsBareLineFeedsAndExtraHeaders() throws Exception {
        String raw = "Content-Type: application/vscode-jsonrpc\ncontent-length: 2\n\n{}";
        InputStream in = stream(raw);

        assertThat(new String(ContentLengthCodec.readFrame(in), StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    @Test
    void missingLengthIsFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Type: x\r\n\r\n{}")))
            .isInstanceOf(FramingException.class)
            .hasMessageContaining("Missing Content-Length");
    }

    @Test
    void nonNumericLengthIsFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: ten\r\n\r\n{}")))
            .isInstanceOf(FramingException.class);
    }

    @Test
    void negativeLengthIsFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: -4\r\n\r\n")))
            .isInstanceOf(FramingException.class);
    }

    @Test
    void headerWithoutColonIsFramingError() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("garbage\r\n\r\n")))
            .isInstanceOf(FramingException.class);
    }

    @Test
    void truncatedBodyIsEndOfStream() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Length: 10\r\n\r\n{}")))
            .isInstanceOf(EOFException.class);
    }

    @Test
    void endOfStreamInsideHeaderIsNotCleanShutdown() {
        assertThatThrownBy(() -> ContentLengthCodec.readFrame(stream("Content-Len")))
            .isInstanceOf(EOFException.class);
    }

    @Test
    void emptyBodyIsAllowed() throws Exception {
        assertThat(ContentLengthCodec.readFrame(stream("Content-Length: 0\r\n\r\n"))).isEmpty();
    }

    private static InputStream stream(String raw) {
        return new ByteArrayInputStream(raw.getBytes(StandardCharsets.UTF_8));
    }
}
