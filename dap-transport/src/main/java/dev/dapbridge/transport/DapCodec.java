package dev.dapbridge.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * Reads and writes {@link DapMessage}s on a duplex byte stream using {@link ContentLengthCodec}
 * framing. Writes are serialized on the codec so that frames from concurrent callers never mix.
 */
public final class DapCodec {

    private final ObjectMapper mapper;
    private final InputStream in;
    private final OutputStream out;
    private final String connectionId;

    public DapCodec(ObjectMapper mapper, InputStream in, OutputStream out, String connectionId) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.in = in;
        this.out = out;
        this.connectionId = connectionId;
    }

    public void write(DapMessage message) throws IOException {
        byte[] payload = encode(message);
        Wire.tx(connectionId, message);
        synchronized (out) {
            ContentLengthCodec.writeFrame(out, payload);
        }
    }

    /**
     * Reads the next message.
     *
     * @return the decoded message, or {@code null} on a clean end of stream
     * @throws MalformedMessageException when the frame body is not a JSON object; the stream stays
     *     aligned on the next frame
     * @throws FramingException when the header block is unusable
     */
    public DapMessage read() throws IOException {
        byte[] payload = ContentLengthCodec.readFrame(in);
        if (payload == null) {
            return null;
        }
        DapMessage message = decode(payload);
        Wire.rx(connectionId, message);
        return message;
    }

    public byte[] encode(DapMessage message) throws JsonProcessingException {
        return mapper.writeValueAsBytes(message);
    }

    public DapMessage decode(byte[] payload) throws MalformedMessageException {
        JsonNode tree;
        try {
            tree = mapper.readTree(payload);
        } catch (IOException e) {
            throw new MalformedMessageException("Frame body is not valid JSON", payload, e);
        }
        if (tree == null || !tree.isObject()) {
            throw new MalformedMessageException("Frame body is not a JSON object", payload, null);
        }
        try {
            return mapper.treeToValue(tree, DapMessage.class);
        } catch (JsonProcessingException e) {
            throw new MalformedMessageException("Frame body is not a DAP message", payload, e);
        }
    }

    public String connectionId() {
        return connectionId;
    }
}
