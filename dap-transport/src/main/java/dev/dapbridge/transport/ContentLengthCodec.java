package dev.dapbridge.transport;

import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Codec that writes and reads DAP frames: an HTTP-like header block terminated by an empty line,
 * carrying {@code Content-Length}, followed by exactly that many bytes of UTF-8 JSON.
 */
public final class ContentLengthCodec {

    public static final String CONTENT_LENGTH = "Content-Length";

    static final int MAX_FRAME_LENGTH = 64 * 1024 * 1024;

    private static final int MAX_HEADER_LINE = 1024;

    private ContentLengthCodec() {
    }

    public static void writeFrame(OutputStream out, byte[] payload) throws IOException {
        if (payload.length > MAX_FRAME_LENGTH) {
            throw new IOException("Frame too large: " + payload.length);
        }
        byte[] header = (CONTENT_LENGTH + ": " + payload.length + "\r\n\r\n").getBytes(StandardCharsets.US_ASCII);
        out.write(header);
        out.write(payload);
        out.flush();
    }

    public static void writeFrame(OutputStream out, String json) throws IOException {
        writeFrame(out, json.getBytes(StandardCharsets.UTF_8));
    }

    public static byte[] readFrame(InputStream in) throws IOException {
        int length = -1;
        boolean firstLine = true;
        while (true) {
            String line = readHeaderLine(in, firstLine);
            if (line == null) {
                return null; // EOF before header indicates clean shutdown.
            }
            firstLine = false;
            if (line.isEmpty()) {
                break;
            }
            int colon = line.indexOf(':');
            if (colon <= 0) {
                throw new FramingException("Malformed header line: " + Wire.truncate(line, 80));
            }
            String name = line.substring(0, colon).trim();
            if (!CONTENT_LENGTH.toLowerCase(Locale.ROOT).equals(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            int parsed = parseLength(line.substring(colon + 1).trim());
            if (length != -1 && length != parsed) {
                throw new FramingException("Conflicting Content-Length headers: " + length + " and " + parsed);
            }
            length = parsed;
        }
        if (length < 0) {
            throw new FramingException("Missing Content-Length header");
        }
        byte[] payload = readFully(in, length);
        if (payload == null) {
            throw new EOFException("Stream closed while reading frame payload of length " + length);
        }
        return payload;
    }

    private static int parseLength(String value) throws FramingException {
        int length;
        try {
            length = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new FramingException("Invalid Content-Length: " + Wire.truncate(value, 40));
        }
        if (length < 0) {
            throw new FramingException("Invalid frame length: " + length);
        }
        if (length > MAX_FRAME_LENGTH) {
            throw new FramingException("Frame too large: " + length);
        }
        return length;
    }

    /**
     * Reads one header line without its terminator. Accepts CRLF and bare LF.
     * Returns {@code null} only when the stream ends before the first byte of a frame.
     */
    private static String readHeaderLine(InputStream in, boolean frameStart) throws IOException {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream(64);
        while (true) {
            int b = in.read();
            if (b == -1) {
                if (frameStart && buffer.size() == 0) {
                    return null;
                }
                throw new EOFException("Unexpected end of stream inside frame header");
            }
            if (b == '\n') {
                break;
            }
            buffer.write(b);
            if (buffer.size() > MAX_HEADER_LINE) {
                throw new FramingException("Header line exceeds " + MAX_HEADER_LINE + " bytes");
            }
        }
        String line = buffer.toString(StandardCharsets.US_ASCII);
        if (line.endsWith("\r")) {
            line = line.substring(0, line.length() - 1);
        }
        return line;
    }

    private static byte[] readFully(InputStream in, int length) throws IOException {
        byte[] buffer = new byte[length];
        int offset = 0;
        while (offset < length) {
            int read = in.read(buffer, offset, length - offset);
            if (read == -1) {
                if (offset == 0) {
                    return null;
                }
                throw new EOFException("Unexpected end of stream after reading " + offset + " bytes");
            }
            offset += read;
        }
        return buffer;
    }
}
