package dev.dapbridge.client;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class MainTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    @Test
    void printsUsageWithoutCommand() throws Exception {
        assertThat(Main.run(new String[0], out, DapClientOptions.defaults())).isEqualTo(2);
        assertThat(output()).contains("Usage:");
    }

    @Test
    void rejectsUnknownCommand() throws Exception {
        assertThat(Main.run(new String[] {"frobnicate"}, out, DapClientOptions.defaults())).isEqualTo(2);
        assertThat(output()).contains("Unknown command: frobnicate");
    }

    @Test
    void initPrintsCapabilities() throws Exception {
        try (FakeDapServer server = new FakeDapServer()) {
            server.autoInitialize().on("disconnect", (request, s) -> s.respond(request));

            int code = Main.run(new String[] {"--host", server.host(), "--port", String.valueOf(server.port()), "init"},
                out, DapClientOptions.defaults());

            assertThat(code).isZero();
            assertThat(output()).contains("INIT capabilities=").contains("supportsConfigurationDoneRequest");
            assertThat(server.receivedCommands()).containsExactly("initialize", "disconnect");
        }
    }

    @Test
    void reportsUnreachableDebugger() throws Exception {
        int port;
        try (ServerSocket socket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
            port = socket.getLocalPort();
        }

        int code = Main.run(new String[] {"--host", "127.0.0.1", "--port", String.valueOf(port), "init"},
            out, DapClientOptions.defaults());

        assertThat(code).isEqualTo(1);
        assertThat(output()).contains("ERROR DapConnectionClosedException");
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
