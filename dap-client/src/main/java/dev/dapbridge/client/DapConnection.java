package dev.dapbridge.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.dapbridge.transport.DapCodec;
import dev.dapbridge.transport.DapMessage;
import dev.dapbridge.transport.MalformedMessageException;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * TCP connection to a debug adapter. A single daemon reader thread separates responses, which go to
 * the {@link PendingCallTable}, from events, which go to the {@link EventLog}. Only end of stream or
 * a framing or I/O failure stops the reader.
 */
class DapConnection implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DapConnection.class);

    private final String host;
    private final int port;
    private final PendingCallTable pending;
    private final EventLog events;
    private final Consumer<Throwable> onClosed;

    private Socket socket;
    private DapCodec codec;
    private Thread readerThread;
    private volatile boolean running;

    DapConnection(String host, int port, PendingCallTable pending, EventLog events, Consumer<Throwable> onClosed) {
        this.host = host;
        this.port = port;
        this.pending = pending;
        this.events = events;
        this.onClosed = onClosed;
    }

    void connect(ObjectMapper mapper, Duration timeout) throws IOException {
        socket = new Socket();
        try {
            socket.connect(new InetSocketAddress(host, port), (int) Math.max(1, timeout.toMillis()));
        } catch (SocketTimeoutException e) {
            socket.close();
            throw new SocketTimeoutException("Connect to " + address() + " timed out after " + timeout.toMillis() + " ms");
        } catch (IOException e) {
            socket.close();
            throw e;
        }
        socket.setTcpNoDelay(true);
        codec = new DapCodec(mapper, new BufferedInputStream(socket.getInputStream()),
            new BufferedOutputStream(socket.getOutputStream()), address());
        running = true;
        readerThread = new Thread(this::readLoop, "dap-reader-" + port);
        readerThread.setDaemon(true);
        readerThread.start();
        LOGGER.info("Connected to {}", address());
    }

    String address() {
        return host + ":" + port;
    }

    boolean isOpen() {
        return running;
    }

    void send(DapMessage message) throws IOException {
        if (!running) {
            throw new IOException("Connection to " + address() + " is closed");
        }
        codec.write(message);
    }

    private void readLoop() {
        Throwable failure = null;
        try {
            while (running) {
                DapMessage message;
                try {
                    message = codec.read();
                } catch (MalformedMessageException e) {
                    LOGGER.warn("Discarding malformed message from {}: {}", address(), e.getMessage());
                    continue;
                }
                if (message == null) {
                    LOGGER.info("Debugger at {} closed the connection", address());
                    break;
                }
                dispatch(message);
            }
        } catch (IOException e) {
            if (running) {
                LOGGER.error("Connection to {} failed", address(), e);
                failure = e;
            }
        } finally {
            boolean wasRunning = running;
            running = false;
            closeSocket();
            if (wasRunning) {
                pending.failAll(failure == null
                    ? "Debugger closed the connection"
                    : "Connection to debugger failed: " + failure.getMessage());
                onClosed.accept(failure);
            }
        }
    }

    private void dispatch(DapMessage message) {
        try {
            if (message.isResponse()) {
                pending.complete(message);
            } else if (message.isEventMessage()) {
                events.append(message.event(), message.body());
            } else if (message.isRequest()) {
                LOGGER.warn("Ignoring reverse request '{}' from debugger", message.command());
            } else {
                LOGGER.warn("Ignoring message of unknown type '{}'", message.type());
            }
        } catch (RuntimeException e) {
            LOGGER.error("Failed to dispatch {} {}", message.type(), message.name(), e);
        }
    }

    @Override
    public void close() {
        running = false;
        closeSocket();
        if (readerThread != null && readerThread != Thread.currentThread()) {
            try {
                readerThread.join(500);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void closeSocket() {
        if (socket != null && !socket.isClosed()) {
            try {
                socket.close();
            } catch (IOException e) {
                LOGGER.debug("Error closing socket to {}", address(), e);
            }
        }
    }
}
