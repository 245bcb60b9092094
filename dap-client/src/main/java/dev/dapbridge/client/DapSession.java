package dev.dapbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.dapbridge.transport.DapMessage;
import dev.dapbridge.transport.SequenceAllocator;
import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Debug session state and the command issue path.
 * <p>
 * Every command passes the same gate: state check, one-permit single flight, then seq allocation,
 * registration and write under the issue lock. The permit is held until the call settles, so at most
 * one command is on the wire, except the launch/configurationDone pair which shares a permit.
 */
final class DapSession implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(DapSession.class);

    static final Set<SessionState> CONNECTED_STATES = EnumSet.complementOf(EnumSet.of(SessionState.DISCONNECTED));
    static final Set<SessionState> INSPECTABLE = EnumSet.of(SessionState.RUNNING, SessionState.PAUSED);

    private final ObjectMapper mapper;
    private final DapClientOptions options;
    private final EventLog events;
    private final PendingCallTable pending = new PendingCallTable();
    private final ReentrantLock issueLock = new ReentrantLock();
    private final Semaphore inFlight = new Semaphore(1, true);
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.DISCONNECTED);
    private final Object lifecycle = new Object();

    private volatile SequenceAllocator sequence = new SequenceAllocator();
    private volatile DapConnection connection;
    private volatile LaunchIntent launchIntent;
    private volatile String projectRoot;

    private record LaunchIntent(String command, JsonNode arguments, PendingLaunch handle) {
    }

    DapSession(ObjectMapper mapper, DapClientOptions options) {
        this.mapper = mapper;
        this.options = options;
        this.events = new EventLog(options.eventLogCapacity() > 0 ? options.eventLogCapacity() : EventLog.DEFAULT_CAPACITY);
        this.events.subscribe(this::onEvent);
    }

    SessionState state() {
        return state.get();
    }

    EventLog events() {
        return events;
    }

    DapClientOptions options() {
        return options;
    }

    String projectRoot() {
        return projectRoot;
    }

    void projectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }

    int pendingCalls() {
        return pending.size();
    }

    void connect(String host, int port) throws DapException {
        synchronized (lifecycle) {
            requireState("connect", EnumSet.of(SessionState.DISCONNECTED));
            sequence = new SequenceAllocator();
            events.clear();
            launchIntent = null;
            DapConnection[] holder = new DapConnection[1];
            DapConnection conn = new DapConnection(host, port, pending, events,
                cause -> onConnectionLost(holder[0], cause));
            holder[0] = conn;
            try {
                conn.connect(mapper, options.connectTimeout());
            } catch (IOException e) {
                throw new DapConnectionClosedException("connect",
                    "Cannot connect to debugger at " + conn.address() + ": " + e.getMessage(), e);
            }
            connection = conn;
            transition(EnumSet.of(SessionState.DISCONNECTED), SessionState.CONNECTED);
        }
    }

    /**
     * Sends {@code initialize} and waits for both its response and the {@code initialized} event, which
     * may arrive in either order.
     */
    JsonNode initialize(JsonNode arguments, Duration timeout) throws DapException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        CompletableFuture<DapEvent> initialized = events.next(event -> event.is("initialized"));
        DapMessage response;
        try {
            response = execute("initialize", arguments, EnumSet.of(SessionState.CONNECTED), timeout);
        } catch (DapException | InterruptedException e) {
            initialized.cancel(false);
            throw e;
        }
        EventLog.await(initialized, "initialized", remaining(deadline));
        transition(EnumSet.of(SessionState.CONNECTED), SessionState.INITIALIZED);
        return response.body();
    }

    /** Records a launch or attach request; it is written by {@link #configurationDone(Duration)}. */
    PendingLaunch prepareLaunch(String command, JsonNode arguments) throws DapStateException {
        issueLock.lock();
        try {
            requireState(command, EnumSet.of(SessionState.INITIALIZED));
            PendingLaunch handle = new PendingLaunch(command);
            launchIntent = new LaunchIntent(command, arguments, handle);
            transition(EnumSet.of(SessionState.INITIALIZED), SessionState.CONFIGURING);
            return handle;
        } finally {
            issueLock.unlock();
        }
    }

    DapMessage configure(String command, JsonNode arguments, Duration timeout)
        throws DapException, InterruptedException {
        return execute(command, arguments, EnumSet.of(SessionState.CONFIGURING), timeout);
    }

    /**
     * Writes the stored launch (or attach) request and {@code configurationDone} back to back. Both calls
     * are outstanding together and are matched independently.
     */
    DapMessage configurationDone(Duration timeout) throws DapException, InterruptedException {
        String command = "configurationDone";
        Set<SessionState> allowed = EnumSet.of(SessionState.CONFIGURING);
        requireState(command, allowed);
        long deadline = System.nanoTime() + timeout.toNanos();
        acquirePermit(command, timeout, deadline);
        PendingCall done;
        issueLock.lock();
        try {
            DapConnection conn;
            try {
                requireState(command, allowed);
                conn = requireConnection(command);
            } catch (DapException e) {
                inFlight.release();
                throw e;
            }
            LaunchIntent intent = launchIntent;
            launchIntent = null;
            Duration remaining = remaining(deadline);
            PendingCall launch = null;
            if (intent != null) {
                launch = pending.register(sequence.next(), intent.command(), remaining);
                intent.handle().bind(launch);
                launch.response().whenComplete((message, error) -> onLaunchSettled(message));
            }
            done = pending.register(sequence.next(), command, remaining);
            CompletableFuture<?> pair = launch == null
                ? done.response()
                : CompletableFuture.allOf(launch.response(), done.response());
            pair.whenComplete((ignored, error) -> inFlight.release());
            if (launch == null || write(conn, launch, intent.arguments())) {
                write(conn, done, null);
            } else {
                done.fail(new DapConnectionClosedException(command, "Launch request could not be written"));
            }
        } finally {
            issueLock.unlock();
        }
        DapMessage response = awaitResponse(done);
        transition(EnumSet.of(SessionState.CONFIGURING), SessionState.RUNNING);
        return response;
    }

    /**
     * Withdraws a launch or attach whose configuration failed before {@code configurationDone} was
     * written. The handle fails with {@code cause} and the session returns to INITIALIZED so the launch
     * can be retried.
     */
    boolean abandonLaunch(PendingLaunch handle, Throwable cause) {
        issueLock.lock();
        try {
            LaunchIntent intent = launchIntent;
            if (intent == null || intent.handle() != handle) {
                return false;
            }
            launchIntent = null;
            handle.fail(cause);
            boolean rolledBack = transition(EnumSet.of(SessionState.CONFIGURING), SessionState.INITIALIZED);
            LOGGER.warn("Configuration of {} failed, request withdrawn: {}", intent.command(), cause.getMessage());
            return rolledBack;
        } finally {
            issueLock.unlock();
        }
    }

    /** Continue and step commands. A stop observed while the command was in flight keeps the session paused. */
    DapMessage resume(String command, JsonNode arguments, Duration timeout) throws DapException, InterruptedException {
        long epoch = events.stopEpoch();
        DapMessage response = execute(command, arguments, EnumSet.of(SessionState.PAUSED), timeout);
        events.runIfNoStopSince(epoch,
            () -> transition(EnumSet.of(SessionState.PAUSED), SessionState.RUNNING));
        return response;
    }

    DapMessage pause(JsonNode arguments, Duration timeout) throws DapException, InterruptedException {
        DapMessage response = execute("pause", arguments, EnumSet.of(SessionState.RUNNING), timeout);
        transition(EnumSet.of(SessionState.RUNNING), SessionState.PAUSED);
        return response;
    }

    DapMessage inspect(String command, JsonNode arguments, Duration timeout) throws DapException, InterruptedException {
        return execute(command, arguments, INSPECTABLE, timeout);
    }

    DapMessage execute(String command, JsonNode arguments, Set<SessionState> allowed, Duration timeout)
        throws DapException, InterruptedException {
        requireState(command, allowed);
        if (options.unsupportedCommands().contains(command)) {
            throw new DapUnsupportedCommandException(command);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        acquirePermit(command, timeout, deadline);
        PendingCall call;
        issueLock.lock();
        try {
            DapConnection conn;
            try {
                requireState(command, allowed);
                conn = requireConnection(command);
            } catch (DapException e) {
                inFlight.release();
                throw e;
            }
            call = pending.register(sequence.next(), command, remaining(deadline));
            call.response().whenComplete((message, error) -> inFlight.release());
            write(conn, call, arguments);
        } finally {
            issueLock.unlock();
        }
        return awaitResponse(call);
    }

    /**
     * Ends the session. Outstanding calls fail at once; the {@code disconnect} request bypasses single
     * flight and is given a short grace period before the socket is closed.
     */
    void disconnect() throws DapException, InterruptedException {
        synchronized (lifecycle) {
            requireState("disconnect", CONNECTED_STATES);
            DapConnection conn = connection;
            transition(CONNECTED_STATES, SessionState.TERMINATED);
            pending.failAll("Session disconnected");
            failLaunchIntent("Session disconnected");
            try {
                if (conn != null && conn.isOpen()) {
                    PendingCall call;
                    issueLock.lock();
                    try {
                        call = pending.register(sequence.next(), "disconnect", options.disconnectTimeout());
                        write(conn, call, null);
                    } finally {
                        issueLock.unlock();
                    }
                    try {
                        call.response().get();
                    } catch (ExecutionException e) {
                        LOGGER.debug("Disconnect was not acknowledged: {}", e.getCause().toString());
                    }
                }
            } finally {
                connection = null;
                if (conn != null) {
                    conn.close();
                }
                pending.failAll("Session disconnected");
                state.set(SessionState.DISCONNECTED);
                LOGGER.info("Session disconnected");
            }
        }
    }

    @Override
    public void close() {
        if (state.get() == SessionState.DISCONNECTED) {
            return;
        }
        try {
            disconnect();
        } catch (DapStateException e) {
            LOGGER.debug("Session already closed");
        } catch (DapException e) {
            LOGGER.warn("Error while closing session: {}", e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void onConnectionLost(DapConnection conn, Throwable cause) {
        synchronized (lifecycle) {
            if (conn == null || connection != conn) {
                return;
            }
            connection = null;
            String reason = cause == null
                ? "Debugger closed the connection"
                : "Connection to debugger failed: " + cause.getMessage();
            transition(CONNECTED_STATES, SessionState.TERMINATED);
            pending.failAll(reason);
            failLaunchIntent(reason);
            state.set(SessionState.DISCONNECTED);
            LOGGER.warn("Session lost: {}", reason);
        }
    }

    private void onEvent(DapEvent event) {
        switch (event.name()) {
            case "stopped" -> transition(EnumSet.of(SessionState.CONFIGURING, SessionState.RUNNING), SessionState.PAUSED);
            case "continued" -> transition(EnumSet.of(SessionState.PAUSED), SessionState.RUNNING);
            case "terminated", "exited" -> transition(
                EnumSet.range(SessionState.CONNECTED, SessionState.PAUSED), SessionState.TERMINATED);
            default -> {
            }
        }
    }

    private void onLaunchSettled(DapMessage response) {
        if (response != null && !response.succeeded()) {
            LOGGER.warn("Debugger rejected {}: {}", response.command(), response.message());
            transition(EnumSet.range(SessionState.CONFIGURING, SessionState.PAUSED), SessionState.TERMINATED);
        }
    }

    private void failLaunchIntent(String reason) {
        LaunchIntent intent = launchIntent;
        launchIntent = null;
        if (intent != null) {
            intent.handle().fail(new DapConnectionClosedException(intent.command(), reason));
        }
    }

    private boolean write(DapConnection conn, PendingCall call, JsonNode arguments) {
        try {
            conn.send(DapMessage.request(call.seq(), call.command(), arguments));
            return true;
        } catch (IOException e) {
            LOGGER.error("Failed to send {}", call, e);
            call.fail(new DapConnectionClosedException(call.command(), "Failed to send '" + call.command() + "': "
                + e.getMessage(), e));
            return false;
        }
    }

    private DapMessage awaitResponse(PendingCall call) throws DapException, InterruptedException {
        DapMessage response;
        try {
            response = call.response().get();
        } catch (ExecutionException e) {
            throw failure(call, e.getCause());
        } catch (CancellationException e) {
            throw failure(call, e);
        } catch (InterruptedException e) {
            call.response().cancel(false);
            throw e;
        }
        if (!response.succeeded()) {
            throw new DapRemoteException(call.command(), response.message(), response.body());
        }
        return response;
    }

    private void acquirePermit(String command, Duration timeout, long deadline)
        throws DapTimeoutException, InterruptedException {
        long wait = Math.max(0, deadline - System.nanoTime());
        if (!inFlight.tryAcquire(wait, TimeUnit.NANOSECONDS)) {
            throw new DapTimeoutException(command, timeout, "Timed out after " + timeout.toMillis()
                + " ms waiting for the previous command to finish before sending '" + command + "'");
        }
    }

    private void requireState(String command, Set<SessionState> allowed) throws DapStateException {
        SessionState current = state.get();
        if (!allowed.contains(current)) {
            throw new DapStateException(command, current, allowed);
        }
    }

    private DapConnection requireConnection(String command) throws DapConnectionClosedException {
        DapConnection conn = connection;
        if (conn == null || !conn.isOpen()) {
            throw new DapConnectionClosedException(command, "Not connected to a debugger");
        }
        return conn;
    }

    private boolean transition(Set<SessionState> from, SessionState to) {
        while (true) {
            SessionState current = state.get();
            if (!from.contains(current) || current == to) {
                return false;
            }
            if (state.compareAndSet(current, to)) {
                LOGGER.info("Session {} -> {}", current, to);
                return true;
            }
        }
    }

    private static Duration remaining(long deadline) {
        return Duration.ofNanos(Math.max(0, deadline - System.nanoTime()));
    }

    static DapException failure(PendingCall call, Throwable cause) {
        Throwable actual = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (actual instanceof DapException dapException) {
            return dapException;
        }
        if (actual instanceof TimeoutException) {
            return new DapTimeoutException(call.command(), call.timeout());
        }
        if (actual instanceof CancellationException) {
            return new DapConnectionClosedException(call.command(), "'" + call.command() + "' was cancelled");
        }
        return new DapProtocolException(call.command(), "Unexpected failure of '" + call.command() + "'", actual);
    }

    static DapException unwrap(String command, Throwable cause) {
        Throwable actual = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (actual instanceof DapException dapException) {
            return dapException;
        }
        return new DapProtocolException(command, "Unexpected failure of '" + command + "'", actual);
    }
}
