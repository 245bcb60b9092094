package dev.dapbridge.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.dapbridge.client.model.Capabilities;
import dev.dapbridge.client.model.ContinueResult;
import dev.dapbridge.client.model.EvaluateResult;
import dev.dapbridge.client.model.ScopesResult;
import dev.dapbridge.client.model.SetBreakpointsResult;
import dev.dapbridge.client.model.StackTraceResult;
import dev.dapbridge.client.model.ThreadsResult;
import dev.dapbridge.client.model.VariablesResult;
import dev.dapbridge.transport.DapMessage;
import java.io.Closeable;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed DAP client for a single debug session.
 * <p>
 * Every method blocks the caller until the debugger answers or the deadline passes, and throws a
 * {@link DapException} subtype on failure. Commands that are not legal in the current
 * {@link SessionState} are rejected before anything is sent. The client is safe for use from several
 * threads; commands are serialized so that only one is on the wire at a time.
 */
public class DapClient implements Closeable {

    public static final String CLIENT_ID = "godot-dap-mcp";
    public static final String ADAPTER_ID = "godot";

    private final ObjectMapper mapper;
    private final DapSession session;

    public DapClient() {
        this(DapClientOptions.defaults());
    }

    public DapClient(DapClientOptions options) {
        this(new ObjectMapper(), options);
    }

    public DapClient(ObjectMapper mapper, DapClientOptions options) {
        this.mapper = mapper.copy().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.session = new DapSession(this.mapper, options);
    }

    public DapClientOptions options() {
        return session.options();
    }

    public SessionState getState() {
        return session.state();
    }

    public boolean isConnected() {
        return session.state().isConnected();
    }

    public EventLog events() {
        return session.events();
    }

    /** Project directory that {@code res://} paths resolve against, if known. */
    public String projectRoot() {
        return session.projectRoot();
    }

    public void setProjectRoot(String projectRoot) {
        session.projectRoot(projectRoot);
    }

    public void connect(String host, int port) throws DapException {
        session.connect(host, port);
    }

    public Capabilities initialize() throws DapException, InterruptedException {
        ObjectNode args = mapper.createObjectNode();
        args.put("clientID", CLIENT_ID);
        args.put("clientName", "Godot DAP MCP bridge");
        args.put("adapterID", ADAPTER_ID);
        args.put("locale", "en-US");
        args.put("linesStartAt1", true);
        args.put("columnsStartAt1", true);
        args.put("pathFormat", "path");
        args.put("supportsVariableType", true);
        args.put("supportsVariablePaging", false);
        args.put("supportsRunInTerminalRequest", false);
        return new Capabilities(session.initialize(args, options().connectTimeout()));
    }

    /** Stores a launch request; it is sent together with {@link #configurationDone()}. */
    public PendingLaunch launch(Map<String, ?> arguments) throws DapStateException {
        return session.prepareLaunch("launch", mapper.valueToTree(arguments));
    }

    /** Stores an attach request; it is sent together with {@link #configurationDone()}. */
    public PendingLaunch attach(Map<String, ?> arguments) throws DapStateException {
        return session.prepareLaunch("attach", mapper.valueToTree(arguments));
    }

    /** Replaces all breakpoints of {@code file}; an empty list clears them. */
    public SetBreakpointsResult setBreakpoints(String file, List<Integer> lines)
        throws DapException, InterruptedException {
        ObjectNode args = mapper.createObjectNode();
        args.putObject("source").put("path", file);
        ArrayNode breakpoints = args.putArray("breakpoints");
        for (Integer line : lines) {
            breakpoints.addObject().put("line", line);
        }
        DapMessage response = session.configure("setBreakpoints", args, options().commandTimeout());
        return read(response, SetBreakpointsResult.class);
    }

    public void setExceptionBreakpoints(List<String> filters) throws DapException, InterruptedException {
        ObjectNode args = mapper.createObjectNode();
        ArrayNode array = args.putArray("filters");
        filters.forEach(array::add);
        session.configure("setExceptionBreakpoints", args, options().commandTimeout());
    }

    public void configurationDone() throws DapException, InterruptedException {
        session.configurationDone(options().commandTimeout());
    }

    /**
     * Launch handshake in one call: stores the launch, sends the breakpoints, then
     * {@code configurationDone}, and waits for the launch acknowledgement.
     */
    public LaunchOutcome launchAndConfigure(Map<String, ?> arguments, Map<String, List<Integer>> breakpoints)
        throws DapException, InterruptedException {
        return configureAndStart(launch(arguments), breakpoints);
    }

    /** Same as {@link #launchAndConfigure} for an already running game. */
    public LaunchOutcome attachAndConfigure(Map<String, ?> arguments, Map<String, List<Integer>> breakpoints)
        throws DapException, InterruptedException {
        return configureAndStart(attach(arguments), breakpoints);
    }

    private LaunchOutcome configureAndStart(PendingLaunch handle, Map<String, List<Integer>> breakpoints)
        throws DapException, InterruptedException {
        Map<String, SetBreakpointsResult> results = new LinkedHashMap<>();
        try {
            for (Map.Entry<String, List<Integer>> entry : breakpoints.entrySet()) {
                results.put(entry.getKey(), setBreakpoints(entry.getKey(), entry.getValue()));
            }
            configurationDone();
        } catch (DapException | InterruptedException e) {
            session.abandonLaunch(handle, e);
            throw e;
        }
        handle.await(options().commandTimeout());
        return new LaunchOutcome(handle, results);
    }

    public ContinueResult continueExecution(int threadId) throws DapException, InterruptedException {
        DapMessage response = session.resume("continue", threadArgs(threadId), options().commandTimeout());
        return read(response, ContinueResult.class);
    }

    public void next(int threadId) throws DapException, InterruptedException {
        session.resume("next", threadArgs(threadId), options().commandTimeout());
    }

    public void stepIn(int threadId) throws DapException, InterruptedException {
        session.resume("stepIn", threadArgs(threadId), options().commandTimeout());
    }

    /** Rejected locally while {@code stepOut} is listed as unsupported, which is the default. */
    public void stepOut(int threadId) throws DapException, InterruptedException {
        session.resume("stepOut", threadArgs(threadId), options().commandTimeout());
    }

    public void pause(int threadId) throws DapException, InterruptedException {
        session.pause(threadArgs(threadId), options().commandTimeout());
    }

    public ThreadsResult threads() throws DapException, InterruptedException {
        return read(session.inspect("threads", null, options().commandTimeout()), ThreadsResult.class);
    }

    public StackTraceResult stackTrace(int threadId, int startFrame, int levels)
        throws DapException, InterruptedException {
        ObjectNode args = threadArgs(threadId);
        args.put("startFrame", startFrame);
        args.put("levels", levels);
        return read(session.inspect("stackTrace", args, options().commandTimeout()), StackTraceResult.class);
    }

    public ScopesResult scopes(int frameId) throws DapException, InterruptedException {
        ObjectNode args = mapper.createObjectNode();
        args.put("frameId", frameId);
        return read(session.inspect("scopes", args, options().commandTimeout()), ScopesResult.class);
    }

    public VariablesResult variables(int variablesReference) throws DapException, InterruptedException {
        ObjectNode args = mapper.createObjectNode();
        args.put("variablesReference", variablesReference);
        return read(session.inspect("variables", args, options().commandTimeout()), VariablesResult.class);
    }

    /**
     * @param frameId frame to evaluate in, or {@code null} for the global context
     * @param context DAP evaluate context such as {@code repl}, {@code watch} or {@code hover}
     */
    public EvaluateResult evaluate(String expression, Integer frameId, String context)
        throws DapException, InterruptedException {
        ObjectNode args = mapper.createObjectNode();
        args.put("expression", expression);
        if (frameId != null) {
            args.put("frameId", frameId);
        }
        if (context != null) {
            args.put("context", context);
        }
        return read(session.inspect("evaluate", args, options().commandTimeout()), EvaluateResult.class);
    }

    public void disconnect() throws DapException, InterruptedException {
        session.disconnect();
    }

    public Optional<StoppedEvent> lastStop() {
        return events().lastStop();
    }

    /** Blocks until the next {@code stopped} event. */
    public StoppedEvent waitForStop(Duration timeout) throws DapTimeoutException, InterruptedException {
        return events().awaitStop(timeout);
    }

    @Override
    public void close() {
        session.close();
    }

    private ObjectNode threadArgs(int threadId) {
        ObjectNode args = mapper.createObjectNode();
        args.put("threadId", threadId);
        return args;
    }

    private <T> T read(DapMessage response, Class<T> type) throws DapProtocolException {
        JsonNode body = response.body() == null ? mapper.createObjectNode() : response.body();
        try {
            return mapper.treeToValue(body, type);
        } catch (JsonProcessingException e) {
            throw new DapProtocolException(response.command(),
                "Cannot read '" + response.command() + "' response as " + type.getSimpleName() + ": "
                    + e.getOriginalMessage(), e);
        }
    }
}
