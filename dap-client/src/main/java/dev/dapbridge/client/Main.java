package dev.dapbridge.client;

import dev.dapbridge.client.model.Capabilities;
import dev.dapbridge.client.model.DapThread;
import dev.dapbridge.client.model.StackFrame;
import dev.dapbridge.client.model.StackTraceResult;
import dev.dapbridge.client.model.ThreadsResult;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Probe for checking a debugger by hand.
 */
public final class Main {

    static final String DEFAULT_HOST = "localhost";
    static final int DEFAULT_PORT = 6006;

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        System.exit(run(args, System.out, DapClientOptions.defaults()));
    }

    static int run(String[] args, PrintStream out, DapClientOptions options) throws Exception {
        List<String> arguments = new ArrayList<>(Arrays.asList(args));
        String host = option(arguments, "--host", DEFAULT_HOST);
        int port = Integer.parseInt(option(arguments, "--port", String.valueOf(DEFAULT_PORT)));
        if (arguments.isEmpty()) {
            printUsage(out);
            return 2;
        }
        String command = arguments.remove(0);
        if (!List.of("init", "threads", "launch").contains(command)) {
            out.println("Unknown command: " + command);
            printUsage(out);
            return 2;
        }

        try (DapClient client = new DapClient(options)) {
            client.connect(host, port);
            Capabilities capabilities = client.initialize();
            switch (command) {
                case "init" -> out.println("INIT capabilities=" + capabilities.raw());
                case "threads" -> handleThreads(client, out);
                default -> handleLaunch(client, arguments, out);
            }
            client.disconnect();
            return 0;
        } catch (DapException e) {
            out.println("ERROR " + e.getClass().getSimpleName() + ": " + e.getMessage());
            return 1;
        }
    }

    private static void handleThreads(DapClient client, PrintStream out) throws Exception {
        client.attachAndConfigure(Map.of(), Map.of());
        ThreadsResult result = client.threads();
        for (DapThread thread : result.threads()) {
            out.println("THREAD " + thread.id() + " " + thread.name());
        }
    }

    private static void handleLaunch(DapClient client, List<String> arguments, PrintStream out) throws Exception {
        if (arguments.isEmpty()) {
            throw new IllegalArgumentException("launch requires a project directory");
        }
        String project = Path.of(arguments.remove(0)).toAbsolutePath().toString();
        GodotLaunchConfig config = GodotLaunchConfig.mainScene(project).build();
        config.validate();
        Map<String, List<Integer>> breakpoints = new LinkedHashMap<>();
        for (String spec : arguments) {
            int colon = spec.lastIndexOf(':');
            if (colon <= 0) {
                throw new IllegalArgumentException("breakpoint must be file:line, got " + spec);
            }
            String file = spec.substring(0, colon);
            if (file.startsWith("res://")) {
                file = Path.of(project, file.substring("res://".length())).toString();
            }
            breakpoints.computeIfAbsent(file, key -> new ArrayList<>()).add(Integer.parseInt(spec.substring(colon + 1)));
        }

        LaunchOutcome outcome = client.launchAndConfigure(config.toLaunchArguments(), breakpoints);
        outcome.breakpoints().forEach((file, result) ->
            result.breakpoints().forEach(bp -> out.println("BREAKPOINT " + file + ":" + bp.line() + " verified=" + bp.verified())));
        out.println("LAUNCHED " + project);
        if (breakpoints.isEmpty()) {
            return;
        }
        StoppedEvent stop = client.waitForStop(Duration.ofSeconds(60));
        out.println("STOPPED reason=" + stop.reason() + " thread=" + stop.threadId());
        StackTraceResult trace = client.stackTrace(stop.threadId() == null ? 1 : stop.threadId(), 0, 20);
        for (StackFrame frame : trace.stackFrames()) {
            String source = frame.source() == null ? "?" : frame.source().path();
            out.println("  #" + frame.id() + " " + frame.name() + " at " + source + ":" + frame.line());
        }
    }

    private static String option(List<String> arguments, String name, String defaultValue) {
        int index = arguments.indexOf(name);
        if (index < 0) {
            return defaultValue;
        }
        if (index + 1 >= arguments.size()) {
            throw new IllegalArgumentException(name + " requires a value");
        }
        String value = arguments.get(index + 1);
        arguments.subList(index, index + 2).clear();
        return value;
    }

    private static void printUsage(PrintStream out) {
        out.println("Usage: java -cp dap-client.jar dev.dapbridge.client.Main [--host h] [--port p] <command> [args]\n" +
            "Commands:\n" +
            "  init\n" +
            "  threads                 attach to the running game and list its threads\n" +
            "  launch <project> [file:line ...]");
    }
}
