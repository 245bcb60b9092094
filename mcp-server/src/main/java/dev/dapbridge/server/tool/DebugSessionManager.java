package dev.dapbridge.server.tool;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import lombok.RequiredArgsConstructor;

import dev.dapbridge.client.DapClient;
import dev.dapbridge.client.SessionState;
import dev.dapbridge.server.config.DapProperties;

/**
 * Debugging session shared by all Godot tools: the debugger client, the configured connection
 * target and the breakpoints requested in the current session, keyed by absolute script path.
 * Breakpoints requested before a launch are staged here and sent during the launch handshake.
 */
@Component
@RequiredArgsConstructor
public class DebugSessionManager {

	private static final Logger logger = LoggerFactory.getLogger(DebugSessionManager.class);

	private final DapClient client;

	private final DapProperties properties;

	private final Map<String, SortedSet<Integer>> breakpoints = new LinkedHashMap<>();

	/**
	 * Access the shared debugger client regardless of its state.
	 * @return the client
	 */
	public DapClient client() {
		return this.client;
	}

	/**
	 * Access the client of a live session.
	 * @return the connected client
	 * @throws ToolException when no session is established
	 */
	public DapClient requireSession() throws ToolException {
		if (!this.client.isConnected()) {
			throw ToolErrors.notConnected();
		}
		return this.client;
	}

	public SessionState state() {
		return this.client.getState();
	}

	public String host() {
		return this.properties.host();
	}

	public int defaultPort() {
		return this.properties.port();
	}

	public String projectRoot() {
		return this.client.projectRoot();
	}

	public void setProjectRoot(String projectRoot) {
		logger.debug("Project root set to {}", projectRoot);
		this.client.setProjectRoot(projectRoot);
	}

	/**
	 * Compute the full line list of a file once {@code line} is added, without recording it.
	 * @param file absolute script path
	 * @param line line to add
	 * @return sorted breakpoint lines of the file
	 */
	public synchronized List<Integer> linesWith(String file, int line) {
		SortedSet<Integer> lines = new TreeSet<>(this.breakpoints.getOrDefault(file, new TreeSet<>()));
		lines.add(line);
		return new ArrayList<>(lines);
	}

	/**
	 * Record the breakpoint lines of a file, replacing any previous set.
	 * @param file absolute script path
	 * @param lines breakpoint lines; an empty list forgets the file
	 */
	public synchronized void recordBreakpoints(String file, List<Integer> lines) {
		if (lines.isEmpty()) {
			this.breakpoints.remove(file);
		}
		else {
			this.breakpoints.put(file, new TreeSet<>(lines));
		}
	}

	/**
	 * Forget all breakpoints of a file.
	 * @param file absolute script path
	 * @return whether the file had breakpoints
	 */
	public synchronized boolean clearBreakpoints(String file) {
		return this.breakpoints.remove(file) != null;
	}

	/**
	 * Snapshot the breakpoints of this session in the form the launch handshake expects.
	 * @return file to sorted lines, in the order files were first used
	 */
	public synchronized Map<String, List<Integer>> breakpoints() {
		Map<String, List<Integer>> copy = new LinkedHashMap<>();
		this.breakpoints.forEach((file, lines) -> copy.put(file, List.copyOf(lines)));
		return copy;
	}

	/**
	 * Drop all breakpoints, used when a session starts or ends.
	 */
	public synchronized void forgetBreakpoints() {
		if (!this.breakpoints.isEmpty()) {
			logger.debug("Forgetting breakpoints in {} files", this.breakpoints.size());
		}
		this.breakpoints.clear();
	}

}
