package dev.dapbridge.client;

import dev.dapbridge.transport.DapMessage;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Outstanding commands keyed by seq. Entries remove themselves when their slot settles, so a timed out
 * call leaves nothing behind for a late response to match.
 */
final class PendingCallTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PendingCallTable.class);

    /** Commands Godot has been seen to answer with a {@code request_seq} that does not match. */
    static final Set<String> HANDSHAKE_COMMANDS = Set.of("launch", "attach", "configurationDone");

    private final Map<Integer, PendingCall> calls = new ConcurrentHashMap<>();

    PendingCall register(int seq, String command, Duration timeout) {
        PendingCall call = new PendingCall(seq, command, timeout);
        calls.put(seq, call);
        call.response().whenComplete((message, error) -> calls.remove(seq, call));
        return call;
    }

    /**
     * Delivers a response to the call it answers.
     *
     * @return {@code true} if a waiting call took the response
     */
    boolean complete(DapMessage response) {
        Optional<PendingCall> match = match(response);
        if (match.isEmpty()) {
            LOGGER.warn("Discarding unmatched response {} for request_seq={}", response.command(),
                response.requestSeq());
            return false;
        }
        PendingCall call = match.get();
        if (!calls.remove(call.seq(), call) || !call.complete(response)) {
            LOGGER.warn("Discarding late response {} for request_seq={}", response.command(), response.requestSeq());
            return false;
        }
        return true;
    }

    private Optional<PendingCall> match(DapMessage response) {
        Integer requestSeq = response.requestSeq();
        PendingCall call = requestSeq == null ? null : calls.get(requestSeq);
        if (call != null) {
            if (response.command() != null && !call.command().equals(response.command())) {
                LOGGER.warn("Protocol error: response for {} references request_seq={} which is {}",
                    response.command(), requestSeq, call);
                return Optional.empty();
            }
            return Optional.of(call);
        }
        if (response.command() == null || !HANDSHAKE_COMMANDS.contains(response.command())) {
            return Optional.empty();
        }
        return calls.values().stream()
            .filter(candidate -> candidate.command().equals(response.command()))
            .min(Comparator.comparingInt(PendingCall::seq));
    }

    void failAll(String reason) {
        List<PendingCall> outstanding = new ArrayList<>(calls.values());
        calls.clear();
        for (PendingCall call : outstanding) {
            call.fail(new DapConnectionClosedException(call.command(), reason));
        }
    }

    int size() {
        return calls.size();
    }
}
