package dev.dapbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Decoded body of a {@code stopped} event.
 */
public record StoppedEvent(StopReason reason, Integer threadId, String description, String text,
                           boolean allThreadsStopped, List<Integer> hitBreakpointIds, Instant receivedAt) {

    static StoppedEvent from(DapEvent event) {
        JsonNode body = event.body();
        List<Integer> hits = new ArrayList<>();
        for (JsonNode id : body.path("hitBreakpointIds")) {
            hits.add(id.asInt());
        }
        return new StoppedEvent(
            StopReason.of(body.path("reason").asText(null)),
            body.hasNonNull("threadId") ? body.get("threadId").asInt() : null,
            body.path("description").asText(null),
            body.path("text").asText(null),
            body.path("allThreadsStopped").asBoolean(false),
            List.copyOf(hits),
            event.receivedAt());
    }
}
