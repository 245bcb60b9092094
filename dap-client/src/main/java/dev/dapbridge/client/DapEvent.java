package dev.dapbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import java.time.Instant;

/**
 * An event as recorded by the {@link EventLog}. {@code index} is the arrival position within the
 * session and never repeats.
 */
public record DapEvent(long index, String name, JsonNode body, Instant receivedAt) {

    public DapEvent {
        if (body == null) {
            body = MissingNode.getInstance();
        }
    }

    public boolean is(String eventName) {
        return eventName.equals(name);
    }
}
