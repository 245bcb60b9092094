package dev.dapbridge.transport;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * DAP protocol message. One record covers the three message kinds; fields that do not apply to a
 * kind stay {@code null} and are left out of the serialized form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record DapMessage(
    int seq,
    String type,
    String command,
    @JsonProperty("event") String event,
    @JsonProperty("request_seq") Integer requestSeq,
    @JsonProperty("success") Boolean success,
    String message,
    JsonNode arguments,
    JsonNode body
) {

    public static final String REQUEST = "request";
    public static final String RESPONSE = "response";
    public static final String EVENT = "event";

    public static DapMessage request(int seq, String command, JsonNode arguments) {
        return new DapMessage(seq, REQUEST, command, null, null, null, null, arguments, null);
    }

    public static DapMessage response(int seq, int requestSeq, String command, boolean success, String message,
                                      JsonNode body) {
        return new DapMessage(seq, RESPONSE, command, null, requestSeq, success, message, null, body);
    }

    public static DapMessage event(int seq, String event, JsonNode body) {
        return new DapMessage(seq, EVENT, null, event, null, null, null, null, body);
    }

    @JsonIgnore
    public boolean isRequest() {
        return REQUEST.equals(type);
    }

    @JsonIgnore
    public boolean isResponse() {
        return RESPONSE.equals(type);
    }

    @JsonIgnore
    public boolean isEventMessage() {
        return EVENT.equals(type);
    }

    /**
     * Whether a response reports success. Not named {@code isSuccess} so that Jackson does not
     * bind it to the {@code success} property.
     */
    @JsonIgnore
    public boolean succeeded() {
        return Boolean.TRUE.equals(success);
    }

    /**
     * Name that identifies the message in logs: the command for requests and responses, the event
     * name for events.
     */
    @JsonIgnore
    public String name() {
        return isEventMessage() ? event : command;
    }
}
