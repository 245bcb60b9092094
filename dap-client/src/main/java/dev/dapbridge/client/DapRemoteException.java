package dev.dapbridge.client;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The debugger answered with {@code success=false}. The message is kept verbatim.
 */
public class DapRemoteException extends DapException {

    private final String remoteMessage;
    private final transient JsonNode body;

    public DapRemoteException(String command, String remoteMessage, JsonNode body) {
        super(command, "Debugger rejected '" + command + "': " + describe(remoteMessage, body));
        this.remoteMessage = remoteMessage;
        this.body = body;
    }

    protected DapRemoteException(String command, String message, String remoteMessage) {
        super(command, message);
        this.remoteMessage = remoteMessage;
        this.body = null;
    }

    public String remoteMessage() {
        return remoteMessage;
    }

    public JsonNode body() {
        return body;
    }

    private static String describe(String message, JsonNode body) {
        JsonNode format = body == null ? null : body.path("error").path("format");
        if (format != null && format.isTextual()) {
            return format.asText();
        }
        return message == null || message.isBlank() ? "(no message)" : message;
    }
}
