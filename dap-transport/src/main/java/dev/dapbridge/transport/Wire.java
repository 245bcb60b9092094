package dev.dapbridge.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging framed DAP traffic in a consistent format so that outbound and inbound
 * messages line up in the log.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_BODY = 200;

    private Wire() {
    }

    public static void rx(String connectionId, DapMessage message) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX conn={} seq={} type={} name={} req={} ok={} body={}",
                connectionId,
                message.seq(),
                message.type(),
                message.name(),
                message.requestSeq(),
                message.success(),
                truncate(payloadOf(message), MAX_BODY));
        }
    }

    public static void tx(String connectionId, DapMessage message) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX conn={} seq={} type={} name={} args={}",
                connectionId,
                message.seq(),
                message.type(),
                message.name(),
                truncate(payloadOf(message), MAX_BODY));
        }
    }

    private static String payloadOf(DapMessage message) {
        if (message.body() != null) {
            return message.body().toString();
        }
        if (message.arguments() != null) {
            return message.arguments().toString();
        }
        return message.message();
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
