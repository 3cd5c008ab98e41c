package dev.jsonrpc.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging HTTP-framed traffic in a consistent format so that client and server
 * logs look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");
    private static final int MAX_BODY = 200;

    private Wire() {
    }

    public static void rx(String connectionId, String startLine, String body) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX conn={} line=[{}] json={}", connectionId, startLine, truncate(body, MAX_BODY));
        }
    }

    public static void tx(String connectionId, String startLine, String body) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX conn={} line=[{}] json={}", connectionId, startLine, truncate(body, MAX_BODY));
        }
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
