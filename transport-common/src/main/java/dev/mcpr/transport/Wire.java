package dev.mcpr.transport;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs framed traffic in one format so that client and server logs look identical.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private Wire() {
    }

    public static void rx(String transport, String json) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX {} json={}", transport, truncate(json, 200));
        }
    }

    public static void tx(String transport, String json) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX {} json={}", transport, truncate(json, 200));
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
