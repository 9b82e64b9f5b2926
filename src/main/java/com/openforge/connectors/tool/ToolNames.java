package com.openforge.connectors.tool;

import java.util.Locale;

/**
 * Tool naming: {@code <connector>_<operation>}, snake-cased, restricted to
 * {@code [a-z0-9_]} so every provider accepts it as a function name.
 */
public final class ToolNames {

    private ToolNames() {
    }

    public static String namespaced(String connector, String operation) {
        return normalize(connector + "_" + operation);
    }

    /**
     * "sendMessage" → "send_message", "Send-Message!" → "send_message".
     */
    public static String normalize(String raw) {
        String snake = raw.trim()
                .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
                .toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9]+", "_");
        return snake.replaceAll("^_+|_+$", "");
    }
}
