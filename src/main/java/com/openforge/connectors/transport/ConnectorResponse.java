package com.openforge.connectors.transport;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Raw vendor response plus how many attempts it took to get it.
 */
public record ConnectorResponse(
        int status,
        Map<String, List<String>> headers,
        String body,
        int attempts
) {

    public ConnectorResponse {
        headers = headers == null ? Map.of() : headers;
        body = body == null ? "" : body;
    }

    public static ConnectorResponse of(int status, String body) {
        return new ConnectorResponse(status, Map.of(), body, 1);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }

    /** First value of a header, matched case-insensitively. */
    public Optional<String> header(String name) {
        return headers.entrySet().stream()
                .filter(e -> e.getKey() != null && e.getKey().equalsIgnoreCase(name))
                .flatMap(e -> e.getValue().stream())
                .findFirst();
    }

    public ConnectorResponse withAttempts(int attempts) {
        return new ConnectorResponse(status, headers, body, attempts);
    }
}
