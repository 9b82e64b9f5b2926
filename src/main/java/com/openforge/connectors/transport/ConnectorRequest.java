package com.openforge.connectors.transport;

import lombok.Builder;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * An outbound vendor call, independent of the HTTP engine.
 *
 * {@code idempotent} is never inferred from the method: a connector must
 * mark an operation idempotent for it to be retried after an ambiguous
 * failure (timeout, reset connection, 429/5xx).
 *
 * @param operation  label used in logs, usually the tool operation name
 */
@Builder(toBuilder = true)
public record ConnectorRequest(
        String method,
        URI uri,
        Map<String, String> headers,
        String body,
        boolean idempotent,
        Duration timeout,
        String operation
) {

    public ConnectorRequest {
        if (uri == null) {
            throw new IllegalArgumentException("uri must not be null");
        }
        method = method == null || method.isBlank() ? "GET" : method.toUpperCase(Locale.ROOT);
        headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        operation = operation == null ? method + " " + uri.getPath() : operation;
    }

    public ConnectorRequest withHeader(String name, String value) {
        Map<String, String> merged = new LinkedHashMap<>(headers);
        merged.put(name, value);
        return toBuilder().headers(merged).build();
    }

    public ConnectorRequest withTimeout(Duration timeout) {
        return toBuilder().timeout(timeout).build();
    }
}
