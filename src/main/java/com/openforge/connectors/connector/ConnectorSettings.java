package com.openforge.connectors.connector;

import com.openforge.connectors.ratelimit.RateLimitPolicy;
import com.openforge.connectors.transport.RetryPolicy;

import java.time.Duration;
import java.util.Map;

/**
 * Per-instance knobs of a connector, already merged with the global defaults.
 *
 * @param baseUrl      overrides the connector's built-in base URL when non-blank
 * @param timeout      overall deadline per call (attempts, waits and backoff); null for none
 * @param credentials  explicit credential values keyed by logical name or env var
 */
public record ConnectorSettings(
        String baseUrl,
        RateLimitPolicy rateLimit,
        RetryPolicy retry,
        Duration timeout,
        Map<String, String> credentials
) {

    public ConnectorSettings {
        rateLimit = rateLimit == null ? RateLimitPolicy.blocking(10, 5) : rateLimit;
        retry = retry == null ? RetryPolicy.defaults() : retry;
        credentials = credentials == null ? Map.of() : Map.copyOf(credentials);
    }

    public static ConnectorSettings defaults() {
        return new ConnectorSettings(null, null, null, null, null);
    }

    public ConnectorSettings withBaseUrl(String baseUrl) {
        return new ConnectorSettings(baseUrl, rateLimit, retry, timeout, credentials);
    }

    public ConnectorSettings withTimeout(Duration timeout) {
        return new ConnectorSettings(baseUrl, rateLimit, retry, timeout, credentials);
    }

    public ConnectorSettings withCredentials(Map<String, String> credentials) {
        return new ConnectorSettings(baseUrl, rateLimit, retry, timeout, credentials);
    }
}
