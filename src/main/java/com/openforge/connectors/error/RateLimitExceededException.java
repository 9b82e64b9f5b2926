package com.openforge.connectors.error;

import java.time.Duration;

/**
 * Fail-fast admission was refused because the bucket did not hold enough tokens.
 */
public class RateLimitExceededException extends ConnectorException {

    private final String limiterName;
    private final Duration retryAfter;

    public RateLimitExceededException(String limiterName, Duration retryAfter) {
        this(ErrorKind.RATE_LIMIT_EXCEEDED, limiterName, retryAfter,
                "Rate limit exceeded for [%s]; next token in %d ms"
                        .formatted(limiterName, retryAfter.toMillis()));
    }

    protected RateLimitExceededException(ErrorKind kind, String limiterName,
                                         Duration retryAfter, String message) {
        super(kind, message);
        this.limiterName = limiterName;
        this.retryAfter = retryAfter;
    }

    public String limiterName() {
        return limiterName;
    }

    /** Estimated wait until the requested cost would be admitted. */
    public Duration retryAfter() {
        return retryAfter;
    }
}
