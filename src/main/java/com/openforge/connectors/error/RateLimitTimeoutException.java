package com.openforge.connectors.error;

import java.time.Duration;

/**
 * Blocking admission gave up because the caller's timeout elapsed first.
 */
public class RateLimitTimeoutException extends RateLimitExceededException {

    private final Duration waited;

    public RateLimitTimeoutException(String limiterName, Duration waited, Duration retryAfter) {
        super(ErrorKind.RATE_LIMIT_TIMEOUT, limiterName, retryAfter,
                "Timed out after %d ms waiting for rate limiter [%s]"
                        .formatted(waited.toMillis(), limiterName));
        this.waited = waited;
    }

    public Duration waited() {
        return waited;
    }
}
