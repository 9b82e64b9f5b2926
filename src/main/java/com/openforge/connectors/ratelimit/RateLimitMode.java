package com.openforge.connectors.ratelimit;

public enum RateLimitMode {

    /** Refuse immediately with RateLimitExceededException. */
    FAIL_FAST,

    /** Wait for tokens until the caller's timeout, then RateLimitTimeoutException. */
    BLOCKING
}
