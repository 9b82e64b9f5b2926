package com.openforge.connectors.ratelimit;

import java.time.Duration;

/**
 * Token-bucket parameters.
 *
 * @param capacity         bucket size; also the burst a fresh limiter admits
 * @param refillPerSecond  tokens added per second of elapsed time
 * @param mode             behaviour when the bucket is short
 * @param acquireTimeout   default wait bound for blocking acquisition
 */
public record RateLimitPolicy(
        int capacity,
        double refillPerSecond,
        RateLimitMode mode,
        Duration acquireTimeout
) {

    public RateLimitPolicy {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive, was " + capacity);
        }
        if (!(refillPerSecond > 0)) {
            throw new IllegalArgumentException("refillPerSecond must be positive, was " + refillPerSecond);
        }
        if (mode == null) {
            mode = RateLimitMode.BLOCKING;
        }
        if (acquireTimeout == null || acquireTimeout.isNegative()) {
            acquireTimeout = Duration.ofSeconds(30);
        }
    }

    public static RateLimitPolicy blocking(int capacity, double refillPerSecond) {
        return new RateLimitPolicy(capacity, refillPerSecond, RateLimitMode.BLOCKING, null);
    }

    public static RateLimitPolicy failFast(int capacity, double refillPerSecond) {
        return new RateLimitPolicy(capacity, refillPerSecond, RateLimitMode.FAIL_FAST, null);
    }
}
