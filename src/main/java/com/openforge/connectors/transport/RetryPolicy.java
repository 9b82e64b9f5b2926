package com.openforge.connectors.transport;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable retry configuration, attached per connector or per request.
 *
 * Backoff before retry n (n = attempts already made, starting at 1):
 *
 *   base * multiplier^(n-1), randomized by ±jitter, capped at maxBackoff
 *
 * computed with Resilience4j's {@link IntervalFunction}.
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseBackoff,
        double multiplier,
        double jitter,
        Duration maxBackoff,
        Set<FailureKind> retryableKinds
) {

    public static final Set<FailureKind> DEFAULT_RETRYABLE = Set.copyOf(EnumSet.of(
            FailureKind.CONNECTION_REFUSED,
            FailureKind.UNKNOWN_HOST,
            FailureKind.CONNECT_TIMEOUT,
            FailureKind.TIMEOUT,
            FailureKind.NETWORK,
            FailureKind.RATE_LIMITED,
            FailureKind.SERVER_UNAVAILABLE));

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (baseBackoff == null || baseBackoff.toMillis() < 1) {
            throw new IllegalArgumentException("baseBackoff must be at least 1 ms");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0, was " + multiplier);
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0, 1), was " + jitter);
        }
        if (maxBackoff == null || maxBackoff.compareTo(baseBackoff) < 0) {
            maxBackoff = baseBackoff;
        }
        retryableKinds = retryableKinds == null || retryableKinds.isEmpty()
                ? DEFAULT_RETRYABLE
                : Set.copyOf(retryableKinds);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(500), 2.0, 0.2, Duration.ofSeconds(10), DEFAULT_RETRYABLE);
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ofMillis(1), 1.0, 0.0, Duration.ofMillis(1), DEFAULT_RETRYABLE);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, baseBackoff, multiplier, jitter, maxBackoff, retryableKinds);
    }

    public boolean isRetryable(FailureKind kind) {
        return kind != FailureKind.CANCELLED && retryableKinds.contains(kind);
    }

    /**
     * Delay to wait after {@code attemptsMade} failed attempts.
     */
    public Duration backoff(int attemptsMade) {
        IntervalFunction intervals = jitter > 0.0
                ? IntervalFunction.ofExponentialRandomBackoff(
                        baseBackoff.toMillis(), multiplier, jitter, maxBackoff.toMillis())
                : IntervalFunction.ofExponentialBackoff(
                        baseBackoff.toMillis(), multiplier, maxBackoff.toMillis());
        long millis = intervals.apply(Math.max(1, attemptsMade));
        return Duration.ofMillis(Math.min(millis, maxBackoff.toMillis()));
    }

    /**
     * Backoff raised to the server's Retry-After hint, still capped at {@code maxBackoff}.
     */
    public Duration backoff(int attemptsMade, Optional<Duration> retryAfter) {
        Duration delay = backoff(attemptsMade);
        return retryAfter
                .filter(hint -> hint.compareTo(delay) > 0)
                .map(hint -> hint.compareTo(maxBackoff) <= 0 ? hint : maxBackoff)
                .orElse(delay);
    }
}
