package com.openforge.connectors.ratelimit;

import com.openforge.connectors.error.OperationCancelledException;
import com.openforge.connectors.error.RateLimitExceededException;
import com.openforge.connectors.error.RateLimitTimeoutException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * Per-connector token bucket.
 *
 * No background refill thread: every admission check first tops the
 * bucket up from the time elapsed since the last update,
 *
 *   tokens = min(capacity, tokens + elapsedSeconds * refillPerSecond)
 *
 * then tries to take {@code cost} tokens. The bucket is an immutable
 * snapshot swapped in with compare-and-set, so concurrent callers either
 * see each other's debit or retry; no update is ever lost and the token
 * count never leaves {@code [0, capacity]}.
 */
@Slf4j
public class RateLimiter {

    private static final long MAX_POLL_NANOS = Duration.ofMillis(50).toNanos();
    private static final double EPSILON = 1e-9;

    private final String name;
    private final RateLimitPolicy policy;
    private final LongSupplier nanoClock;
    private final Sleeper sleeper;
    private final AtomicReference<Bucket> bucket;

    private record Bucket(double tokens, long updatedAt) {}

    public RateLimiter(String name, RateLimitPolicy policy) {
        this(name, policy, System::nanoTime, Sleeper.SYSTEM);
    }

    public RateLimiter(String name, RateLimitPolicy policy, LongSupplier nanoClock, Sleeper sleeper) {
        this.name = name;
        this.policy = policy;
        this.nanoClock = nanoClock;
        this.sleeper = sleeper;
        this.bucket = new AtomicReference<>(new Bucket(policy.capacity(), nanoClock.getAsLong()));
    }

    // ── Public API ───────────────────────────────────────────────────────────

    /** Take {@code cost} tokens if they are available right now. Never waits. */
    public boolean tryAcquire(int cost) {
        return takeOrWait(cost) == 0L;
    }

    public void acquire() {
        acquire(1);
    }

    /** Acquire using the policy's mode and default timeout. */
    public void acquire(int cost) {
        acquire(cost, policy.acquireTimeout());
    }

    /**
     * Acquire using the policy's mode. In blocking mode {@code timeout}
     * bounds the total wait; in fail-fast mode it is ignored.
     */
    public void acquire(int cost, Duration timeout) {
        long waitNanos = takeOrWait(cost);
        if (waitNanos == 0L) {
            return;
        }
        if (policy.mode() == RateLimitMode.FAIL_FAST) {
            throw new RateLimitExceededException(name, Duration.ofNanos(waitNanos));
        }

        long started = nanoClock.getAsLong();
        long deadline = started + Math.max(0L, timeout.toNanos());
        log.debug("[RateLimiter:{}] Bucket short, waiting ~{} ms for {} token(s)",
                name, Duration.ofNanos(waitNanos).toMillis(), cost);

        while (waitNanos > 0L) {
            long remaining = deadline - nanoClock.getAsLong();
            if (remaining <= 0L) {
                throw new RateLimitTimeoutException(name,
                        Duration.ofNanos(nanoClock.getAsLong() - started), Duration.ofNanos(waitNanos));
            }
            try {
                sleeper.sleep(Duration.ofNanos(Math.min(Math.min(waitNanos, MAX_POLL_NANOS), remaining)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException(
                        "Interrupted while waiting for rate limiter [%s]".formatted(name), e);
            }
            waitNanos = takeOrWait(cost);
        }
    }

    /** Current token count after lazy refill; does not consume anything. */
    public double availableTokens() {
        Bucket current = bucket.get();
        return refill(current, nanoClock.getAsLong());
    }

    public String name() {
        return name;
    }

    public RateLimitPolicy policy() {
        return policy;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Debit {@code cost} tokens atomically. Returns 0 on success, otherwise
     * the estimated nanoseconds until enough tokens will have accumulated
     * (the bucket is left untouched in that case).
     */
    private long takeOrWait(int cost) {
        if (cost <= 0) {
            throw new IllegalArgumentException("cost must be positive, was " + cost);
        }
        if (cost > policy.capacity()) {
            throw new IllegalArgumentException(
                    "cost %d exceeds capacity %d of rate limiter [%s]".formatted(cost, policy.capacity(), name));
        }
        while (true) {
            Bucket current = bucket.get();
            long now = nanoClock.getAsLong();
            double available = refill(current, now);
            if (available + EPSILON >= cost) {
                Bucket next = new Bucket(Math.max(0.0, available - cost), Math.max(now, current.updatedAt()));
                if (bucket.compareAndSet(current, next)) {
                    return 0L;
                }
                continue;
            }
            double deficit = cost - available;
            return Math.max(1L, (long) Math.ceil(deficit / policy.refillPerSecond() * 1_000_000_000d));
        }
    }

    private double refill(Bucket current, long now) {
        long elapsed = Math.max(0L, now - current.updatedAt());
        double added = elapsed / 1_000_000_000d * policy.refillPerSecond();
        return Math.min(policy.capacity(), current.tokens() + added);
    }
}
