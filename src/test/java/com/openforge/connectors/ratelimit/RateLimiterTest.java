package com.openforge.connectors.ratelimit;

import com.openforge.connectors.error.OperationCancelledException;
import com.openforge.connectors.error.RateLimitExceededException;
import com.openforge.connectors.error.RateLimitTimeoutException;
import com.openforge.connectors.support.FakeClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RateLimiterTest {

    private final FakeClock clock = new FakeClock();

    private RateLimiter limiter(RateLimitPolicy policy) {
        return new RateLimiter("test", policy, clock, clock);
    }

    @Test
    void failFastAdmitsCapacityThenRefusesUntilOneTokenRefills() {
        RateLimiter limiter = limiter(RateLimitPolicy.failFast(3, 4));

        limiter.acquire(1);
        limiter.acquire(1);
        limiter.acquire(1);

        assertThatThrownBy(() -> limiter.acquire(1))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(e -> assertThat(((RateLimitExceededException) e).retryAfter())
                        .isEqualTo(Duration.ofMillis(250)));

        clock.advance(Duration.ofMillis(250));
        limiter.acquire(1);
        assertThat(limiter.availableTokens()).isLessThan(1.0);
    }

    @Test
    void tryAcquireNeverWaits() {
        RateLimiter limiter = limiter(RateLimitPolicy.blocking(2, 1));

        assertThat(limiter.tryAcquire(2)).isTrue();
        assertThat(limiter.tryAcquire(1)).isFalse();
        assertThat(clock.sleeps()).isEmpty();
    }

    @Test
    void refillIsCappedAtCapacity() {
        RateLimiter limiter = limiter(RateLimitPolicy.failFast(3, 4));
        limiter.acquire(3);

        clock.advance(Duration.ofMinutes(5));

        assertThat(limiter.availableTokens()).isEqualTo(3.0);
    }

    @Test
    void blockingWaitsInBoundedSlicesUntilAdmitted() {
        RateLimiter limiter = limiter(RateLimitPolicy.blocking(1, 5));
        limiter.acquire(1);

        limiter.acquire(1, Duration.ofSeconds(5));

        assertThat(clock.totalSlept().toMillis()).isBetween(199L, 201L);
        assertThat(clock.sleeps()).allSatisfy(d -> assertThat(d).isLessThanOrEqualTo(Duration.ofMillis(50)));
    }

    @Test
    void blockingGivesUpWhenTimeoutElapses() {
        RateLimiter limiter = limiter(RateLimitPolicy.blocking(1, 0.1));
        limiter.acquire(1);

        assertThatThrownBy(() -> limiter.acquire(1, Duration.ofMillis(120)))
                .isInstanceOf(RateLimitTimeoutException.class);
        assertThat(clock.totalSlept()).isLessThanOrEqualTo(Duration.ofMillis(120));
    }

    @Test
    void costAboveCapacityIsRejected() {
        RateLimiter limiter = limiter(RateLimitPolicy.blocking(3, 1));

        assertThatThrownBy(() -> limiter.acquire(4))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void interruptionWhileWaitingCancelsAndRestoresFlag() {
        RateLimiter limiter = new RateLimiter("test", RateLimitPolicy.blocking(1, 1), clock,
                duration -> {
                    throw new InterruptedException("stop");
                });
        limiter.acquire(1);

        try {
            assertThatThrownBy(() -> limiter.acquire(1))
                    .isInstanceOf(OperationCancelledException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void concurrentCallersNeverOverdrawTheBucket() throws Exception {
        RateLimiter limiter = new RateLimiter("shared", RateLimitPolicy.failFast(50, 0.001));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> attempts = new ArrayList<>();
            for (int i = 0; i < 200; i++) {
                attempts.add(pool.submit(() -> {
                    start.await();
                    return limiter.tryAcquire(1);
                }));
            }
            start.countDown();

            int admitted = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(5, TimeUnit.SECONDS)) {
                    admitted++;
                }
            }
            assertThat(admitted).isEqualTo(50);
        } finally {
            pool.shutdownNow();
        }
    }
}
