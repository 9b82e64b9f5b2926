package com.openforge.connectors.transport;

import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.error.OperationCancelledException;
import com.openforge.connectors.error.TransportException;
import com.openforge.connectors.ratelimit.RateLimiter;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.nio.channels.UnresolvedAddressException;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Resilient request execution for one connector.
 *
 * Each call runs through a Resilience4j {@link Retry} built from the
 * request's {@link RetryPolicy}. Per attempt:
 *   1. take a token from the connector's {@link RateLimiter}
 *   2. send through the underlying {@link HttpTransport}
 *   3. classify: success / other HTTP status → return to the connector,
 *      transport failure → {@link FailureKind}
 *   4. retry only when the policy lists the kind AND either the request is
 *      marked idempotent or the failure is provably pre-execution
 *   5. back off (exponential + jitter, raised by Retry-After) unless the
 *      caller's deadline would pass first
 *
 * Application-level errors (4xx, 500, error payloads in 2xx) are the
 * connector's to translate; this class never looks at response bodies.
 */
@Slf4j
public class RetryingTransport {

    private final String name;
    private final HttpTransport delegate;
    private final RateLimiter rateLimiter;
    private final LongSupplier nanoClock;

    public RetryingTransport(String name, HttpTransport delegate, RateLimiter rateLimiter) {
        this(name, delegate, rateLimiter, System::nanoTime);
    }

    public RetryingTransport(String name,
                             HttpTransport delegate,
                             RateLimiter rateLimiter,
                             LongSupplier nanoClock) {
        this.name = name;
        this.delegate = delegate;
        this.rateLimiter = rateLimiter;
        this.nanoClock = nanoClock;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    public ConnectorResponse execute(ConnectorRequest request, RetryPolicy policy) {
        return execute(request, policy, null);
    }

    /**
     * @param timeout overall deadline for all attempts, rate-limit waits and
     *                backoffs; {@code null} means bounded by the policy only
     */
    public ConnectorResponse execute(ConnectorRequest request, RetryPolicy policy, Duration timeout) {
        Call call = new Call(request, policy, timeout);
        Retry retry = Retry.of(name + ":" + request.operation(), RetryConfig.<ConnectorResponse>custom()
                .maxAttempts(policy.maxAttempts())
                .retryOnResult(call::retryOnResponse)
                .retryOnException(call::retryOnException)
                .intervalBiFunction((attempt, outcome) -> call.nextDelay.toMillis())
                .failAfterMaxAttempts(false)
                .build());
        retry.getEventPublisher().onRetry(event -> log.warn(
                "[Transport:{}] {} attempt {}/{} failed ({}{}), retrying in {} ms",
                name, request.operation(), event.getNumberOfRetryAttempts(), policy.maxAttempts(),
                call.lastFailure.kind(),
                call.lastFailure.status() == null ? "" : " HTTP " + call.lastFailure.status(),
                call.nextDelay.toMillis()));

        ConnectorResponse response;
        try {
            response = Retry.decorateCheckedSupplier(retry, call::attempt).get();
        } catch (AttemptFailed e) {
            throw call.exhausted(e.failure);
        } catch (ConnectorException e) {
            throw e;
        } catch (RuntimeException | Error e) {
            if (interrupted(e)) {
                throw new OperationCancelledException(
                        "Interrupted while backing off %s on [%s]".formatted(request.operation(), name), e);
            }
            throw e;
        } catch (Throwable e) {
            throw new IllegalStateException("Unexpected failure executing " + request.operation(), e);
        }

        if (classify(response.status()) != null) {
            throw call.exhausted(call.lastFailure);
        }
        if (response.attempts() > 1) {
            log.info("[Transport:{}] {} succeeded on attempt {}", name, request.operation(), response.attempts());
        }
        return response;
    }

    public RateLimiter rateLimiter() {
        return rateLimiter;
    }

    // ── Classification ───────────────────────────────────────────────────────

    static FailureKind classify(int status) {
        return switch (status) {
            case 429 -> FailureKind.RATE_LIMITED;
            case 502, 503, 504 -> FailureKind.SERVER_UNAVAILABLE;
            default -> null;
        };
    }

    static FailureKind classify(IOException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof UnknownHostException || t instanceof UnresolvedAddressException) {
                return FailureKind.UNKNOWN_HOST;
            }
        }
        if (e instanceof HttpConnectTimeoutException) {
            return FailureKind.CONNECT_TIMEOUT;
        }
        if (e instanceof HttpTimeoutException || e instanceof SocketTimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (e instanceof ConnectException) {
            return FailureKind.CONNECTION_REFUSED;
        }
        return FailureKind.NETWORK;
    }

    static boolean shouldRetry(FailureKind kind, ConnectorRequest request, RetryPolicy policy) {
        return policy.isRetryable(kind) && (request.idempotent() || kind.isPreExecution());
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private record Failure(FailureKind kind, Integer status, Optional<Duration> retryAfter, Throwable cause) {}

    /** Carries a transport failure out of the decorated supplier. */
    private static final class AttemptFailed extends RuntimeException {

        private final Failure failure;

        AttemptFailed(Failure failure) {
            super(failure.kind().name(), failure.cause(), false, false);
            this.failure = failure;
        }
    }

    /** State of one {@link #execute} call across its attempts. */
    private final class Call {

        private final ConnectorRequest request;
        private final RetryPolicy policy;
        private final long started;
        private final Long deadline;

        private int attempts;
        private Failure lastFailure;
        private String stopReason = "Retries exhausted";
        private Duration nextDelay = Duration.ZERO;

        Call(ConnectorRequest request, RetryPolicy policy, Duration timeout) {
            this.request = request;
            this.policy = policy;
            this.started = nanoClock.getAsLong();
            this.deadline = timeout == null ? null : started + timeout.toNanos();
        }

        ConnectorResponse attempt() {
            attempts++;
            Duration remaining = remaining();
            if (remaining != null && remaining.isZero()) {
                throw new TransportException("Deadline reached before attempt " + attempts + " of " + request.operation(),
                        FailureKind.CANCELLED, attempts - 1, elapsed(), null, null);
            }

            if (remaining == null) {
                rateLimiter.acquire(1);
            } else {
                rateLimiter.acquire(1, remaining);
            }

            try {
                ConnectorResponse response = delegate.send(boundTimeout(request, remaining()));
                FailureKind kind = classify(response.status());
                if (kind != null) {
                    lastFailure = new Failure(kind, response.status(), retryAfter(response), null);
                }
                return response.withAttempts(attempts);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new OperationCancelledException(
                        "Interrupted during %s on [%s]".formatted(request.operation(), name), e);
            } catch (IOException e) {
                lastFailure = new Failure(classify(e), null, Optional.empty(), e);
                throw new AttemptFailed(lastFailure);
            }
        }

        boolean retryOnResponse(ConnectorResponse response) {
            return classify(response.status()) != null && shouldContinue(lastFailure);
        }

        boolean retryOnException(Throwable failure) {
            return failure instanceof AttemptFailed attemptFailed && shouldContinue(attemptFailed.failure);
        }

        private boolean shouldContinue(Failure failure) {
            if (!shouldRetry(failure.kind(), request, policy)) {
                stopReason = "Non-retryable failure";
                return false;
            }
            if (attempts >= policy.maxAttempts()) {
                stopReason = "Retries exhausted";
                return false;
            }
            Duration delay = policy.backoff(attempts, failure.retryAfter());
            Duration left = remaining();
            if (left != null && delay.compareTo(left) >= 0) {
                stopReason = "Deadline would pass before next retry";
                return false;
            }
            nextDelay = delay;
            return true;
        }

        TransportException exhausted(Failure failure) {
            Duration elapsed = elapsed();
            log.warn("[Transport:{}] {} failed after {} attempt(s) in {} ms: {} ({})",
                    name, request.operation(), attempts, elapsed.toMillis(), stopReason, failure.kind());
            return new TransportException("%s for %s on [%s]".formatted(stopReason, request.operation(), name),
                    failure.kind(), attempts, elapsed, failure.status(), failure.cause());
        }

        private Duration remaining() {
            if (deadline == null) {
                return null;
            }
            long left = deadline - nanoClock.getAsLong();
            return left <= 0 ? Duration.ZERO : Duration.ofNanos(left);
        }

        private Duration elapsed() {
            return Duration.ofNanos(Math.max(0L, nanoClock.getAsLong() - started));
        }
    }

    private static boolean interrupted(Throwable e) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private ConnectorRequest boundTimeout(ConnectorRequest request, Duration remaining) {
        if (remaining == null || remaining.isZero()) {
            return request;
        }
        if (request.timeout() == null || request.timeout().compareTo(remaining) > 0) {
            return request.withTimeout(remaining);
        }
        return request;
    }

    /** Retry-After as delta-seconds or an HTTP date. */
    static Optional<Duration> retryAfter(ConnectorResponse response) {
        return response.header("Retry-After").flatMap(value -> {
            String trimmed = value.trim();
            try {
                return Optional.of(Duration.ofSeconds(Math.max(0L, Long.parseLong(trimmed))));
            } catch (NumberFormatException notSeconds) {
                try {
                    ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
                    Duration until = Duration.between(ZonedDateTime.now(at.getZone()), at);
                    return Optional.of(until.isNegative() ? Duration.ZERO : until);
                } catch (DateTimeParseException unparseable) {
                    return Optional.empty();
                }
            }
        });
    }
}
