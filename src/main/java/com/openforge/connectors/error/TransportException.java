package com.openforge.connectors.error;

import com.openforge.connectors.transport.FailureKind;

import java.time.Duration;

/**
 * Transport-level failure surfaced after the retry budget (or the caller's
 * deadline) ran out, or immediately for a non-retryable failure.
 *
 * Carries enough context to diagnose without inspecting the transport:
 * what went wrong, how many attempts were made and how long it took.
 */
public class TransportException extends ConnectorException {

    private final FailureKind failureKind;
    private final int attempts;
    private final Duration elapsed;
    private final Integer lastStatus;

    public TransportException(String message, FailureKind failureKind, int attempts,
                              Duration elapsed, Integer lastStatus, Throwable cause) {
        super(ErrorKind.TRANSPORT,
                "%s [kind=%s, attempts=%d, elapsed=%dms%s]".formatted(
                        message, failureKind, attempts, elapsed.toMillis(),
                        lastStatus == null ? "" : ", status=" + lastStatus),
                cause);
        this.failureKind = failureKind;
        this.attempts = attempts;
        this.elapsed = elapsed;
        this.lastStatus = lastStatus;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public int attempts() {
        return attempts;
    }

    public Duration elapsed() {
        return elapsed;
    }

    /** HTTP status of the last attempt, or {@code null} if no response arrived. */
    public Integer lastStatus() {
        return lastStatus;
    }
}
