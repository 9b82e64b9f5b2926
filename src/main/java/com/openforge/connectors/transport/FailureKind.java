package com.openforge.connectors.transport;

/**
 * Classification of a failed transport attempt.
 *
 * The first three are provably pre-execution: the request never reached the
 * vendor, so even non-idempotent operations may be retried on them.
 */
public enum FailureKind {

    /** TCP connection refused by the remote host. */
    CONNECTION_REFUSED(true),

    /** DNS lookup failed. */
    UNKNOWN_HOST(true),

    /** Connect phase timed out; nothing was written. */
    CONNECT_TIMEOUT(true),

    /** Request was sent, response did not arrive in time. */
    TIMEOUT(false),

    /** Connection reset or closed mid-exchange; server-side effect unknown. */
    NETWORK(false),

    /** HTTP 429. */
    RATE_LIMITED(false),

    /** HTTP 502, 503 or 504. */
    SERVER_UNAVAILABLE(false),

    /** Caller interrupted or deadline reached. Never retried. */
    CANCELLED(false);

    private final boolean preExecution;

    FailureKind(boolean preExecution) {
        this.preExecution = preExecution;
    }

    public boolean isPreExecution() {
        return preExecution;
    }
}
