package com.openforge.connectors.error;

/**
 * Root of the connector error taxonomy.
 *
 * Unchecked, like the rest of the runtime's failures: callers that can
 * recover catch the specific subtype, everything else propagates to the
 * REST advice or the tool-call loop.
 *
 * {@link #isFatal()} separates errors a model can work around (bad
 * arguments, a vendor 404) from errors no amount of retrying by the model
 * will fix (missing credentials, rejected provider key, bad configuration).
 */
public class ConnectorException extends RuntimeException {

    private final ErrorKind kind;

    public ConnectorException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ConnectorException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public boolean isFatal() {
        return false;
    }
}
