package com.openforge.connectors.error;

/**
 * The calling thread was interrupted while waiting on a limiter or a backoff.
 * The interrupt flag is restored before this is thrown.
 */
public class OperationCancelledException extends ConnectorException {

    public OperationCancelledException(String message, Throwable cause) {
        super(ErrorKind.CANCELLED, message, cause);
    }
}
