package com.openforge.connectors.transport;

import java.io.IOException;

/**
 * A single, unretried network exchange.
 *
 * Implementations report network failures as {@link IOException} and
 * return every HTTP status as a response; classification belongs to
 * {@link RetryingTransport}.
 */
@FunctionalInterface
public interface HttpTransport {

    ConnectorResponse send(ConnectorRequest request) throws IOException, InterruptedException;
}
