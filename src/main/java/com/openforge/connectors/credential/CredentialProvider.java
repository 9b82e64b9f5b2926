package com.openforge.connectors.credential;

import java.util.Optional;

/**
 * One credential source. Implementations return an empty optional rather
 * than throwing when they simply do not hold the value.
 */
public interface CredentialProvider {

    CredentialOrigin origin();

    /** Short label used in "not found" diagnostics, e.g. "env:SLACK_TOKEN". */
    String describe(CredentialSpec spec);

    Optional<String> lookup(CredentialSpec spec);
}
