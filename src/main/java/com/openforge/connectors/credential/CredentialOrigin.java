package com.openforge.connectors.credential;

/**
 * Where a resolved credential came from. Declaration order is resolution order.
 */
public enum CredentialOrigin {
    EXPLICIT,
    ENVIRONMENT,
    FILE,
    PROMPT,
    SECRET_STORE,
    /** Optional credential that no source provided. */
    NONE
}
