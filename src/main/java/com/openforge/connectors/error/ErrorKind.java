package com.openforge.connectors.error;

import java.util.Locale;

/**
 * Stable classification carried by every {@link ConnectorException}.
 *
 * The lower-case {@link #code()} is what callers see in structured error
 * payloads ({@code {"error": {"kind": "...", "message": "..."}}}).
 */
public enum ErrorKind {

    CREDENTIAL_NOT_FOUND,
    RATE_LIMIT_EXCEEDED,
    RATE_LIMIT_TIMEOUT,
    TRANSPORT,
    CANCELLED,
    TOOL_ARGUMENT,
    UNKNOWN_TOOL,
    TOOL_EXECUTION,
    DUPLICATE_TOOL_NAME,
    TOOL_LOOP_BUDGET_EXCEEDED,
    TOOL_LOOP_FATAL,
    VENDOR_API,
    PROVIDER,
    PROVIDER_AUTHENTICATION,
    PROVIDER_PARAMETER,
    PROVIDER_MODEL,
    CONFIGURATION;

    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
