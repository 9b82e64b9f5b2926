package com.openforge.connectors.credential;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

/**
 * A resolved secret or configuration value.
 *
 * The value never leaves the process through logs or JSON:
 * {@link #toString()} masks it and Jackson ignores it.
 */
public record Credential(
        String name,
        @JsonIgnore String value,
        CredentialOrigin origin,
        Instant resolvedAt
) {

    public static Credential absent(String name, Instant resolvedAt) {
        return new Credential(name, null, CredentialOrigin.NONE, resolvedAt);
    }

    public boolean isPresent() {
        return value != null;
    }

    @Override
    public String toString() {
        return "Credential[name=%s, value=%s, origin=%s, resolvedAt=%s]"
                .formatted(name, isPresent() ? "****" : "<absent>", origin, resolvedAt);
    }
}
