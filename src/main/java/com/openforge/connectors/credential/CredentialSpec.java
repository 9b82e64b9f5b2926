package com.openforge.connectors.credential;

import java.util.Locale;

/**
 * A credential a connector declares it needs.
 *
 * @param name        logical name, unique within the connector (e.g. "api_key")
 * @param envVar      environment variable, also the file name under the credentials directory
 * @param required    whether resolution fails when no source yields a value
 * @param promptable  whether the interactive prompt may be used for this credential
 * @param secretPath  secret-store path to read {@code name} from, or null when not stored there
 */
public record CredentialSpec(
        String name,
        String envVar,
        boolean required,
        boolean promptable,
        String secretPath
) {

    public CredentialSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Credential name must not be blank");
        }
        if (envVar == null || envVar.isBlank()) {
            envVar = name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
        }
    }

    public static CredentialSpec required(String name, String envVar) {
        return new CredentialSpec(name, envVar, true, false, null);
    }

    public static CredentialSpec optional(String name, String envVar) {
        return new CredentialSpec(name, envVar, false, false, null);
    }

    public CredentialSpec asPromptable() {
        return new CredentialSpec(name, envVar, required, true, secretPath);
    }

    public CredentialSpec storedAt(String path) {
        return new CredentialSpec(name, envVar, required, promptable, path);
    }
}
