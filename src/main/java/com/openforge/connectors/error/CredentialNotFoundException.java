package com.openforge.connectors.error;

import java.util.List;

/**
 * A required credential could not be found in any configured source.
 */
public class CredentialNotFoundException extends ConnectorException {

    private final String credentialName;
    private final List<String> sourcesConsulted;

    public CredentialNotFoundException(String credentialName, List<String> sourcesConsulted) {
        super(ErrorKind.CREDENTIAL_NOT_FOUND,
                "Required credential '%s' not found (consulted: %s)"
                        .formatted(credentialName, String.join(", ", sourcesConsulted)));
        this.credentialName = credentialName;
        this.sourcesConsulted = List.copyOf(sourcesConsulted);
    }

    public String credentialName() {
        return credentialName;
    }

    public List<String> sourcesConsulted() {
        return sourcesConsulted;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
