package com.openforge.connectors.credential;

import java.util.Optional;

public class SecretStoreCredentialProvider implements CredentialProvider {

    private final SecretStore store;

    public SecretStoreCredentialProvider(SecretStore store) {
        this.store = store;
    }

    @Override
    public CredentialOrigin origin() {
        return CredentialOrigin.SECRET_STORE;
    }

    @Override
    public String describe(CredentialSpec spec) {
        return spec.secretPath() == null
                ? store.name() + "(not declared)"
                : store.name() + ":" + spec.secretPath() + "#" + spec.name();
    }

    @Override
    public Optional<String> lookup(CredentialSpec spec) {
        if (spec.secretPath() == null) {
            return Optional.empty();
        }
        return store.read(spec.secretPath(), spec.name());
    }
}
