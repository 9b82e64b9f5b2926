package com.openforge.connectors.credential;

import java.util.Optional;

/**
 * External secret store, e.g. Vault.
 */
public interface SecretStore {

    String name();

    /**
     * @param path secret location inside the store
     * @param key  field within the secret
     */
    Optional<String> read(String path, String key);
}
