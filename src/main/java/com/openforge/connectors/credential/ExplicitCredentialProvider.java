package com.openforge.connectors.credential;

import java.util.Map;
import java.util.Optional;

/**
 * Values passed in directly, from configuration or programmatic options.
 * Looked up by logical name first, then by environment-variable name.
 */
public class ExplicitCredentialProvider implements CredentialProvider {

    private final Map<String, String> values;

    public ExplicitCredentialProvider(Map<String, String> values) {
        this.values = values == null ? Map.of() : Map.copyOf(values);
    }

    @Override
    public CredentialOrigin origin() {
        return CredentialOrigin.EXPLICIT;
    }

    @Override
    public String describe(CredentialSpec spec) {
        return "config:" + spec.name();
    }

    @Override
    public Optional<String> lookup(CredentialSpec spec) {
        String value = values.get(spec.name());
        if (value == null) {
            value = values.get(spec.envVar());
        }
        return Optional.ofNullable(value);
    }
}
