package com.openforge.connectors.credential;

import java.util.Optional;
import java.util.function.Function;

public class EnvironmentCredentialProvider implements CredentialProvider {

    private final Function<String, String> environment;

    public EnvironmentCredentialProvider() {
        this(System::getenv);
    }

    public EnvironmentCredentialProvider(Function<String, String> environment) {
        this.environment = environment;
    }

    @Override
    public CredentialOrigin origin() {
        return CredentialOrigin.ENVIRONMENT;
    }

    @Override
    public String describe(CredentialSpec spec) {
        return "env:" + spec.envVar();
    }

    @Override
    public Optional<String> lookup(CredentialSpec spec) {
        return Optional.ofNullable(environment.apply(spec.envVar()));
    }
}
