package com.openforge.connectors.connector;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.connectors.credential.CredentialProvider;
import com.openforge.connectors.credential.ExplicitCredentialProvider;
import com.openforge.connectors.ratelimit.Sleeper;
import com.openforge.connectors.transport.HttpTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Shared collaborators every connector instance is built from.
 *
 * {@code credentialProviders} are the process-wide sources (environment,
 * file, prompt, secret store) in resolution order; a connector's explicit
 * values are put in front of them per instance.
 */
public record ConnectorContext(
        HttpTransport transport,
        ObjectMapper objectMapper,
        List<CredentialProvider> credentialProviders,
        LongSupplier nanoClock,
        Sleeper sleeper
) {

    public ConnectorContext {
        credentialProviders = credentialProviders == null ? List.of() : List.copyOf(credentialProviders);
        nanoClock = nanoClock == null ? System::nanoTime : nanoClock;
        sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    public static ConnectorContext of(HttpTransport transport,
                                      ObjectMapper objectMapper,
                                      List<CredentialProvider> credentialProviders) {
        return new ConnectorContext(transport, objectMapper, credentialProviders, null, null);
    }

    List<CredentialProvider> providersFor(Map<String, String> explicitValues) {
        List<CredentialProvider> chain = new ArrayList<>(credentialProviders.size() + 1);
        chain.add(new ExplicitCredentialProvider(explicitValues));
        chain.addAll(credentialProviders);
        return chain;
    }
}
