package com.openforge.connectors.credential;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.connectors.error.OperationCancelledException;
import com.openforge.connectors.error.TransportException;
import com.openforge.connectors.error.VendorApiException;
import com.openforge.connectors.transport.FailureKind;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * HashiCorp Vault KV v2 reader.
 *
 *   GET {address}/v1/{mount}/data/{path}
 *   X-Vault-Token: ...
 *   → {"data": {"data": {"<key>": "<value>"}, "metadata": {...}}}
 *
 * A 404 means "not stored here" and yields empty; any other error status
 * is surfaced as a {@link VendorApiException}.
 */
@Slf4j
public class VaultSecretStore implements SecretStore {

    private static final Duration READ_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String address;
    private final String mount;
    private final Supplier<String> token;

    public VaultSecretStore(HttpClient httpClient,
                            ObjectMapper objectMapper,
                            String address,
                            String mount,
                            Supplier<String> token) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.address = address.endsWith("/") ? address.substring(0, address.length() - 1) : address;
        this.mount = mount;
        this.token = token;
    }

    @Override
    public String name() {
        return "vault";
    }

    @Override
    public Optional<String> read(String path, String key) {
        String token = this.token.get();
        if (token == null || token.isBlank()) {
            log.debug("[Vault] No token configured, skipping read of {}", path);
            return Optional.empty();
        }
        String trimmedPath = path.startsWith("/") ? path.substring(1) : path;
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create("%s/v1/%s/data/%s".formatted(address, mount, trimmedPath)))
                .header("X-Vault-Token", token)
                .timeout(READ_TIMEOUT)
                .GET()
                .build();

        long started = System.nanoTime();
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new TransportException("Vault read failed for " + trimmedPath, FailureKind.NETWORK, 1,
                    Duration.ofNanos(System.nanoTime() - started), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted reading Vault secret " + trimmedPath, e);
        }

        int status = response.statusCode();
        if (status == 404) {
            return Optional.empty();
        }
        if (status < 200 || status >= 300) {
            throw new VendorApiException(name(), status, null, "Vault read failed for " + trimmedPath);
        }

        try {
            JsonNode value = objectMapper.readTree(response.body()).path("data").path("data").path(key);
            return value.isMissingNode() || value.isNull() ? Optional.empty() : Optional.of(value.asText());
        } catch (JsonProcessingException e) {
            throw new VendorApiException(name(), status, "malformed_body",
                    "Unparseable Vault response for " + trimmedPath);
        }
    }
}
