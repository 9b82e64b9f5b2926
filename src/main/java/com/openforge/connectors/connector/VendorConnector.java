package com.openforge.connectors.connector;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.openforge.connectors.credential.Credential;
import com.openforge.connectors.credential.CredentialResolver;
import com.openforge.connectors.credential.CredentialSpec;
import com.openforge.connectors.error.ConnectorConfigurationException;
import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.error.VendorApiException;
import com.openforge.connectors.ratelimit.RateLimiter;
import com.openforge.connectors.tool.ToolNames;
import com.openforge.connectors.tool.ToolOperation;
import com.openforge.connectors.tool.ToolSource;
import com.openforge.connectors.transport.ConnectorRequest;
import com.openforge.connectors.transport.ConnectorResponse;
import com.openforge.connectors.transport.RetryPolicy;
import com.openforge.connectors.transport.RetryingTransport;
import lombok.extern.slf4j.Slf4j;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * Base class of every vendor integration.
 *
 * A subclass declares its credentials up front, lists its tool operations
 * explicitly in {@link #operations()}, and builds requests with
 * {@link #request(String, String)}. Everything between the request and the
 * response (credential lookup, rate limiting, retries, error translation)
 * happens here, so vendor code only deals with payloads.
 *
 * Hooks:
 *   {@link #authorize(ConnectorRequest)}       add auth headers to every outbound request
 *   {@link #translateError(ConnectorRequest, ConnectorResponse)}  non-2xx → exception
 *   {@link #inspect(ConnectorRequest, ConnectorResponse, JsonNode)} error payloads inside 2xx
 */
@Slf4j
public abstract class VendorConnector implements ToolSource {

    private static final int ERROR_SNIPPET_LENGTH = 300;

    protected final ObjectMapper objectMapper;

    private final String name;
    private final String description;
    private final String baseUrl;
    private final ConnectorSettings settings;
    private final CredentialResolver credentials;
    private final RetryingTransport transport;

    protected VendorConnector(String name,
                              String description,
                              String defaultBaseUrl,
                              List<CredentialSpec> credentialSpecs,
                              ConnectorSettings settings,
                              ConnectorContext context) {
        this.name = name;
        this.description = description;
        this.settings = settings == null ? ConnectorSettings.defaults() : settings;
        this.baseUrl = stripTrailingSlash(
                this.settings.baseUrl() == null || this.settings.baseUrl().isBlank()
                        ? defaultBaseUrl
                        : this.settings.baseUrl());
        if (this.baseUrl == null || this.baseUrl.isBlank()) {
            throw new ConnectorConfigurationException("Connector [%s] has no base URL".formatted(name));
        }
        this.objectMapper = context.objectMapper();
        this.credentials = new CredentialResolver(name,
                context.providersFor(this.settings.credentials()), credentialSpecs);
        RateLimiter rateLimiter = new RateLimiter(name, this.settings.rateLimit(),
                context.nanoClock(), context.sleeper());
        this.transport = new RetryingTransport(name, context.transport(), rateLimiter, context.nanoClock());
    }

    // ── Identity ─────────────────────────────────────────────────────────────

    @Override
    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public String baseUrl() {
        return baseUrl;
    }

    @Override
    public abstract List<ToolOperation> operations();

    public Collection<CredentialSpec> credentialSpecs() {
        return credentials.declared();
    }

    public ConnectorInfo info() {
        return new ConnectorInfo(
                name,
                description,
                baseUrl,
                credentialSpecs().stream().map(CredentialSpec::name).toList(),
                operations().stream().map(op -> ToolNames.namespaced(name, op.name())).toList());
    }

    // ── Credentials ──────────────────────────────────────────────────────────

    protected Credential credential(String credentialName) {
        return credentials.resolve(credentialName);
    }

    /** Resolved value of a required credential. */
    protected String secret(String credentialName) {
        return credential(credentialName).value();
    }

    public void refreshCredentials() {
        credentials.refreshAll();
    }

    // ── Request execution ────────────────────────────────────────────────────

    protected ConnectorRequest.ConnectorRequestBuilder request(String method, String path) {
        return ConnectorRequest.builder()
                .method(method)
                .uri(URI.create(baseUrl + (path.startsWith("/") ? path : "/" + path)));
    }

    protected ConnectorResponse execute(ConnectorRequest request) {
        return execute(request, settings.retry(), settings.timeout());
    }

    protected ConnectorResponse execute(ConnectorRequest request, RetryPolicy policy, Duration timeout) {
        ConnectorRequest authorized = authorize(request);
        log.debug("[Connector:{}] → {}", name, authorized.operation());
        ConnectorResponse response = transport.execute(authorized, policy, timeout);
        if (!response.isSuccessful()) {
            throw translateError(authorized, response);
        }
        return response;
    }

    /** Executes and parses the body as JSON, then runs {@link #inspect}. */
    protected JsonNode executeForJson(ConnectorRequest request) {
        ConnectorResponse response = execute(request);
        JsonNode body = parse(request, response);
        inspect(request, response, body);
        return body;
    }

    protected String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize request payload for " + name, e);
        }
    }

    // ── Hooks ────────────────────────────────────────────────────────────────

    protected ConnectorRequest authorize(ConnectorRequest request) {
        return request;
    }

    protected ConnectorException translateError(ConnectorRequest request, ConnectorResponse response) {
        JsonNode body = tryParse(response.body());
        return new VendorApiException(name, response.status(), vendorCode(body),
                "%s failed with HTTP %d: %s".formatted(request.operation(), response.status(),
                        snippet(response.body())));
    }

    protected void inspect(ConnectorRequest request, ConnectorResponse response, JsonNode body) {
        // most vendors signal errors with the status code only
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    protected JsonNode tryParse(String body) {
        if (body == null || body.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return MissingNode.getInstance();
        }
    }

    protected static String snippet(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= ERROR_SNIPPET_LENGTH ? body : body.substring(0, ERROR_SNIPPET_LENGTH) + "...";
    }

    /** Best-effort vendor error code from the common error envelope shapes. */
    protected static String vendorCode(JsonNode body) {
        JsonNode error = body.path("error");
        if (error.isTextual()) {
            return error.asText();
        }
        for (String field : List.of("code", "type", "status")) {
            if (error.path(field).isValueNode()) {
                return error.path(field).asText();
            }
        }
        return body.path("code").isValueNode() ? body.path("code").asText() : null;
    }

    private JsonNode parse(ConnectorRequest request, ConnectorResponse response) {
        try {
            return objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            throw new VendorApiException(name, response.status(), "invalid_json",
                    "%s returned a body that is not JSON: %s".formatted(request.operation(),
                            snippet(response.body())));
        }
    }

    private static String stripTrailingSlash(String url) {
        return url != null && url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
