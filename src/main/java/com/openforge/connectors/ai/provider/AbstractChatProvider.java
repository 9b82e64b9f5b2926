package com.openforge.connectors.ai.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.ai.ChatClient;
import com.openforge.connectors.ai.ProviderSettings;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.connector.ConnectorContext;
import com.openforge.connectors.connector.ConnectorSettings;
import com.openforge.connectors.connector.VendorConnector;
import com.openforge.connectors.credential.CredentialSpec;
import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.error.ProviderAuthenticationException;
import com.openforge.connectors.error.ProviderException;
import com.openforge.connectors.error.ProviderModelException;
import com.openforge.connectors.error.ProviderParameterException;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolOperation;
import com.openforge.connectors.tool.adapter.ChatToolFormat;
import com.openforge.connectors.transport.ConnectorRequest;
import com.openforge.connectors.transport.ConnectorResponse;
import lombok.extern.slf4j.Slf4j;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared request/response plumbing for chat backends.
 *
 * A provider is a {@link VendorConnector} like any other, so the API key
 * goes through credential resolution and every completion through the rate
 * limiter and retry policy. Completions are sent as idempotent: a retried
 * completion may be billed twice but has no other side effect.
 *
 * Subclasses only translate: conversation → wire body, wire body → {@link AIResponse}.
 */
@Slf4j
public abstract class AbstractChatProvider extends VendorConnector implements ChatClient {

    protected static final String API_KEY = "api_key";

    protected final ProviderSettings providerSettings;
    protected final ChatToolFormat toolFormat;

    protected AbstractChatProvider(ProviderSettings providerSettings,
                                   ChatToolFormat toolFormat,
                                   ConnectorSettings connectorSettings,
                                   ConnectorContext context) {
        super(providerSettings.provider().id(),
                "Chat completions via " + providerSettings.provider().id() + " (" + providerSettings.model() + ")",
                providerSettings.provider().defaultBaseUrl(),
                List.of(apiKeySpec(providerSettings)),
                merge(providerSettings, connectorSettings),
                context);
        this.providerSettings = providerSettings;
        this.toolFormat = toolFormat;
    }

    // ── ChatClient ───────────────────────────────────────────────────────────

    @Override
    public AIResponse complete(List<AIMessage> conversation, String systemPrompt, List<ToolDescriptor> tools) {
        List<ToolDescriptor> offered = tools == null ? List.of() : tools;
        ObjectNode body = buildRequest(conversation, systemPrompt, offered);
        ConnectorRequest request = request("POST", endpoint())
                .body(toJson(body))
                .idempotent(true)
                .operation("chat " + model())
                .build();

        log.debug("[Chat:{}] → {} message(s), {} tool(s)", name(), conversation.size(), offered.size());
        AIResponse response = parseResponse(executeForJson(request));
        log.debug("[Chat:{}] ← stop={} tool-calls={} tokens={}", name(), response.stopReason(),
                response.toolCalls().size(), response.usage().totalTokens());
        return response;
    }

    @Override
    public String providerName() {
        return providerSettings.provider().id();
    }

    @Override
    public String model() {
        return providerSettings.model();
    }

    public ProviderSettings providerSettings() {
        return providerSettings;
    }

    /** Chat providers consume tools; they export none. */
    @Override
    public List<ToolOperation> operations() {
        return List.of();
    }

    // ── Wire translation ─────────────────────────────────────────────────────

    protected abstract String endpoint();

    protected abstract ObjectNode buildRequest(List<AIMessage> conversation, String systemPrompt,
                                               List<ToolDescriptor> tools);

    protected abstract AIResponse parseResponse(JsonNode body);

    // ── Error mapping ────────────────────────────────────────────────────────

    @Override
    protected ConnectorException translateError(ConnectorRequest request, ConnectorResponse response) {
        JsonNode body = tryParse(response.body());
        String message = errorMessage(body, response.body());
        int status = response.status();
        return switch (status) {
            case 401, 403 -> new ProviderAuthenticationException(name(), status, message);
            case 400, 422 -> new ProviderParameterException(name(), status, message);
            case 404 -> new ProviderModelException(name(), status,
                    "Model '%s' not available: %s".formatted(model(), message));
            default -> new ProviderException(name(), status, "HTTP %d: %s".formatted(status, message));
        };
    }

    /** Null when no key is configured for a keyless provider. */
    protected String apiKey() {
        return credential(API_KEY).value();
    }

    private static String errorMessage(JsonNode body, String raw) {
        JsonNode error = body.path("error");
        if (error.path("message").isTextual()) {
            return error.path("message").asText();
        }
        if (error.isTextual()) {
            return error.asText();
        }
        return snippet(raw);
    }

    private static CredentialSpec apiKeySpec(ProviderSettings settings) {
        String env = settings.provider().apiKeyEnv();
        return settings.provider().requiresApiKey()
                ? CredentialSpec.required(API_KEY, env)
                : CredentialSpec.optional(API_KEY, settings.provider().name() + "_API_KEY");
    }

    private static ConnectorSettings merge(ProviderSettings provider, ConnectorSettings connector) {
        ConnectorSettings base = connector == null ? ConnectorSettings.defaults() : connector;
        Map<String, String> credentials = new HashMap<>(base.credentials());
        if (provider.hasApiKey()) {
            credentials.put(API_KEY, provider.apiKey());
        }
        return base.withBaseUrl(provider.baseUrl())
                .withTimeout(provider.timeout())
                .withCredentials(credentials);
    }
}
