package com.openforge.connectors.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.connectors.agent.ToolCallLoop;
import com.openforge.connectors.ai.AIConnector;
import com.openforge.connectors.ai.ChatClient;
import com.openforge.connectors.ai.ChatProviderFactory;
import com.openforge.connectors.ai.FallbackChatClient;
import com.openforge.connectors.ai.provider.AbstractChatProvider;
import com.openforge.connectors.connector.ConnectorCatalog;
import com.openforge.connectors.connector.ConnectorContext;
import com.openforge.connectors.connector.VendorConnector;
import com.openforge.connectors.credential.CredentialProvider;
import com.openforge.connectors.credential.EnvironmentCredentialProvider;
import com.openforge.connectors.credential.FileCredentialProvider;
import com.openforge.connectors.credential.PromptCredentialProvider;
import com.openforge.connectors.credential.SecretStoreCredentialProvider;
import com.openforge.connectors.credential.VaultSecretStore;
import com.openforge.connectors.tool.ToolRegistry;
import com.openforge.connectors.transport.HttpTransport;
import com.openforge.connectors.vendor.meshy.MeshyConnector;
import com.openforge.connectors.vendor.slack.SlackConnector;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;

/**
 * Connector wiring.
 *
 * Credential chain, per connector (first hit wins):
 *   explicit settings → environment → credential files → prompt (if allowed) → secret store (if configured)
 *
 * Every vendor {@link VendorConnector} bean lands in the {@link ConnectorCatalog},
 * which registers its tools in the {@link ToolRegistry}.
 */
@Slf4j
@Configuration
public class ConnectorsConfig {

    // ── Shared context ───────────────────────────────────────────────────────

    @Bean
    public ConnectorContext connectorContext(HttpTransport httpTransport,
                                             HttpClient httpClient,
                                             ObjectMapper objectMapper,
                                             ConnectorProperties properties) {
        return ConnectorContext.of(httpTransport, objectMapper, credentialProviders(properties, httpClient, objectMapper));
    }

    private static List<CredentialProvider> credentialProviders(ConnectorProperties properties,
                                                                HttpClient httpClient,
                                                                ObjectMapper objectMapper) {
        ConnectorProperties.Credentials credentials = properties.credentials();
        List<CredentialProvider> providers = new ArrayList<>();
        providers.add(new EnvironmentCredentialProvider());
        providers.add(new FileCredentialProvider(credentialDirectory(credentials.directory())));

        providers.add(new PromptCredentialProvider(credentials.allowPrompt(),
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out));

        ConnectorProperties.Vault vault = credentials.vault();
        if (vault.isConfigured()) {
            String tokenEnv = vault.tokenEnv();
            providers.add(new SecretStoreCredentialProvider(new VaultSecretStore(
                    httpClient, objectMapper, vault.address(), vault.mount(), () -> System.getenv(tokenEnv))));
            log.info("[ConnectorsConfig] Vault secret store enabled at {} (mount={})", vault.address(), vault.mount());
        }

        return providers;
    }

    // ── Vendors ──────────────────────────────────────────────────────────────

    @Bean
    @ConditionalOnProperty(prefix = "connectors.vendors.slack", name = "enabled", matchIfMissing = true)
    public SlackConnector slackConnector(ConnectorProperties properties, ConnectorContext context) {
        return new SlackConnector(properties.settingsFor(SlackConnector.NAME), context);
    }

    @Bean
    @ConditionalOnProperty(prefix = "connectors.vendors.meshy", name = "enabled", matchIfMissing = true)
    public MeshyConnector meshyConnector(ConnectorProperties properties, ConnectorContext context) {
        return new MeshyConnector(properties.settingsFor(MeshyConnector.NAME), context);
    }

    // ── Chat providers ───────────────────────────────────────────────────────

    @Bean
    public ChatProviderFactory chatProviderFactory(ConnectorContext context, ConnectorProperties properties) {
        return new ChatProviderFactory(context, properties.settingsFor("ai"));
    }

    @Bean
    public AbstractChatProvider primaryChatProvider(ChatProviderFactory factory, ConnectorProperties properties) {
        return factory.create(properties.ai().primary().toSettings());
    }

    @Bean
    @ConditionalOnExpression("!'${connectors.ai.fallback.provider:}'.isBlank()")
    public AbstractChatProvider fallbackChatProvider(ChatProviderFactory factory, ConnectorProperties properties) {
        return factory.create(properties.ai().fallback().toSettings());
    }

    /**
     * The client everything else talks to. Always a {@link FallbackChatClient}
     * so the primary breaker applies even without a fallback.
     */
    @Bean
    @Primary
    public ChatClient chatClient(@Qualifier("primaryChatProvider") AbstractChatProvider primary,
                                 @Qualifier("fallbackChatProvider") Optional<AbstractChatProvider> fallback,
                                 @Qualifier("primaryChatCircuitBreaker") CircuitBreaker primaryCb,
                                 @Qualifier("fallbackChatCircuitBreaker") CircuitBreaker fallbackCb) {
        return new FallbackChatClient(primary, fallback.orElse(null), primaryCb, fallbackCb);
    }

    // ── Catalog and loop ─────────────────────────────────────────────────────

    /**
     * Chat providers are connectors too but export no tools, and primary and
     * fallback may share a provider name, so they stay out of the catalog.
     */
    @Bean
    public ConnectorCatalog connectorCatalog(List<VendorConnector> connectors, ToolRegistry toolRegistry) {
        List<VendorConnector> vendors = connectors.stream()
                .filter(connector -> !(connector instanceof ChatClient))
                .toList();
        return new ConnectorCatalog(vendors, toolRegistry);
    }

    /**
     * Depends on the catalog so every connector's tools are registered
     * before the first conversation.
     */
    @Bean
    public ToolCallLoop toolCallLoop(ChatClient chatClient,
                                     ToolRegistry toolRegistry,
                                     ConnectorCatalog connectorCatalog,
                                     ObjectMapper objectMapper,
                                     ConnectorProperties properties,
                                     ExecutorService connectorToolExecutor) {
        ConnectorProperties.Agent agent = properties.agent();
        log.info("[ConnectorsConfig] Tool-call loop: maxRoundTrips={} parallel={} tools={}",
                agent.maxRoundTrips(), agent.parallelToolExecution(), toolRegistry.size());
        return new ToolCallLoop(chatClient, toolRegistry, objectMapper,
                agent.maxRoundTrips(), agent.parallelToolExecution(), connectorToolExecutor);
    }

    @Bean
    public AIConnector aiConnector(ChatClient chatClient, ToolCallLoop toolCallLoop, ConnectorProperties properties) {
        return new AIConnector(chatClient, toolCallLoop, properties.agent().systemPrompt());
    }

    private static Path credentialDirectory(String configured) {
        if (configured == null || configured.isBlank()) {
            return Path.of(System.getProperty("user.home"), ".vendor-connectors", "credentials");
        }
        return Path.of(configured);
    }
}
