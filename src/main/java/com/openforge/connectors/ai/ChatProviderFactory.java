package com.openforge.connectors.ai;

import com.openforge.connectors.ai.provider.AbstractChatProvider;
import com.openforge.connectors.ai.provider.anthropic.AnthropicChatProvider;
import com.openforge.connectors.ai.provider.google.GeminiChatProvider;
import com.openforge.connectors.ai.provider.openai.OpenAiChatProvider;
import com.openforge.connectors.connector.ConnectorContext;
import com.openforge.connectors.connector.ConnectorSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Maps a runtime provider choice to its implementation.
 */
@Slf4j
@RequiredArgsConstructor
public class ChatProviderFactory {

    private final ConnectorContext context;

    /** Rate limit and retry applied to every provider; base URL and timeout come from the provider settings. */
    private final ConnectorSettings connectorDefaults;

    public AbstractChatProvider create(ProviderSettings settings) {
        AbstractChatProvider provider = switch (settings.provider()) {
            case OPENAI, XAI, OLLAMA -> new OpenAiChatProvider(settings, connectorDefaults, context);
            case ANTHROPIC -> new AnthropicChatProvider(settings, connectorDefaults, context);
            case GOOGLE -> new GeminiChatProvider(settings, connectorDefaults, context);
        };
        log.info("[ChatProviderFactory] Created {} provider (model={}, baseUrl={})",
                settings.provider().id(), settings.model(), settings.baseUrl());
        return provider;
    }

    /** @see ProviderSettings#fromOptions(Map) */
    public AbstractChatProvider create(Map<String, ?> options) {
        return create(ProviderSettings.fromOptions(options));
    }
}
