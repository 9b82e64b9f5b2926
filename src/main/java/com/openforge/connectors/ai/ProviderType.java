package com.openforge.connectors.ai;

import com.openforge.connectors.error.ConnectorConfigurationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * Supported chat backends with their built-in defaults.
 *
 * OPENAI, XAI and OLLAMA share the OpenAI-compatible /chat/completions wire
 * format; ANTHROPIC uses the Messages API and GOOGLE Gemini generateContent.
 */
public enum ProviderType {

    OPENAI("openai", "gpt-4o", "https://api.openai.com/v1", "OPENAI_API_KEY", 2.0),
    ANTHROPIC("anthropic", "claude-sonnet-4-20250514", "https://api.anthropic.com/v1", "ANTHROPIC_API_KEY", 1.0),
    GOOGLE("google", "gemini-1.5-pro", "https://generativelanguage.googleapis.com/v1beta", "GOOGLE_API_KEY", 1.0),
    XAI("xai", "grok-2", "https://api.x.ai/v1", "XAI_API_KEY", 1.0),
    OLLAMA("ollama", "llama3.2", "http://localhost:11434/v1", null, 1.0);

    private final String id;
    private final String defaultModel;
    private final String defaultBaseUrl;
    private final String apiKeyEnv;
    private final double maxTemperature;

    ProviderType(String id, String defaultModel, String defaultBaseUrl, String apiKeyEnv, double maxTemperature) {
        this.id = id;
        this.defaultModel = defaultModel;
        this.defaultBaseUrl = defaultBaseUrl;
        this.apiKeyEnv = apiKeyEnv;
        this.maxTemperature = maxTemperature;
    }

    public String id() {
        return id;
    }

    public String defaultModel() {
        return defaultModel;
    }

    public String defaultBaseUrl() {
        return defaultBaseUrl;
    }

    /** Environment variable holding the API key; null for keyless local servers. */
    public String apiKeyEnv() {
        return apiKeyEnv;
    }

    public boolean requiresApiKey() {
        return apiKeyEnv != null;
    }

    public double maxTemperature() {
        return maxTemperature;
    }

    public static ProviderType from(String value) {
        if (value == null || value.isBlank()) {
            throw new ConnectorConfigurationException("Chat provider must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.id.equals(normalized) || ("grok".equals(normalized) && t == XAI)
                        || ("gemini".equals(normalized) && t == GOOGLE))
                .findFirst()
                .orElseThrow(() -> new ConnectorConfigurationException(
                        "Unknown chat provider '%s', expected one of %s".formatted(value,
                                Arrays.stream(values()).map(ProviderType::id).toList())));
    }
}
