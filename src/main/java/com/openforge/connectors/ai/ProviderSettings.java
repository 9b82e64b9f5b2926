package com.openforge.connectors.ai;

import com.openforge.connectors.error.ConnectorConfigurationException;
import com.openforge.connectors.error.ProviderParameterException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validated settings of one chat provider instance.
 *
 * Blank model and base URL fall back to the provider's defaults. Temperature
 * must lie in {@code [0, provider max]} and max tokens must be positive;
 * violations fail at construction, not on the first request.
 */
public record ProviderSettings(
        ProviderType provider,
        String model,
        String baseUrl,
        double temperature,
        int maxTokens,
        Duration timeout,
        String apiKey
) {

    public static final double DEFAULT_TEMPERATURE = 0.7;
    public static final int DEFAULT_MAX_TOKENS = 4096;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);

    static final Set<String> OPTION_KEYS = Set.of(
            "provider", "model", "base_url", "temperature", "max_tokens", "timeout_seconds", "api_key");

    public ProviderSettings {
        if (provider == null) {
            throw new ConnectorConfigurationException("Chat provider must be set");
        }
        model = model == null || model.isBlank() ? provider.defaultModel() : model;
        baseUrl = baseUrl == null || baseUrl.isBlank() ? provider.defaultBaseUrl() : baseUrl;
        timeout = timeout == null || timeout.isZero() || timeout.isNegative() ? DEFAULT_TIMEOUT : timeout;
        if (Double.isNaN(temperature) || temperature < 0.0 || temperature > provider.maxTemperature()) {
            throw new ProviderParameterException(provider.id(), null,
                    "Temperature must be between 0.0 and %.1f, got %s".formatted(provider.maxTemperature(), temperature));
        }
        if (maxTokens <= 0) {
            throw new ProviderParameterException(provider.id(), null,
                    "max_tokens must be positive, got " + maxTokens);
        }
    }

    public static ProviderSettings defaults(ProviderType provider) {
        return new ProviderSettings(provider, null, null, DEFAULT_TEMPERATURE, DEFAULT_MAX_TOKENS, null, null);
    }

    /**
     * Build from loosely typed options, e.g. a parsed request body.
     *
     * @throws ConnectorConfigurationException on unknown keys or unparseable values
     */
    public static ProviderSettings fromOptions(Map<String, ?> options) {
        List<String> unknown = new ArrayList<>();
        for (String key : options.keySet()) {
            if (!OPTION_KEYS.contains(key)) {
                unknown.add(key);
            }
        }
        if (!unknown.isEmpty()) {
            throw new ConnectorConfigurationException(
                    "Unknown provider option(s) %s, accepted: %s".formatted(unknown, OPTION_KEYS.stream().sorted().toList()));
        }
        Object provider = options.get("provider");
        Object timeoutSeconds = options.get("timeout_seconds");
        return new ProviderSettings(
                ProviderType.from(provider == null ? ProviderType.OPENAI.id() : provider.toString()),
                string(options.get("model")),
                string(options.get("base_url")),
                number("temperature", options.get("temperature"), DEFAULT_TEMPERATURE),
                integer("max_tokens", options.get("max_tokens"), DEFAULT_MAX_TOKENS),
                timeoutSeconds == null ? null
                        : Duration.ofMillis((long) (number("timeout_seconds", timeoutSeconds, 0) * 1000)),
                string(options.get("api_key")));
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return "ProviderSettings[provider=%s, model=%s, baseUrl=%s, temperature=%s, maxTokens=%d, timeout=%s, apiKey=%s]"
                .formatted(provider.id(), model, baseUrl, temperature, maxTokens, timeout, hasApiKey() ? "****" : "unset");
    }

    private static String string(Object value) {
        return value == null ? null : value.toString();
    }

    private static double number(String key, Object value, double fallback) {
        if (value == null) {
            return fallback;
        }
        double parsed;
        if (value instanceof Number n) {
            parsed = n.doubleValue();
        } else {
            try {
                parsed = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new ConnectorConfigurationException("Option '%s' must be numeric, got '%s'".formatted(key, value));
            }
        }
        if (!Double.isFinite(parsed)) {
            throw new ConnectorConfigurationException("Option '%s' must be a finite number, got '%s'".formatted(key, value));
        }
        return parsed;
    }

    private static int integer(String key, Object value, int fallback) {
        double parsed = number(key, value, fallback);
        if (parsed != Math.rint(parsed) || parsed < Integer.MIN_VALUE || parsed > Integer.MAX_VALUE) {
            throw new ConnectorConfigurationException("Option '%s' must be a whole number in int range, got '%s'"
                    .formatted(key, value));
        }
        return (int) parsed;
    }
}
