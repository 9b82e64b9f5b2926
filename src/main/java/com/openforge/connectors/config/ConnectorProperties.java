package com.openforge.connectors.config;

import com.openforge.connectors.ai.ProviderSettings;
import com.openforge.connectors.ai.ProviderType;
import com.openforge.connectors.connector.ConnectorSettings;
import com.openforge.connectors.ratelimit.RateLimitMode;
import com.openforge.connectors.ratelimit.RateLimitPolicy;
import com.openforge.connectors.transport.RetryPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.Map;

/**
 * Externalised connector configuration.
 *
 * Reads from application.yml under the "connectors" prefix:
 *
 * connectors:
 *   credentials:
 *     directory: ${user.home}/.vendor-connectors/credentials
 *     allow-prompt: false
 *     vault: { address: "", mount: secret, token-env: VAULT_TOKEN }
 *   defaults:
 *     rate-limit: { capacity: 10, refill-per-second: 5, mode: BLOCKING, acquire-timeout: 30s }
 *     retry: { max-attempts: 3, base-backoff: 500ms, multiplier: 2.0, jitter: 0.2, max-backoff: 10s }
 *   ai:
 *     primary:  { provider: openai, model: "", temperature: 0.7, max-tokens: 4096, timeout: 120s }
 *     fallback: { provider: "" }
 *   agent:
 *     max-round-trips: 10
 *     parallel-tool-execution: false
 *   vendors:
 *     slack: { enabled: true, base-url: "", credentials: { token: ... } }
 *
 * Unknown keys fail startup.
 */
@ConfigurationProperties(prefix = "connectors", ignoreUnknownFields = false)
public record ConnectorProperties(
        @DefaultValue Credentials credentials,
        @DefaultValue Defaults defaults,
        @DefaultValue Ai ai,
        @DefaultValue Agent agent,
        Map<String, Vendor> vendors
) {

    public ConnectorProperties {
        vendors = vendors == null ? Map.of() : Map.copyOf(vendors);
    }

    /**
     * Global defaults overlaid with the vendor's own entry, if any.
     */
    public ConnectorSettings settingsFor(String vendor) {
        Vendor overrides = vendors.get(vendor);
        ConnectorSettings base = new ConnectorSettings(null, defaults.rateLimit().toPolicy(),
                defaults.retry().toPolicy(), defaults.timeout(), null);
        if (overrides == null) {
            return base;
        }
        return new ConnectorSettings(
                overrides.baseUrl(),
                overrides.rateLimit() == null ? base.rateLimit() : overrides.rateLimit().toPolicy(),
                overrides.retry() == null ? base.retry() : overrides.retry().toPolicy(),
                overrides.timeout() == null ? base.timeout() : overrides.timeout(),
                overrides.credentials());
    }

    // ── Credentials ──────────────────────────────────────────────────────────

    public record Credentials(
            String directory,
            @DefaultValue("false") boolean allowPrompt,
            @DefaultValue Vault vault
    ) {}

    public record Vault(
            @DefaultValue("") String address,
            @DefaultValue("secret") String mount,
            @DefaultValue("VAULT_TOKEN") String tokenEnv
    ) {

        public boolean isConfigured() {
            return address != null && !address.isBlank();
        }
    }

    // ── Transport defaults ───────────────────────────────────────────────────

    public record Defaults(
            @DefaultValue RateLimit rateLimit,
            @DefaultValue Retry retry,
            Duration timeout
    ) {}

    public record RateLimit(
            @DefaultValue("10") int capacity,
            @DefaultValue("5") double refillPerSecond,
            @DefaultValue("BLOCKING") RateLimitMode mode,
            @DefaultValue("30s") Duration acquireTimeout
    ) {

        public RateLimitPolicy toPolicy() {
            return new RateLimitPolicy(capacity, refillPerSecond, mode, acquireTimeout);
        }
    }

    public record Retry(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("500ms") Duration baseBackoff,
            @DefaultValue("2.0") double multiplier,
            @DefaultValue("0.2") double jitter,
            @DefaultValue("10s") Duration maxBackoff
    ) {

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxAttempts, baseBackoff, multiplier, jitter, maxBackoff, null);
        }
    }

    // ── AI providers ─────────────────────────────────────────────────────────

    public record Ai(
            @DefaultValue Provider primary,
            @DefaultValue Provider fallback
    ) {

        public boolean hasFallback() {
            return fallback != null && fallback.isSet();
        }
    }

    public record Provider(
            @DefaultValue("") String provider,
            @DefaultValue("") String model,
            @DefaultValue("") String baseUrl,
            @DefaultValue("0.7") double temperature,
            @DefaultValue("4096") int maxTokens,
            @DefaultValue("120s") Duration timeout,
            String apiKey
    ) {

        public boolean isSet() {
            return provider != null && !provider.isBlank();
        }

        public ProviderSettings toSettings() {
            ProviderType type = ProviderType.from(isSet() ? provider : ProviderType.OPENAI.id());
            return new ProviderSettings(type, model, baseUrl,
                    temperature, maxTokens, timeout, apiKey);
        }
    }

    // ── Tool-call loop ───────────────────────────────────────────────────────

    public record Agent(
            @DefaultValue("10") int maxRoundTrips,
            @DefaultValue("false") boolean parallelToolExecution,
            @DefaultValue("4") int toolThreads,
            @DefaultValue("You are a helpful assistant. Use the available tools when they help answer the request.")
            String systemPrompt
    ) {}

    // ── Vendors ──────────────────────────────────────────────────────────────

    public record Vendor(
            @DefaultValue("true") boolean enabled,
            String baseUrl,
            RateLimit rateLimit,
            Retry retry,
            Duration timeout,
            Map<String, String> credentials
    ) {}
}
