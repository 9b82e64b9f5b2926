package com.openforge.connectors.ai;

import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.error.OperationCancelledException;
import com.openforge.connectors.error.ProviderException;
import com.openforge.connectors.tool.ToolDescriptor;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * High-availability chat routing.
 *
 * Call graph:
 *
 *   complete(conversation, systemPrompt, tools)
 *     └─ primaryCircuitBreaker
 *           └─ primary.complete(...)        (retries happen inside the provider's transport)
 *                 ↓ (on CallNotPermittedException or any failure except cancellation)
 *     └─ fallbackCircuitBreaker
 *           └─ fallback.complete(...)
 *
 * Without a fallback the primary's failure is rethrown as is. Failures keep
 * their own classification; nothing is rewrapped into a generic error.
 */
@Slf4j
public class FallbackChatClient implements ChatClient {

    private final ChatClient primary;
    private final ChatClient fallback;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;

    /**
     * @param fallback   may be null
     * @param fallbackCb ignored when {@code fallback} is null
     */
    public FallbackChatClient(ChatClient primary,
                              ChatClient fallback,
                              CircuitBreaker primaryCb,
                              CircuitBreaker fallbackCb) {
        this.primary = primary;
        this.fallback = fallback;
        this.primaryCb = primaryCb;
        this.fallbackCb = fallbackCb;
    }

    // ── Public API ───────────────────────────────────────────────────────────

    @Override
    public AIResponse complete(List<AIMessage> conversation, String systemPrompt, List<ToolDescriptor> tools) {
        try {
            return guarded(primaryCb, primary, () -> primary.complete(conversation, systemPrompt, tools));
        } catch (OperationCancelledException e) {
            throw e;
        } catch (RuntimeException primaryException) {
            if (fallback == null) {
                throw primaryException;
            }
            log.warn("[ChatRouter] Primary provider {} failed ({}), engaging fallback {}. Cause: {}",
                    primary.providerName(), primaryException.getClass().getSimpleName(),
                    fallback.providerName(), primaryException.getMessage());
            return guarded(fallbackCb, fallback, () -> fallback.complete(conversation, systemPrompt, tools));
        }
    }

    @Override
    public String providerName() {
        return primary.providerName();
    }

    @Override
    public String model() {
        return primary.model();
    }

    public boolean hasFallback() {
        return fallback != null;
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Decorates the call with the breaker and runs it. Fully programmatic;
     * no AOP proxies, no annotations.
     */
    private static AIResponse guarded(CircuitBreaker cb, ChatClient client, Supplier<AIResponse> call) {
        try {
            return CircuitBreaker.decorateSupplier(cb, call).get();
        } catch (CallNotPermittedException e) {
            throw new ProviderException(client.providerName(),
                    "Circuit breaker '%s' is open; call not permitted".formatted(cb.getName()), e);
        }
    }
}
