package com.openforge.connectors.config;

import com.openforge.connectors.error.OperationCancelledException;
import com.openforge.connectors.error.ProviderParameterException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Programmatic Resilience4j wiring.
 *
 * Two named breakers, one per chat provider slot:
 *   • "primaryChat"
 *   • "fallbackChat"
 *
 * Retries are not configured here: every connector retries inside its own
 * transport, so a breaker sees one failure per exhausted call.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    public static final String PRIMARY_CHAT = "primaryChat";
    public static final String FALLBACK_CHAT = "fallbackChat";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // trip after 50 % of the last 10 calls fail
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(10)
                .failureRateThreshold(50)
                // treat slow calls (>60 s) as failures
                .slowCallDurationThreshold(Duration.ofSeconds(60))
                .slowCallRateThreshold(80)
                .permittedNumberOfCallsInHalfOpenState(2)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(RuntimeException.class)
                // a cancelled call or a bad request says nothing about provider health
                .ignoreExceptions(OperationCancelledException.class, ProviderParameterException.class)
                .build();

        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(config);
        registry.circuitBreaker(PRIMARY_CHAT);
        registry.circuitBreaker(FALLBACK_CHAT);
        return registry;
    }

    @Bean
    public CircuitBreaker primaryChatCircuitBreaker(CircuitBreakerRegistry registry) {
        return logTransitions(registry.circuitBreaker(PRIMARY_CHAT));
    }

    @Bean
    public CircuitBreaker fallbackChatCircuitBreaker(CircuitBreakerRegistry registry) {
        return logTransitions(registry.circuitBreaker(FALLBACK_CHAT));
    }

    private static CircuitBreaker logTransitions(CircuitBreaker breaker) {
        breaker.getEventPublisher().onStateTransition(event ->
                log.warn("[CircuitBreaker:{}] {}", event.getCircuitBreakerName(), event.getStateTransition()));
        return breaker;
    }
}
