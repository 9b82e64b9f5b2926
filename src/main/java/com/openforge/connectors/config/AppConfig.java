package com.openforge.connectors.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.openforge.connectors.transport.HttpTransport;
import com.openforge.connectors.transport.JdkHttpTransport;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Core infrastructure beans:
 *  - Java HttpClient      → the ONLY HTTP engine; no WebClient, no RestTemplate
 *  - HttpTransport        → connectors talk to the HttpClient only through this seam
 *  - Tool executor        → bounded pool for parallel tool execution in the loop
 *  - Jackson ObjectMapper → snake_case ↔ camelCase, Java 8 time, tolerant deserialization
 */
@Configuration
public class AppConfig {

    /**
     * Named "connectorToolExecutor" to stay clear of Spring Boot's
     * auto-configured "applicationTaskExecutor".
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService connectorToolExecutor(ConnectorProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threads = runnable -> {
            Thread thread = new Thread(runnable, "connector-tool-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.agent().toolThreads()), threads);
    }

    /**
     * Single, shared HttpClient instance.
     * 30 s connect timeout; per-request timeouts are set by each connector.
     */
    @Bean
    public HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .version(HttpClient.Version.HTTP_1_1)
                .build();
    }

    @Bean
    public HttpTransport httpTransport(HttpClient httpClient) {
        return new JdkHttpTransport(httpClient);
    }

    /**
     * Shared ObjectMapper configured for vendor JSON:
     *  - snake_case property names (tool_calls, finish_reason …)
     *  - ISO-8601 dates, NOT timestamps
     *  - Unknown properties silently ignored (vendors add fields without breaking us)
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }
}
