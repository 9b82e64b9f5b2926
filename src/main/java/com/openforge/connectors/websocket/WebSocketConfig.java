package com.openforge.connectors.websocket;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.simp.config.MessageBrokerRegistry;
import org.springframework.web.socket.config.annotation.EnableWebSocketMessageBroker;
import org.springframework.web.socket.config.annotation.StompEndpointRegistry;
import org.springframework.web.socket.config.annotation.WebSocketMessageBrokerConfigurer;

/**
 * STOMP over WebSocket for tool-loop progress.
 *
 * Client flow:
 *   1. CONNECT to ws://host/ws (SockJS clients use http://host/ws-sockjs)
 *   2. SUBSCRIBE {@value ToolLoopEventPublisher#TOPIC_PREFIX}{conversationId}
 *   3. POST /api/chat with the same conversation_id
 *   4. ToolLoopEvent frames arrive while the loop runs
 *
 * Events only flow server → client, so no application destination prefix is
 * registered. The simple broker is in-memory and single-node.
 */
@Configuration
@EnableWebSocketMessageBroker
public class WebSocketConfig implements WebSocketMessageBrokerConfigurer {

    public static final String ENDPOINT = "/ws";
    public static final String SOCKJS_ENDPOINT = "/ws-sockjs";

    private final String[] allowedOrigins;

    public WebSocketConfig(@Value("${websocket.allowed-origins:*}") String[] allowedOrigins) {
        this.allowedOrigins = allowedOrigins;
    }

    @Override
    public void configureMessageBroker(MessageBrokerRegistry registry) {
        registry.enableSimpleBroker("/topic");
    }

    @Override
    public void registerStompEndpoints(StompEndpointRegistry registry) {
        registry.addEndpoint(ENDPOINT).setAllowedOriginPatterns(allowedOrigins);
        registry.addEndpoint(SOCKJS_ENDPOINT).setAllowedOriginPatterns(allowedOrigins).withSockJS();
    }
}
