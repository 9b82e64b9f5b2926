package com.openforge.connectors.websocket;

import com.openforge.connectors.agent.ExecutedToolCall;
import com.openforge.connectors.agent.ToolLoopListener;
import com.openforge.connectors.agent.ToolLoopResult;
import com.openforge.connectors.agent.event.ToolLoopEvent;
import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.tool.ToolInvocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Thin facade over SimpMessagingTemplate that routes ToolLoopEvents to the
 * STOMP topic of each conversation.
 *
 * Topic layout:
 *   /topic/tool-loop/{conversationId}  → all events for one loop run
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolLoopEventPublisher {

    public static final String TOPIC_PREFIX = "/topic/tool-loop/";

    private final SimpMessagingTemplate messagingTemplate;

    /** Fire-and-forget; a delivery failure never reaches the loop. */
    public void publish(ToolLoopEvent event) {
        String destination = TOPIC_PREFIX + event.conversationId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }

    /** A loop listener that mirrors every callback onto the conversation's topic. */
    public ToolLoopListener listenerFor(String conversationId) {
        return new ToolLoopListener() {

            @Override
            public void onRoundTripStart(int roundTrip) {
                publish(ToolLoopEvent.roundTripStart(conversationId, roundTrip));
            }

            @Override
            public void onToolCall(ToolInvocation invocation, int roundTrip) {
                publish(ToolLoopEvent.toolCall(conversationId, invocation.id(), invocation.toolName(),
                        invocation.arguments(), roundTrip));
            }

            @Override
            public void onToolResult(ExecutedToolCall result) {
                publish(ToolLoopEvent.toolResult(conversationId, result.id(), result.toolName(),
                        result.outcome(), result.error(), result.durationMs(), result.roundTrip()));
            }

            @Override
            public void onFinalAnswer(ToolLoopResult result) {
                publish(ToolLoopEvent.finalAnswer(conversationId, result.content(), result.roundTrips()));
            }

            @Override
            public void onError(ConnectorException error, int roundTrip) {
                publish(ToolLoopEvent.error(conversationId, error.kind().code(), error.getMessage(), roundTrip));
            }
        };
    }

    public static String topicFor(String conversationId) {
        return TOPIC_PREFIX + conversationId;
    }
}
