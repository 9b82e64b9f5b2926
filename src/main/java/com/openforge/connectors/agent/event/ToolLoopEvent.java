package com.openforge.connectors.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * The single event envelope broadcast over WebSocket.
 *
 * Fields:
 *   conversationId  the loop run this event belongs to
 *   type            discriminator; tells the client how to render the event
 *   content         free-form text (answer for FINAL_ANSWER, message for ERROR)
 *   payload         structured object for tool events, null otherwise
 *   roundTrip       which model round trip produced this event
 *   timestamp       epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolLoopEvent(
        String            conversationId,
        ToolLoopEventType type,
        String            content,
        Object            payload,
        int               roundTrip,
        long              timestamp
) {

    // ── Static factory helpers ───────────────────────────────────────────────

    public static ToolLoopEvent roundTripStart(String conversationId, int roundTrip) {
        return new ToolLoopEvent(conversationId, ToolLoopEventType.ROUND_TRIP_START, null, null, roundTrip, now());
    }

    public static ToolLoopEvent toolCall(String conversationId, String id, String toolName,
                                         Map<String, Object> arguments, int roundTrip) {
        return new ToolLoopEvent(conversationId, ToolLoopEventType.TOOL_CALL, null,
                new ToolCallPayload(id, toolName, arguments), roundTrip, now());
    }

    public static ToolLoopEvent toolResult(String conversationId, String id, String toolName,
                                           JsonNode outcome, boolean error, long durationMs, int roundTrip) {
        return new ToolLoopEvent(conversationId, ToolLoopEventType.TOOL_RESULT, null,
                new ToolResultPayload(id, toolName, outcome, error, durationMs), roundTrip, now());
    }

    public static ToolLoopEvent finalAnswer(String conversationId, String answer, int roundTrip) {
        return new ToolLoopEvent(conversationId, ToolLoopEventType.FINAL_ANSWER, answer, null, roundTrip, now());
    }

    public static ToolLoopEvent error(String conversationId, String kind, String message, int roundTrip) {
        return new ToolLoopEvent(conversationId, ToolLoopEventType.ERROR, message, kind, roundTrip, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }

    // ── Nested payload types ─────────────────────────────────────────────────

    public record ToolCallPayload(String id, String toolName, Map<String, Object> arguments) {}

    public record ToolResultPayload(String id, String toolName, JsonNode outcome, boolean error, long durationMs) {}
}
