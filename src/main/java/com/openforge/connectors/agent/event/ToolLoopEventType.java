package com.openforge.connectors.agent.event;

/**
 * Classifies every event a tool-call loop emits over WebSocket.
 *
 * Flow: ROUND_TRIP_START → (TOOL_CALL → TOOL_RESULT)* → ROUND_TRIP_START → … → FINAL_ANSWER
 */
public enum ToolLoopEventType {

    /** A model call is about to be made. */
    ROUND_TRIP_START,

    /** The model requested a tool. payload = ToolCallPayload. */
    TOOL_CALL,

    /** A tool returned or failed. payload = ToolResultPayload. */
    TOOL_RESULT,

    /** The loop finished; content = answer. */
    FINAL_ANSWER,

    /** The loop ended with an error. content = message, payload = error kind. */
    ERROR
}
