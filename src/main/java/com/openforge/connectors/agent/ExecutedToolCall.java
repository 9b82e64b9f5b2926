package com.openforge.connectors.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;

/**
 * One tool call the loop ran, with the exact result fed back to the model.
 *
 * @param outcome {@code {"result": ...}} or {@code {"error": {"kind", "message"}}}
 */
public record ExecutedToolCall(
        String id,
        String toolName,
        Map<String, Object> arguments,
        ObjectNode outcome,
        boolean error,
        int roundTrip,
        long durationMs
) {}
