package com.openforge.connectors.agent;

import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIUsage;
import com.openforge.connectors.ai.model.StopReason;

import java.util.List;

/**
 * Outcome of a completed loop.
 *
 * @param conversation the input conversation plus every assistant and tool turn the loop added
 * @param usage        summed over all round trips
 */
public record ToolLoopResult(
        String content,
        List<AIMessage> conversation,
        List<ExecutedToolCall> toolCalls,
        int roundTrips,
        AIUsage usage,
        StopReason stopReason,
        String provider,
        String model
) {}
