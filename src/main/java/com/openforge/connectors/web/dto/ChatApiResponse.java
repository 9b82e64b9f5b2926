package com.openforge.connectors.web.dto;

import com.openforge.connectors.agent.ExecutedToolCall;
import com.openforge.connectors.agent.ToolLoopResult;
import com.openforge.connectors.ai.model.AIUsage;
import com.openforge.connectors.ai.model.StopReason;

import java.util.List;

public record ChatApiResponse(
        String conversationId,
        String content,
        String provider,
        String model,
        AIUsage usage,
        StopReason stopReason,
        List<ExecutedToolCall> toolCalls,
        int roundTrips,
        String wsTopic
) {

    public static ChatApiResponse from(String conversationId, ToolLoopResult result, String wsTopic) {
        return new ChatApiResponse(
                conversationId,
                result.content(),
                result.provider(),
                result.model(),
                result.usage(),
                result.stopReason(),
                result.toolCalls(),
                result.roundTrips(),
                wsTopic);
    }
}
