package com.openforge.connectors.ai.model;

import com.openforge.connectors.tool.ToolInvocation;

import java.util.List;

/**
 * One model reply. Tool calls are requests only; the client never runs them.
 */
public record AIResponse(
        String content,
        AIUsage usage,
        List<ToolInvocation> toolCalls,
        StopReason stopReason,
        String provider,
        String model
) {

    public AIResponse {
        content = content == null ? "" : content;
        usage = usage == null ? AIUsage.empty() : usage;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
        if (stopReason == null) {
            stopReason = toolCalls.isEmpty() ? StopReason.STOP : StopReason.TOOL_CALLS;
        }
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }

    /** The assistant turn to append to the conversation before tool results. */
    public AIMessage toMessage() {
        return AIMessage.assistant(content, toolCalls);
    }
}
