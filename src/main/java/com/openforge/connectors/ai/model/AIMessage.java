package com.openforge.connectors.ai.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.connectors.tool.ToolInvocation;
import lombok.Builder;

import java.util.List;

/**
 * A single entry in a conversation. Conversations are plain caller-owned
 * lists; nothing here is persisted.
 *
 * role variants:
 *   SYSTEM    instructions; providers with a separate system field lift it out
 *   USER      human turn
 *   ASSISTANT model reply; may carry tool calls instead of (or besides) content
 *   TOOL      result of one tool call, linked by toolCallId
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record AIMessage(
        AIRole role,
        String content,
        List<ToolInvocation> toolCalls,
        String toolCallId,
        String toolName
) {

    public AIMessage {
        if (role == null) {
            throw new IllegalArgumentException("Message role must not be null");
        }
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    // ── Static factory helpers ──────────────────────────────────────────────

    public static AIMessage system(String content) {
        return AIMessage.builder().role(AIRole.SYSTEM).content(content).build();
    }

    public static AIMessage user(String content) {
        return AIMessage.builder().role(AIRole.USER).content(content).build();
    }

    public static AIMessage assistant(String content) {
        return AIMessage.builder().role(AIRole.ASSISTANT).content(content).build();
    }

    public static AIMessage assistant(String content, List<ToolInvocation> toolCalls) {
        return AIMessage.builder().role(AIRole.ASSISTANT).content(content).toolCalls(toolCalls).build();
    }

    public static AIMessage toolResult(String toolCallId, String toolName, String result) {
        return AIMessage.builder().role(AIRole.TOOL).toolCallId(toolCallId).toolName(toolName).content(result).build();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
