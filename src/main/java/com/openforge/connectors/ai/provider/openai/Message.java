package com.openforge.connectors.ai.provider.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;

import java.util.List;

/**
 * A single entry in the OpenAI wire conversation.
 *
 * role variants:
 *   "system"    initial persona / instructions
 *   "user"      human turn
 *   "assistant" model reply; may contain tool_calls instead of content
 *   "tool"      result returned after executing a tool call
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record Message(
        String role,

        /** Text content. Null for assistant messages that only contain tool_calls. */
        String content,

        /** Present only in assistant messages when the model wants to call tools. */
        List<ToolCall> toolCalls,

        /** Present only in tool-result messages; matches the id of the ToolCall. */
        String toolCallId
) {

    // ── Static factory helpers ──────────────────────────────────────────────

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        return Message.builder()
                .role("assistant")
                .content(content == null || content.isEmpty() ? null : content)
                .toolCalls(toolCalls == null || toolCalls.isEmpty() ? null : toolCalls)
                .build();
    }

    public static Message toolResult(String toolCallId, String result) {
        return Message.builder().role("tool").toolCallId(toolCallId).content(result).build();
    }
}
