package com.openforge.connectors.ai;

import com.openforge.connectors.agent.ToolCallLoop;
import com.openforge.connectors.agent.ToolLoopListener;
import com.openforge.connectors.agent.ToolLoopResult;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Entry point for callers that want answers rather than wire calls:
 * plain chat, or a prompt answered with the registered tools.
 */
@RequiredArgsConstructor
public class AIConnector {

    private final ChatClient chatClient;
    private final ToolCallLoop toolCallLoop;
    private final String defaultSystemPrompt;

    /** Single completion without tools. A null system prompt uses the configured default. */
    public AIResponse chat(String prompt, List<AIMessage> history, String systemPrompt) {
        return chatClient.chat(prompt, history, effective(systemPrompt), List.of());
    }

    public ToolLoopResult invoke(String prompt, boolean useTools) {
        return invoke(UUID.randomUUID().toString(), prompt, List.of(), null, useTools, ToolLoopListener.NOOP);
    }

    /**
     * With tools, runs the tool-call loop; without, wraps a single completion
     * in the same result shape (one round trip, no tool calls).
     */
    public ToolLoopResult invoke(String conversationId,
                                 String prompt,
                                 List<AIMessage> history,
                                 String systemPrompt,
                                 boolean useTools,
                                 ToolLoopListener listener) {
        List<AIMessage> conversation = new ArrayList<>(history == null ? List.of() : history);
        conversation.add(AIMessage.user(prompt));
        if (useTools) {
            return toolCallLoop.run(conversationId, conversation, effective(systemPrompt), listener);
        }

        AIResponse response = chatClient.complete(conversation, effective(systemPrompt), List.of());
        conversation.add(AIMessage.assistant(response.content()));
        ToolLoopResult result = new ToolLoopResult(response.content(), List.copyOf(conversation), List.of(), 1,
                response.usage(), response.stopReason(), response.provider(), response.model());
        listener.onFinalAnswer(result);
        return result;
    }

    private String effective(String systemPrompt) {
        return systemPrompt == null || systemPrompt.isBlank() ? defaultSystemPrompt : systemPrompt;
    }
}
