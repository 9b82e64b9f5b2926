package com.openforge.connectors.ai;

import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.tool.ToolDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * One chat completion against some model backend.
 *
 * Implementations translate the conversation and tool snapshot into their
 * wire format, normalize the reply into {@link AIResponse}, and never run
 * the tools a model asks for.
 */
public interface ChatClient {

    /**
     * @param conversation full history, oldest first; not modified
     * @param systemPrompt instructions, or null
     * @param tools        tools the model may call; empty disables tool calling
     */
    AIResponse complete(List<AIMessage> conversation, String systemPrompt, List<ToolDescriptor> tools);

    default AIResponse chat(String message, List<AIMessage> history, String systemPrompt, List<ToolDescriptor> tools) {
        List<AIMessage> conversation = new ArrayList<>(history == null ? List.of() : history);
        conversation.add(AIMessage.user(message));
        return complete(conversation, systemPrompt, tools);
    }

    /** Provider id used in logs and responses, e.g. "openai". */
    String providerName();

    String model();
}
