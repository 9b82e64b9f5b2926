package com.openforge.connectors.ai.provider.openai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.ai.ProviderSettings;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.ai.model.AIUsage;
import com.openforge.connectors.ai.model.StopReason;
import com.openforge.connectors.ai.provider.AbstractChatProvider;
import com.openforge.connectors.connector.ConnectorContext;
import com.openforge.connectors.connector.ConnectorSettings;
import com.openforge.connectors.error.ProviderException;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolInvocation;
import com.openforge.connectors.tool.adapter.OpenAiToolFormat;
import com.openforge.connectors.transport.ConnectorRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI-compatible /chat/completions. Serves OPENAI, XAI and OLLAMA; they
 * differ only in base URL, default model and whether a key is required.
 */
public class OpenAiChatProvider extends AbstractChatProvider {

    public OpenAiChatProvider(ProviderSettings providerSettings,
                              ConnectorSettings connectorSettings,
                              ConnectorContext context) {
        super(providerSettings, new OpenAiToolFormat(context.objectMapper()), connectorSettings, context);
    }

    @Override
    protected String endpoint() {
        return "/chat/completions";
    }

    @Override
    protected ObjectNode buildRequest(List<AIMessage> conversation, String systemPrompt, List<ToolDescriptor> tools) {
        List<Message> messages = new ArrayList<>(conversation.size() + 1);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(Message.system(systemPrompt));
        }
        conversation.forEach(m -> messages.add(toWire(m)));

        ChatRequest.ChatRequestBuilder request = ChatRequest.builder()
                .model(model())
                .messages(messages)
                .temperature(providerSettings.temperature())
                .maxTokens(providerSettings.maxTokens());
        if (!tools.isEmpty()) {
            request.tools(toolFormat.formatTools(tools)).toolChoice("auto");
        }
        return objectMapper.valueToTree(request.build());
    }

    @Override
    protected AIResponse parseResponse(JsonNode body) {
        ChatResponse response;
        try {
            response = objectMapper.treeToValue(body, ChatResponse.class);
        } catch (JsonProcessingException e) {
            throw new ProviderException(name(), "Unreadable chat completion response", e);
        }
        ChatResponse.Choice choice = response.firstChoice();
        if (choice == null) {
            throw new ProviderException(name(), null, "Response contained no choices: " + response.id());
        }

        List<ToolInvocation> toolCalls = toolFormat.parseToolCalls(body);
        ChatResponse.Usage usage = response.usage();
        return new AIResponse(
                choice.content(),
                usage == null ? AIUsage.empty()
                        : new AIUsage(usage.promptTokens(), usage.completionTokens(), usage.totalTokens()),
                toolCalls,
                stopReason(choice.finishReason(), !toolCalls.isEmpty()),
                providerName(),
                response.model() == null ? model() : response.model());
    }

    @Override
    protected ConnectorRequest authorize(ConnectorRequest request) {
        ConnectorRequest json = request.withHeader("Content-Type", "application/json");
        String key = apiKey();
        return key == null ? json : json.withHeader("Authorization", "Bearer " + key);
    }

    private Message toWire(AIMessage message) {
        return switch (message.role()) {
            case SYSTEM -> Message.system(message.content());
            case USER -> Message.user(message.content());
            case ASSISTANT -> Message.assistant(message.content(), message.toolCalls().stream()
                    .map(call -> ToolCall.ofFunction(call.id(), call.toolName(), argumentsJson(call)))
                    .toList());
            case TOOL -> Message.toolResult(message.toolCallId(), message.content());
        };
    }

    private String argumentsJson(ToolInvocation call) {
        return call.isMalformed()
                ? String.valueOf(call.arguments().get(ToolInvocation.RAW_ARGUMENTS_KEY))
                : toJson(call.arguments());
    }

    static StopReason stopReason(String finishReason, boolean hasToolCalls) {
        if (hasToolCalls) {
            return StopReason.TOOL_CALLS;
        }
        return "length".equals(finishReason) ? StopReason.LENGTH : StopReason.STOP;
    }
}
