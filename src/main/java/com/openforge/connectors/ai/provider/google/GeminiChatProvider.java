package com.openforge.connectors.ai.provider.google;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.ai.ProviderSettings;
import com.openforge.connectors.ai.model.AIMessage;
import com.openforge.connectors.ai.model.AIResponse;
import com.openforge.connectors.ai.model.AIRole;
import com.openforge.connectors.ai.model.AIUsage;
import com.openforge.connectors.ai.model.StopReason;
import com.openforge.connectors.ai.provider.AbstractChatProvider;
import com.openforge.connectors.connector.ConnectorContext;
import com.openforge.connectors.connector.ConnectorSettings;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolInvocation;
import com.openforge.connectors.tool.adapter.GeminiToolFormat;
import com.openforge.connectors.transport.ConnectorRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Gemini generateContent.
 *
 * Roles are "user" and "model"; tool results go back as functionResponse
 * parts keyed by tool name, since Gemini function calls carry no id.
 */
public class GeminiChatProvider extends AbstractChatProvider {

    public GeminiChatProvider(ProviderSettings providerSettings,
                              ConnectorSettings connectorSettings,
                              ConnectorContext context) {
        super(providerSettings, new GeminiToolFormat(context.objectMapper()), connectorSettings, context);
    }

    @Override
    protected String endpoint() {
        return "/models/" + model() + ":generateContent";
    }

    @Override
    protected ObjectNode buildRequest(List<AIMessage> conversation, String systemPrompt, List<ToolDescriptor> tools) {
        ObjectNode body = objectMapper.createObjectNode();

        List<String> system = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            system.add(systemPrompt);
        }

        ArrayNode contents = body.putArray("contents");
        String lastRole = null;
        ArrayNode parts = null;
        for (AIMessage message : conversation) {
            if (message.role() == AIRole.SYSTEM) {
                system.add(message.content());
                continue;
            }
            String role = message.role() == AIRole.ASSISTANT ? "model" : "user";
            if (!role.equals(lastRole)) {
                ObjectNode turn = contents.addObject();
                turn.put("role", role);
                parts = turn.putArray("parts");
                lastRole = role;
            }
            appendParts(parts, message);
        }

        if (!system.isEmpty()) {
            body.putObject("systemInstruction").putArray("parts").addObject().put("text", String.join("\n\n", system));
        }
        if (!tools.isEmpty()) {
            body.set("tools", toolFormat.formatTools(tools));
        }
        ObjectNode generation = body.putObject("generationConfig");
        generation.put("temperature", providerSettings.temperature());
        generation.put("maxOutputTokens", providerSettings.maxTokens());
        return body;
    }

    @Override
    protected AIResponse parseResponse(JsonNode body) {
        JsonNode candidate = body.path("candidates").path(0);
        StringBuilder text = new StringBuilder();
        for (JsonNode part : candidate.path("content").path("parts")) {
            if (part.path("text").isTextual()) {
                text.append(part.path("text").asText());
            }
        }
        List<ToolInvocation> toolCalls = toolFormat.parseToolCalls(body);
        JsonNode usage = body.path("usageMetadata");
        int input = usage.path("promptTokenCount").asInt(0);
        int output = usage.path("candidatesTokenCount").asInt(0);
        return new AIResponse(
                text.toString(),
                new AIUsage(input, output, usage.path("totalTokenCount").asInt(input + output)),
                toolCalls,
                stopReason(candidate.path("finishReason").asText(""), !toolCalls.isEmpty()),
                providerName(),
                body.path("modelVersion").asText(model()));
    }

    @Override
    protected ConnectorRequest authorize(ConnectorRequest request) {
        return request
                .withHeader("x-goog-api-key", apiKey())
                .withHeader("Content-Type", "application/json");
    }

    private void appendParts(ArrayNode parts, AIMessage message) {
        switch (message.role()) {
            case TOOL -> {
                ObjectNode response = parts.addObject().putObject("functionResponse");
                response.put("name", message.toolName());
                response.set("response", asObject(message.content()));
            }
            case ASSISTANT -> {
                if (message.content() != null && !message.content().isBlank()) {
                    parts.addObject().put("text", message.content());
                }
                for (ToolInvocation call : message.toolCalls()) {
                    ObjectNode functionCall = parts.addObject().putObject("functionCall");
                    functionCall.put("name", call.toolName());
                    functionCall.set("args", call.isMalformed()
                            ? objectMapper.createObjectNode()
                            : objectMapper.valueToTree(call.arguments()));
                }
            }
            default -> parts.addObject().put("text", message.content() == null ? "" : message.content());
        }
    }

    /** functionResponse.response must be an object. */
    private ObjectNode asObject(String content) {
        JsonNode parsed = tryParse(content);
        if (parsed instanceof ObjectNode object) {
            return object;
        }
        ObjectNode wrapper = objectMapper.createObjectNode();
        if (parsed.isMissingNode()) {
            wrapper.put("result", content == null ? "" : content);
        } else {
            wrapper.set("result", parsed);
        }
        return wrapper;
    }

    static StopReason stopReason(String finishReason, boolean hasToolCalls) {
        if (hasToolCalls) {
            return StopReason.TOOL_CALLS;
        }
        return "MAX_TOKENS".equals(finishReason) ? StopReason.LENGTH : StopReason.STOP;
    }
}
