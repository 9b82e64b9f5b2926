package com.openforge.connectors.ai.provider.anthropic;

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
import com.openforge.connectors.tool.adapter.AnthropicToolFormat;
import com.openforge.connectors.transport.ConnectorRequest;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic Messages API.
 *
 * The system prompt is a top-level field, tool results travel as
 * {@code tool_result} blocks inside a user turn, and consecutive turns of
 * the same role are merged because the API expects user/assistant to
 * alternate.
 */
public class AnthropicChatProvider extends AbstractChatProvider {

    static final String API_VERSION = "2023-06-01";

    public AnthropicChatProvider(ProviderSettings providerSettings,
                                 ConnectorSettings connectorSettings,
                                 ConnectorContext context) {
        super(providerSettings, new AnthropicToolFormat(context.objectMapper()), connectorSettings, context);
    }

    @Override
    protected String endpoint() {
        return "/messages";
    }

    @Override
    protected ObjectNode buildRequest(List<AIMessage> conversation, String systemPrompt, List<ToolDescriptor> tools) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model());
        body.put("max_tokens", providerSettings.maxTokens());
        body.put("temperature", providerSettings.temperature());

        List<String> system = new ArrayList<>();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            system.add(systemPrompt);
        }

        ArrayNode messages = body.putArray("messages");
        String lastRole = null;
        ArrayNode blocks = null;
        for (AIMessage message : conversation) {
            if (message.role() == AIRole.SYSTEM) {
                system.add(message.content());
                continue;
            }
            String role = message.role() == AIRole.ASSISTANT ? "assistant" : "user";
            if (!role.equals(lastRole)) {
                ObjectNode turn = messages.addObject();
                turn.put("role", role);
                blocks = turn.putArray("content");
                lastRole = role;
            }
            appendBlocks(blocks, message);
        }

        if (!system.isEmpty()) {
            body.put("system", String.join("\n\n", system));
        }
        if (!tools.isEmpty()) {
            body.set("tools", toolFormat.formatTools(tools));
        }
        return body;
    }

    @Override
    protected AIResponse parseResponse(JsonNode body) {
        StringBuilder text = new StringBuilder();
        for (JsonNode block : body.path("content")) {
            if ("text".equals(block.path("type").asText())) {
                text.append(block.path("text").asText());
            }
        }
        List<ToolInvocation> toolCalls = toolFormat.parseToolCalls(body);
        JsonNode usage = body.path("usage");
        return new AIResponse(
                text.toString(),
                AIUsage.of(usage.path("input_tokens").asInt(0), usage.path("output_tokens").asInt(0)),
                toolCalls,
                stopReason(body.path("stop_reason").asText(""), !toolCalls.isEmpty()),
                providerName(),
                body.path("model").asText(model()));
    }

    @Override
    protected ConnectorRequest authorize(ConnectorRequest request) {
        return request
                .withHeader("x-api-key", apiKey())
                .withHeader("anthropic-version", API_VERSION)
                .withHeader("content-type", "application/json");
    }

    private void appendBlocks(ArrayNode blocks, AIMessage message) {
        switch (message.role()) {
            case TOOL -> {
                ObjectNode result = blocks.addObject();
                result.put("type", "tool_result");
                result.put("tool_use_id", message.toolCallId());
                result.put("content", message.content() == null ? "" : message.content());
            }
            case ASSISTANT -> {
                if (message.content() != null && !message.content().isBlank()) {
                    blocks.addObject().put("type", "text").put("text", message.content());
                }
                for (ToolInvocation call : message.toolCalls()) {
                    ObjectNode use = blocks.addObject();
                    use.put("type", "tool_use");
                    use.put("id", call.id());
                    use.put("name", call.toolName());
                    use.set("input", call.isMalformed()
                            ? objectMapper.createObjectNode()
                            : objectMapper.valueToTree(call.arguments()));
                }
            }
            default -> blocks.addObject().put("type", "text").put("text",
                    message.content() == null ? "" : message.content());
        }
    }

    static StopReason stopReason(String stopReason, boolean hasToolCalls) {
        if (hasToolCalls) {
            return StopReason.TOOL_CALLS;
        }
        return "max_tokens".equals(stopReason) ? StopReason.LENGTH : StopReason.STOP;
    }
}
