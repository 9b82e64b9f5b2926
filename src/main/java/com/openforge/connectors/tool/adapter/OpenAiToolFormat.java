package com.openforge.connectors.tool.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.openforge.connectors.ai.provider.openai.FunctionTool;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolInvocation;

import java.util.ArrayList;
import java.util.List;

/**
 * OpenAI-compatible function calling (OpenAI, xAI, Ollama).
 *
 * Declares:  [{"type": "function", "function": {"name", "description", "parameters"}}]
 * Parses:    choices[0].message.tool_calls[] → {id, function: {name, arguments: "<json string>"}}
 */
public class OpenAiToolFormat extends AbstractChatToolFormat {

    public OpenAiToolFormat(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ArrayNode formatTools(List<ToolDescriptor> tools) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ToolDescriptor tool : tools) {
            array.add(objectMapper.valueToTree(FunctionTool.of(tool)));
        }
        return array;
    }

    @Override
    public List<ToolInvocation> parseToolCalls(JsonNode providerResponse) {
        JsonNode calls = providerResponse.path("choices").path(0).path("message").path("tool_calls");
        List<ToolInvocation> invocations = new ArrayList<>();
        for (JsonNode call : calls) {
            JsonNode function = call.path("function");
            invocations.add(toInvocation(
                    call.path("id").asText(null),
                    function.path("name").asText(),
                    function.get("arguments")));
        }
        return invocations;
    }
}
