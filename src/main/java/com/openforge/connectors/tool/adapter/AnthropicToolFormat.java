package com.openforge.connectors.tool.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.tool.ToolDescriptor;
import com.openforge.connectors.tool.ToolInvocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Anthropic Messages API tool use.
 *
 * Declares:  [{"name", "description", "input_schema"}]
 * Parses:    content[] blocks with type "tool_use" → {id, name, input: {...}}
 */
public class AnthropicToolFormat extends AbstractChatToolFormat {

    public AnthropicToolFormat(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ArrayNode formatTools(List<ToolDescriptor> tools) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ToolDescriptor tool : tools) {
            ObjectNode entry = array.addObject();
            entry.put("name", tool.name());
            entry.put("description", tool.description());
            entry.set("input_schema", tool.inputSchema());
        }
        return array;
    }

    @Override
    public List<ToolInvocation> parseToolCalls(JsonNode providerResponse) {
        List<ToolInvocation> invocations = new ArrayList<>();
        for (JsonNode block : providerResponse.path("content")) {
            if ("tool_use".equals(block.path("type").asText())) {
                invocations.add(toInvocation(
                        block.path("id").asText(null),
                        block.path("name").asText(),
                        block.get("input")));
            }
        }
        return invocations;
    }
}
