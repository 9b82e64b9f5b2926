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
 * Gemini generateContent function calling.
 *
 * Declares:  [{"functionDeclarations": [{"name", "description", "parameters"}]}]
 * Parses:    candidates[0].content.parts[].functionCall → {name, args: {...}}
 *
 * Gemini's schema dialect rejects {@code additionalProperties} and
 * {@code default}, and calls carry no id, so ids are synthesized as
 * {@code call_<n>} in emission order.
 */
public class GeminiToolFormat extends AbstractChatToolFormat {

    private static final List<String> UNSUPPORTED_KEYWORDS = List.of("additionalProperties", "default");

    public GeminiToolFormat(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ArrayNode formatTools(List<ToolDescriptor> tools) {
        ArrayNode array = objectMapper.createArrayNode();
        if (tools.isEmpty()) {
            return array;
        }
        ArrayNode declarations = array.addObject().putArray("functionDeclarations");
        for (ToolDescriptor tool : tools) {
            ObjectNode declaration = declarations.addObject();
            declaration.put("name", tool.name());
            declaration.put("description", tool.description());
            ObjectNode parameters = sanitize(tool.inputSchema());
            if (parameters.path("properties").size() > 0) {
                if (parameters.path("required").isEmpty()) {
                    parameters.remove("required");
                }
                declaration.set("parameters", parameters);
            }
        }
        return array;
    }

    @Override
    public List<ToolInvocation> parseToolCalls(JsonNode providerResponse) {
        List<ToolInvocation> invocations = new ArrayList<>();
        int index = 0;
        for (JsonNode part : providerResponse.path("candidates").path(0).path("content").path("parts")) {
            JsonNode call = part.get("functionCall");
            if (call != null) {
                invocations.add(toInvocation("call_" + index++, call.path("name").asText(), call.get("args")));
            }
        }
        return invocations;
    }

    /** Strips keywords from schema nodes only; names under {@code properties} are left alone. */
    private static ObjectNode sanitize(ObjectNode schema) {
        UNSUPPORTED_KEYWORDS.forEach(schema::remove);
        if (schema.get("properties") instanceof ObjectNode properties) {
            properties.elements().forEachRemaining(GeminiToolFormat::sanitizeChild);
        }
        sanitizeChild(schema.get("items"));
        return schema;
    }

    private static void sanitizeChild(JsonNode node) {
        if (node instanceof ObjectNode schema) {
            sanitize(schema);
        }
    }
}
