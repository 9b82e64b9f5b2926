package com.openforge.connectors.tool.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.connectors.tool.ToolInvocation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
@RequiredArgsConstructor
abstract class AbstractChatToolFormat implements ChatToolFormat {

    private static final TypeReference<Map<String, Object>> ARGUMENTS = new TypeReference<>() {};

    protected final ObjectMapper objectMapper;

    /**
     * Arguments arrive as a JSON string (OpenAI), an object (Anthropic,
     * Gemini, some OpenAI-compatible servers) or not at all.
     */
    protected ToolInvocation toInvocation(String id, String name, JsonNode arguments) {
        if (arguments == null || arguments.isNull() || arguments.isMissingNode()) {
            return new ToolInvocation(id, name, Map.of(), null);
        }
        if (arguments.isObject()) {
            return new ToolInvocation(id, name, objectMapper.convertValue(arguments, ARGUMENTS), null);
        }
        if (arguments.isTextual()) {
            String raw = arguments.asText();
            if (raw.isBlank()) {
                return new ToolInvocation(id, name, Map.of(), null);
            }
            try {
                JsonNode parsed = objectMapper.readTree(raw);
                if (parsed != null && parsed.isObject()) {
                    return new ToolInvocation(id, name, objectMapper.convertValue(parsed, ARGUMENTS), null);
                }
            } catch (JsonProcessingException e) {
                log.debug("[ToolFormat] Unparseable arguments for {}: {}", name, e.getOriginalMessage());
            }
            return ToolInvocation.malformed(id, name, raw);
        }
        return ToolInvocation.malformed(id, name, arguments.toString());
    }
}
