package com.openforge.connectors.ai.provider.openai;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.connectors.tool.ToolDescriptor;

/**
 * One entry of the "tools" array:
 * {@code {"type": "function", "function": {"name", "description", "parameters"}}}.
 */
public record FunctionTool(String type, Function function) {

    /** Parameters stay a tree so the registry's schema is sent verbatim. */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Function(String name, String description, JsonNode parameters) {}

    public static FunctionTool of(ToolDescriptor tool) {
        return new FunctionTool("function", new Function(tool.name(), tool.description(), tool.inputSchema()));
    }
}
