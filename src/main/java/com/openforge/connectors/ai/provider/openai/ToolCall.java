package com.openforge.connectors.ai.provider.openai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/** A tool call echoed back in an assistant message. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {

    public static ToolCall ofFunction(String id, String name, String arguments) {
        return new ToolCall(id, "function", new FunctionCallResult(name, arguments));
    }
}
