package com.openforge.connectors.tool;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.error.ToolExecutionException;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Result of running a tool, in the caller-legible shape shared by the RPC
 * surface and the tool-call loop:
 *
 *   {"result": ...}                               on success
 *   {"error": {"kind": "...", "message": "..."}}  on failure
 */
public record ToolOutcome(JsonNode result, ConnectorException failure) {

    public static ToolOutcome success(JsonNode result) {
        return new ToolOutcome(result, null);
    }

    public static ToolOutcome failure(ConnectorException failure) {
        return new ToolOutcome(null, failure);
    }

    /**
     * Run a tool and capture any failure as data. Never throws for tool errors.
     */
    public static ToolOutcome run(ToolDescriptor tool, Map<String, Object> arguments,
                                  ObjectMapper objectMapper) {
        return capture(tool.name(), () -> tool.invoke(arguments), objectMapper);
    }

    public static ToolOutcome capture(String toolName, Supplier<Object> call, ObjectMapper objectMapper) {
        try {
            return success(objectMapper.valueToTree(call.get()));
        } catch (ConnectorException e) {
            return failure(e);
        } catch (RuntimeException e) {
            return failure(new ToolExecutionException(toolName, e));
        }
    }

    public boolean isError() {
        return failure != null;
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        if (failure == null) {
            node.set("result", result == null ? JsonNodeFactory.instance.nullNode() : result);
        } else {
            ObjectNode error = node.putObject("error");
            error.put("kind", failure.kind().code());
            error.put("message", failure.getMessage());
        }
        return node;
    }
}
