package com.openforge.connectors.tool;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.error.OperationCancelledException;
import com.openforge.connectors.error.ToolArgumentException;
import com.openforge.connectors.error.ToolExecutionException;

import java.util.List;
import java.util.Map;

/**
 * A registered tool. Read-only after registration.
 *
 * {@link #invoke(Map)} is the single execution path every adapter uses:
 * validate first, then call the handler, so a validation failure never
 * produces a side effect.
 */
public record ToolDescriptor(
        String name,
        String connector,
        String operation,
        String description,
        @JsonIgnore ToolSchema schema,
        @JsonIgnore ToolHandler handler,
        ToolCategory category,
        boolean concurrencySafe
) {

    public static ToolDescriptor of(String connector, ToolOperation operation) {
        return new ToolDescriptor(
                ToolNames.namespaced(connector, operation.name()),
                connector,
                operation.name(),
                operation.description(),
                operation.schema(),
                operation.handler(),
                operation.category(),
                operation.concurrencySafe());
    }

    public ObjectNode inputSchema() {
        return schema.toJson();
    }

    public Object invoke(Map<String, Object> arguments) {
        if (arguments != null && arguments.containsKey(ToolInvocation.RAW_ARGUMENTS_KEY)) {
            throw new ToolArgumentException(name, List.of(
                    "arguments are not a valid JSON object: " + arguments.get(ToolInvocation.RAW_ARGUMENTS_KEY)));
        }
        Map<String, Object> validated = schema.validate(name, arguments);
        try {
            return handler.handle(new ToolArguments(validated));
        } catch (ConnectorException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OperationCancelledException("Interrupted while running tool " + name, e);
        } catch (Exception e) {
            throw new ToolExecutionException(name, e);
        }
    }
}
