package com.openforge.connectors.tool.adapter;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Map;
import java.util.function.Function;

/**
 * Framework-neutral tool: {@code (name, description, schema, invoke)}.
 * Invocation validates before running; errors are thrown, not wrapped.
 */
public record CallableTool(
        String name,
        String description,
        ObjectNode schema,
        boolean concurrencySafe,
        Function<Map<String, Object>, Object> invoker
) {

    public Object call(Map<String, Object> arguments) {
        return invoker.apply(arguments);
    }
}
