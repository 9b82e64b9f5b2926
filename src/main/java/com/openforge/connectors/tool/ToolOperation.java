package com.openforge.connectors.tool;

import lombok.Builder;

/**
 * A typed operation a connector declares for tool export.
 *
 * @param name            operation name, namespaced with the connector name at registration
 * @param concurrencySafe may run in parallel with other calls of the same model turn
 */
@Builder
public record ToolOperation(
        String name,
        String description,
        ToolCategory category,
        ToolSchema schema,
        ToolHandler handler,
        boolean concurrencySafe
) {

    public ToolOperation {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Operation name must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Operation '%s' has no handler".formatted(name));
        }
        description = description == null ? "" : description;
        category = category == null ? ToolCategory.GENERAL : category;
        schema = schema == null ? ToolSchema.empty() : schema;
    }
}
