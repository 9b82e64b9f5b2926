package com.openforge.connectors.error;

import java.util.List;

/**
 * Arguments failed schema validation; the handler was not invoked.
 */
public class ToolArgumentException extends ConnectorException {

    private final String toolName;
    private final List<String> violations;

    public ToolArgumentException(String toolName, List<String> violations) {
        super(ErrorKind.TOOL_ARGUMENT,
                "Invalid arguments for tool '%s': %s".formatted(toolName, String.join("; ", violations)));
        this.toolName = toolName;
        this.violations = List.copyOf(violations);
    }

    public String toolName() {
        return toolName;
    }

    public List<String> violations() {
        return violations;
    }
}
