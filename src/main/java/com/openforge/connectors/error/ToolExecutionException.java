package com.openforge.connectors.error;

/**
 * A tool handler threw something outside the connector taxonomy.
 */
public class ToolExecutionException extends ConnectorException {

    private final String toolName;

    public ToolExecutionException(String toolName, Throwable cause) {
        super(ErrorKind.TOOL_EXECUTION,
                "Tool '%s' failed: %s".formatted(toolName, cause.getMessage()), cause);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
