package com.openforge.connectors.error;

public class UnknownToolException extends ConnectorException {

    private final String toolName;

    public UnknownToolException(String toolName) {
        super(ErrorKind.UNKNOWN_TOOL, "Unknown tool: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }
}
