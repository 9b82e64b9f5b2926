package com.openforge.connectors.error;

public class DuplicateToolNameException extends ConnectorException {

    private final String toolName;

    public DuplicateToolNameException(String toolName) {
        super(ErrorKind.DUPLICATE_TOOL_NAME, "Tool name already registered: " + toolName);
        this.toolName = toolName;
    }

    public String toolName() {
        return toolName;
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
