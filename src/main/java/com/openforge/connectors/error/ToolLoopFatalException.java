package com.openforge.connectors.error;

/**
 * A tool failed in a way the model cannot recover from; the loop stopped.
 * The original classification is kept as the cause.
 */
public class ToolLoopFatalException extends ConnectorException {

    private final String toolName;
    private final int roundTrip;

    public ToolLoopFatalException(String toolName, int roundTrip, ConnectorException cause) {
        super(ErrorKind.TOOL_LOOP_FATAL,
                "Tool '%s' failed fatally on round trip %d (%s): %s"
                        .formatted(toolName, roundTrip, cause.kind().code(), cause.getMessage()),
                cause);
        this.toolName = toolName;
        this.roundTrip = roundTrip;
    }

    public String toolName() {
        return toolName;
    }

    public int roundTrip() {
        return roundTrip;
    }

    /** Classification of the underlying tool failure. */
    public ErrorKind causeKind() {
        return ((ConnectorException) getCause()).kind();
    }

    @Override
    public boolean isFatal() {
        return true;
    }
}
