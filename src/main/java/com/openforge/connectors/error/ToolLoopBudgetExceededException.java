package com.openforge.connectors.error;

/**
 * The model was still requesting tools when the round-trip budget ran out.
 */
public class ToolLoopBudgetExceededException extends ConnectorException {

    private final int maxRoundTrips;

    public ToolLoopBudgetExceededException(int maxRoundTrips) {
        super(ErrorKind.TOOL_LOOP_BUDGET_EXCEEDED,
                "Tool-call loop exceeded its budget of %d model round trip(s)".formatted(maxRoundTrips));
        this.maxRoundTrips = maxRoundTrips;
    }

    public int maxRoundTrips() {
        return maxRoundTrips;
    }
}
