package com.openforge.connectors.agent;

import com.openforge.connectors.error.ConnectorException;
import com.openforge.connectors.tool.ToolInvocation;

/**
 * Progress callbacks, invoked synchronously on the loop's thread.
 * Implementations must not throw.
 */
public interface ToolLoopListener {

    ToolLoopListener NOOP = new ToolLoopListener() {};

    default void onRoundTripStart(int roundTrip) {
    }

    default void onToolCall(ToolInvocation invocation, int roundTrip) {
    }

    default void onToolResult(ExecutedToolCall result) {
    }

    default void onFinalAnswer(ToolLoopResult result) {
    }

    default void onError(ConnectorException error, int roundTrip) {
    }
}
