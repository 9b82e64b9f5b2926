package com.openforge.connectors.ai.model;

public enum StopReason {

    /** Natural end of the reply. */
    STOP,

    /** The model is waiting for tool results. */
    TOOL_CALLS,

    /** Cut off by the output token limit. */
    LENGTH
}
