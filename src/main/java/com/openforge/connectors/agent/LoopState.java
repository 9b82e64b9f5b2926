package com.openforge.connectors.agent;

/**
 * States of one tool-call loop run.
 *
 * Flow: AWAITING_MODEL → MODEL_RESPONDED → TOOL_CALL_REQUESTED → TOOL_EXECUTING
 *       → TOOL_RESULT_APPENDED → AWAITING_MODEL … → MODEL_RESPONDED → DONE
 */
public enum LoopState {

    AWAITING_MODEL,

    MODEL_RESPONDED,

    /** The reply asked for tools; the assistant turn is appended. */
    TOOL_CALL_REQUESTED,

    TOOL_EXECUTING,

    /** Every requested call has a tool-role result in the conversation. */
    TOOL_RESULT_APPENDED,

    DONE
}
