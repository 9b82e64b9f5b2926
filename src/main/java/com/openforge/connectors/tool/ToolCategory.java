package com.openforge.connectors.tool;

public enum ToolCategory {

    /** Reads vendor state; no side effects. */
    READ,

    /** Creates or changes vendor state (messages, records, jobs). */
    WRITE,

    /** Starts long-running generation work (3D models, completions). */
    GENERATION,

    GENERAL
}
