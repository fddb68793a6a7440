package com.deepansh.trendagent.stream;

/**
 * Kinds of progress events a loop execution emits, in the order a client sees them:
 * zero or more TOKEN / TOOL_ACTIVITY events, then exactly one DONE or ERROR.
 */
public enum StreamEventType {

    /** A fragment of the final answer. */
    TOKEN("token"),

    /** A tool started, completed or failed. */
    TOOL_ACTIVITY("tool_activity"),

    /** Terminal: the answer was fully streamed. */
    DONE("done"),

    /** Terminal: the run failed and no answer was produced. */
    ERROR("error");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == DONE || this == ERROR;
    }
}
