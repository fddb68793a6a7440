package com.deepansh.trendagent.tool;

/**
 * What a tool hands back across the tool boundary: either output text or an error.
 */
public record ToolOutput(boolean success, String output, String error) {

    public static ToolOutput ok(String output) {
        return new ToolOutput(true, output, null);
    }

    public static ToolOutput failure(String error) {
        return new ToolOutput(false, null, error);
    }
}
