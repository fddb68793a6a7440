package com.deepansh.trendagent.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class ToolResult {

    String toolName;
    String output;
    boolean succeeded;
    String error;
    Duration duration;

    public static ToolResult success(String toolName, String output, Duration duration) {
        return ToolResult.builder()
                .toolName(toolName)
                .output(output)
                .succeeded(true)
                .duration(duration)
                .build();
    }

    public static ToolResult failure(String toolName, String error, Duration duration) {
        return ToolResult.builder()
                .toolName(toolName)
                .output("")
                .succeeded(false)
                .error(error)
                .duration(duration)
                .build();
    }

    /**
     * Text folded back into the conversation as a tool_result message.
     * Failures are described so the model can adapt instead of inventing results.
     */
    public String toContextText() {
        if (succeeded) {
            return output;
        }
        return "Tool " + toolName + " failed: " + error + ". "
                + "No results were obtained from this tool; answer from your own knowledge "
                + "and do not claim otherwise.";
    }
}
