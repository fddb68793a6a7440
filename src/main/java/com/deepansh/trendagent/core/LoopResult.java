package com.deepansh.trendagent.core;

import com.deepansh.trendagent.model.ToolResult;

import java.util.List;

/**
 * Outcome summary of one loop execution, used for logging and by callers that
 * need more than the event stream.
 */
public record LoopResult(
        Status status,
        String finalAnswer,
        int iterationsUsed,
        boolean limitReached,
        List<ToolResult> toolResults,
        String messageId
) {

    public enum Status {
        COMPLETED, FAILED, CANCELLED
    }

    public LoopResult {
        toolResults = List.copyOf(toolResults);
    }

    static LoopResult completed(LoopState state, boolean limitReached, List<ToolResult> toolResults, String messageId) {
        return new LoopResult(Status.COMPLETED, state.finalAnswer(), state.iteration(), limitReached, toolResults, messageId);
    }

    static LoopResult failed(LoopState state, List<ToolResult> toolResults) {
        return new LoopResult(Status.FAILED, null, state.iteration(), false, toolResults, null);
    }

    static LoopResult cancelled(LoopState state, List<ToolResult> toolResults) {
        return new LoopResult(Status.CANCELLED, null, state.iteration(), false, toolResults, null);
    }
}
