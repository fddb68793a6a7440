package com.deepansh.trendagent.tool;

import com.deepansh.trendagent.model.ActionRequest;
import com.deepansh.trendagent.model.ToolResult;
import com.deepansh.trendagent.stream.StreamEventEmitter;
import com.deepansh.trendagent.stream.ToolPhase;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one tool call under a time bound and turns every outcome into a ToolResult.
 *
 * Never throws: unknown tools, tool-reported failures, exceptions, timeouts and
 * interruptions all come back as failed results so the loop can keep reasoning.
 * Each call is bracketed by exactly two tool_activity events: started, then
 * completed or failed.
 */
@Component
@Slf4j
public class ToolDispatcher {

    private final ToolRegistry toolRegistry;
    private final AsyncTaskExecutor toolExecutor;

    public ToolDispatcher(ToolRegistry toolRegistry,
                          @Qualifier("toolTaskExecutor") AsyncTaskExecutor toolExecutor) {
        this.toolRegistry = toolRegistry;
        this.toolExecutor = toolExecutor;
    }

    /**
     * @param budget remaining loop budget; the effective bound is the lesser of this
     *               and the tool's own timeout. An exhausted budget fails the call
     *               without starting it.
     */
    public ToolResult dispatch(ActionRequest request, Duration budget, StreamEventEmitter emitter) {
        String toolName = request.toolName();
        AgentTool tool = toolRegistry.find(toolName).orElse(null);
        String displayName = tool != null ? tool.getDisplayName() : toolName;

        emitter.toolActivity(toolName, ToolPhase.started, "Using " + displayName + "...");
        long start = System.nanoTime();

        ToolResult result;
        if (tool == null) {
            String msg = String.format("Unknown tool '%s'. Available tools: %s",
                    toolName, toolRegistry.names());
            log.warn(msg);
            result = ToolResult.failure(toolName, msg, elapsedSince(start));
        } else if (budget != null && (budget.isNegative() || budget.isZero())) {
            result = ToolResult.failure(toolName, "no time left in the loop budget", elapsedSince(start));
        } else {
            result = invokeBounded(tool, request.toolInput(), effectiveTimeout(tool, budget), start);
        }

        if (result.isSucceeded()) {
            emitter.toolActivity(toolName, ToolPhase.completed, null);
            log.info("Tool [{}] completed in {}ms", toolName, result.getDuration().toMillis());
        } else {
            emitter.toolActivity(toolName, ToolPhase.failed, result.getError());
            log.warn("Tool [{}] failed in {}ms: {}", toolName,
                    result.getDuration().toMillis(), result.getError());
        }
        return result;
    }

    private ToolResult invokeBounded(AgentTool tool, String input, Duration timeout, long start) {
        String toolName = tool.getName();
        log.info("Executing tool: [{}] with input: '{}' [timeout={}ms]", toolName, input, timeout.toMillis());

        Future<ToolOutput> future;
        try {
            future = toolExecutor.submit(() -> tool.invoke(input));
        } catch (TaskRejectedException e) {
            log.error("Tool executor rejected [{}]", toolName, e);
            return ToolResult.failure(toolName, "tool capacity exhausted, try again later", elapsedSince(start));
        }

        try {
            ToolOutput output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            Duration took = elapsedSince(start);
            if (output == null) {
                return ToolResult.failure(toolName, "tool returned no output", took);
            }
            if (!output.success()) {
                String error = output.error() == null || output.error().isBlank()
                        ? "unknown error" : output.error();
                return ToolResult.failure(toolName, error, took);
            }
            log.debug("Tool [{}] returned: {}", toolName, output.output());
            return ToolResult.success(toolName, output.output() == null ? "" : output.output(), took);

        } catch (TimeoutException e) {
            future.cancel(true);
            return ToolResult.failure(toolName,
                    "timed out after " + timeout.toMillis() + "ms", elapsedSince(start));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return ToolResult.failure(toolName, "call abandoned", elapsedSince(start));
        } catch (ExecutionException e) {
            // Tools should report failures as ToolOutput, but a throw must not escape
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Unexpected error in tool [{}]", toolName, cause);
            return ToolResult.failure(toolName, "execution failed: " + cause.getMessage(), elapsedSince(start));
        }
    }

    private static Duration effectiveTimeout(AgentTool tool, Duration budget) {
        Duration own = tool.getTimeout();
        if (budget == null) {
            return own;
        }
        return own.compareTo(budget) <= 0 ? own : budget;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
