package com.deepansh.trendagent.tool;

import java.time.Duration;

/**
 * Contract every tool must implement.
 *
 * The name and description are rendered into the system instruction, which is the
 * only signal the model has for choosing a tool.
 *
 * Tools should NOT throw: report upstream errors, bad payloads and bad input as
 * {@link ToolOutput#failure(String)}. The dispatcher still guards against throws.
 */
public interface AgentTool {

    /** Exact name the model writes after "ACTION:" */
    String getName();

    /** Short label shown to users while the tool runs, e.g. "Web Search" */
    String getDisplayName();

    /** When to use the tool and what its input means */
    String getDescription();

    /** Upper bound for one invocation */
    Duration getTimeout();

    /**
     * @param input free text from the model, possibly empty
     */
    ToolOutput invoke(String input);

    /** Cheap reachability check for the health endpoint. */
    default boolean isHealthy() {
        return true;
    }
}
