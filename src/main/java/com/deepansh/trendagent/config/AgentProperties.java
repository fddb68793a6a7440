package com.deepansh.trendagent.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Loop limits and runner sizing, bound from the "agent" prefix.
 */
@ConfigurationProperties(prefix = "agent")
@Data
public class AgentProperties {

    /** Upper bound on tool-invoking turns per user message */
    private int maxIterations = 10;

    /** Wall-clock budget for one loop execution, tool calls included */
    private Duration timeout = Duration.ofSeconds(30);

    /** How many prior turns of the conversation are replayed to the model */
    private int historyWindow = 10;

    /** Overrides the generated system instruction when non-blank */
    private String systemPrompt = "";

    /** Tools exposed to the model. Empty means every registered tool. */
    private List<String> enabledTools = new ArrayList<>();

    /** SSE connection timeout; should comfortably exceed {@link #timeout} plus streaming time */
    private Duration streamTimeout = Duration.ofMinutes(2);

    private Executor executor = new Executor();

    @Data
    public static class Executor {
        private int corePoolSize = 4;
        private int maxPoolSize = 16;
        private int queueCapacity = 100;
        private int toolPoolSize = 8;
    }
}
