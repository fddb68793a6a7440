package com.deepansh.trendagent.core;

import com.deepansh.trendagent.config.AgentProperties;
import com.deepansh.trendagent.model.Message;
import com.deepansh.trendagent.tool.AgentTool;
import com.deepansh.trendagent.tool.ToolRegistry;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Assembles the initial history: [system] + last N prior turns + [new user message].
 *
 * Prior turns are read-only input; how they are stored and fetched is the
 * conversation store's business.
 */
@Component
public class ConversationContextBuilder {

    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;

    public ConversationContextBuilder(ToolRegistry toolRegistry, AgentProperties properties) {
        this.toolRegistry = toolRegistry;
        this.properties = properties;
    }

    public List<Message> build(List<Message> priorTurns, String userMessage) {
        List<Message> window = lastTurns(priorTurns, properties.getHistoryWindow());

        List<Message> messages = new ArrayList<>(window.size() + 2);
        messages.add(Message.system(systemInstruction()));
        messages.addAll(window);
        messages.add(Message.user(userMessage));
        return messages;
    }

    public String systemInstruction() {
        String configured = properties.getSystemPrompt();
        if (configured != null && !configured.isBlank()) {
            return configured;
        }

        List<AgentTool> tools = new ArrayList<>(toolRegistry.all());
        StringBuilder toolList = new StringBuilder();
        for (int i = 0; i < tools.size(); i++) {
            AgentTool tool = tools.get(i);
            toolList.append(i + 1).append(". ").append(tool.getName())
                    .append(": ").append(tool.getDescription()).append('\n');
        }
        String names = tools.stream().map(AgentTool::getName).collect(Collectors.joining(" or "));

        return """
                You are a helpful AI assistant with access to tools.

                You have access to the following tools:
                %s
                When you need to use a tool, respond with:
                ACTION: <tool_name>
                INPUT: <tool_input>

                Request one tool at a time. I will then provide the tool result and you can continue.
                If a tool result says the tool failed, do not claim you obtained its results.

                If you don't need tools, just provide your answer directly.

                Tool names must be exactly: %s""".formatted(toolList, names);
    }

    private static List<Message> lastTurns(List<Message> priorTurns, int limit) {
        if (priorTurns == null || priorTurns.isEmpty() || limit <= 0) {
            return List.of();
        }
        int from = Math.max(0, priorTurns.size() - limit);
        return priorTurns.subList(from, priorTurns.size());
    }
}
