package com.deepansh.trendagent.core;

import com.deepansh.trendagent.model.ActionRequest;
import com.deepansh.trendagent.tool.AgentTool;
import com.deepansh.trendagent.tool.ToolRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a tool request from raw completion text.
 *
 * Marker convention taught by the system instruction:
 * <pre>
 * ACTION: Tavily_Search
 * INPUT: latest LangChain release
 * </pre>
 *
 * Markers are matched case-insensitively. The input is the rest of the INPUT line.
 * When that is empty, the following lines up to a blank line or another ACTION
 * marker form the input. A missing INPUT means a parameterless call.
 *
 * Malformed or unknown references fail open: the text is treated as a final
 * answer, never retried. A model that keeps emitting a bad tool name would
 * otherwise spin until the iteration limit.
 */
@Component
@Slf4j
public class ActionParser {

    private static final Pattern ACTION_MARKER = Pattern.compile("ACTION:[ \\t]*(\\w+)", Pattern.CASE_INSENSITIVE);
    private static final Pattern INPUT_MARKER = Pattern.compile("INPUT:", Pattern.CASE_INSENSITIVE);

    private final ToolRegistry toolRegistry;

    public ActionParser(ToolRegistry toolRegistry) {
        this.toolRegistry = toolRegistry;
    }

    /**
     * @return the requested action, or empty when the text is a final answer
     */
    public Optional<ActionRequest> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        Matcher action = ACTION_MARKER.matcher(text);
        if (!action.find()) {
            return Optional.empty();
        }

        String requested = action.group(1);
        Optional<AgentTool> tool = toolRegistry.find(requested);
        if (tool.isEmpty()) {
            log.warn("Model referenced unknown tool '{}', treating output as final answer", requested);
            return Optional.empty();
        }

        String input = extractInput(text, action.end());
        return Optional.of(new ActionRequest(tool.get().getName(), input));
    }

    private String extractInput(String text, int from) {
        Matcher input = INPUT_MARKER.matcher(text);
        if (!input.find(from)) {
            return "";
        }

        String[] lines = text.substring(input.end()).split("\\R", -1);
        String sameLine = lines[0].trim();
        if (!sameLine.isEmpty()) {
            return sameLine;
        }

        StringBuilder block = new StringBuilder();
        for (int i = 1; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank() || ACTION_MARKER.matcher(line.trim()).lookingAt()) {
                break;
            }
            if (block.length() > 0) block.append('\n');
            block.append(line.trim());
        }
        return block.toString().trim();
    }
}
