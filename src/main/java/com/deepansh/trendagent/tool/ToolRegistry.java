package com.deepansh.trendagent.tool;

import com.deepansh.trendagent.config.AgentProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Closed registry of the tools the model may call.
 *
 * Spring injects every AgentTool bean; the set is fixed at startup. A duplicate
 * name, or an entry in agent.enabled-tools that no bean provides, fails startup
 * so an unknown tool is a configuration error rather than a runtime surprise.
 *
 * Lookup is case-insensitive and always answers with the canonical tool.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, AgentTool> tools;

    public ToolRegistry(List<AgentTool> toolBeans, AgentProperties properties) {
        Map<String, AgentTool> byKey = new LinkedHashMap<>();
        for (AgentTool tool : toolBeans) {
            AgentTool previous = byKey.put(key(tool.getName()), tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + tool.getName());
            }
        }

        List<String> enabled = properties.getEnabledTools();
        if (enabled != null && !enabled.isEmpty()) {
            Map<String, AgentTool> selected = new LinkedHashMap<>();
            for (String name : enabled) {
                AgentTool tool = byKey.get(key(name));
                if (tool == null) {
                    throw new IllegalStateException(
                            "agent.enabled-tools lists unknown tool '" + name + "'. Available: "
                                    + byKey.values().stream().map(AgentTool::getName).toList());
                }
                selected.put(key(name), tool);
            }
            byKey = selected;
        }

        this.tools = Collections.unmodifiableMap(byKey);
        tools.values().forEach(tool ->
                log.info("Registered tool: [{}] timeout={}", tool.getName(), tool.getTimeout()));
        log.info("Total tools registered: {}", tools.size());
    }

    public Optional<AgentTool> find(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(key(name.trim())));
    }

    public boolean hasTool(String name) {
        return find(name).isPresent();
    }

    public Collection<AgentTool> all() {
        return tools.values();
    }

    public List<String> names() {
        return tools.values().stream().map(AgentTool::getName).toList();
    }

    public int toolCount() {
        return tools.size();
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
