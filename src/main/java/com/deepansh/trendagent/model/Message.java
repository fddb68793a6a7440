package com.deepansh.trendagent.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * One entry of the ordered history sent to the completion service.
 * Immutable: the loop only ever appends new instances.
 */
@Value
@Builder
@Jacksonized
public class Message {

    public enum Role {
        system, user, assistant, tool_result
    }

    Role role;
    String content;

    /** Present when role = tool_result: the tool that produced this content */
    String toolName;

    public static Message system(String content) {
        return Message.builder().role(Role.system).content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role(Role.user).content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role(Role.assistant).content(content).build();
    }

    public static Message toolResult(String toolName, String content) {
        return Message.builder().role(Role.tool_result).toolName(toolName).content(content).build();
    }
}
