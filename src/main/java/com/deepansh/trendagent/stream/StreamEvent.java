package com.deepansh.trendagent.stream;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Event envelope for one step of a loop execution.
 *
 * Only the fields relevant to {@code type} are set:
 *   TOKEN          token
 *   TOOL_ACTIVITY  toolName, phase, message (display text or failure reason)
 *   DONE           messageId (null when storage did not assign one)
 *   ERROR          message
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(
        StreamEventType type,
        String token,
        String toolName,
        ToolPhase phase,
        String message,
        String messageId
) {

    public static StreamEvent token(String token) {
        return new StreamEvent(StreamEventType.TOKEN, token, null, null, null, null);
    }

    public static StreamEvent toolActivity(String toolName, ToolPhase phase, String message) {
        return new StreamEvent(StreamEventType.TOOL_ACTIVITY, null, toolName, phase, message, null);
    }

    public static StreamEvent done(String messageId) {
        return new StreamEvent(StreamEventType.DONE, null, null, null, null, messageId);
    }

    public static StreamEvent error(String message) {
        return new StreamEvent(StreamEventType.ERROR, null, null, null, message, null);
    }

    /** JSON body of the SSE data frame for this event. */
    public Map<String, Object> payload() {
        Map<String, Object> data = new LinkedHashMap<>();
        switch (type) {
            case TOKEN -> data.put("token", token);
            case TOOL_ACTIVITY -> {
                data.put("tool", toolName);
                data.put("status", phase.name());
                if (message != null) data.put("message", message);
            }
            case DONE -> data.put("message_id", messageId);
            case ERROR -> data.put("error", message);
        }
        return data;
    }
}
