package com.deepansh.trendagent.conversation;

import com.deepansh.trendagent.model.Message;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * A persisted conversation turn. Only user and assistant turns are stored;
 * intermediate tool traffic lives and dies with one loop execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class StoredMessage {

    private String id;
    private String conversationId;
    private String userId;
    private Message.Role role;
    private String content;
    private Instant createdAt;

    public Message toMessage() {
        return Message.builder().role(role).content(content).build();
    }
}
