package com.deepansh.trendagent.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class ChatMessageRequest {

    @NotBlank(message = "conversation_id must not be blank")
    @JsonProperty("conversation_id")
    private String conversationId;

    @NotBlank(message = "content must not be blank")
    @Size(max = 4096, message = "content must be at most 4096 characters")
    private String content;
}
