package com.deepansh.trendagent.exception;

public class ConversationNotFoundException extends AgentException {

    public ConversationNotFoundException(String conversationId) {
        super("Conversation not found: " + conversationId);
    }
}
