package com.deepansh.trendagent.conversation;

import com.deepansh.trendagent.model.Message;

import java.util.List;
import java.util.Optional;

/**
 * Storage collaborator. The agent only reads a history window and hands back
 * new turns; the store assigns identifiers and owns the layout.
 */
public interface ConversationStore {

    Conversation createConversation(String userId, String title);

    /** Empty when the conversation does not exist or belongs to another user. */
    Optional<Conversation> findConversation(String conversationId, String userId);

    /** Newest first. */
    List<Conversation> listConversations(String userId);

    /** All turns, oldest first. */
    List<StoredMessage> listMessages(String conversationId);

    /** The most recent {@code limit} turns, oldest first. */
    List<Message> recentMessages(String conversationId, int limit);

    StoredMessage saveMessage(String conversationId, String userId, Message.Role role, String content);
}
