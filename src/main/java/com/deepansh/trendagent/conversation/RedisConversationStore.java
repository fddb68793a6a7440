package com.deepansh.trendagent.conversation;

import com.deepansh.trendagent.exception.AgentException;
import com.deepansh.trendagent.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis-backed conversation store.
 *
 * Key layout:
 * - chat:conversation:{id}                 JSON Conversation
 * - chat:conversation:{id}:messages        LIST of JSON StoredMessage, append order
 * - chat:user:{userId}:conversations       LIST of conversation ids, newest first
 *
 * Appending with RPUSH keeps turns ordered without rewriting the whole history,
 * and LRANGE -N -1 reads the window directly.
 */
@Component
@Slf4j
public class RedisConversationStore implements ConversationStore {

    private static final String CONVERSATION_PREFIX = "chat:conversation:";
    private static final String MESSAGES_SUFFIX = ":messages";
    private static final String USER_PREFIX = "chat:user:";
    private static final String USER_SUFFIX = ":conversations";

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RedisConversationStore(StringRedisTemplate redisTemplate, ObjectMapper objectMapper, Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public Conversation createConversation(String userId, String title) {
        Instant now = clock.instant();
        Conversation conversation = Conversation.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .title(title)
                .createdAt(now)
                .updatedAt(now)
                .build();

        redisTemplate.opsForValue().set(conversationKey(conversation.getId()), write(conversation));
        redisTemplate.opsForList().leftPush(userKey(userId), conversation.getId());
        log.info("Conversation created [id={}, userId={}]", conversation.getId(), userId);
        return conversation;
    }

    @Override
    public Optional<Conversation> findConversation(String conversationId, String userId) {
        String json = redisTemplate.opsForValue().get(conversationKey(conversationId));
        if (json == null) {
            log.debug("No conversation found [id={}]", conversationId);
            return Optional.empty();
        }
        Conversation conversation = read(json, Conversation.class);
        if (!Objects.equals(conversation.getUserId(), userId)) {
            log.warn("Conversation {} requested by non-owner {}", conversationId, userId);
            return Optional.empty();
        }
        return Optional.of(conversation);
    }

    @Override
    public List<Conversation> listConversations(String userId) {
        List<String> ids = redisTemplate.opsForList().range(userKey(userId), 0, -1);
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        List<String> values = redisTemplate.opsForValue()
                .multiGet(ids.stream().map(RedisConversationStore::conversationKey).toList());
        if (values == null) {
            return List.of();
        }
        return values.stream()
                .filter(Objects::nonNull)
                .map(json -> read(json, Conversation.class))
                .toList();
    }

    @Override
    public List<StoredMessage> listMessages(String conversationId) {
        return readMessages(conversationId, 0);
    }

    @Override
    public List<Message> recentMessages(String conversationId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return readMessages(conversationId, -limit).stream()
                .map(StoredMessage::toMessage)
                .toList();
    }

    @Override
    public StoredMessage saveMessage(String conversationId, String userId, Message.Role role, String content) {
        Instant now = clock.instant();
        StoredMessage message = StoredMessage.builder()
                .id(UUID.randomUUID().toString())
                .conversationId(conversationId)
                .userId(userId)
                .role(role)
                .content(content)
                .createdAt(now)
                .build();

        redisTemplate.opsForList().rightPush(messagesKey(conversationId), write(message));
        touch(conversationId, now);
        log.debug("Saved {} message [id={}, conversation={}]", role, message.getId(), conversationId);
        return message;
    }

    private List<StoredMessage> readMessages(String conversationId, long start) {
        List<String> raw = redisTemplate.opsForList().range(messagesKey(conversationId), start, -1);
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        List<StoredMessage> messages = new ArrayList<>(raw.size());
        for (String json : raw) {
            messages.add(read(json, StoredMessage.class));
        }
        return messages;
    }

    private void touch(String conversationId, Instant now) {
        String key = conversationKey(conversationId);
        String json = redisTemplate.opsForValue().get(key);
        if (json == null) {
            return;
        }
        Conversation conversation = read(json, Conversation.class);
        conversation.setUpdatedAt(now);
        redisTemplate.opsForValue().set(key, write(conversation));
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new AgentException("Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T read(String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new AgentException("Corrupt " + type.getSimpleName() + " entry in Redis", e);
        }
    }

    private static String conversationKey(String conversationId) {
        return CONVERSATION_PREFIX + conversationId;
    }

    private static String messagesKey(String conversationId) {
        return CONVERSATION_PREFIX + conversationId + MESSAGES_SUFFIX;
    }

    private static String userKey(String userId) {
        return USER_PREFIX + userId + USER_SUFFIX;
    }
}
