package com.deepansh.trendagent.api;

import com.deepansh.trendagent.config.AgentProperties;
import com.deepansh.trendagent.conversation.Conversation;
import com.deepansh.trendagent.conversation.ConversationStore;
import com.deepansh.trendagent.conversation.StoredMessage;
import com.deepansh.trendagent.core.ChatService;
import com.deepansh.trendagent.exception.ConversationNotFoundException;
import com.deepansh.trendagent.model.ChatMessageRequest;
import com.deepansh.trendagent.model.ConversationCreateRequest;
import com.deepansh.trendagent.stream.StreamEventEmitter;
import com.deepansh.trendagent.tool.AgentTool;
import com.deepansh.trendagent.tool.ToolRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat endpoints. Caller identity arrives in X-User-Id, set by the
 * authentication layer in front of this service.
 *
 * POST /api/v1/chat/conversations                   create a conversation
 * GET  /api/v1/chat/conversations                   list the caller's conversations
 * GET  /api/v1/chat/conversations/{id}/messages     list turns of one conversation
 * POST /api/v1/chat/message                         send a message, SSE response
 * GET  /api/v1/chat/health
 */
@RestController
@RequestMapping("/api/v1/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String USER_HEADER = "X-User-Id";

    private final ChatService chatService;
    private final ConversationStore conversationStore;
    private final ToolRegistry toolRegistry;
    private final AgentProperties properties;

    @PostMapping("/conversations")
    public ResponseEntity<Conversation> createConversation(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody ConversationCreateRequest request) {
        return ResponseEntity.ok(conversationStore.createConversation(userId, request.getTitle()));
    }

    @GetMapping("/conversations")
    public ResponseEntity<Map<String, Object>> listConversations(@RequestHeader(USER_HEADER) String userId) {
        List<Conversation> conversations = conversationStore.listConversations(userId);
        return ResponseEntity.ok(Map.of(
                "conversations", conversations,
                "count", conversations.size()));
    }

    @GetMapping("/conversations/{conversationId}/messages")
    public ResponseEntity<Map<String, Object>> listMessages(
            @RequestHeader(USER_HEADER) String userId,
            @PathVariable String conversationId) {
        conversationStore.findConversation(conversationId, userId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));

        List<StoredMessage> messages = conversationStore.listMessages(conversationId);
        return ResponseEntity.ok(Map.of(
                "conversation_id", conversationId,
                "messages", messages,
                "count", messages.size()));
    }

    @PostMapping(path = "/message", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter sendMessage(
            @RequestHeader(USER_HEADER) String userId,
            @Valid @RequestBody ChatMessageRequest request) {
        SseEmitter sseEmitter = new SseEmitter(properties.getStreamTimeout().toMillis());

        StreamEventEmitter emitter = chatService.processMessage(
                request.getConversationId(), userId, request.getContent(), new SseEventSink(sseEmitter));

        // Consumer gone: stop the run. A normal completion after the terminal event is not a disconnect.
        sseEmitter.onTimeout(emitter::cancel);
        sseEmitter.onError(e -> emitter.cancel());
        sseEmitter.onCompletion(() -> {
            if (!emitter.isTerminated()) {
                emitter.cancel();
            }
        });
        return sseEmitter;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, String> tools = new LinkedHashMap<>();
        for (AgentTool tool : toolRegistry.all()) {
            tools.put(tool.getName(), tool.isHealthy() ? "UP" : "DOWN");
        }
        return ResponseEntity.ok(Map.of("status", "UP", "tools", tools));
    }
}
