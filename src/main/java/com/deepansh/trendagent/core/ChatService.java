package com.deepansh.trendagent.core;

import com.deepansh.trendagent.config.AgentProperties;
import com.deepansh.trendagent.conversation.ConversationStore;
import com.deepansh.trendagent.exception.ConversationNotFoundException;
import com.deepansh.trendagent.model.Message;
import com.deepansh.trendagent.stream.EventSink;
import com.deepansh.trendagent.stream.StreamEventEmitter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Future;

/**
 * "Process a user message within a conversation."
 *
 * Per-message flow:
 * 1. Verify the conversation belongs to the caller (fails before any streaming)
 * 2. Load the history window, then persist the new user turn
 * 3. Build the context and run the loop on the agent executor
 * 4. The loop persists the final answer and reports its id in the done event
 *
 * The returned emitter is the caller's handle: cancelling it abandons the run.
 */
@Service
@Slf4j
public class ChatService {

    static final String BUSY_ERROR = "The assistant is busy. Please try again shortly.";

    private final ReActLoop reActLoop;
    private final ConversationContextBuilder contextBuilder;
    private final ConversationStore conversationStore;
    private final AgentProperties properties;
    private final AsyncTaskExecutor agentExecutor;

    public ChatService(ReActLoop reActLoop,
                       ConversationContextBuilder contextBuilder,
                       ConversationStore conversationStore,
                       AgentProperties properties,
                       @Qualifier("agentTaskExecutor") AsyncTaskExecutor agentExecutor) {
        this.reActLoop = reActLoop;
        this.contextBuilder = contextBuilder;
        this.conversationStore = conversationStore;
        this.properties = properties;
        this.agentExecutor = agentExecutor;
    }

    public StreamEventEmitter processMessage(String conversationId, String userId, String content, EventSink sink) {
        conversationStore.findConversation(conversationId, userId)
                .orElseThrow(() -> new ConversationNotFoundException(conversationId));

        String runId = UUID.randomUUID().toString().substring(0, 8);
        log.info("Message received [run={}, conversation={}, userId={}, chars={}]",
                runId, conversationId, userId, content.length());

        List<Message> history = conversationStore.recentMessages(conversationId, properties.getHistoryWindow());
        conversationStore.saveMessage(conversationId, userId, Message.Role.user, content);
        List<Message> messages = contextBuilder.build(history, content);

        StreamEventEmitter emitter = new StreamEventEmitter(runId, sink);
        FinalAnswerHandler persistAnswer = answer -> conversationStore
                .saveMessage(conversationId, userId, Message.Role.assistant, answer)
                .getId();

        Future<LoopResult> run;
        try {
            run = agentExecutor.submit(() -> reActLoop.run(messages, emitter, persistAnswer));
        } catch (TaskRejectedException e) {
            log.error("Agent executor saturated, rejecting run [run={}]", runId, e);
            emitter.error(BUSY_ERROR);
            return emitter;
        }

        emitter.onCancel(() -> run.cancel(true));
        return emitter;
    }
}
