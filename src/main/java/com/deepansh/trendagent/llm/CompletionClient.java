package com.deepansh.trendagent.llm;

import com.deepansh.trendagent.model.Message;

import java.util.List;

/**
 * Boundary to the chat model. Implementations throw
 * {@link com.deepansh.trendagent.exception.CompletionException} on transport or quota errors.
 */
public interface CompletionClient {

    /**
     * Blocking completion over the full history.
     *
     * @return the whole completion text, never null
     */
    String complete(List<Message> messages);

    /**
     * Streaming completion. Tokens are handed to {@code consumer} in arrival order
     * until the stream ends or the consumer returns false.
     */
    void stream(List<Message> messages, TokenConsumer consumer);
}
