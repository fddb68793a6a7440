package com.deepansh.trendagent.resilience;

import com.deepansh.trendagent.exception.CompletionException;
import com.deepansh.trendagent.llm.CompletionClient;
import com.deepansh.trendagent.llm.TokenConsumer;
import com.deepansh.trendagent.model.Message;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decorator around the raw completion client that adds a circuit breaker.
 *
 * No retry and no canned answer: a failed completion must surface as a loop-level
 * error, and a retried stream could replay tokens the user already saw. The
 * breaker only stops hammering a provider that is already down.
 *
 * Circuit breaker config (application.yml, instance "completion"):
 * - Opens after 50% failure rate in a sliding window of 10 calls
 * - Waits 30s before allowing trial calls (half-open state)
 */
@Component
@Primary
@Slf4j
public class ResilientCompletionClient implements CompletionClient {

    private final CompletionClient delegate;

    public ResilientCompletionClient(@Qualifier("rawCompletionClient") CompletionClient delegate) {
        this.delegate = delegate;
    }

    @Override
    @CircuitBreaker(name = "completion", fallbackMethod = "completeRejected")
    public String complete(List<Message> messages) {
        return delegate.complete(messages);
    }

    @Override
    @CircuitBreaker(name = "completion", fallbackMethod = "streamRejected")
    public void stream(List<Message> messages, TokenConsumer consumer) {
        delegate.stream(messages, consumer);
    }

    /** Only open-circuit rejections land here; other failures keep their own type. */
    public String completeRejected(List<Message> messages, CallNotPermittedException ex) {
        log.error("Completion circuit breaker is OPEN, rejecting call: {}", ex.getMessage());
        throw new CompletionException("completion service circuit is open", ex);
    }

    public void streamRejected(List<Message> messages, TokenConsumer consumer, CallNotPermittedException ex) {
        log.error("Completion circuit breaker is OPEN, rejecting stream: {}", ex.getMessage());
        throw new CompletionException("completion service circuit is open", ex);
    }
}
