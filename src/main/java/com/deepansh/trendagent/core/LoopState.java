package com.deepansh.trendagent.core;

import com.deepansh.trendagent.model.Message;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable snapshot of one loop execution. Every transition returns a new state,
 * so nothing here is shared between concurrent runs or mutated behind the loop's back.
 */
public record LoopState(int iteration, List<Message> messages, Instant startedAt, String finalAnswer) {

    public LoopState {
        messages = List.copyOf(messages);
    }

    public static LoopState start(List<Message> initialMessages, Instant now) {
        return new LoopState(0, initialMessages, now, null);
    }

    public LoopState append(Message message) {
        List<Message> next = new ArrayList<>(messages.size() + 1);
        next.addAll(messages);
        next.add(message);
        return new LoopState(iteration, next, startedAt, finalAnswer);
    }

    public LoopState nextIteration() {
        return new LoopState(iteration + 1, messages, startedAt, finalAnswer);
    }

    public LoopState withFinalAnswer(String answer) {
        return new LoopState(iteration, messages, startedAt, answer);
    }

    public Duration elapsed(Clock clock) {
        return Duration.between(startedAt, clock.instant());
    }
}
