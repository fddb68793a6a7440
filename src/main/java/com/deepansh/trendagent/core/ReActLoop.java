package com.deepansh.trendagent.core;

import com.deepansh.trendagent.config.AgentProperties;
import com.deepansh.trendagent.llm.CompletionClient;
import com.deepansh.trendagent.model.ActionRequest;
import com.deepansh.trendagent.model.Message;
import com.deepansh.trendagent.model.ToolResult;
import com.deepansh.trendagent.stream.StreamEventEmitter;
import com.deepansh.trendagent.tool.ToolDispatcher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Core ReAct (Reason → Act → Observe) loop for one user message.
 *
 * Per-run flow:
 * 1. REASONING: blocking completion, parse for an action
 * 2. ACTING: dispatch the tool, fold its result (or failure description) into context
 * 3. repeat until no action is requested or a limit is hit
 * 4. FINALIZING: stream a completion over the same history, emit tokens, persist, done
 *
 * Limits never produce an error: the run is forced into FINALIZING instead.
 * Tool failures become context. Only completion failures end the run with an error event.
 */
@Service
@Slf4j
public class ReActLoop {

    static final String GENERIC_ERROR = "The assistant is temporarily unavailable. Please try again.";

    private final CompletionClient completionClient;
    private final ActionParser actionParser;
    private final ToolDispatcher toolDispatcher;
    private final AgentProperties properties;
    private final Clock clock;

    public ReActLoop(CompletionClient completionClient,
                     ActionParser actionParser,
                     ToolDispatcher toolDispatcher,
                     AgentProperties properties,
                     Clock clock) {
        this.completionClient = completionClient;
        this.actionParser = actionParser;
        this.toolDispatcher = toolDispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    public LoopResult run(List<Message> initialMessages,
                          StreamEventEmitter emitter,
                          FinalAnswerHandler answerHandler) {
        String runId = emitter.getRunId();
        int maxIterations = properties.getMaxIterations();

        LoopState state = LoopState.start(initialMessages, clock.instant());
        LoopPhase phase = LoopPhase.REASONING;
        List<ToolResult> toolResults = new ArrayList<>();
        ActionRequest pending = null;
        String candidate = null;
        boolean limitReached = false;
        String messageId = null;

        log.info("Loop started [run={}, messages={}, maxIterations={}, timeout={}]",
                runId, initialMessages.size(), maxIterations, properties.getTimeout());

        try {
            while (phase != LoopPhase.DONE) {
                if (emitter.isCancelled()) {
                    log.info("Loop abandoned in {} [run={}, iteration={}]", phase, runId, state.iteration());
                    return LoopResult.cancelled(state, toolResults);
                }

                switch (phase) {
                    case REASONING -> {
                        log.info("Reasoning step {}/{} [run={}]", state.iteration() + 1, maxIterations, runId);
                        String completion = completionClient.complete(state.messages());
                        Optional<ActionRequest> action = actionParser.parse(completion);

                        if (action.isPresent() && withinLimits(state)) {
                            pending = action.get();
                            state = state.append(Message.assistant(completion));
                            phase = LoopPhase.ACTING;
                        } else {
                            if (action.isPresent()) {
                                limitReached = true;
                                log.warn("Limit reached, forcing final answer [run={}, iteration={}, elapsed={}ms]",
                                        runId, state.iteration(), state.elapsed(clock).toMillis());
                            }
                            candidate = completion;
                            phase = LoopPhase.FINALIZING;
                        }
                    }
                    case ACTING -> {
                        log.info("Model requested tool: [{}] [run={}]", pending.toolName(), runId);
                        ToolResult result = toolDispatcher.dispatch(pending, remainingBudget(state), emitter);
                        toolResults.add(result);
                        state = state.append(Message.toolResult(result.getToolName(), result.toContextText()))
                                .nextIteration();
                        pending = null;
                        phase = LoopPhase.REASONING;
                    }
                    case FINALIZING -> {
                        String answer = streamAnswer(state, emitter, candidate);
                        if (emitter.isCancelled()) {
                            log.info("Consumer left during streaming [run={}]", runId);
                            return LoopResult.cancelled(state, toolResults);
                        }
                        state = state.withFinalAnswer(answer);
                        messageId = persist(answerHandler, answer, runId);
                        emitter.done(messageId);
                        phase = LoopPhase.DONE;
                    }
                    default -> throw new IllegalStateException("Unexpected phase " + phase);
                }
            }
        } catch (RuntimeException e) {
            if (emitter.isCancelled()) {
                log.info("Loop stopped after cancellation [run={}]: {}", runId, e.getMessage());
                return LoopResult.cancelled(state, toolResults);
            }
            log.error("Loop failed [run={}, iteration={}]", runId, state.iteration(), e);
            emitter.error(GENERIC_ERROR);
            return LoopResult.failed(state, toolResults);
        }

        log.info("Loop complete [run={}, iterations={}, tools={}, limitReached={}, elapsed={}ms]",
                runId, state.iteration(), toolResults.size(), limitReached, state.elapsed(clock).toMillis());
        return LoopResult.completed(state, limitReached, toolResults, messageId);
    }

    /**
     * Streams the user-visible answer with full tool context. If the model streams
     * nothing, the last blocking completion is sent as a single token instead.
     */
    private String streamAnswer(LoopState state, StreamEventEmitter emitter, String candidate) {
        StringBuilder answer = new StringBuilder();
        completionClient.stream(state.messages(), token -> {
            if (emitter.isCancelled()) {
                return false;
            }
            answer.append(token);
            return emitter.token(token);
        });

        if (answer.toString().isBlank() && candidate != null && !candidate.isBlank() && !emitter.isCancelled()) {
            log.warn("Final stream was empty, falling back to last completion [run={}]", emitter.getRunId());
            emitter.token(candidate);
            return candidate;
        }
        return answer.toString();
    }

    private String persist(FinalAnswerHandler handler, String answer, String runId) {
        try {
            return handler.onFinalAnswer(answer);
        } catch (RuntimeException e) {
            log.error("Failed to persist final answer [run={}]", runId, e);
            return null;
        }
    }

    private boolean withinLimits(LoopState state) {
        return state.iteration() < properties.getMaxIterations()
                && state.elapsed(clock).compareTo(properties.getTimeout()) < 0;
    }

    private Duration remainingBudget(LoopState state) {
        return properties.getTimeout().minus(state.elapsed(clock));
    }
}
